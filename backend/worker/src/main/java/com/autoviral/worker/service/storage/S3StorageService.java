package com.autoviral.worker.service.storage;

import com.autoviral.common.exception.ApiException;
import com.autoviral.common.exception.ErrorCode;
import com.autoviral.worker.config.S3Config;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.s3.presigner.model.GetObjectPresignRequest;

import java.time.Duration;

/**
 * AWS S3 저장소 (aws.s3.enabled=true)
 * 비공개 버킷을 가정하고, 외부 전달 시 presigned GET URL 을 만든다.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "aws.s3.enabled", havingValue = "true")
public class S3StorageService implements StorageService {

    private final S3Client s3Client;
    private final S3Presigner s3Presigner;
    private final S3Config s3Config;
    private final RestTemplate restTemplate;

    public S3StorageService(S3Client s3Client, S3Presigner s3Presigner, S3Config s3Config, RestTemplate restTemplate) {
        this.s3Client = s3Client;
        this.s3Presigner = s3Presigner;
        this.s3Config = s3Config;
        this.restTemplate = restTemplate;
        log.info("S3StorageService initialized - bucket: {}, region: {}", s3Config.getBucket(), s3Config.getRegion());
    }

    @Override
    public String upload(String key, byte[] data, String contentType) {
        try {
            PutObjectRequest request = PutObjectRequest.builder()
                    .bucket(s3Config.getBucket())
                    .key(key)
                    .contentType(contentType)
                    .build();
            s3Client.putObject(request, RequestBody.fromBytes(data));
            log.info("[S3] Uploaded {}/{} ({} bytes)", s3Config.getBucket(), key, data.length);
            return s3Config.objectUrl(key);
        } catch (S3Exception e) {
            log.error("[S3] Upload failed: {}", key, e);
            throw new ApiException(ErrorCode.STORAGE_FAILED, "S3 upload failed: " + e.getMessage(), e);
        }
    }

    @Override
    public String fetchableUrl(String storedUrl, long ttlSeconds) {
        String key = keyOf(storedUrl);
        if (key == null) {
            // 외부 URL 은 그대로
            return storedUrl;
        }
        try {
            GetObjectPresignRequest presignRequest = GetObjectPresignRequest.builder()
                    .signatureDuration(Duration.ofSeconds(ttlSeconds > 0 ? ttlSeconds : s3Config.getPresignedUrlExpiration()))
                    .getObjectRequest(GetObjectRequest.builder().bucket(s3Config.getBucket()).key(key).build())
                    .build();
            return s3Presigner.presignGetObject(presignRequest).url().toString();
        } catch (S3Exception e) {
            log.error("[S3] Presign failed: {}", key, e);
            throw new ApiException(ErrorCode.STORAGE_FAILED, "Failed to generate presigned URL: " + e.getMessage(), e);
        }
    }

    @Override
    public byte[] download(String storedUrl) {
        String key = keyOf(storedUrl);
        if (key == null) {
            return downloadExternal(storedUrl);
        }
        try {
            GetObjectRequest request = GetObjectRequest.builder()
                    .bucket(s3Config.getBucket())
                    .key(key)
                    .build();
            return s3Client.getObjectAsBytes(request).asByteArray();
        } catch (NoSuchKeyException e) {
            throw new ApiException(ErrorCode.NOT_FOUND, "File not found in storage: " + key, e);
        } catch (S3Exception e) {
            log.error("[S3] Download failed: {}", key, e);
            throw new ApiException(ErrorCode.STORAGE_FAILED, "S3 download failed: " + e.getMessage(), e);
        }
    }

    @Override
    public boolean isEnabled() {
        return true;
    }

    /**
     * 이 버킷의 객체 URL 이면 키, 아니면 null
     */
    String keyOf(String storedUrl) {
        String prefix = s3Config.objectUrl("");
        if (storedUrl != null && storedUrl.startsWith(prefix)) {
            return storedUrl.substring(prefix.length());
        }
        return null;
    }

    private byte[] downloadExternal(String url) {
        if (url == null || !(url.startsWith("https://") || url.startsWith("http://"))) {
            throw new ApiException(ErrorCode.NOT_FOUND, "Asset URL is not downloadable: " + url);
        }
        try {
            byte[] body = restTemplate.getForObject(url, byte[].class);
            return body != null ? body : new byte[0];
        } catch (RestClientException e) {
            throw new ApiException(ErrorCode.STORAGE_FAILED, "Download failed: " + e.getMessage(), e);
        }
    }
}
