package com.autoviral.worker.service.storage;

import com.autoviral.common.exception.ApiException;
import com.autoviral.common.exception.ErrorCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * 로컬 디스크 저장소 (S3 비활성)
 * 돌려주는 URL 은 자리표시 URL 이라 외부 플랫폼 게시에는 쓸 수 없고, 워커 내부 렌더링에만 쓰인다.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "aws.s3.enabled", havingValue = "false", matchIfMissing = true)
public class LocalStorageService implements StorageService {

    private final Path root;

    public LocalStorageService(@Value("${storage.local-path:}") String localPath) {
        this.root = (localPath == null || localPath.isBlank()
                ? Paths.get(System.getProperty("java.io.tmpdir"), "autoviral-storage")
                : Paths.get(localPath)).toAbsolutePath().normalize();
        try {
            Files.createDirectories(root);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create local storage directory: " + root, e);
        }
        log.info("LocalStorageService initialized - path: {}", root);
    }

    @Override
    public String upload(String key, byte[] data, String contentType) {
        Path filePath = resolve(key);
        try {
            Files.createDirectories(filePath.getParent());
            Files.write(filePath, data);
            log.info("[LocalStorage] Saved {} ({} bytes)", filePath, data.length);
            return PLACEHOLDER_URL_PREFIX + key;
        } catch (IOException e) {
            log.error("[LocalStorage] Failed to save: {}", key, e);
            throw new ApiException(ErrorCode.STORAGE_FAILED, "Local storage failed: " + e.getMessage(), e);
        }
    }

    @Override
    public String fetchableUrl(String storedUrl, long ttlSeconds) {
        return storedUrl;
    }

    @Override
    public byte[] download(String storedUrl) {
        if (storedUrl == null || !storedUrl.startsWith(PLACEHOLDER_URL_PREFIX)) {
            throw new ApiException(ErrorCode.NOT_FOUND, "Not a local storage URL: " + storedUrl);
        }
        Path filePath = resolve(storedUrl.substring(PLACEHOLDER_URL_PREFIX.length()));
        if (!Files.exists(filePath)) {
            throw new ApiException(ErrorCode.NOT_FOUND, "File not found: " + storedUrl);
        }
        try {
            return Files.readAllBytes(filePath);
        } catch (IOException e) {
            throw new ApiException(ErrorCode.STORAGE_FAILED, "Local storage read failed: " + e.getMessage(), e);
        }
    }

    @Override
    public boolean isEnabled() {
        return false;
    }

    private Path resolve(String key) {
        Path path = root.resolve(key).normalize();
        if (!path.startsWith(root)) {
            throw new ApiException(ErrorCode.INVALID_REQUEST, "Invalid storage key: " + key);
        }
        return path;
    }
}
