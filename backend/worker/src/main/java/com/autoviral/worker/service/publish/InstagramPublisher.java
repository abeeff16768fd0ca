package com.autoviral.worker.service.publish;

import com.autoviral.common.enums.Platform;
import com.autoviral.common.exception.ApiException;
import com.autoviral.common.exception.ErrorCode;
import com.autoviral.worker.dto.PublishDto;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Instagram Graph API: 영상 컨테이너 생성 → 처리 완료 대기(status_code) → media_publish
 */
@Slf4j
@Component
public class InstagramPublisher extends AbstractPlatformPublisher {

    static final String GRAPH_BASE = "https://graph.facebook.com/v21.0";
    static final int CAPTION_MAX = 2200;

    private final int pollAttempts;
    private final long pollIntervalMs;

    public InstagramPublisher(RestTemplate restTemplate, ObjectMapper objectMapper,
                              @Value("${pipeline.publish.instagram.poll-attempts:30}") int pollAttempts,
                              @Value("${pipeline.publish.instagram.poll-interval-ms:2000}") long pollIntervalMs) {
        super(restTemplate, objectMapper);
        this.pollAttempts = pollAttempts;
        this.pollIntervalMs = pollIntervalMs;
    }

    @Override
    public Platform getPlatform() {
        return Platform.INSTAGRAM;
    }

    @Override
    public PublishDto.Attempt publish(PublishDto.Request request) {
        String token = request.getAccessToken();

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("media_type", "VIDEO");
        body.put("video_url", request.getVideoUrl());
        body.put("caption", truncate(request.getCaption(), CAPTION_MAX));

        URI createUri = graphUri("/me/media", token).build().encode().toUri();
        String created = call("container", () -> restTemplate.exchange(
                createUri, HttpMethod.POST, new HttpEntity<>(body, headers), String.class).getBody());
        String containerId = textOrNull(readTree(created).path("id"));
        if (containerId == null) {
            throw rejected("No container id from Instagram");
        }

        waitUntilFinished(containerId, token);

        URI publishUri = graphUri("/me/media_publish", token)
                .queryParam("creation_id", containerId)
                .build().encode().toUri();
        String published = call("media_publish", () -> restTemplate.exchange(
                publishUri, HttpMethod.POST, HttpEntity.EMPTY, String.class).getBody());
        String mediaId = textOrNull(readTree(published).path("id"));
        String platformPostId = mediaId != null ? mediaId : containerId;
        log.info("[Publish] Instagram postId={} mediaId={}", request.getPostId(), platformPostId);
        return new PublishDto.Attempt(platformPostId);
    }

    /**
     * FINISHED 면 종료, ERROR 면 실패. 시도 횟수를 다 써도 끝나지 않으면 게시를 시도해 본다.
     */
    private void waitUntilFinished(String containerId, String token) {
        URI statusUri = graphUri("/" + containerId, token)
                .queryParam("fields", "status_code")
                .build().encode().toUri();
        for (int attempt = 0; attempt < pollAttempts; attempt++) {
            String response = call("status", () -> restTemplate.getForObject(statusUri, String.class));
            String status = textOrNull(readTree(response).path("status_code"));
            if ("FINISHED".equals(status)) {
                return;
            }
            if ("ERROR".equals(status)) {
                throw rejected("Instagram container processing failed");
            }
            sleep();
        }
        log.warn("[Publish] Instagram container {} not FINISHED after {} polls, publishing anyway", containerId, pollAttempts);
    }

    private void sleep() {
        if (pollIntervalMs <= 0) {
            return;
        }
        try {
            Thread.sleep(pollIntervalMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ApiException(ErrorCode.PLATFORM_PUBLISH_FAILED, "Interrupted while waiting for Instagram", e);
        }
    }

    private static UriComponentsBuilder graphUri(String path, String token) {
        return UriComponentsBuilder.fromHttpUrl(GRAPH_BASE + path).queryParam("access_token", token);
    }
}
