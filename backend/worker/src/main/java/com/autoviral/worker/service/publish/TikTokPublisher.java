package com.autoviral.worker.service.publish;

import com.autoviral.common.enums.Platform;
import com.autoviral.worker.dto.PublishDto;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * TikTok Content Posting API: PULL_FROM_URL 방식으로 업로드 초기화. publish_id 를 게시 ID 로 쓴다.
 */
@Slf4j
@Component
public class TikTokPublisher extends AbstractPlatformPublisher {

    static final String INIT_URL = "https://open.tiktokapis.com/v2/post/publish/inbox/video/init/";
    static final int TITLE_MAX = 150;

    public TikTokPublisher(RestTemplate restTemplate, ObjectMapper objectMapper) {
        super(restTemplate, objectMapper);
    }

    @Override
    public Platform getPlatform() {
        return Platform.TIKTOK;
    }

    @Override
    public PublishDto.Attempt publish(PublishDto.Request request) {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(request.getAccessToken());
        headers.setContentType(MediaType.APPLICATION_JSON);

        String caption = request.getCaption();
        Map<String, Object> postInfo = new LinkedHashMap<>();
        postInfo.put("title", caption == null || caption.isBlank() ? "Video" : truncate(caption, TITLE_MAX));
        postInfo.put("privacy_level", "PUBLIC_TO_EVERYONE");
        postInfo.put("disable_duet", false);
        postInfo.put("disable_comment", false);

        Map<String, Object> sourceInfo = new LinkedHashMap<>();
        sourceInfo.put("source", "PULL_FROM_URL");
        sourceInfo.put("video_url", request.getVideoUrl());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("post_info", postInfo);
        body.put("source_info", sourceInfo);

        String response = call("init", () -> restTemplate.exchange(
                INIT_URL, HttpMethod.POST, new HttpEntity<>(body, headers), String.class).getBody());
        JsonNode root = readTree(response);

        JsonNode error = root.path("error");
        String code = textOrNull(error.path("code"));
        if (code != null && !"ok".equals(code)) {
            String message = textOrNull(error.path("message"));
            throw rejected(message != null ? message : "TikTok init failed");
        }
        String publishId = textOrNull(root.path("data").path("publish_id"));
        if (publishId == null) {
            throw rejected("No publish_id from TikTok");
        }
        log.info("[Publish] TikTok postId={} publishId={}", request.getPostId(), publishId);
        return new PublishDto.Attempt(publishId);
    }
}
