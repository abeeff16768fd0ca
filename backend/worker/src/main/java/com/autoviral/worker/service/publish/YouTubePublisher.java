package com.autoviral.worker.service.publish;

import com.autoviral.common.enums.Platform;
import com.autoviral.worker.dto.PublishDto;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * YouTube Data API v3 resumable upload
 * URL 로 가져가는 방식이 없어서 영상을 받아 직접 올린다.
 */
@Slf4j
@Component
public class YouTubePublisher extends AbstractPlatformPublisher {

    static final String UPLOAD_INIT_URL =
            "https://www.googleapis.com/upload/youtube/v3/videos?uploadType=resumable&part=snippet,status";
    static final int TITLE_MAX = 100;
    static final int DESCRIPTION_MAX = 5000;
    static final String CATEGORY_PEOPLE_AND_BLOGS = "22";

    public YouTubePublisher(RestTemplate restTemplate, ObjectMapper objectMapper) {
        super(restTemplate, objectMapper);
    }

    @Override
    public Platform getPlatform() {
        return Platform.YOUTUBE;
    }

    @Override
    public PublishDto.Attempt publish(PublishDto.Request request) {
        byte[] video = call("download", () -> restTemplate.getForObject(URI.create(request.getVideoUrl()), byte[].class));
        if (video == null || video.length == 0) {
            throw rejected("Video download returned no content");
        }

        String caption = request.getCaption() == null ? "" : request.getCaption();
        Map<String, Object> snippet = new LinkedHashMap<>();
        snippet.put("title", truncate(caption.isBlank() ? "Video" : caption, TITLE_MAX));
        snippet.put("description", truncate(caption, DESCRIPTION_MAX));
        snippet.put("categoryId", CATEGORY_PEOPLE_AND_BLOGS);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("snippet", snippet);
        body.put("status", Map.of("privacyStatus", "public"));

        HttpHeaders initHeaders = new HttpHeaders();
        initHeaders.setBearerAuth(request.getAccessToken());
        initHeaders.setContentType(MediaType.APPLICATION_JSON);
        ResponseEntity<String> init = call("upload init", () -> restTemplate.exchange(
                UPLOAD_INIT_URL, HttpMethod.POST, new HttpEntity<>(body, initHeaders), String.class));
        URI uploadUri = init.getHeaders().getLocation();
        if (uploadUri == null) {
            throw rejected("YouTube did not return upload URL");
        }

        HttpHeaders uploadHeaders = new HttpHeaders();
        uploadHeaders.setContentType(MediaType.valueOf("video/mp4"));
        String uploaded = call("upload", () -> restTemplate.exchange(
                uploadUri, HttpMethod.PUT, new HttpEntity<>(video, uploadHeaders), String.class).getBody());
        String videoId = textOrNull(readTree(uploaded).path("id"));
        if (videoId == null) {
            throw rejected("YouTube upload response missing id");
        }
        log.info("[Publish] YouTube postId={} videoId={} bytes={}", request.getPostId(), videoId, video.length);
        return new PublishDto.Attempt(videoId);
    }
}
