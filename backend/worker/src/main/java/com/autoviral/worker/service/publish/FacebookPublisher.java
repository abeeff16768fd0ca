package com.autoviral.worker.service.publish;

import com.autoviral.common.enums.Platform;
import com.autoviral.worker.dto.PublishDto;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;

/**
 * Facebook Graph API: me/videos 에 file_url 로 게시
 */
@Slf4j
@Component
public class FacebookPublisher extends AbstractPlatformPublisher {

    static final String VIDEOS_URL = "https://graph.facebook.com/v21.0/me/videos";
    static final int DESCRIPTION_MAX = 5000;

    public FacebookPublisher(RestTemplate restTemplate, ObjectMapper objectMapper) {
        super(restTemplate, objectMapper);
    }

    @Override
    public Platform getPlatform() {
        return Platform.FACEBOOK;
    }

    @Override
    public PublishDto.Attempt publish(PublishDto.Request request) {
        URI uri = UriComponentsBuilder.fromHttpUrl(VIDEOS_URL)
                .queryParam("access_token", request.getAccessToken())
                .build().encode().toUri();

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("file_url", request.getVideoUrl());
        form.add("description", truncate(request.getCaption(), DESCRIPTION_MAX));

        String response = call("videos", () -> restTemplate.exchange(
                uri, HttpMethod.POST, new HttpEntity<>(form, headers), String.class).getBody());
        String videoId = textOrNull(readTree(response).path("id"));
        String platformPostId = videoId != null ? videoId : "unknown";
        log.info("[Publish] Facebook postId={} videoId={}", request.getPostId(), platformPostId);
        return new PublishDto.Attempt(platformPostId);
    }
}
