package com.autoviral.worker.service.publish;

import com.autoviral.common.exception.ApiException;
import com.autoviral.common.exception.ErrorCode;
import com.autoviral.worker.dto.PublishDto;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withException;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

@DisplayName("TikTokPublisher Tests")
class TikTokPublisherTest {

    private MockRestServiceServer server;
    private TikTokPublisher publisher;

    private final PublishDto.Request request = PublishDto.Request.builder()
            .postId(1L)
            .accessToken("tok")
            .videoUrl("https://bucket.s3.amazonaws.com/video.mp4?sig=1")
            .caption("Three habits that changed my mornings")
            .build();

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        publisher = new TikTokPublisher(restTemplate, new ObjectMapper());
    }

    @Test
    @DisplayName("Init pulls the video from the URL and returns the publish id")
    void testPublish_Success() {
        server.expect(requestTo(TikTokPublisher.INIT_URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Authorization", "Bearer tok"))
                .andExpect(jsonPath("$.source_info.source").value("PULL_FROM_URL"))
                .andExpect(jsonPath("$.source_info.video_url").value(request.getVideoUrl()))
                .andExpect(jsonPath("$.post_info.title").value(request.getCaption()))
                .andRespond(withSuccess("{\"data\":{\"publish_id\":\"v_pub_123\"},\"error\":{\"code\":\"ok\"}}",
                        MediaType.APPLICATION_JSON));

        PublishDto.Attempt attempt = publisher.publish(request);

        assertEquals("v_pub_123", attempt.getPlatformPostId());
        server.verify();
    }

    @Test
    @DisplayName("Error code in the body is a rejection")
    void testPublish_ErrorBody() {
        server.expect(requestTo(TikTokPublisher.INIT_URL))
                .andRespond(withSuccess("{\"error\":{\"code\":\"spam_risk_too_many_posts\",\"message\":\"Too many posts\"}}",
                        MediaType.APPLICATION_JSON));

        ApiException e = assertThrows(ApiException.class, () -> publisher.publish(request));

        assertEquals(ErrorCode.PLATFORM_REJECTED, e.getErrorCode());
        assertEquals("Too many posts", e.getMessage());
    }

    @Test
    @DisplayName("Missing publish id is a rejection")
    void testPublish_NoPublishId() {
        server.expect(requestTo(TikTokPublisher.INIT_URL))
                .andRespond(withSuccess("{\"data\":{}}", MediaType.APPLICATION_JSON));

        ApiException e = assertThrows(ApiException.class, () -> publisher.publish(request));

        assertEquals("No publish_id from TikTok", e.getMessage());
    }

    @Test
    @DisplayName("Both 4xx and 5xx are retried by the queue")
    void testPublish_HttpErrors() {
        server.expect(requestTo(TikTokPublisher.INIT_URL)).andRespond(withStatus(HttpStatus.UNAUTHORIZED));
        ApiException unauthorized = assertThrows(ApiException.class, () -> publisher.publish(request));
        assertEquals(ErrorCode.PLATFORM_REJECTED, unauthorized.getErrorCode());
        assertTrue(unauthorized.isRetryable());

        server.reset();
        server.expect(requestTo(TikTokPublisher.INIT_URL)).andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));
        ApiException unavailable = assertThrows(ApiException.class, () -> publisher.publish(request));
        assertEquals(ErrorCode.PLATFORM_PUBLISH_FAILED, unavailable.getErrorCode());
        assertTrue(unavailable.isRetryable());
    }

    @Test
    @DisplayName("Network failure is retryable")
    void testPublish_Network() {
        server.expect(requestTo(TikTokPublisher.INIT_URL)).andRespond(withException(new IOException("reset")));

        ApiException e = assertThrows(ApiException.class, () -> publisher.publish(request));

        assertEquals(ErrorCode.PLATFORM_PUBLISH_FAILED, e.getErrorCode());
    }
}
