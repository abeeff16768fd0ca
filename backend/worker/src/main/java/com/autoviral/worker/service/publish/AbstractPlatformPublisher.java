package com.autoviral.worker.service.publish;

import com.autoviral.common.exception.ApiException;
import com.autoviral.common.exception.ErrorCode;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.util.function.Supplier;

/**
 * HTTP 오류 → ApiException 매핑 공통부
 */
@Slf4j
public abstract class AbstractPlatformPublisher implements PlatformPublisher {

    protected final RestTemplate restTemplate;
    protected final ObjectMapper objectMapper;

    protected AbstractPlatformPublisher(RestTemplate restTemplate, ObjectMapper objectMapper) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
    }

    protected <T> T call(String step, Supplier<T> request) {
        try {
            return request.get();
        } catch (HttpStatusCodeException e) {
            String body = truncate(e.getResponseBodyAsString(), 500);
            log.warn("[Publish] {} {} failed: status={} body={}", getPlatform(), step, e.getStatusCode().value(), body);
            ErrorCode code = e.getStatusCode().is4xxClientError() ? ErrorCode.PLATFORM_REJECTED : ErrorCode.PLATFORM_PUBLISH_FAILED;
            throw new ApiException(code, getPlatform().getDisplayName() + " " + step + " failed ("
                    + e.getStatusCode().value() + "): " + body, e);
        } catch (ResourceAccessException e) {
            log.warn("[Publish] {} {} unreachable: {}", getPlatform(), step, e.getMessage());
            throw new ApiException(ErrorCode.PLATFORM_PUBLISH_FAILED,
                    getPlatform().getDisplayName() + " " + step + " unreachable: " + e.getMessage(), e);
        }
    }

    protected JsonNode readTree(String body) {
        if (body == null || body.isBlank()) {
            return objectMapper.createObjectNode();
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new ApiException(ErrorCode.PLATFORM_REJECTED,
                    getPlatform().getDisplayName() + " returned a non-JSON response", e);
        }
    }

    protected ApiException rejected(String message) {
        return new ApiException(ErrorCode.PLATFORM_REJECTED, message);
    }

    protected static String truncate(String value, int max) {
        if (value == null) {
            return "";
        }
        return value.length() > max ? value.substring(0, max) : value;
    }

    protected static String textOrNull(JsonNode node) {
        return node == null || node.isMissingNode() || node.isNull() || node.asText().isEmpty() ? null : node.asText();
    }
}
