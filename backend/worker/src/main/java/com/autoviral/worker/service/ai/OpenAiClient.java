package com.autoviral.worker.service.ai;

import com.autoviral.common.exception.ApiException;
import com.autoviral.common.exception.ErrorCode;
import com.autoviral.worker.service.image.SafetyFilterException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * OpenAI HTTP API 호출 (chat completions, audio speech, images generations)
 *
 * 오류 매핑:
 * - 401/403 → AI_API_KEY_INVALID (재시도 안 함)
 * - 이미지 콘텐츠 정책 거절 → SafetyFilterException
 * - 연결 실패 → AI_SERVICE_UNAVAILABLE
 * - 그 밖의 HTTP 오류 → 호출 측이 준 실패 코드
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OpenAiClient {

    private static final int MAX_IMAGE_PROMPT = 4000;

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;

    @Value("${openai.api-key:}")
    private String apiKey;

    @Value("${openai.base-url:https://api.openai.com/v1}")
    private String baseUrl;

    /**
     * @return choices[0].message.content (trim)
     */
    public String chat(String model, String systemPrompt, String userPrompt,
                       double temperature, int maxTokens, ErrorCode failureCode) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("messages", List.of(
                Map.of("role", "system", "content", systemPrompt),
                Map.of("role", "user", "content", userPrompt)
        ));
        body.put("temperature", temperature);
        body.put("max_tokens", maxTokens);

        String response = post("/chat/completions", body, String.class, failureCode, null);
        JsonNode root = readTree(response, failureCode);
        JsonNode content = root.path("choices").path(0).path("message").path("content");
        if (content.isMissingNode() || content.isNull()) {
            throw new ApiException(failureCode, "OpenAI chat response has no content");
        }
        String text = content.asText().trim();
        log.debug("[OpenAI] chat model={} response length={}", model, text.length());
        return text;
    }

    /**
     * @return mp3 바이트
     */
    public byte[] speech(String model, String voice, String input) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("voice", voice);
        body.put("input", input);

        byte[] audio = post("/audio/speech", body, byte[].class, ErrorCode.TTS_GENERATION_FAILED, null);
        if (audio == null || audio.length == 0) {
            throw new ApiException(ErrorCode.TTS_GENERATION_FAILED, "OpenAI speech returned empty audio");
        }
        log.debug("[OpenAI] speech model={} voice={} bytes={}", model, voice, audio.length);
        return audio;
    }

    /**
     * b64_json 응답을 디코딩한 PNG 바이트
     * @throws SafetyFilterException 콘텐츠 정책 거절
     */
    public byte[] image(String model, String prompt, String size) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("prompt", prompt.length() > MAX_IMAGE_PROMPT ? prompt.substring(0, MAX_IMAGE_PROMPT) : prompt);
        body.put("n", 1);
        body.put("size", size);
        body.put("response_format", "b64_json");
        body.put("quality", "standard");
        if ("dall-e-3".equals(model)) {
            body.put("style", "natural");
        }

        String response = post("/images/generations", body, String.class, ErrorCode.IMAGE_GENERATION_FAILED, prompt);
        JsonNode data = readTree(response, ErrorCode.IMAGE_GENERATION_FAILED).path("data").path(0).path("b64_json");
        if (!data.isTextual() || data.asText().isEmpty()) {
            throw new ApiException(ErrorCode.IMAGE_GENERATION_FAILED, "OpenAI image response has no b64_json");
        }
        return Base64.getDecoder().decode(data.asText());
    }

    public boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank();
    }

    private <T> T post(String path, Map<String, Object> body, Class<T> responseType,
                       ErrorCode failureCode, String imagePrompt) {
        if (!isConfigured()) {
            throw new ApiException(ErrorCode.AI_API_KEY_INVALID, "OPENAI_API_KEY is not set");
        }
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setBearerAuth(apiKey);

        try {
            ResponseEntity<T> response = restTemplate.exchange(
                    baseUrl + path, HttpMethod.POST, new HttpEntity<>(body, headers), responseType);
            return response.getBody();
        } catch (HttpStatusCodeException e) {
            String errorBody = e.getResponseBodyAsString();
            log.warn("[OpenAI] {} failed: status={} body={}", path, e.getStatusCode().value(),
                    errorBody.length() > 500 ? errorBody.substring(0, 500) : errorBody);
            if (e.getStatusCode().value() == HttpStatus.UNAUTHORIZED.value()
                    || e.getStatusCode().value() == HttpStatus.FORBIDDEN.value()) {
                throw new ApiException(ErrorCode.AI_API_KEY_INVALID, "OpenAI rejected the API key", e);
            }
            if (imagePrompt != null && SafetyFilterException.isSafetyRejection(errorBody)) {
                throw new SafetyFilterException(imagePrompt, errorBody);
            }
            throw new ApiException(failureCode, "OpenAI " + path + " failed with status " + e.getStatusCode().value(), e);
        } catch (ResourceAccessException e) {
            log.warn("[OpenAI] {} unreachable: {}", path, e.getMessage());
            throw new ApiException(ErrorCode.AI_SERVICE_UNAVAILABLE, "OpenAI is unreachable: " + e.getMessage(), e);
        }
    }

    private JsonNode readTree(String response, ErrorCode failureCode) {
        if (response == null || response.isBlank()) {
            throw new ApiException(failureCode, "OpenAI returned an empty response");
        }
        try {
            return objectMapper.readTree(response);
        } catch (JsonProcessingException e) {
            throw new ApiException(failureCode, "OpenAI returned malformed JSON", e);
        }
    }
}
