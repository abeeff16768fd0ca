package com.autoviral.worker.util;

import com.autoviral.common.exception.ApiException;
import com.autoviral.common.exception.ErrorCode;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * JSON 컬럼 직렬화
 */
public final class Jsons {

    private Jsons() {
    }

    public static String write(ObjectMapper objectMapper, Object value) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new ApiException(ErrorCode.INTERNAL_SERVER_ERROR,
                    "Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    public static <T> T read(ObjectMapper objectMapper, String json, Class<T> type, ErrorCode errorCode) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new ApiException(errorCode, "Malformed " + type.getSimpleName() + " JSON", e);
        }
    }
}
