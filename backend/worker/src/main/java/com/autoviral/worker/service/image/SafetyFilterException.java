package com.autoviral.worker.service.image;

import lombok.Getter;

/**
 * 이미지 생성 요청이 콘텐츠 정책(content_policy_violation, safety system)에 의해 거절되었을 때 발생
 * 호출 측은 안전한 대체 프롬프트로 한 번 재시도한다.
 */
@Getter
public class SafetyFilterException extends RuntimeException {

    private final String originalPrompt;

    public SafetyFilterException(String originalPrompt, String providerMessage) {
        super("Image generation blocked by safety filter: " + providerMessage);
        this.originalPrompt = originalPrompt;
    }

    public static boolean isSafetyRejection(String errorBody) {
        if (errorBody == null) {
            return false;
        }
        String lower = errorBody.toLowerCase();
        return lower.contains("content_policy_violation") || lower.contains("safety system");
    }
}
