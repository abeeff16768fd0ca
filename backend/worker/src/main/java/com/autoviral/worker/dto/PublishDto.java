package com.autoviral.worker.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;

public class PublishDto {

    /**
     * 플랫폼 어댑터 입력 (토큰은 복호화된 값, URL 은 외부에서 GET 가능한 값)
     */
    @Getter
    @Builder
    @AllArgsConstructor
    public static class Request {
        private final Long postId;
        private final String accessToken;
        private final String videoUrl;
        private final String caption;
    }

    @Getter
    @AllArgsConstructor
    public static class Attempt {
        private final String platformPostId;
    }

    /**
     * 게시 트리거 결과
     */
    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TriggerResult {
        private boolean success;
        private String message;
        private List<Long> postIds;
    }
}
