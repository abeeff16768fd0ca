package com.autoviral.common.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum PostStatus {

    PENDING("대기중"),
    POSTING("게시중"),
    POSTED("게시 완료"),
    FAILED("실패");

    private final String description;
}
