package com.autoviral.common.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 게시 대상 소셜 플랫폼
 */
@Getter
@RequiredArgsConstructor
public enum Platform {

    TIKTOK("tiktok", "TikTok"),
    INSTAGRAM("instagram", "Instagram"),
    YOUTUBE("youtube", "YouTube"),
    FACEBOOK("facebook", "Facebook");

    private final String code;
    private final String displayName;
}
