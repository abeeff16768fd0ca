package com.autoviral.common.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum SeriesStatus {

    DRAFT("작성중"),
    ACTIVE("운영중"),
    PAUSED("일시정지"),
    ARCHIVED("보관됨");

    private final String description;

    public boolean isLaunchable() {
        return this == DRAFT || this == PAUSED;
    }
}
