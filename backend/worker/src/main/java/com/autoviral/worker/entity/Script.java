package com.autoviral.worker.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 생성된 스크립트 (생성 후 변경하지 않는다. 재생성 시 새 행)
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Script {
    private Long scriptId;
    private Long seriesId;
    private String languageCode;
    private String text;
    private String scenes;          // JSON 배열, 레거시 모드면 null
    private String promptMetadata;  // JSON
    private LocalDateTime createdAt;
}
