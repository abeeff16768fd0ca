package com.autoviral.common.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 파이프라인 작업 단위
 * errorStep 은 에피소드/게시 오류 페이로드의 step 값으로 사용된다.
 */
@Getter
@RequiredArgsConstructor
public enum PipelineStage {

    SCRIPT("script_generation"),
    MEDIA("media_generation"),
    RENDER("render"),
    PUBLISH("publish");

    private final String errorStep;
}
