package com.autoviral.common.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum TaskStatus {

    QUEUED("대기중"),
    RUNNING("실행중"),
    DONE("완료"),
    DEAD("재시도 한도 초과 또는 재시도 불가");

    private final String description;
}
