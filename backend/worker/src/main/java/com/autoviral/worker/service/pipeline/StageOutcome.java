package com.autoviral.worker.service.pipeline;

public enum StageOutcome {
    /** 단계 완료, 다음 단계로 진행 */
    COMPLETED,
    /** 이미 처리되었거나 진행할 수 없는 상태라 아무것도 하지 않음 */
    SKIPPED
}
