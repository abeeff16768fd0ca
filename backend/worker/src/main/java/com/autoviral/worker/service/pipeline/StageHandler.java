package com.autoviral.worker.service.pipeline;

import com.autoviral.common.enums.PipelineStage;

import java.time.LocalDateTime;

/**
 * 파이프라인 단계 실행기
 * 실패는 예외로 알린다. 재시도 여부와 다음 단계 연결은 {@link PipelineTaskWorker} 와
 * {@link PipelineDefinition} 이 결정하며, 단계가 직접 다음 단계를 등록하지 않는다.
 */
public interface StageHandler {

    PipelineStage getStage();

    /**
     * @param targetId   PUBLISH 는 postId, 나머지는 episodeId
     * @param leaseUntil 이 실행의 작업 점유 만료 시각
     */
    StageOutcome execute(Long targetId, LocalDateTime leaseUntil);
}
