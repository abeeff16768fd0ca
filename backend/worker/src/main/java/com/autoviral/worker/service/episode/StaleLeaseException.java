package com.autoviral.worker.service.episode;

import lombok.Getter;

/**
 * 에피소드를 다른(더 새로운) 실행이 점유하고 있어 이번 실행의 결과를 버려야 할 때
 * 워커는 재시도하지 않고 작업을 완료 처리한다.
 */
@Getter
public class StaleLeaseException extends RuntimeException {

    private final Long episodeId;

    public StaleLeaseException(Long episodeId, String message) {
        super(message);
        this.episodeId = episodeId;
    }
}
