package com.autoviral.worker.service.episode;

import com.autoviral.common.enums.PipelineStage;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * 한 단계 실행이 보유한 에피소드 점유권. 이후의 모든 쓰기는 token 이 일치할 때만 반영된다.
 */
@Getter
@ToString
@RequiredArgsConstructor
public class EpisodeLease {
    private final Long episodeId;
    private final PipelineStage stage;
    private final String token;
}
