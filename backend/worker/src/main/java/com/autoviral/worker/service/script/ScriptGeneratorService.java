package com.autoviral.worker.service.script;

import com.autoviral.worker.dto.ScriptDto;
import com.autoviral.worker.dto.SeriesDto;

/**
 * 시리즈 설정으로 대본 생성
 */
public interface ScriptGeneratorService {

    /**
     * 씬 단위 대본. 검증을 통과한 씬 목록과 이어붙인 전문을 돌려준다.
     * @throws com.autoviral.common.exception.ApiException SCRIPT_INVALID_SCENES 등
     */
    ScriptDto.Generated generateScenes(SeriesDto.Config config, int minScenes, int maxScenes);

    /**
     * 씬 분할 없는 단일 대본 (scenes == null)
     */
    ScriptDto.Generated generateText(SeriesDto.Config config);
}
