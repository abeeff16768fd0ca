package com.autoviral.worker.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;

public class ScriptDto {

    /**
     * 검증을 통과한 씬 (script.scenes 컬럼 저장 형식)
     */
    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SceneSpec {
        @JsonProperty("scene")
        private int scene;
        @JsonProperty("text")
        private String text;
        @JsonProperty("visual_description")
        private String visualDescription;
    }

    /**
     * 텍스트 생성 결과. 씬 모드면 scenes 가 채워지고 text 는 씬 나레이션을 빈 줄로 이은 값.
     */
    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Generated {
        private String text;
        private List<SceneSpec> scenes;
    }
}
