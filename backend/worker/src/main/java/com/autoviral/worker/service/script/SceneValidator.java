package com.autoviral.worker.service.script;

import com.autoviral.common.exception.ApiException;
import com.autoviral.common.exception.ErrorCode;
import com.autoviral.worker.dto.ScriptDto;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * 텍스트 모델이 돌려준 씬 배열 검증
 *
 * - 비어 있지 않은 배열이어야 하고 각 항목은 객체
 * - text 는 trim 후 비어 있으면 안 됨
 * - visual_description 이 없으면 나레이션 앞 500자
 * - maxScenes 초과분은 잘라내고 번호는 1부터 연속으로 다시 매김
 */
public final class SceneValidator {

    static final int VISUAL_FALLBACK_LENGTH = 500;

    private SceneValidator() {
    }

    public static List<ScriptDto.SceneSpec> validate(JsonNode raw, int maxScenes) {
        if (raw == null || !raw.isArray() || raw.isEmpty()) {
            throw new ApiException(ErrorCode.SCRIPT_INVALID_SCENES, "scenes must be a non-empty list");
        }
        List<ScriptDto.SceneSpec> scenes = new ArrayList<>();
        for (int i = 0; i < raw.size(); i++) {
            JsonNode item = raw.get(i);
            if (!item.isObject()) {
                throw new ApiException(ErrorCode.SCRIPT_INVALID_SCENES, "scene " + i + " must be an object");
            }
            String text = textOf(item.get("text"));
            if (text.isEmpty()) {
                throw new ApiException(ErrorCode.SCRIPT_INVALID_SCENES, "scene " + i + " missing 'text'");
            }
            String visual = textOf(item.get("visual_description"));
            if (visual.isEmpty()) {
                visual = text.length() > VISUAL_FALLBACK_LENGTH ? text.substring(0, VISUAL_FALLBACK_LENGTH) : text;
            }
            scenes.add(ScriptDto.SceneSpec.builder()
                    .scene(i + 1)
                    .text(text)
                    .visualDescription(visual)
                    .build());
        }
        if (maxScenes > 0 && scenes.size() > maxScenes) {
            scenes = new ArrayList<>(scenes.subList(0, maxScenes));
        }
        return scenes;
    }

    /**
     * 씬 나레이션을 빈 줄로 이은 대본 전문
     */
    public static String joinText(List<ScriptDto.SceneSpec> scenes) {
        StringBuilder sb = new StringBuilder();
        for (ScriptDto.SceneSpec scene : scenes) {
            if (sb.length() > 0) {
                sb.append("\n\n");
            }
            sb.append(scene.getText().trim());
        }
        return sb.toString();
    }

    private static String textOf(JsonNode node) {
        if (node == null || node.isNull()) {
            return "";
        }
        return node.asText("").trim();
    }
}
