package com.autoviral.worker.service.script;

import com.autoviral.common.exception.ApiException;
import com.autoviral.common.exception.ErrorCode;
import com.autoviral.worker.dto.ScriptDto;
import com.autoviral.worker.dto.SeriesDto;
import com.autoviral.worker.service.ai.OpenAiClient;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class OpenAiScriptGeneratorServiceImpl implements ScriptGeneratorService {

    private static final double SCENE_TEMPERATURE = 0.6;
    private static final int SCENE_MAX_TOKENS = 2000;
    private static final double TEXT_TEMPERATURE = 0.7;
    private static final int TEXT_MAX_TOKENS = 1000;

    private final OpenAiClient openAiClient;
    private final ObjectMapper objectMapper;

    @Value("${openai.chat-model:gpt-4o-mini}")
    private String chatModel;

    @Override
    public ScriptDto.Generated generateScenes(SeriesDto.Config config, int minScenes, int maxScenes) {
        String raw = openAiClient.chat(chatModel,
                ScriptPromptBuilder.SCENE_SYSTEM_PROMPT,
                ScriptPromptBuilder.sceneUserPrompt(config, minScenes, maxScenes),
                SCENE_TEMPERATURE, SCENE_MAX_TOKENS, ErrorCode.SCRIPT_GENERATION_FAILED);

        List<ScriptDto.SceneSpec> scenes = SceneValidator.validate(parseSceneArray(raw), maxScenes);
        log.info("[Script] Generated {} scenes for seriesId={}", scenes.size(), config.getSeriesId());
        return ScriptDto.Generated.builder()
                .text(SceneValidator.joinText(scenes))
                .scenes(scenes)
                .build();
    }

    @Override
    public ScriptDto.Generated generateText(SeriesDto.Config config) {
        String text = openAiClient.chat(chatModel,
                ScriptPromptBuilder.TEXT_SYSTEM_PROMPT,
                ScriptPromptBuilder.textUserPrompt(config),
                TEXT_TEMPERATURE, TEXT_MAX_TOKENS, ErrorCode.SCRIPT_GENERATION_FAILED);
        if (text.isEmpty()) {
            throw new ApiException(ErrorCode.SCRIPT_GENERATION_FAILED, "Script response was empty");
        }
        log.info("[Script] Generated script (length: {} chars) for seriesId={}", text.length(), config.getSeriesId());
        return ScriptDto.Generated.builder().text(text).build();
    }

    JsonNode parseSceneArray(String raw) {
        String cleaned = stripCodeFence(raw);
        try {
            return objectMapper.readTree(cleaned);
        } catch (JsonProcessingException e) {
            log.warn("[Script] LLM returned invalid JSON: {}", e.getOriginalMessage());
            throw new ApiException(ErrorCode.SCRIPT_INVALID_SCENES, "Script scenes response was not valid JSON", e);
        }
    }

    /**
     * 모델이 ```json ... ``` 로 감싸 보낸 경우 제거
     */
    static String stripCodeFence(String raw) {
        String cleaned = raw == null ? "" : raw.trim();
        if (cleaned.startsWith("```json")) {
            cleaned = cleaned.substring(7);
        } else if (cleaned.startsWith("```")) {
            cleaned = cleaned.substring(3);
        }
        if (cleaned.endsWith("```")) {
            cleaned = cleaned.substring(0, cleaned.length() - 3);
        }
        return cleaned.trim();
    }
}
