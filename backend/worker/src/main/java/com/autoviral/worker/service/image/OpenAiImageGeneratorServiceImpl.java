package com.autoviral.worker.service.image;

import com.autoviral.common.exception.ApiException;
import com.autoviral.worker.service.ai.OpenAiClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class OpenAiImageGeneratorServiceImpl implements ImageGeneratorService {

    static final String SIZE_VERTICAL = "1024x1792";

    private final OpenAiClient openAiClient;

    @Value("${openai.image-model:dall-e-3}")
    private String imageModel;

    @Value("${openai.generate-video-image:true}")
    private boolean enabled;

    @Override
    public Optional<byte[]> generateSceneImage(String visualDescription, int sceneIndex) {
        if (!enabled || !openAiClient.isConfigured()) {
            return Optional.empty();
        }
        String prompt = ImagePromptBuilder.scenePrompt(visualDescription);
        try {
            return Optional.of(openAiClient.image(imageModel, prompt, SIZE_VERTICAL));
        } catch (SafetyFilterException e) {
            log.warn("[Image] scene {} blocked by safety filter, retrying with fallback prompt", sceneIndex);
        } catch (ApiException e) {
            log.warn("[Image] scene {} failed: {}", sceneIndex, e.getMessage());
            return Optional.empty();
        }
        try {
            return Optional.of(openAiClient.image(imageModel, ImagePromptBuilder.SAFE_FALLBACK_PROMPT, SIZE_VERTICAL));
        } catch (SafetyFilterException | ApiException e) {
            log.warn("[Image] fallback scene image {} also failed: {}", sceneIndex, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public Optional<byte[]> generateCoverImage(String scriptText) {
        if (!enabled || !openAiClient.isConfigured()) {
            return Optional.empty();
        }
        try {
            return Optional.of(openAiClient.image(imageModel, ImagePromptBuilder.coverPrompt(scriptText), SIZE_VERTICAL));
        } catch (SafetyFilterException | ApiException e) {
            log.warn("[Image] cover image failed: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
