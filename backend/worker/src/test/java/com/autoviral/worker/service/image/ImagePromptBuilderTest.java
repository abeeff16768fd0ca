package com.autoviral.worker.service.image;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ImagePromptBuilder Tests")
class ImagePromptBuilderTest {

    @Test
    @DisplayName("Scene prompt wraps the description with the no-text suffix")
    void testScenePrompt() {
        String prompt = ImagePromptBuilder.scenePrompt("  a lighthouse in a storm  ");

        assertTrue(prompt.startsWith("Create an image with zero readable text. Do not include any writing of any kind. a lighthouse in a storm"));
        assertTrue(prompt.endsWith(ImagePromptBuilder.SCENE_STYLE_SUFFIX));
    }

    @Test
    @DisplayName("Blank description falls back and long ones are cut")
    void testScenePrompt_Bounds() {
        assertTrue(ImagePromptBuilder.scenePrompt(null).contains(ImagePromptBuilder.DEFAULT_SCENE_DESCRIPTION));

        String prompt = ImagePromptBuilder.scenePrompt("x".repeat(1000));
        assertTrue(prompt.contains("x".repeat(400)));
        assertFalse(prompt.contains("x".repeat(401)));
    }

    @Test
    @DisplayName("Cover prompt quotes a bounded snippet of the script")
    void testCoverPrompt() {
        assertTrue(ImagePromptBuilder.coverPrompt("").contains("distant mountains"));
        assertTrue(ImagePromptBuilder.coverPrompt("Money habits").contains("Theme or mood of the video: Money habits. "));
        assertTrue(ImagePromptBuilder.coverPrompt("y".repeat(900)).contains("y".repeat(800) + "..."));
    }

    @Test
    @DisplayName("Provider errors mentioning the safety system are recognized")
    void testIsSafetyRejection() {
        assertTrue(SafetyFilterException.isSafetyRejection("{\"code\":\"content_policy_violation\"}"));
        assertTrue(SafetyFilterException.isSafetyRejection("Rejected by our Safety System"));
        assertFalse(SafetyFilterException.isSafetyRejection("rate limit"));
        assertFalse(SafetyFilterException.isSafetyRejection(null));
    }
}
