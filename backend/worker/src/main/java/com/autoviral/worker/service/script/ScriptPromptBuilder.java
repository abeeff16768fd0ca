package com.autoviral.worker.service.script;

import com.autoviral.worker.dto.SeriesDto;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 대본 생성 프롬프트
 */
public final class ScriptPromptBuilder {

    static final String SCENE_SYSTEM_PROMPT =
            "You are a professional scriptwriter for short vertical videos (Reels/TikTok). "
            + "Output ONLY a valid JSON array of scenes. No markdown, no code fence, no explanation.";

    static final String TEXT_SYSTEM_PROMPT =
            "You are a professional scriptwriter for short-form video content. "
            + "Create engaging, concise scripts optimized for social media platforms.";

    private static final String DEFAULT_LANGUAGE = "en-US";

    private static final Map<String, String> SCENE_THEMES = Map.of(
            "motivation", "inspiring motivational short-form video",
            "horror", "suspenseful horror story",
            "finance", "educational finance tip",
            "ai_tech", "engaging AI and technology explainer",
            "kids", "fun, educational content for children",
            "anime", "anime-style narrative",
            "custom", "custom content"
    );

    private static final Map<String, String> TEXT_BASES = Map.of(
            "motivation", "Create an inspiring motivational short-form video script",
            "horror", "Create a suspenseful horror story script",
            "finance", "Create an educational finance tip script",
            "ai_tech", "Create an engaging AI and technology explainer script",
            "kids", "Create a fun, educational script suitable for children",
            "anime", "Create an anime-style narrative script",
            "custom", "Create a custom content script"
    );

    private ScriptPromptBuilder() {
    }

    public static String sceneUserPrompt(SeriesDto.Config config, int minScenes, int maxScenes) {
        String theme = SCENE_THEMES.getOrDefault(config.getContentType(), "short-form video");
        SeriesDto.CustomTopic topic = config.getCustomTopic();
        if ("custom".equals(config.getContentType()) && topic != null) {
            theme = "custom: " + (topic.getTopicTitle() != null ? topic.getTopicTitle() : theme);
        }
        SeriesDto.ScriptPreferences prefs = config.getScriptPreferences();
        String lengthSec = prefs != null && "45_60".equals(prefs.getStoryLength()) ? "45-60" : "30-40";

        StringBuilder prompt = new StringBuilder()
                .append("Create a ").append(theme).append(" script for ").append(lengthSec)
                .append(" seconds of spoken content. ")
                .append("Split it into exactly ").append(minScenes).append(" to ").append(maxScenes)
                .append(" short scenes. ")
                .append("For each scene provide: ")
                .append("\"scene\" (1-based index), ")
                .append("\"text\" (the exact narration for that scene, one or two sentences), ")
                .append("\"visual_description\" (short cinematic visual for that moment: setting, mood. ")
                .append("MUST contain no text/letters/words/subtitles/signage/watermarks). ")
                .append("Keep visual_description under 100 words, cinematic and concrete. ")
                .append("Output a JSON array only, e.g. [{\"scene\":1,\"text\":\"...\",\"visual_description\":\"...\"}, ...]");
        String language = config.getLanguageCode();
        if (!DEFAULT_LANGUAGE.equals(language)) {
            prompt.append(" Language for narration: ").append(language).append(".");
        }
        return prompt.toString();
    }

    public static String textUserPrompt(SeriesDto.Config config) {
        List<String> parts = new ArrayList<>();
        String base = TEXT_BASES.getOrDefault(config.getContentType(), "Create a video script");
        SeriesDto.CustomTopic topic = config.getCustomTopic();

        if ("custom".equals(config.getContentType()) && topic != null) {
            parts.add(base + " about: " + nullToEmpty(topic.getTopicTitle()));
            if (notBlank(topic.getTargetAudience())) {
                parts.add("Target audience: " + topic.getTargetAudience());
            }
            if (notBlank(topic.getTone())) {
                parts.add("Tone: " + topic.getTone());
            }
            if (topic.getKeywords() != null && !topic.getKeywords().isEmpty()) {
                parts.add("Keywords to include: " + String.join(", ", topic.getKeywords()));
            }
            if (notBlank(topic.getCtaStyle())) {
                parts.add("Call-to-action style: " + topic.getCtaStyle());
            }
        } else {
            parts.add(base);
        }

        SeriesDto.ScriptPreferences prefs = config.getScriptPreferences();
        if (prefs != null) {
            String storyLength = prefs.getStoryLength() != null ? prefs.getStoryLength() : "30_40";
            if ("30_40".equals(storyLength)) {
                parts.add("Length: 30-40 seconds of spoken content");
            } else if ("45_60".equals(storyLength)) {
                parts.add("Length: 45-60 seconds of spoken content");
            }
            if (notBlank(prefs.getTone())) {
                parts.add("Tone: " + prefs.getTone());
            }
            if (notBlank(prefs.getHookStrength())) {
                parts.add("Hook strength: " + prefs.getHookStrength());
            }
            if (prefs.isIncludeCta() && notBlank(prefs.getCtaText())) {
                parts.add("Include call-to-action: " + prefs.getCtaText());
            }
        }
        String language = config.getLanguageCode();
        if (!DEFAULT_LANGUAGE.equals(language)) {
            parts.add("Language: " + language);
        }
        parts.add("Write only the script text, no stage directions or notes. "
                + "Make it engaging and suitable for a short-form video.");
        return String.join("\n", parts);
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
