package com.autoviral.worker.service.image;

/**
 * 이미지 프롬프트. 글자가 들어간 이미지가 나오지 않도록 모든 프롬프트에 금지 문구를 붙인다.
 */
public final class ImagePromptBuilder {

    static final int SCENE_DESCRIPTION_MAX = 400;
    static final int COVER_SNIPPET_MAX = 800;

    static final String DEFAULT_SCENE_DESCRIPTION = "atmospheric cinematic moment, moody lighting";

    static final String SCENE_STYLE_SUFFIX =
            " Cinematic dramatic lighting, photorealistic, film grain, shallow depth of field, "
            + "professional color grading, no text or logos, vertical composition 9:16, hyper realistic. "
            + "Family-friendly, PG-13 only, no gore, no graphic violence, no weapons, no nudity. "
            + "Absolutely no letters, words, subtitles, captions, signage, watermarks, UI, or symbols.";

    public static final String SAFE_FALLBACK_PROMPT =
            "Soft, abstract atmospheric background with gentle gradients and subtle light rays, "
            + "no characters, no creatures, no text, no symbols, no violence, suitable for a "
            + "family-friendly short vertical story. Vertical 9:16 composition, cinematic lighting.";

    private ImagePromptBuilder() {
    }

    public static String scenePrompt(String visualDescription) {
        String desc = visualDescription == null ? "" : visualDescription.trim();
        if (desc.length() > SCENE_DESCRIPTION_MAX) {
            desc = desc.substring(0, SCENE_DESCRIPTION_MAX);
        }
        if (desc.isEmpty()) {
            desc = DEFAULT_SCENE_DESCRIPTION;
        }
        return "Create an image with zero readable text. Do not include any writing of any kind. "
                + desc + SCENE_STYLE_SUFFIX;
    }

    /**
     * 레거시 모드 커버 이미지 (대본 전체 분위기)
     */
    public static String coverPrompt(String scriptText) {
        String text = scriptText == null ? "" : scriptText.trim();
        if (text.isEmpty()) {
            return "Photorealistic cinematic scene: soft gradient sky and distant mountains, "
                    + "professional color grading, shallow depth of field, vertical composition, no text.";
        }
        String snippet = text.length() > COVER_SNIPPET_MAX ? text.substring(0, COVER_SNIPPET_MAX).trim() + "..." : text;
        return "Photorealistic, cinematic photograph suitable as the background for a short vertical video. "
                + "Theme or mood of the video: " + snippet + ". "
                + "Style: realistic photography, film look, professional color grading, shallow depth of field, "
                + "high quality, no text or logos, no cartoon or illustration. Portrait orientation, 9:16 aspect. "
                + "Family-friendly, PG-13 tone, no gore, no graphic violence, no explicit injuries or disturbing content.";
    }
}
