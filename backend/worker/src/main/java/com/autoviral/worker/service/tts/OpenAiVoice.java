package com.autoviral.worker.service.tts;

import com.autoviral.worker.dto.SeriesDto;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * OpenAI TTS 음성
 */
@Getter
@RequiredArgsConstructor
public enum OpenAiVoice {
    ALLOY("alloy", "neutral", "neutral"),
    ECHO("echo", "male", "neutral"),
    FABLE("fable", "male", "warm"),
    ONYX("onyx", "male", "deep"),
    NOVA("nova", "female", "friendly"),
    SHIMMER("shimmer", "female", "warm");

    private final String voiceId;
    private final String gender;
    private final String style;

    /**
     * 시리즈 음성 설정 → 음성
     * female+warm → nova, female → shimmer, male+deep → onyx, male → echo, 그 외 alloy
     * ("female" 이 "male" 을 포함하므로 female 을 먼저 본다)
     */
    public static OpenAiVoice select(SeriesDto.VoiceLanguage voiceLanguage) {
        if (voiceLanguage == null) {
            return ALLOY;
        }
        String gender = lower(voiceLanguage.getGender());
        String style = lower(voiceLanguage.getStyle());
        if (gender.contains("female")) {
            return style.contains("warm") ? NOVA : SHIMMER;
        }
        if (gender.contains("male")) {
            return style.contains("deep") ? ONYX : ECHO;
        }
        return ALLOY;
    }

    private static String lower(String value) {
        return value == null ? "" : value.toLowerCase();
    }
}
