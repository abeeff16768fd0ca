package com.autoviral.worker.service.tts;

import com.autoviral.worker.dto.SeriesDto;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("OpenAiVoice Tests")
class OpenAiVoiceTest {

    @ParameterizedTest
    @CsvSource({
            "female, warm, NOVA",
            "Female, Warm and calm, NOVA",
            "female, energetic, SHIMMER",
            "male, deep, ONYX",
            "male, neutral, ECHO",
            "MALE, , ECHO",
            "neutral, warm, ALLOY",
            ", , ALLOY"
    })
    @DisplayName("Should map gender and style to a voice")
    void testSelect(String gender, String style, OpenAiVoice expected) {
        SeriesDto.VoiceLanguage voice = SeriesDto.VoiceLanguage.builder()
                .languageCode("en-US").gender(gender).style(style).build();

        assertEquals(expected, OpenAiVoice.select(voice));
    }

    @Test
    @DisplayName("Missing voice settings use alloy")
    void testSelect_Null() {
        assertEquals(OpenAiVoice.ALLOY, OpenAiVoice.select(null));
        assertEquals("alloy", OpenAiVoice.select(null).getVoiceId());
    }
}
