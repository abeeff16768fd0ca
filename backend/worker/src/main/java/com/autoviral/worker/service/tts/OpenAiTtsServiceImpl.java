package com.autoviral.worker.service.tts;

import com.autoviral.common.exception.ApiException;
import com.autoviral.common.exception.ErrorCode;
import com.autoviral.worker.service.ai.OpenAiClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class OpenAiTtsServiceImpl implements TtsService {

    static final int MAX_INPUT_LENGTH = 4096;

    private final OpenAiClient openAiClient;

    @Value("${openai.tts-model:tts-1}")
    private String ttsModel;

    @Override
    public byte[] synthesize(String text, OpenAiVoice voice) {
        if (text == null || text.isBlank()) {
            throw new ApiException(ErrorCode.TTS_GENERATION_FAILED, "Narration text is empty");
        }
        String input = text.length() > MAX_INPUT_LENGTH ? text.substring(0, MAX_INPUT_LENGTH) : text;
        byte[] audio = openAiClient.speech(ttsModel, voice.getVoiceId(), input);
        log.info("[TTS] voice={} chars={} bytes={}", voice.getVoiceId(), input.length(), audio.length);
        return audio;
    }
}
