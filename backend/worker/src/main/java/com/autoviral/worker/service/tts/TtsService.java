package com.autoviral.worker.service.tts;

/**
 * 나레이션 음성 합성
 */
public interface TtsService {

    /**
     * @return mp3 바이트
     */
    byte[] synthesize(String text, OpenAiVoice voice);
}
