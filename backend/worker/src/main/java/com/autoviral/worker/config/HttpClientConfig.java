package com.autoviral.worker.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

/**
 * HTTP 클라이언트 / JSON 공통 설정
 * - RestTemplate: 생성형 AI 호출과 플랫폼 업로드가 같이 사용
 * - ObjectMapper: 시리즈 설정, 매니페스트, 오류 페이로드 JSON 컬럼 처리
 */
@Configuration
public class HttpClientConfig {

    /**
     * 연결 30초, 읽기 타임아웃은 설정값 (영상 업로드/이미지 생성은 수 분 걸릴 수 있다)
     */
    @Bean
    @Primary
    public RestTemplate restTemplate(@Value("${http.read-timeout-ms:600000}") int readTimeoutMs) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(30000);
        factory.setReadTimeout(readTimeoutMs);
        return new RestTemplate(factory);
    }

    @Bean
    @Primary
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
