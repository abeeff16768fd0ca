package com.autoviral.worker.config;

import com.autoviral.worker.service.pipeline.RetryPolicy;
import lombok.Getter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.time.Duration;

/**
 * 파이프라인 실행 설정
 */
@Getter
@Configuration
public class PipelineConfig {

    // 씬 기반 영상 (false 면 단일 나레이션 + 단일 이미지)
    @Value("${pipeline.scene-based-video:true}")
    private boolean sceneBasedVideo;

    @Value("${pipeline.scenes.min:5}")
    private int sceneMin;

    @Value("${pipeline.scenes.max:12}")
    private int sceneMax;

    // 게시 몇 시간 전에 스크립트 생성을 시작할지
    @Value("${pipeline.script-lead-hours:6}")
    private int scriptLeadHours;

    @Value("${pipeline.retry.max-attempts:5}")
    private int maxAttempts;

    @Value("${pipeline.retry.base-delay-ms:2000}")
    private long retryBaseDelayMs;

    @Value("${pipeline.retry.max-delay-ms:600000}")
    private long retryMaxDelayMs;

    @Value("${pipeline.worker.concurrency:4}")
    private int workerConcurrency;

    // 작업 점유 시간. 이 시간 안에 ack 가 없으면 다른 워커가 다시 가져간다.
    @Value("${pipeline.worker.visibility-timeout-seconds:1800}")
    private long visibilityTimeoutSeconds;

    @Value("${pipeline.publish.video-url-ttl-seconds:7200}")
    private long videoUrlTtlSeconds;

    public Duration getVisibilityTimeout() {
        return Duration.ofSeconds(visibilityTimeoutSeconds);
    }

    /**
     * 스케줄 계산과 작업 큐가 공유하는 시계
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RetryPolicy retryPolicy() {
        return new RetryPolicy(maxAttempts, retryBaseDelayMs, retryMaxDelayMs);
    }

    @Bean(name = "pipelineExecutor")
    public ThreadPoolTaskExecutor pipelineExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(workerConcurrency);
        executor.setMaxPoolSize(workerConcurrency);
        // 점유는 세마포어로 제한하므로 큐가 쌓이지 않는다
        executor.setQueueCapacity(workerConcurrency);
        executor.setThreadNamePrefix("pipeline-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        return executor;
    }
}
