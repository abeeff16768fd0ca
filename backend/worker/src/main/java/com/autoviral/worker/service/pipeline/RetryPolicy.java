package com.autoviral.worker.service.pipeline;

import com.autoviral.common.exception.ApiException;
import lombok.Getter;

import java.time.Duration;

/**
 * 지수 백오프 재시도 정책
 * attempt 번째 실패 후 대기: min(maxDelay, baseDelay * 2^(attempt-1))
 */
@Getter
public class RetryPolicy {

    private final int maxAttempts;
    private final long baseDelayMs;
    private final long maxDelayMs;

    public RetryPolicy(int maxAttempts, long baseDelayMs, long maxDelayMs) {
        if (maxAttempts < 1 || baseDelayMs < 0 || maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException("Invalid retry policy: attempts=" + maxAttempts
                    + ", base=" + baseDelayMs + ", max=" + maxDelayMs);
        }
        this.maxAttempts = maxAttempts;
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
    }

    public Duration delayAfter(int attempt) {
        int exponent = Math.max(0, Math.min(attempt - 1, 30));
        long delay = baseDelayMs * (1L << exponent);
        if (delay < 0 || delay > maxDelayMs) {
            delay = maxDelayMs;
        }
        return Duration.ofMillis(delay);
    }

    /**
     * 입력/상태 오류(ApiException 4xx 계열)는 다시 실행해도 같은 결과라 재시도하지 않는다.
     */
    public boolean shouldRetry(int attempt, int taskMaxAttempts, Throwable error) {
        if (error instanceof ApiException && !((ApiException) error).isRetryable()) {
            return false;
        }
        return attempt < Math.min(taskMaxAttempts, maxAttempts);
    }
}
