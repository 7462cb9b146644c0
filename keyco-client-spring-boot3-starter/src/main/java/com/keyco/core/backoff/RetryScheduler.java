package com.keyco.core.backoff;

import com.keyco.config.KeycoClientProperties;
import com.keyco.exception.ApiException;

import java.time.Duration;

/**
 * 重试判定与等待时长
 * 只有 error.shouldRetry() 且 attempt < maxRetries 才会重试
 */
public class RetryScheduler {

    private final BackoffRegistry backoff;

    private final KeycoClientProperties props;

    public RetryScheduler(BackoffRegistry backoff, KeycoClientProperties props) {
        this.backoff = backoff;
        this.props = props;
    }

    public boolean shouldRetry(ApiException error, int attempt) {
        return error.shouldRetry() && attempt < maxRetries();
    }

    public Duration delay(int attempt) {
        return backoff.current().delay(attempt, props);
    }

    /**
     * 终态错误: 因次数耗尽而停止时追加 "Retried N times without success."
     */
    public ApiException finalError(ApiException error, int attempt) {
        if (error.shouldRetry() && attempt > 0 && attempt >= maxRetries()) {
            return error.withRetriesExhausted(attempt);
        }
        return error;
    }

    public int maxRetries() {
        return props.getRetry().getMaxRetries();
    }
}
