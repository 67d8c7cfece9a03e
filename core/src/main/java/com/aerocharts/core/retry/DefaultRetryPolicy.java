package com.aerocharts.core.retry;

import com.aerocharts.core.error.ChartSourceException;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/** 일시적 실패(retryable kind)만 재시도. 500ms → 1000ms → 2000ms (±10% Jitter) */
public final class DefaultRetryPolicy implements RetryPolicy {
    private final int maxAttempts;
    private final long baseMillis;

    public DefaultRetryPolicy() { this(3, 500); }

    public DefaultRetryPolicy(int maxAttempts, long baseMillis) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.baseMillis = Math.max(1, baseMillis);
    }

    @Override public boolean shouldRetry(ChartSourceException failure, int attempt) {
        return attempt < maxAttempts && failure.isRetryable();
    }

    @Override public Duration nextDelay(int attempt) {
        long raw = baseMillis << Math.min(20, Math.max(0, attempt - 1));
        double jitter = 0.9 + ThreadLocalRandom.current().nextDouble(0.2);
        return Duration.ofMillis((long) (raw * jitter));
    }

    @Override public int maxAttempts() { return maxAttempts; }
}
