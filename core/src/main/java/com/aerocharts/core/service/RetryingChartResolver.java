package com.aerocharts.core.service;

import com.aerocharts.core.api.IChartResolver;
import com.aerocharts.core.error.ChartFailureKind;
import com.aerocharts.core.error.ChartSourceException;
import com.aerocharts.core.model.ChartsResult;
import com.aerocharts.core.retry.RetryPolicy;
import com.aerocharts.core.util.Sleeper;
import com.aerocharts.core.util.StructuredLog;

import java.time.Duration;
import java.util.Objects;

/** 호출자 측 재시도 래퍼: retryable kind(UPSTREAM_UNAVAILABLE, BACKEND_TIMEOUT, VERSION_UNRESOLVED)만 */
public final class RetryingChartResolver implements IChartResolver {

    private static final StructuredLog SLOG = StructuredLog.get(RetryingChartResolver.class);

    private final IChartResolver delegate;
    private final RetryPolicy policy;
    private final Sleeper sleeper;

    public RetryingChartResolver(IChartResolver delegate, RetryPolicy policy, Sleeper sleeper) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    @Override
    public ChartsResult resolve(String identifier) throws ChartSourceException {
        return resolve(identifier, null);
    }

    @Override
    public ChartsResult resolve(String identifier, String sourceId) throws ChartSourceException {
        int attempt = 1;
        while (true) {
            try {
                return delegate.resolve(identifier, sourceId);
            } catch (ChartSourceException e) {
                if (!policy.shouldRetry(e, attempt)) throw e;
                Duration delay = policy.nextDelay(attempt);
                SLOG.warn("retry", "icao", identifier, "kind", e.kind().name(),
                        "attempt", attempt, "delayMs", delay.toMillis());
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new ChartSourceException(ChartFailureKind.BACKEND_TIMEOUT,
                            "interrupted while waiting to retry", e.sourceId(), e.identifier(), e);
                }
                attempt++;
            }
        }
    }
}
