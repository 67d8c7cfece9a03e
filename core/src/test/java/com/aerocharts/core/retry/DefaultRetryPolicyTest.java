package com.aerocharts.core.retry;

import com.aerocharts.core.error.ChartFailureKind;
import com.aerocharts.core.error.ChartSourceException;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class DefaultRetryPolicyTest {

    private static ChartSourceException fail(ChartFailureKind k) {
        return new ChartSourceException(k, k.name());
    }

    @Test
    void only_transient_kinds_and_within_max_attempts() {
        var p = new DefaultRetryPolicy();
        assertEquals(3, p.maxAttempts());

        for (ChartFailureKind k : ChartFailureKind.values()) {
            assertEquals(k.isRetryable(), p.shouldRetry(fail(k), 1), "attempt 1 for " + k);
        }
        assertTrue(p.shouldRetry(fail(ChartFailureKind.BACKEND_TIMEOUT), 2));
        assertFalse(p.shouldRetry(fail(ChartFailureKind.BACKEND_TIMEOUT), 3), "must stop at attempt=3");
    }

    @Test
    void backoff_doubles_with_jitter_plus_minus_10_percent() {
        var p = new DefaultRetryPolicy();
        assertBetween(p.nextDelay(1), 450, 550, "attempt=1");
        assertBetween(p.nextDelay(2), 900, 1100, "attempt=2");
        assertBetween(p.nextDelay(3), 1800, 2200, "attempt=3");
    }

    @Test
    void none_never_retries() {
        assertFalse(RetryPolicy.none().shouldRetry(fail(ChartFailureKind.UPSTREAM_UNAVAILABLE), 1));
    }

    private static void assertBetween(Duration d, long min, long max, String label) {
        long ms = d.toMillis();
        assertTrue(ms >= min && ms <= max, () -> label + " out of range: " + ms + "ms (expected " + min + "~" + max + "ms)");
    }
}
