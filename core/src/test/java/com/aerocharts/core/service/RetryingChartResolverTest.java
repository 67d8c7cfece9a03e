package com.aerocharts.core.service;

import com.aerocharts.core.api.IChartResolver;
import com.aerocharts.core.error.ChartFailureKind;
import com.aerocharts.core.error.ChartSourceException;
import com.aerocharts.core.model.ChartsResult;
import com.aerocharts.core.retry.DefaultRetryPolicy;
import com.aerocharts.core.util.Sleeper;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class RetryingChartResolverTest {

    /** sleep(Duration) 호출 기록 */
    static final class TestSleeper implements Sleeper {
        final List<Duration> sleeps = new ArrayList<>();
        @Override public void sleep(Duration d) { sleeps.add(d); }
    }

    /** n번째 호출까지 실패, 이후 성공 */
    static final class Flaky implements IChartResolver {
        final AtomicInteger calls = new AtomicInteger();
        final int failures;
        final ChartFailureKind kind;
        Flaky(int failures, ChartFailureKind kind) { this.failures = failures; this.kind = kind; }

        @Override public ChartsResult resolve(String identifier) throws ChartSourceException {
            return resolve(identifier, null);
        }

        @Override public ChartsResult resolve(String identifier, String sourceId) throws ChartSourceException {
            if (calls.incrementAndGet() <= failures) {
                throw new ChartSourceException(kind, "attempt " + calls.get(), "estonia", identifier, null);
            }
            return ChartsResult.builder().identifier(identifier).sourceId("estonia").build();
        }
    }

    @Test
    void transient_failure_is_retried_with_backoff() throws Exception {
        Flaky flaky = new Flaky(2, ChartFailureKind.UPSTREAM_UNAVAILABLE);
        TestSleeper sleeper = new TestSleeper();

        ChartsResult r = new RetryingChartResolver(flaky, new DefaultRetryPolicy(3, 100), sleeper).resolve("EETN");

        assertEquals("EETN", r.getIdentifier());
        assertEquals(3, flaky.calls.get());
        assertEquals(2, sleeper.sleeps.size());
        assertTrue(sleeper.sleeps.get(1).compareTo(sleeper.sleeps.get(0)) > 0, "backoff must grow");
    }

    @Test
    void gives_up_after_max_attempts() {
        Flaky flaky = new Flaky(10, ChartFailureKind.VERSION_UNRESOLVED);
        ChartSourceException e = assertThrows(ChartSourceException.class,
                () -> new RetryingChartResolver(flaky, new DefaultRetryPolicy(3, 1), new TestSleeper()).resolve("EETN"));
        assertEquals(ChartFailureKind.VERSION_UNRESOLVED, e.kind());
        assertEquals(3, flaky.calls.get());
    }

    @Test
    void terminal_failure_is_not_retried() {
        Flaky flaky = new Flaky(1, ChartFailureKind.NOT_FOUND);
        TestSleeper sleeper = new TestSleeper();
        assertThrows(ChartSourceException.class,
                () -> new RetryingChartResolver(flaky, new DefaultRetryPolicy(), sleeper).resolve("EEXX"));
        assertEquals(1, flaky.calls.get());
        assertTrue(sleeper.sleeps.isEmpty());
    }

    @Test
    void interrupted_wait_stops_retrying() {
        Flaky flaky = new Flaky(5, ChartFailureKind.BACKEND_TIMEOUT);
        Sleeper interrupting = d -> { throw new InterruptedException("stop"); };
        try {
            ChartSourceException e = assertThrows(ChartSourceException.class,
                    () -> new RetryingChartResolver(flaky, new DefaultRetryPolicy(), interrupting).resolve("EETN"));
            assertEquals(ChartFailureKind.BACKEND_TIMEOUT, e.kind());
            assertTrue(Thread.currentThread().isInterrupted());
            assertEquals(1, flaky.calls.get());
        } finally {
            Thread.interrupted();
        }
    }
}
