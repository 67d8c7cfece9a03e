package com.aerocharts.core.browser;

import com.aerocharts.core.error.ChartFailureKind;
import com.aerocharts.core.error.ChartSourceException;
import com.aerocharts.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 동시 브라우저 세션 수를 제한하는 풀.
 * lease()는 permit 획득 후 세션을 새로 연다. Lease.close()는 세션을 닫고 permit을 반환(여러 번 호출해도 1회만).
 *
 * 사용:
 * <pre>
 * try (BrowserSessionPool.Lease lease = pool.lease()) {
 *     lease.session().navigate(...);
 * }
 * </pre>
 */
public final class BrowserSessionPool implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(BrowserSessionPool.class);
    private static final StructuredLog SLOG = StructuredLog.get(BrowserSessionPool.class);

    private final BrowserSessionFactory factory;
    private final Semaphore permits;
    private final int size;
    private final Duration acquireTimeout;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public BrowserSessionPool(BrowserSessionFactory factory, int size, Duration acquireTimeout) {
        if (size < 1) throw new IllegalArgumentException("pool size must be >= 1");
        this.factory = Objects.requireNonNull(factory, "factory");
        this.size = size;
        this.permits = new Semaphore(size, true);
        this.acquireTimeout = Objects.requireNonNull(acquireTimeout, "acquireTimeout");
    }

    public Lease lease() throws ChartSourceException {
        if (closed.get()) {
            throw new ChartSourceException(ChartFailureKind.UPSTREAM_UNAVAILABLE, "browser pool is closed");
        }
        try {
            if (!permits.tryAcquire(acquireTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                throw new ChartSourceException(ChartFailureKind.BACKEND_TIMEOUT,
                        "no browser session available within " + acquireTimeout.toMillis() + " ms");
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new ChartSourceException(ChartFailureKind.BACKEND_TIMEOUT, "interrupted while waiting for a browser session", ie);
        }

        BrowserSession session;
        try {
            session = factory.open();
        } catch (ChartSourceException | RuntimeException e) {
            permits.release();
            throw e;
        }
        SLOG.debug("session-leased", "available", permits.availablePermits(), "size", size);
        return new Lease(session);
    }

    /** 남은 permit 수 */
    public int available() { return permits.availablePermits(); }

    public int size() { return size; }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            factory.close();
        }
    }

    public final class Lease implements AutoCloseable {
        private final BrowserSession session;
        private final AtomicBoolean released = new AtomicBoolean(false);

        private Lease(BrowserSession session) {
            this.session = session;
        }

        public BrowserSession session() { return session; }

        @Override
        public void close() {
            if (!released.compareAndSet(false, true)) return;
            try {
                session.close();
            } catch (RuntimeException e) {
                LOG.warn("Browser session close failed: {}", e.toString());
            } finally {
                permits.release();
                SLOG.debug("session-released", "available", permits.availablePermits(), "size", size);
            }
        }
    }
}
