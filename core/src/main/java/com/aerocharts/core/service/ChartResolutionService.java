package com.aerocharts.core.service;

import com.aerocharts.core.adapter.AdapterFactory;
import com.aerocharts.core.api.IChartAdapter;
import com.aerocharts.core.api.IChartResolver;
import com.aerocharts.core.browser.BrowserSessionPool;
import com.aerocharts.core.browser.PlaywrightBrowserSessionFactory;
import com.aerocharts.core.categorize.ChartCategorizer;
import com.aerocharts.core.config.ResolverConfig;
import com.aerocharts.core.error.ChartFailureKind;
import com.aerocharts.core.error.ChartSourceException;
import com.aerocharts.core.html.ChartLinkExtractor;
import com.aerocharts.core.http.HttpPageFetcher;
import com.aerocharts.core.model.AdapterKind;
import com.aerocharts.core.model.ChartCategory;
import com.aerocharts.core.model.ChartRecord;
import com.aerocharts.core.model.ChartsResult;
import com.aerocharts.core.model.RawChart;
import com.aerocharts.core.model.SourceDescriptor;
import com.aerocharts.core.model.SourceInfo;
import com.aerocharts.core.model.TimeoutClass;
import com.aerocharts.core.registry.SourceRegistry;
import com.aerocharts.core.url.UrlResolutionScope;
import com.aerocharts.core.url.UrlResolver;
import com.aerocharts.core.util.NamedThreadFactory;
import com.aerocharts.core.util.StructuredLog;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 해석 오케스트레이터:
 *  - registry 조회 → 어댑터 호출(타임아웃 등급만큼) → 분류 + URL 정규화/중복 제거 → 결과
 *  - 어댑터 호출은 타임아웃 등급별 워커 풀에서 실행. 시간 초과 시 작업을 interrupt로 취소하고 BACKEND_TIMEOUT
 *  - 오프라인 DB 소스는 네트워크가 없으므로 호출 스레드에서 바로 실행
 *  - 어댑터의 타입 있는 오류는 kind 그대로 전달(재분류/삼킴 없음)
 *  - 0건은 빈 결과(오류 아님)
 *
 * 예상치 못한 런타임 예외: IOException 계열 → UPSTREAM_UNAVAILABLE, 그 외 → PARSE_MISMATCH(원인 보존).
 * 큐에서 기다린 시간도 타임아웃에 포함되지만, 등급별 풀이라 느린 브라우저 소스가 다른 등급을 막지 않는다.
 */
public final class ChartResolutionService implements IChartResolver, AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(ChartResolutionService.class);
    private static final StructuredLog SLOG = StructuredLog.get(ChartResolutionService.class);

    private final SourceRegistry registry;
    private final ResolverConfig config;
    private final Map<AdapterKind, IChartAdapter> adapters;
    private final ChartCategorizer categorizer;
    private final UrlResolver urls;
    private final AutoCloseable resources;
    private final Map<TimeoutClass, ExecutorService> pools = new EnumMap<>(TimeoutClass.class);

    /** 기본 구성: java.net.http fetcher + Jackson + Playwright 세션 풀 */
    public ChartResolutionService(SourceRegistry registry, ResolverConfig config) {
        this(registry, config, defaultPool(config));
    }

    private ChartResolutionService(SourceRegistry registry, ResolverConfig config, BrowserSessionPool pool) {
        this(registry, config,
                AdapterFactory.create(config, new HttpPageFetcher(config), new ObjectMapper(), pool),
                new ChartCategorizer(), new UrlResolver(), pool);
    }

    /** DI 생성자(테스트/플러그인 주입용). resources는 close() 때 함께 닫힌다(null 가능) */
    public ChartResolutionService(SourceRegistry registry,
                                  ResolverConfig config,
                                  Map<AdapterKind, IChartAdapter> adapters,
                                  ChartCategorizer categorizer,
                                  UrlResolver urls,
                                  AutoCloseable resources) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.config = Objects.requireNonNull(config, "config");
        this.adapters = Map.copyOf(Objects.requireNonNull(adapters, "adapters"));
        this.categorizer = Objects.requireNonNull(categorizer, "categorizer");
        this.urls = Objects.requireNonNull(urls, "urls");
        this.resources = resources;
        config.validate();

        for (SourceDescriptor d : registry.descriptors()) {
            if (!this.adapters.containsKey(d.getAdapterKind())) {
                throw new IllegalStateException("no adapter for " + d.getAdapterKind() + " (source " + d.getId() + ")");
            }
        }

        int cc = config.getConcurrency();
        for (TimeoutClass t : TimeoutClass.values()) {
            pools.put(t, new ThreadPoolExecutor(
                    cc, cc,
                    0L, TimeUnit.MILLISECONDS,
                    new LinkedBlockingQueue<>(),
                    new NamedThreadFactory("chart-" + t.name().toLowerCase(Locale.ROOT))));
        }
    }

    private static BrowserSessionPool defaultPool(ResolverConfig config) {
        return new BrowserSessionPool(new PlaywrightBrowserSessionFactory(config),
                config.browser().getPoolSize(),
                Duration.ofMillis(config.browser().getAcquireTimeoutMs()));
    }

    @Override
    public ChartsResult resolve(String identifier) throws ChartSourceException {
        return resolve(identifier, null);
    }

    @Override
    public ChartsResult resolve(String identifier, String sourceId) throws ChartSourceException {
        String id = SourceRegistry.normalize(identifier);
        SourceDescriptor d = (sourceId == null || sourceId.isBlank())
                ? registry.resolve(id)
                : registry.byId(sourceId);
        if (id.isEmpty()) {
            throw new ChartSourceException(ChartFailureKind.UNKNOWN_SOURCE, "identifier is blank", d.getId(), id, null);
        }

        StructuredLog log = SLOG.with("source", d.getId()).with("icao", id);
        Duration timeout = config.timeoutFor(d.getTimeoutClass());
        log.info("resolve-start", "adapter", d.getAdapterKind().name(), "timeoutMs", timeout.toMillis());
        long t0 = System.nanoTime();

        List<RawChart> raw;
        try {
            raw = invoke(adapters.get(d.getAdapterKind()), id, d, timeout);
        } catch (ChartSourceException e) {
            ChartSourceException ctx = e.withContext(d.getId(), id);
            LOG.warn("Resolve {} via {} failed: {} {}", id, d.getId(), ctx.kind(), ctx.getMessage());
            log.warn("adapter-failed", "kind", ctx.kind().name(), "retryable", ctx.isRetryable(),
                    "elapsedMs", (System.nanoTime() - t0) / 1_000_000);
            throw ctx;
        }

        List<ChartRecord> records = normalize(raw, d);
        long elapsedMs = (System.nanoTime() - t0) / 1_000_000;
        LOG.info("Resolved {} via {}: raw={}, charts={}, {} ms", id, d.getId(), raw.size(), records.size(), elapsedMs);
        log.info("resolve-done", "raw", raw.size(), "count", records.size(), "elapsedMs", elapsedMs);

        return ChartsResult.builder()
                .identifier(id)
                .sourceId(d.getId())
                .sourceName(d.getDisplayName())
                .charts(records)
                .fetchedAt(Instant.now())
                .build();
    }

    /** 어댑터를 워커 풀에서 실행하고 timeout 안에 끝나지 않으면 취소 */
    private List<RawChart> invoke(IChartAdapter adapter, String id, SourceDescriptor d, Duration timeout)
            throws ChartSourceException {
        if (d.isOffline()) {
            try {
                List<RawChart> out = adapter.fetch(id, d);
                return out == null ? List.of() : out;
            } catch (RuntimeException e) {
                throw classify(e);
            }
        }

        Future<List<RawChart>> f;
        try {
            f = pools.get(d.getTimeoutClass()).submit(() -> adapter.fetch(id, d));
        } catch (RejectedExecutionException e) {
            throw new ChartSourceException(ChartFailureKind.UPSTREAM_UNAVAILABLE, "resolver is shut down", e);
        }

        try {
            List<RawChart> out = f.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return out == null ? List.of() : out;
        } catch (TimeoutException te) {
            f.cancel(true);
            throw new ChartSourceException(ChartFailureKind.BACKEND_TIMEOUT,
                    d.getDisplayName() + " did not answer within " + timeout.toMillis() + " ms", te);
        } catch (InterruptedException ie) {
            f.cancel(true);
            Thread.currentThread().interrupt();
            throw new ChartSourceException(ChartFailureKind.BACKEND_TIMEOUT, "interrupted while waiting for " + d.getId(), ie);
        } catch (ExecutionException ee) {
            throw classify(ee.getCause() != null ? ee.getCause() : ee);
        }
    }

    static ChartSourceException classify(Throwable cause) {
        if (cause instanceof ChartSourceException) return (ChartSourceException) cause;
        if (cause instanceof IOException || cause instanceof UncheckedIOException) {
            return new ChartSourceException(ChartFailureKind.UPSTREAM_UNAVAILABLE, String.valueOf(cause), cause);
        }
        return new ChartSourceException(ChartFailureKind.PARSE_MISMATCH, "adapter failed: " + cause, cause);
    }

    /** 발행 순서 유지, 같은 URL은 첫 번째만 */
    private List<ChartRecord> normalize(List<RawChart> raw, SourceDescriptor d) {
        UrlResolutionScope scope = urls.newScope();
        List<ChartRecord> out = new ArrayList<>(raw.size());
        for (RawChart r : raw) {
            if (r == null || r.getLocator().isEmpty()) continue;
            String base = r.getBaseUrl().orElse(d.getBaseEndpoint());

            Optional<String> url;
            try {
                url = scope.resolveNew(r.getLocator(), base);
            } catch (IllegalArgumentException e) {
                LOG.warn("Skipping unresolvable locator '{}' from {}: {}", r.getLocator(), d.getId(), e.getMessage());
                continue;
            }
            if (url.isEmpty()) continue;

            String title = r.getTitle().isEmpty() ? ChartLinkExtractor.filename(url.get()) : r.getTitle();
            ChartCategory category = categorizer.categorize(title, r.getSectionHint());
            out.add(new ChartRecord(title, url.get(), category));
        }
        return out;
    }

    public List<SourceInfo> sources() { return registry.sources(); }

    public List<String> prefixes() { return registry.prefixes(); }

    @Override
    public void close() {
        for (ExecutorService pool : pools.values()) pool.shutdownNow();
        try {
            for (Map.Entry<TimeoutClass, ExecutorService> e : pools.entrySet()) {
                if (!e.getValue().awaitTermination(10, TimeUnit.SECONDS)) {
                    LOG.warn("Chart workers ({}) did not stop within 10s", e.getKey());
                }
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
        if (resources != null) {
            try {
                resources.close();
            } catch (Exception e) {
                LOG.warn("Failed to release resolver resources: {}", e.toString());
            }
        }
    }
}
