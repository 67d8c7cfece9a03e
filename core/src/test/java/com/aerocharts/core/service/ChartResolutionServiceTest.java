package com.aerocharts.core.service;

import com.aerocharts.core.api.IChartAdapter;
import com.aerocharts.core.categorize.ChartCategorizer;
import com.aerocharts.core.config.ResolverConfig;
import com.aerocharts.core.error.ChartFailureKind;
import com.aerocharts.core.error.ChartSourceException;
import com.aerocharts.core.model.AdapterKind;
import com.aerocharts.core.model.ChartCategory;
import com.aerocharts.core.model.ChartRecord;
import com.aerocharts.core.model.ChartsResult;
import com.aerocharts.core.model.RawChart;
import com.aerocharts.core.model.SourceDescriptor;
import com.aerocharts.core.model.TimeoutClass;
import com.aerocharts.core.registry.SourceRegistry;
import com.aerocharts.core.url.UrlResolver;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.UncheckedIOException;
import java.net.SocketException;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class ChartResolutionServiceTest {

    private static final String PAGE = "https://aip.example/ad/LEMD.html";

    private ChartResolutionService service;

    @AfterEach
    void tearDown() {
        if (service != null) service.close();
    }

    private static SourceRegistry registry() {
        return new SourceRegistry(List.of(
                SourceDescriptor.builder().id("spain").displayName("ENAIRE").prefix("LE")
                        .adapterKind(AdapterKind.STATIC_HTML).baseEndpoint("https://aip.example/").build(),
                SourceDescriptor.builder().id("brazil").prefix("SB")
                        .adapterKind(AdapterKind.JSON_API).baseEndpoint("https://api.example/")
                        .timeoutClass(TimeoutClass.FAST).build()));
    }

    private ChartResolutionService service(IChartAdapter... adapters) {
        Map<AdapterKind, IChartAdapter> map = new EnumMap<>(AdapterKind.class);
        for (IChartAdapter a : adapters) map.put(a.kind(), a);
        // 지정 안 한 종류는 빈 결과
        for (AdapterKind k : List.of(AdapterKind.STATIC_HTML, AdapterKind.JSON_API)) {
            map.putIfAbsent(k, new StubAdapter(k, (id, d) -> List.of()));
        }
        service = create(map);
        return service;
    }

    private static ChartResolutionService create(Map<AdapterKind, IChartAdapter> adapters) {
        ResolverConfig cfg = ResolverConfig.defaults().setFastTimeout(Duration.ofMillis(300));
        return new ChartResolutionService(registry(), cfg, adapters, new ChartCategorizer(), new UrlResolver(), null);
    }

    private static StubAdapter json(StubAdapter.Behavior b) {
        return new StubAdapter(AdapterKind.JSON_API, b);
    }

    @Test
    void records_are_categorized_resolved_and_deduplicated_in_emission_order() throws Exception {
        StubAdapter html = new StubAdapter(AdapterKind.STATIC_HTML, (id, d) -> List.of(
                RawChart.builder().title("SID RWY 36L").locator("charts/SID 36L.pdf").baseUrl(PAGE).build(),
                RawChart.builder().title("SID RWY 36L (copy)").locator("https://aip.example/ad/charts/SID%2036L.pdf").build(),
                RawChart.builder().title("").locator("AIRPORT_DIAGRAM.pdf").baseUrl(PAGE).build(),
                RawChart.builder().title("Chart 7").locator("/c7.pdf").sectionHint(ChartCategory.APPROACH).build(),
                RawChart.builder().title("Noise").locator("   ").build()));

        ChartsResult r = service(html).resolve(" lemd ");

        assertThat(r.getIdentifier()).isEqualTo("LEMD");
        assertThat(r.getSourceId()).isEqualTo("spain");
        assertThat(r.getSourceName()).isEqualTo("ENAIRE");
        assertThat(r.getCharts()).containsExactly(
                new ChartRecord("SID RWY 36L", "https://aip.example/ad/charts/SID%2036L.pdf", ChartCategory.DEPARTURE_PROCEDURE),
                new ChartRecord("AIRPORT DIAGRAM", "https://aip.example/ad/AIRPORT_DIAGRAM.pdf", ChartCategory.GROUND),
                new ChartRecord("Chart 7", "https://aip.example/c7.pdf", ChartCategory.APPROACH));
    }

    @Test
    void zero_charts_is_a_result_not_a_failure() throws Exception {
        ChartsResult r = service(json((id, d) -> List.of())).resolve("SBGR");
        assertThat(r.isEmpty()).isTrue();
        assertThat(r.getSourceId()).isEqualTo("brazil");
    }

    @Test
    void adapter_failure_surfaces_unchanged_with_context() {
        service(json((id, d) -> {
            throw new ChartSourceException(ChartFailureKind.ACCESS_RESTRICTED, "login wall");
        }));
        ChartSourceException e = catchThrowableOfType(() -> service.resolve("SBGR"), ChartSourceException.class);
        assertThat(e.kind()).isEqualTo(ChartFailureKind.ACCESS_RESTRICTED);
        assertThat(e.getMessage()).isEqualTo("login wall");
        assertThat(e.sourceId()).isEqualTo("brazil");
        assertThat(e.identifier()).isEqualTo("SBGR");
    }

    @Test
    void unknown_prefix_never_reaches_an_adapter() {
        StubAdapter a = json((id, d) -> List.of());
        service(a);
        ChartSourceException e = catchThrowableOfType(() -> service.resolve("ZZZZ"), ChartSourceException.class);
        assertThat(e.kind()).isEqualTo(ChartFailureKind.UNKNOWN_SOURCE);
        assertThat(a.calls.get()).isZero();
    }

    @Test
    void slow_adapter_is_cancelled_at_its_timeout_class() throws Exception {
        CountDownLatch interrupted = new CountDownLatch(1);
        service(json((id, d) -> {
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException ie) {
                interrupted.countDown();
                throw ie;
            }
            return List.of();
        }));

        long t0 = System.nanoTime();
        ChartSourceException e = catchThrowableOfType(() -> service.resolve("SBGR"), ChartSourceException.class);
        long ms = (System.nanoTime() - t0) / 1_000_000;

        assertThat(e.kind()).isEqualTo(ChartFailureKind.BACKEND_TIMEOUT);
        assertThat(e.isRetryable()).isTrue();
        assertThat(ms).isLessThan(5_000);
        assertThat(interrupted.await(2, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void unexpected_adapter_errors_are_classified() {
        service(json((id, d) -> { throw new UncheckedIOException(new SocketException("reset")); }));
        assertThat(catchThrowableOfType(() -> service.resolve("SBGR"), ChartSourceException.class).kind())
                .isEqualTo(ChartFailureKind.UPSTREAM_UNAVAILABLE);
        service.close();

        service(json((id, d) -> { throw new IllegalStateException("selector returned nothing"); }));
        assertThat(catchThrowableOfType(() -> service.resolve("SBGR"), ChartSourceException.class).kind())
                .isEqualTo(ChartFailureKind.PARSE_MISMATCH);
    }

    @Test
    void explicit_source_overrides_prefix_routing() throws Exception {
        StubAdapter html = new StubAdapter(AdapterKind.STATIC_HTML, (id, d) -> List.of());
        StubAdapter api = json((id, d) -> List.of());
        service(html, api);

        assertThat(service.resolve("LEMD", "BRAZIL").getSourceId()).isEqualTo("brazil");
        assertThat(api.calls.get()).isEqualTo(1);
        assertThat(html.calls.get()).isZero();

        ChartSourceException e = catchThrowableOfType(() -> service.resolve("LEMD", "nope"), ChartSourceException.class);
        assertThat(e.kind()).isEqualTo(ChartFailureKind.UNKNOWN_SOURCE);
    }

    @Test
    void busy_slow_sources_do_not_starve_other_sources() throws Exception {
        SourceRegistry mixed = new SourceRegistry(List.of(
                SourceDescriptor.builder().id("argentina").prefix("SA")
                        .adapterKind(AdapterKind.BROWSER_AUTOMATION).baseEndpoint("https://ais.example/").build(),
                SourceDescriptor.builder().id("new_zealand").prefix("NZ")
                        .adapterKind(AdapterKind.OFFLINE_DATABASE).option("database", "nz.json").build(),
                SourceDescriptor.builder().id("spain").prefix("LE")
                        .adapterKind(AdapterKind.STATIC_HTML).baseEndpoint("https://aip.example/").build()));

        CountDownLatch started = new CountDownLatch(2);
        CountDownLatch release = new CountDownLatch(1);
        Map<AdapterKind, IChartAdapter> adapters = new EnumMap<>(AdapterKind.class);
        adapters.put(AdapterKind.BROWSER_AUTOMATION, new StubAdapter(AdapterKind.BROWSER_AUTOMATION, (id, d) -> {
            started.countDown();
            release.await(10, TimeUnit.SECONDS);
            return List.of();
        }));
        adapters.put(AdapterKind.OFFLINE_DATABASE, new StubAdapter(AdapterKind.OFFLINE_DATABASE,
                (id, d) -> List.of(RawChart.of("NZAA ILS RWY 23L", "https://aip.example/NZAA_41.pdf"))));
        adapters.put(AdapterKind.STATIC_HTML, new StubAdapter(AdapterKind.STATIC_HTML,
                (id, d) -> List.of(RawChart.of("LEMD SID RWY 36L", "https://aip.example/LEMD_sid.pdf"))));

        ResolverConfig cfg = ResolverConfig.defaults()
                .setConcurrency(2)
                .setFastTimeout(Duration.ofMillis(300))
                .setModerateTimeout(Duration.ofMillis(1_000))
                .setSlowTimeout(Duration.ofSeconds(10));
        service = new ChartResolutionService(mixed, cfg, adapters, new ChartCategorizer(), new UrlResolver(), null);

        ExecutorService callers = Executors.newFixedThreadPool(2);
        try {
            List<Future<ChartsResult>> slow = List.of(
                    callers.submit(() -> service.resolve("SAEZ")),
                    callers.submit(() -> service.resolve("SABE")));
            assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

            // 느린 등급의 워커가 모두 점유된 상태
            assertThat(service.resolve("NZAA").getCharts()).extracting(ChartRecord::getCategory)
                    .containsExactly(ChartCategory.APPROACH);
            assertThat(service.resolve("LEMD").getCharts()).extracting(ChartRecord::getCategory)
                    .containsExactly(ChartCategory.DEPARTURE_PROCEDURE);

            release.countDown();
            for (Future<ChartsResult> f : slow) {
                assertThat(f.get(5, TimeUnit.SECONDS).isEmpty()).isTrue();
            }
        } finally {
            release.countDown();
            callers.shutdownNow();
        }
    }

    @Test
    void every_configured_kind_needs_an_adapter() {
        Map<AdapterKind, IChartAdapter> onlyJson = Map.of(AdapterKind.JSON_API, json((id, d) -> List.of()));
        assertThatThrownBy(() -> create(onlyJson))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("STATIC_HTML");
    }

    @Test
    void listing_delegates_to_registry() {
        service();
        assertThat(service.prefixes()).containsExactly("LE", "SB");
        assertThat(service.sources()).hasSize(2);
    }
}
