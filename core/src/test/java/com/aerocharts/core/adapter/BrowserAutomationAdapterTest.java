package com.aerocharts.core.adapter;

import com.aerocharts.core.browser.BrowserSessionPool;
import com.aerocharts.core.browser.FakeBrowserSession;
import com.aerocharts.core.error.ChartFailureKind;
import com.aerocharts.core.error.ChartSourceException;
import com.aerocharts.core.model.AdapterKind;
import com.aerocharts.core.model.RawChart;
import com.aerocharts.core.model.SourceDescriptor;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class BrowserAutomationAdapterTest {

    private static final String RESULTS = String.join("\n",
            "<table>",
            "<tr><th>Documento</th><th></th></tr>",
            "<tr><td>Plano de Aeródromo SAEZ</td><td><a href='/aip/descarga/SAEZ_ADC.pdf'>Descargar</a></td></tr>",
            "<tr><td>SAEZ SID RWY 11</td><td><a href='/aip/descarga/SAEZ_SID11.pdf'>Descargar</a></td></tr>",
            "<tr><td>Plano de Aeródromo SABE</td><td><a href='/aip/descarga/SABE_ADC.pdf'>Descargar</a></td></tr>",
            "</table>");

    private final FakeBrowserSession session = new FakeBrowserSession();
    private final BrowserSessionPool pool = new BrowserSessionPool(() -> session, 1, Duration.ofMillis(100));

    private static SourceDescriptor argentina() {
        return SourceDescriptor.builder()
                .id("argentina").prefix("SA")
                .adapterKind(AdapterKind.BROWSER_AUTOMATION)
                .baseEndpoint("https://ais.example/aip")
                .option("browser-url", "{base}#ad")
                .option("tab-selector", "a[href*='#ad']")
                .option("search-selector", "input[type='search']")
                .option("results-selector", "tr")
                .option("link-pattern", "descarga")
                .option("settle-ms", "10")
                .build();
    }

    @Test
    void scripted_search_then_rows_for_the_identifier() throws Exception {
        session.html = RESULTS;
        session.url = "https://ais.example/aip#ad";

        List<RawChart> raw = new BrowserAutomationAdapter(pool).fetch("saez", argentina());

        assertThat(session.calls).containsExactly(
                "navigate https://ais.example/aip#ad",
                "click a[href*='#ad']",
                "fill input[type='search'] SAEZ",
                "press Enter",
                "wait tr",
                "settle");
        assertThat(raw).extracting(RawChart::getTitle)
                .containsExactly("Plano de Aeródromo SAEZ", "SAEZ SID RWY 11");
        assertThat(raw.get(0).getBaseUrl()).contains("https://ais.example/aip#ad");
        assertThat(session.closed).isTrue();
        assertThat(pool.available()).isEqualTo(1);
    }

    @Test
    void results_never_appearing_is_not_found_and_session_is_released() {
        session.resultsAppear = false;

        ChartSourceException e = catchThrowableOfType(
                () -> new BrowserAutomationAdapter(pool).fetch("SAZZ", argentina()), ChartSourceException.class);

        assertThat(e.kind()).isEqualTo(ChartFailureKind.NOT_FOUND);
        assertThat(session.closed).isTrue();
        assertThat(pool.available()).isEqualTo(1);
    }

    @Test
    void navigation_timeout_releases_session() {
        session.navigateFailure = new ChartSourceException(ChartFailureKind.BACKEND_TIMEOUT, "navigation timed out");

        ChartSourceException e = catchThrowableOfType(
                () -> new BrowserAutomationAdapter(pool).fetch("SAEZ", argentina()), ChartSourceException.class);

        assertThat(e.kind()).isEqualTo(ChartFailureKind.BACKEND_TIMEOUT);
        assertThat(pool.available()).isEqualTo(1);
    }

    @Test
    void extraction_without_identifier_filter_keeps_every_row() {
        SourceDescriptor d = SourceDescriptor.builder()
                .id("argentina").prefix("SA")
                .adapterKind(AdapterKind.BROWSER_AUTOMATION)
                .baseEndpoint("https://ais.example/aip")
                .option("search-selector", "input")
                .option("results-selector", "tr")
                .option("link-pattern", "descarga")
                .option("filter-identifier", "false")
                .build();
        List<RawChart> raw = BrowserAutomationAdapter.extract(RESULTS, "https://ais.example/aip", "SAEZ", d);
        assertThat(raw).hasSize(3);
    }
}
