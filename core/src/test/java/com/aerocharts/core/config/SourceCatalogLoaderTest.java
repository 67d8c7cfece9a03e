package com.aerocharts.core.config;

import com.aerocharts.core.model.AdapterKind;
import com.aerocharts.core.model.SourceDescriptor;
import com.aerocharts.core.model.TimeoutClass;
import com.aerocharts.core.registry.SourceRegistry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SourceCatalogLoaderTest {

    @TempDir
    Path tmp;

    @Test
    void builtin_catalog_loads_and_routes() throws Exception {
        SourceCatalog cat = SourceCatalogLoader.loadDefault();
        SourceRegistry reg = cat.registry();

        assertThat(reg.resolve("KJFK").getAdapterKind()).isEqualTo(AdapterKind.STATIC_HTML);
        assertThat(reg.resolve("LEMD").getAdapterKind()).isEqualTo(AdapterKind.FRAGMENT_FILTERED);
        assertThat(reg.resolve("SAEZ").getTimeoutClass()).isEqualTo(TimeoutClass.SLOW);
        assertThat(reg.resolve("NZAA").isOffline()).isTrue();
        assertThat(reg.resolve("LHBP").option("version-pattern")).contains("(\\d{4}-\\d{2}-\\d{2})");
        assertThat(cat.getConfig().getConcurrency()).isEqualTo(4);
    }

    @Test
    void file_catalog_with_resolver_section() throws Exception {
        String yml = String.join("\n",
                "resolver:",
                "  timeouts: { fastMs: 1000, moderateMs: 2000, slowMs: 9000 }",
                "  concurrency: 2",
                "  userAgent: test-agent",
                "  dataDir: /srv/aerocharts",
                "  browser: { poolSize: 3, headless: false }",
                "sources:",
                "  - id: Brazil",
                "    name: DECEA",
                "    prefixes: SB, SD, SN",
                "    adapter: json-api",
                "    baseEndpoint: https://api.example/",
                "    options:",
                "      api-url: \"{base}charts?icao={icao}\"",
                "      items-path: data",
                "      step: 5");
        Path f = tmp.resolve("catalog.yml");
        Files.writeString(f, yml, StandardCharsets.UTF_8);

        SourceCatalog cat = SourceCatalogLoader.load(f);
        ResolverConfig cfg = cat.getConfig();
        assertThat(cfg.getFastTimeout()).isEqualTo(Duration.ofSeconds(1));
        assertThat(cfg.timeoutFor(TimeoutClass.SLOW)).isEqualTo(Duration.ofSeconds(9));
        assertThat(cfg.getConcurrency()).isEqualTo(2);
        assertThat(cfg.getUserAgent()).isEqualTo("test-agent");
        assertThat(cfg.getDataDir()).isEqualTo(Path.of("/srv/aerocharts"));
        assertThat(cfg.browser().getPoolSize()).isEqualTo(3);
        assertThat(cfg.browser().isHeadless()).isFalse();

        SourceDescriptor d = cat.getSources().get(0);
        assertThat(d.getId()).isEqualTo("brazil");
        assertThat(d.getDisplayName()).isEqualTo("DECEA");
        assertThat(d.getIdentifierPrefixes()).containsExactly("SB", "SD", "SN");
        assertThat(d.getTimeoutClass()).isEqualTo(TimeoutClass.MODERATE);
        assertThat(d.option("api-url")).contains("{base}charts?icao={icao}");
        // 숫자 옵션도 문자열로
        assertThat(d.option("step")).contains("5");
    }

    @Test
    void missing_file_is_io_error() {
        assertThatThrownBy(() -> SourceCatalogLoader.load(tmp.resolve("nope.yml")))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("not found");
    }

    @Test
    void empty_or_malformed_catalog_is_io_error() {
        assertThatThrownBy(() -> load("sources: []"))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("no 'sources'");
        assertThatThrownBy(() -> load("sources: [ {id: a"))
                .isInstanceOf(IOException.class);
        assertThatThrownBy(() -> load("- just\n- a list"))
                .isInstanceOf(IOException.class);
    }

    @Test
    void bad_source_entry_names_its_position() {
        String yml = String.join("\n",
                "sources:",
                "  - { id: ok, prefixes: [K], adapter: static-html, baseEndpoint: 'https://h/' }",
                "  - { id: bad, prefixes: [SA], adapter: browser-automation, baseEndpoint: 'https://h/', timeoutClass: fast }");
        assertThatThrownBy(() -> load(yml))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("sources[1]");
    }

    @Test
    void unknown_adapter_kind_is_rejected() {
        assertThatThrownBy(() -> load("sources:\n  - { id: x, prefixes: [K], adapter: ftp, baseEndpoint: 'https://h/' }"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("sources[0]");
    }

    @Test
    void inconsistent_timeouts_are_rejected() {
        String yml = String.join("\n",
                "resolver:",
                "  timeouts: { fastMs: 50000, moderateMs: 2000 }",
                "sources:",
                "  - { id: ok, prefixes: [K], adapter: static-html, baseEndpoint: 'https://h/' }");
        assertThatThrownBy(() -> load(yml)).isInstanceOf(IllegalArgumentException.class);
    }

    private static SourceCatalog load(String yml) throws IOException {
        return SourceCatalogLoader.load(new ByteArrayInputStream(yml.getBytes(StandardCharsets.UTF_8)), "test.yml");
    }
}
