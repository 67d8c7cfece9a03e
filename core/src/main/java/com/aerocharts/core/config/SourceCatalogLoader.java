package com.aerocharts.core.config;

import com.aerocharts.core.model.AdapterKind;
import com.aerocharts.core.model.SourceDescriptor;
import com.aerocharts.core.model.TimeoutClass;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.IntConsumer;

/**
 * sources.yml을 읽어 SourceCatalog로 변환.
 *
 * 예상 YAML 키:
 * resolver:
 *   timeouts: { fastMs: 10000, moderateMs: 30000, slowMs: 120000 }
 *   connectTimeoutMs: 10000
 *   followRedirects: true
 *   userAgent: "..."
 *   concurrency: 4
 *   dataDir: "data"
 *   browser: { poolSize: 2, headless: true, acquireTimeoutMs: 60000 }
 *
 * sources:
 *   - id: faa
 *     name: "FAA (United States)"
 *     prefixes: [K]
 *     excludePrefixes: []            # 옵션
 *     adapter: static-html           # static-html | fragment-filtered | json-api | browser-automation | offline-database
 *     baseEndpoint: "https://..."
 *     timeoutClass: moderate         # fast | moderate | slow (생략 시 어댑터 기본)
 *     options: { airport-page: "{base}?airportId={icao3}" }
 */
public final class SourceCatalogLoader {

    /** 클래스패스 기본 카탈로그 */
    public static final String DEFAULT_RESOURCE = "aerocharts/sources.yml";

    private SourceCatalogLoader() {}

    /** -Dac.catalog가 있으면 그 파일, 없으면 클래스패스 기본 카탈로그 */
    public static SourceCatalog loadDefault() throws IOException {
        String override = System.getProperty("ac.catalog");
        if (override != null && !override.isBlank()) {
            return load(Path.of(override.trim()));
        }
        try (InputStream in = SourceCatalogLoader.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) throw new IOException("default catalog not found on classpath: " + DEFAULT_RESOURCE);
            return load(in, "classpath:" + DEFAULT_RESOURCE);
        }
    }

    public static SourceCatalog load(Path yamlPath) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        if (!Files.exists(yamlPath)) {
            throw new IOException("catalog not found at: " + yamlPath.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(yamlPath)) {
            return load(in, yamlPath.toString());
        }
    }

    public static SourceCatalog load(InputStream in, String origin) throws IOException {
        Object root;
        try {
            root = new Yaml(new SafeConstructor(new LoaderOptions())).load(in);
        } catch (YAMLException e) {
            throw new IOException("invalid YAML in " + origin + ": " + e.getMessage(), e);
        }
        if (!(root instanceof Map<?, ?> map)) {
            throw new IOException("catalog " + origin + " must be a YAML mapping with a 'sources' list");
        }

        ResolverConfig cfg = ResolverConfig.defaults();
        Map<String, Object> resolver = getMap(map, "resolver");
        if (resolver != null) applyResolver(resolver, cfg);
        cfg.applySystemOverrides();
        cfg.validate();

        Object rawSources = map.get("sources");
        if (!(rawSources instanceof List<?> list) || list.isEmpty()) {
            throw new IOException("catalog " + origin + " has no 'sources'");
        }
        List<SourceDescriptor> sources = new ArrayList<>(list.size());
        for (int i = 0; i < list.size(); i++) {
            Object o = list.get(i);
            if (!(o instanceof Map<?, ?> m)) {
                throw new IllegalArgumentException(origin + ": sources[" + i + "] is not a mapping");
            }
            try {
                sources.add(toDescriptor(m));
            } catch (IllegalArgumentException | NullPointerException e) {
                throw new IllegalArgumentException(origin + ": sources[" + i + "] " + e.getMessage(), e);
            }
        }
        return new SourceCatalog(cfg, sources);
    }

    private static void applyResolver(Map<String, Object> r, ResolverConfig cfg) {
        Map<String, Object> t = getMap(r, "timeouts");
        if (t != null) {
            setMs(t, "fastMs", cfg::setFastTimeout);
            setMs(t, "moderateMs", cfg::setModerateTimeout);
            setMs(t, "slowMs", cfg::setSlowTimeout);
        }
        setMs(r, "connectTimeoutMs", cfg::setConnectTimeout);
        setBoolean(r, "followRedirects", cfg::setFollowRedirects);
        setString(r, "userAgent", cfg::setUserAgent);
        setInt(r, "concurrency", cfg::setConcurrency);
        setString(r, "dataDir", s -> cfg.setDataDir(Path.of(s)));

        Map<String, Object> b = getMap(r, "browser");
        if (b != null) {
            setInt(b, "poolSize", cfg.browser()::setPoolSize);
            setBoolean(b, "headless", cfg.browser()::setHeadless);
            setInt(b, "acquireTimeoutMs", cfg.browser()::setAcquireTimeoutMs);
        }
    }

    private static SourceDescriptor toDescriptor(Map<?, ?> m) {
        SourceDescriptor.Builder b = SourceDescriptor.builder();
        setString(m, "id", b::id);
        setString(m, "name", b::displayName);
        setStringList(m, "prefixes", b::prefixes);
        setStringList(m, "excludePrefixes", b::excludedPrefixes);
        setString(m, "adapter", s -> b.adapterKind(AdapterKind.parse(s)));
        setString(m, "baseEndpoint", b::baseEndpoint);
        setString(m, "timeoutClass", s -> b.timeoutClass(TimeoutClass.parse(s)));

        Map<String, Object> opts = getMap(m, "options");
        if (opts != null) {
            Map<String, String> out = new LinkedHashMap<>();
            for (Map.Entry<String, Object> e : opts.entrySet()) {
                if (e.getValue() != null) out.put(e.getKey(), String.valueOf(e.getValue()));
            }
            b.options(out);
        }
        return b.build();
    }

    // ------------ helpers ------------
    @SuppressWarnings("unchecked")
    private static Map<String, Object> getMap(Map<?, ?> map, String key) {
        Object v = map.get(key);
        if (v instanceof Map<?, ?> m) return (Map<String, Object>) m;
        return null;
    }

    private static void setString(Map<?, ?> map, String key, Consumer<String> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(String.valueOf(v));
    }

    /** 리스트 또는 "a,b,c" */
    private static void setStringList(Map<?, ?> map, String key, Consumer<List<String>> setter) {
        Object v = map.get(key);
        if (v == null) return;
        List<String> out = new ArrayList<>();
        if (v instanceof List<?> list) {
            for (Object o : list) if (o != null) out.add(String.valueOf(o));
        } else {
            for (String p : String.valueOf(v).split("\\s*,\\s*")) if (!p.isBlank()) out.add(p.trim());
        }
        if (!out.isEmpty()) setter.accept(List.copyOf(out));
    }

    private static void setBoolean(Map<?, ?> map, String key, Consumer<Boolean> setter) {
        Object v = map.get(key);
        if (v == null) return;
        if (v instanceof Boolean bool) setter.accept(bool);
        else setter.accept(Boolean.parseBoolean(String.valueOf(v).trim()));
    }

    private static void setInt(Map<?, ?> map, String key, IntConsumer setter) {
        Object v = map.get(key);
        if (v == null) return;
        if (v instanceof Number n) {
            setter.accept(n.intValue());
            return;
        }
        try {
            setter.accept(Integer.parseInt(String.valueOf(v).trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("'" + key + "' must be an integer (was " + v + ")", e);
        }
    }

    private static void setMs(Map<?, ?> map, String key, Consumer<Duration> setter) {
        setInt(map, key, ms -> setter.accept(Duration.ofMillis(ms)));
    }
}
