package com.aerocharts.core.adapter;

import com.aerocharts.core.api.IChartAdapter;
import com.aerocharts.core.error.ChartFailureKind;
import com.aerocharts.core.error.ChartSourceException;
import com.aerocharts.core.model.AdapterKind;
import com.aerocharts.core.model.RawChart;
import com.aerocharts.core.model.SourceDescriptor;
import com.aerocharts.core.util.StructuredLog;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 미리 만들어 둔 JSON DB 소스. 네트워크를 쓰지 않는다.
 * 파일은 처음 필요할 때 한 번 읽어 메모리에 두고 이후 읽기 전용.
 *
 * 형식: { "NZAA": { "charts": [ { "name": "...", "url": "..." } ] }, ... }
 *      (값이 곧바로 배열이어도 된다)
 *
 * options:
 *   database  DB 경로. 상대 경로는 dataDir 기준, "classpath:" 접두사는 클래스패스 리소스
 */
public final class OfflineDatabaseAdapter implements IChartAdapter {

    private static final StructuredLog SLOG = StructuredLog.get(OfflineDatabaseAdapter.class);

    private final ObjectMapper mapper;
    private final Path dataDir;
    private final Map<String, Map<String, List<RawChart>>> databases = new ConcurrentHashMap<>();

    public OfflineDatabaseAdapter(ObjectMapper mapper, Path dataDir) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.dataDir = Objects.requireNonNull(dataDir, "dataDir");
    }

    @Override
    public AdapterKind kind() { return AdapterKind.OFFLINE_DATABASE; }

    @Override
    public List<RawChart> fetch(String identifier, SourceDescriptor d) throws ChartSourceException {
        Map<String, List<RawChart>> db = database(d);
        List<RawChart> charts = db.get(identifier.trim().toUpperCase(Locale.ROOT));
        if (charts == null) {
            throw new ChartSourceException(ChartFailureKind.NOT_FOUND,
                    identifier + " is not in the " + d.getDisplayName() + " database");
        }
        return charts;
    }

    private Map<String, List<RawChart>> database(SourceDescriptor d) throws ChartSourceException {
        String location = d.requireOption("database");
        Map<String, List<RawChart>> db = databases.get(location);
        if (db != null) return db;
        synchronized (databases) {
            db = databases.get(location);
            if (db == null) {
                db = load(location, d);
                databases.put(location, db);
            }
            return db;
        }
    }

    private Map<String, List<RawChart>> load(String location, SourceDescriptor d) throws ChartSourceException {
        JsonNode root;
        try (InputStream in = open(location)) {
            root = mapper.readTree(in);
        } catch (IOException e) {
            throw new ChartSourceException(ChartFailureKind.PARSE_MISMATCH,
                    "offline database unreadable: " + location + " (" + e.getMessage() + ")", e);
        }
        if (root == null || !root.isObject()) {
            throw new ChartSourceException(ChartFailureKind.PARSE_MISMATCH,
                    "offline database must be a JSON object keyed by identifier: " + location);
        }

        String base = d.getBaseEndpoint();
        Map<String, List<RawChart>> out = new HashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = root.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            JsonNode arr = e.getValue().isArray() ? e.getValue() : e.getValue().path("charts");
            List<RawChart> charts = new ArrayList<>();
            for (JsonNode c : arr) {
                String url = c.path("url").asText("");
                if (url.isBlank()) continue;
                charts.add(RawChart.builder()
                        .title(c.path("name").asText(c.path("title").asText("")))
                        .locator(url)
                        .baseUrl(base)
                        .build());
            }
            out.put(e.getKey().trim().toUpperCase(Locale.ROOT), Collections.unmodifiableList(charts));
        }
        SLOG.with("source", d.getId()).info("offline-db-loaded", "location", location, "airports", out.size());
        return Collections.unmodifiableMap(out);
    }

    private InputStream open(String location) throws IOException {
        if (location.startsWith("classpath:")) {
            String res = location.substring("classpath:".length());
            InputStream in = OfflineDatabaseAdapter.class.getClassLoader()
                    .getResourceAsStream(res.startsWith("/") ? res.substring(1) : res);
            if (in == null) throw new IOException("classpath resource not found: " + res);
            return in;
        }
        Path p = Path.of(location);
        if (!p.isAbsolute()) p = dataDir.resolve(p);
        return Files.newInputStream(p);
    }
}
