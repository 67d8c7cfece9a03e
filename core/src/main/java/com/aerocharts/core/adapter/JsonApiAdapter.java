package com.aerocharts.core.adapter;

import com.aerocharts.core.api.IChartAdapter;
import com.aerocharts.core.api.IPageFetcher;
import com.aerocharts.core.error.ChartFailureKind;
import com.aerocharts.core.error.ChartSourceException;
import com.aerocharts.core.model.AdapterKind;
import com.aerocharts.core.model.ChartCategory;
import com.aerocharts.core.model.PageResponse;
import com.aerocharts.core.model.RawChart;
import com.aerocharts.core.model.SourceDescriptor;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * 구조화된 JSON API 소스. 요청 1번으로 받은 응답을 평평한 (제목, 로케이터) 목록으로 바꾼다.
 *
 * 지원하는 응답 모양:
 *   [ {...}, ... ]                           평평한 배열
 *   { "charts": [ ... ] }                    배열을 감싼 객체(charts/items/data/results)
 *   { "SID": [ ... ], "APP": [ ... ] }       분류별 중첩(키가 분류 힌트가 됨)
 *   { "LEMD": <위 모양 중 하나> }             식별자 키로 한 번 감싼 형태
 *
 * options:
 *   api-url      요청 URL 템플릿(기본 {base})
 *   items-path   점 구분 경로로 배열 위치를 직접 지정(예: data.charts)
 *   title-field  제목 필드(기본 name → title → label → chart_name)
 *   url-field    URL 필드(기본 url → href → link → file_path → path)
 */
public final class JsonApiAdapter implements IChartAdapter {

    private static final Logger LOG = LoggerFactory.getLogger(JsonApiAdapter.class);

    private static final List<String> WRAPPER_FIELDS = List.of("charts", "items", "data", "results");
    private static final List<String> TITLE_FIELDS = List.of("name", "title", "label", "chart_name");
    private static final List<String> URL_FIELDS = List.of("url", "href", "link", "file_path", "path");
    private static final List<String> TYPE_FIELDS = List.of("category", "type");

    private final IPageFetcher fetcher;
    private final ObjectMapper mapper;

    public JsonApiAdapter(IPageFetcher fetcher, ObjectMapper mapper) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    @Override
    public AdapterKind kind() { return AdapterKind.JSON_API; }

    @Override
    public List<RawChart> fetch(String identifier, SourceDescriptor d) throws ChartSourceException {
        String url = IdentifierTemplate.expand(d.option("api-url", "{base}"), identifier, d);
        PageResponse resp = fetcher.get(URI.create(url), Map.of("Accept", "application/json"));

        JsonNode root;
        try {
            root = mapper.readTree(resp.getBody());
        } catch (JsonProcessingException e) {
            throw new ChartSourceException(ChartFailureKind.PARSE_MISMATCH,
                    "response from " + url + " is not valid JSON", e);
        }
        if (root == null || root.isMissingNode() || root.isNull()) {
            throw new ChartSourceException(ChartFailureKind.PARSE_MISMATCH, "empty JSON body from " + url);
        }
        return normalize(root, identifier, d, resp.getFinalUri().toString());
    }

    List<RawChart> normalize(JsonNode root, String identifier, SourceDescriptor d, String baseUrl)
            throws ChartSourceException {
        JsonNode node = root;

        // 식별자 키로 감싼 경우 한 단계 내려감
        String id = identifier.trim().toUpperCase(Locale.ROOT);
        if (node.isObject() && node.has(id)) node = node.get(id);

        var path = d.option("items-path");
        if (path.isPresent()) {
            for (String part : path.get().split("\\.")) {
                node = node.path(part);
            }
            if (!node.isArray()) {
                throw new ChartSourceException(ChartFailureKind.PARSE_MISMATCH,
                        "items-path '" + path.get() + "' does not point at an array");
            }
        }

        List<RawChart> out = new ArrayList<>();
        String titleField = d.option("title-field", null);
        String urlField = d.option("url-field", null);

        if (node.isArray()) {
            collect(node, null, titleField, urlField, baseUrl, out);
            return out;
        }
        if (!node.isObject()) {
            throw new ChartSourceException(ChartFailureKind.PARSE_MISMATCH,
                    "unexpected JSON shape: " + node.getNodeType());
        }
        for (String w : WRAPPER_FIELDS) {
            JsonNode arr = node.get(w);
            if (arr != null && arr.isArray()) {
                collect(arr, null, titleField, urlField, baseUrl, out);
                return out;
            }
        }

        if (node.size() == 0) return out;

        // 분류별 중첩: 값이 배열인 필드마다 키를 분류 힌트로
        boolean sawArray = false;
        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            JsonNode value = e.getValue();
            if (value.isObject()) {
                for (String w : WRAPPER_FIELDS) {
                    if (value.has(w) && value.get(w).isArray()) { value = value.get(w); break; }
                }
            }
            if (!value.isArray()) continue;
            sawArray = true;
            collect(value, categoryOf(e.getKey()), titleField, urlField, baseUrl, out);
        }
        if (!sawArray) {
            throw new ChartSourceException(ChartFailureKind.PARSE_MISMATCH,
                    "no chart array found in JSON object with fields " + fieldNames(node));
        }
        return out;
    }

    private static void collect(JsonNode arr, ChartCategory hint, String titleField, String urlField,
                                String baseUrl, List<RawChart> out) {
        for (JsonNode item : arr) {
            String title;
            String locator;
            ChartCategory itemHint = hint;
            if (item.isTextual()) {
                title = "";
                locator = item.asText();
            } else if (item.isObject()) {
                title = text(item, titleField, TITLE_FIELDS);
                locator = text(item, urlField, URL_FIELDS);
                if (itemHint == null) itemHint = categoryOf(text(item, null, TYPE_FIELDS));
            } else {
                continue;
            }
            if (locator == null || locator.isBlank()) {
                LOG.debug("Skipping JSON item without url: {}", item);
                continue;
            }
            out.add(RawChart.builder()
                    .title(title)
                    .locator(locator)
                    .baseUrl(baseUrl)
                    .sectionHint(itemHint)
                    .build());
        }
    }

    private static String text(JsonNode item, String preferred, List<String> fallbacks) {
        if (preferred != null) {
            JsonNode v = item.get(preferred);
            return (v != null && v.isValueNode() && !v.isNull()) ? v.asText() : null;
        }
        for (String f : fallbacks) {
            JsonNode v = item.get(f);
            if (v != null && v.isValueNode() && !v.isNull() && !v.asText().isBlank()) return v.asText();
        }
        return null;
    }

    /** 알 수 없는 분류 키는 힌트 없음(키워드 규칙으로) */
    private static ChartCategory categoryOf(String key) {
        if (key == null || key.isBlank()) return null;
        try {
            return ChartCategory.parse(key);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    private static List<String> fieldNames(JsonNode node) {
        List<String> names = new ArrayList<>();
        node.fieldNames().forEachRemaining(names::add);
        return names;
    }
}
