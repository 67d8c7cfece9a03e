package com.aerocharts.app.cli;

import com.aerocharts.core.error.ChartSourceException;
import com.aerocharts.core.model.ChartCategory;
import com.aerocharts.core.model.ChartRecord;
import com.aerocharts.core.model.ChartsResult;
import com.aerocharts.core.model.SourceInfo;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** 결과/소스 목록/실패 메시지 출력(텍스트 또는 JSON) */
public final class ChartsPrinter {

    private final ObjectMapper mapper;

    public ChartsPrinter() {
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    /** 분류 순서대로 그룹 + 개수 */
    public void printText(ChartsResult r, PrintStream out) {
        out.printf("%s - %s (%d charts)%n", r.getIdentifier(), r.getSourceName(), r.totalCount());
        for (Map.Entry<ChartCategory, List<ChartRecord>> e : r.byCategory().entrySet()) {
            out.println();
            out.printf("%s (%d)%n", e.getKey().code(), e.getValue().size());
            for (ChartRecord c : e.getValue()) {
                out.printf("  %s%n    %s%n", c.getTitle(), c.getUrl());
            }
        }
    }

    /** API 응답 모양: icao_code, source, charts{GEN:[...]}, total_count, fetched_at */
    public void printJson(ChartsResult r, PrintStream out) {
        Map<String, Object> root = new LinkedHashMap<>();
        root.put("icao_code", r.getIdentifier());
        root.put("source", r.getSourceId());
        root.put("source_name", r.getSourceName());
        Map<String, List<Map<String, String>>> charts = new LinkedHashMap<>();
        for (Map.Entry<ChartCategory, List<ChartRecord>> e : r.byCategory().entrySet()) {
            List<Map<String, String>> items = new ArrayList<>();
            for (ChartRecord c : e.getValue()) {
                Map<String, String> item = new LinkedHashMap<>();
                item.put("name", c.getTitle());
                item.put("url", c.getUrl());
                item.put("category", c.getCategory().code());
                items.add(item);
            }
            charts.put(e.getKey().code(), items);
        }
        root.put("charts", charts);
        root.put("total_count", r.totalCount());
        root.put("fetched_at", r.getFetchedAt());
        out.println(toJson(root));
    }

    public void printSources(List<SourceInfo> sources, PrintStream out) {
        for (SourceInfo s : sources) {
            out.printf("%-14s %-32s %-20s %s%s%n",
                    s.getSourceId(), s.getName(), s.getAdapterKind(),
                    String.join(",", s.getPrefixes()), s.isOffline() ? " (offline)" : "");
        }
    }

    public void printSourcesJson(List<SourceInfo> sources, PrintStream out) {
        out.println(toJson(sources));
    }

    /** 사용자용 한 줄 메시지. "no charts published", "could not reach source", "unknown airport"는 항상 서로 다름 */
    public static String failureMessage(ChartSourceException e) {
        String who = e.identifier() == null ? "" : e.identifier() + ": ";
        String via = e.sourceId() == null ? "" : " [" + e.sourceId() + "]";
        return who + e.kind().summary() + via + " - " + e.getMessage();
    }

    public static String noChartsMessage(ChartsResult r) {
        return r.getIdentifier() + ": no charts published by " + r.getSourceName();
    }

    /** 필터로 모두 빠진 경우: 소스는 차트를 발행했으므로 "no charts published"와 구분 */
    public static String noChartsInCategoryMessage(ChartsResult all, ChartCategory category) {
        return all.getIdentifier() + ": no " + category.code() + " charts ("
                + all.totalCount() + " charts in other categories)";
    }


    private String toJson(Object o) {
        try {
            return mapper.writeValueAsString(o);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("JSON serialization failed", e);
        }
    }
}
