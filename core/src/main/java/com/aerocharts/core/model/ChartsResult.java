package com.aerocharts.core.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** 해석 결과. 차트가 0건이어도 정상 결과(오류 아님) */
public final class ChartsResult {
    private final String identifier;
    private final String sourceId;
    private final String sourceName;
    private final List<ChartRecord> charts;
    private final Instant fetchedAt;

    private ChartsResult(Builder b) {
        this.identifier = b.identifier;
        this.sourceId = b.sourceId;
        this.sourceName = b.sourceName == null ? b.sourceId : b.sourceName;
        this.charts = List.copyOf(b.charts);
        this.fetchedAt = b.fetchedAt == null ? Instant.now() : b.fetchedAt;
    }

    public String getIdentifier() { return identifier; }
    public String getSourceId() { return sourceId; }
    public String getSourceName() { return sourceName; }
    public List<ChartRecord> getCharts() { return charts; }
    public Instant getFetchedAt() { return fetchedAt; }

    public int totalCount() { return charts.size(); }
    public boolean isEmpty() { return charts.isEmpty(); }

    /** 분류 순서(GEN, GND, SID, STAR, APP)대로 묶음. 빈 분류는 생략 */
    public Map<ChartCategory, List<ChartRecord>> byCategory() {
        Map<ChartCategory, List<ChartRecord>> out = new EnumMap<>(ChartCategory.class);
        for (ChartRecord r : charts) {
            out.computeIfAbsent(r.getCategory(), k -> new ArrayList<>()).add(r);
        }
        out.replaceAll((k, v) -> Collections.unmodifiableList(v));
        return Collections.unmodifiableMap(out);
    }

    /** 한 분류만 남긴 새 결과 */
    public ChartsResult only(ChartCategory category) {
        Objects.requireNonNull(category, "category");
        List<ChartRecord> kept = new ArrayList<>();
        for (ChartRecord r : charts) if (r.getCategory() == category) kept.add(r);
        return builder()
                .identifier(identifier)
                .sourceId(sourceId)
                .sourceName(sourceName)
                .charts(kept)
                .fetchedAt(fetchedAt)
                .build();
    }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private String identifier;
        private String sourceId;
        private String sourceName;
        private List<ChartRecord> charts = List.of();
        private Instant fetchedAt;

        public Builder identifier(String v) { this.identifier = v; return this; }
        public Builder sourceId(String v) { this.sourceId = v; return this; }
        public Builder sourceName(String v) { this.sourceName = v; return this; }
        public Builder charts(List<ChartRecord> v) { this.charts = v; return this; }
        public Builder fetchedAt(Instant v) { this.fetchedAt = v; return this; }

        public ChartsResult build() {
            Objects.requireNonNull(identifier, "identifier");
            Objects.requireNonNull(sourceId, "sourceId");
            Objects.requireNonNull(charts, "charts");
            return new ChartsResult(this);
        }
    }
}
