package com.aerocharts.core.model;

import java.util.Objects;
import java.util.Optional;

/**
 * 어댑터가 내보내는 원시 (제목, 로케이터) 쌍.
 * baseUrl: 로케이터를 해석할 기준 페이지(없으면 descriptor의 baseEndpoint)
 * sectionHint: 페이지 구조에서 얻은 분류 힌트(있으면 키워드 규칙보다 우선)
 */
public final class RawChart {
    private final String title;
    private final String locator;
    private final String baseUrl;
    private final ChartCategory sectionHint;

    private RawChart(Builder b) {
        this.title = b.title == null ? "" : b.title.trim();
        this.locator = b.locator.trim();
        this.baseUrl = b.baseUrl;
        this.sectionHint = b.sectionHint;
    }

    public static RawChart of(String title, String locator) {
        return builder().title(title).locator(locator).build();
    }

    public String getTitle() { return title; }
    public String getLocator() { return locator; }
    public Optional<String> getBaseUrl() { return Optional.ofNullable(baseUrl); }
    public Optional<ChartCategory> getSectionHint() { return Optional.ofNullable(sectionHint); }

    @Override
    public String toString() {
        return "RawChart{title='" + title + "', locator='" + locator + "'"
                + (sectionHint == null ? "" : ", hint=" + sectionHint.code()) + '}';
    }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private String title;
        private String locator;
        private String baseUrl;
        private ChartCategory sectionHint;

        public Builder title(String title) { this.title = title; return this; }
        public Builder locator(String locator) { this.locator = locator; return this; }
        public Builder baseUrl(String baseUrl) { this.baseUrl = baseUrl; return this; }
        public Builder sectionHint(ChartCategory hint) { this.sectionHint = hint; return this; }

        public RawChart build() {
            Objects.requireNonNull(locator, "locator");
            return new RawChart(this);
        }
    }
}
