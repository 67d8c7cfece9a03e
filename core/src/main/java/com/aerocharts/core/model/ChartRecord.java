package com.aerocharts.core.model;

import java.util.Objects;

/** 정규화된 차트 1건. 오케스트레이터만 생성한다. */
public final class ChartRecord {
    private final String title;
    private final String url;
    private final ChartCategory category;

    public ChartRecord(String title, String url, ChartCategory category) {
        this.title = Objects.requireNonNull(title, "title");
        this.url = Objects.requireNonNull(url, "url");
        this.category = Objects.requireNonNull(category, "category");
        if (title.isBlank()) throw new IllegalArgumentException("title is blank");
        if (url.isBlank()) throw new IllegalArgumentException("url is blank");
    }

    public String getTitle() { return title; }
    public String getUrl() { return url; }
    public ChartCategory getCategory() { return category; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ChartRecord)) return false;
        ChartRecord that = (ChartRecord) o;
        return title.equals(that.title) && url.equals(that.url) && category == that.category;
    }

    @Override
    public int hashCode() { return Objects.hash(title, url, category); }

    @Override
    public String toString() {
        return "ChartRecord{" + category.code() + ", title='" + title + "', url=" + url + '}';
    }
}
