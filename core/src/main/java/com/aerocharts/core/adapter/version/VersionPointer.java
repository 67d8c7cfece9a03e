package com.aerocharts.core.adapter.version;

import java.time.LocalDate;
import java.util.Objects;

/** 현재 유효한 발행 폴더. 요청마다 새로 해석하고 캐시하지 않는다 */
public final class VersionPointer {
    private final String tag;
    private final String dateText;
    private final LocalDate date;

    public VersionPointer(String tag, String dateText, LocalDate date) {
        this.tag = Objects.requireNonNull(tag, "tag");
        this.dateText = Objects.requireNonNull(dateText, "dateText");
        this.date = Objects.requireNonNull(date, "date");
    }

    /** 폴더 이름 원문(예: 2025-11-27-AIRAC) */
    public String getTag() { return tag; }
    /** 폴더에서 찾은 날짜 부분(예: 2025-11-27) */
    public String getDateText() { return dateText; }
    public LocalDate getDate() { return date; }

    @Override
    public String toString() { return tag + " (" + date + ")"; }
}
