package com.aerocharts.core.model;

import java.util.Locale;

/** 차트 분류(닫힌 집합). code는 CLI/JSON에서 쓰는 짧은 표기 */
public enum ChartCategory {
    GENERAL("GEN", "General"),
    GROUND("GND", "Ground"),
    DEPARTURE_PROCEDURE("SID", "Departure procedure"),
    ARRIVAL_PROCEDURE("STAR", "Arrival procedure"),
    APPROACH("APP", "Approach");

    private final String code;
    private final String label;

    ChartCategory(String code, String label) {
        this.code = code;
        this.label = label;
    }

    public String code() { return code; }
    public String label() { return label; }

    /** 코드(GEN/SID...) 또는 enum 이름(대소문자 무시). 모르면 IllegalArgumentException */
    public static ChartCategory parse(String s) {
        if (s == null || s.isBlank()) throw new IllegalArgumentException("category is blank");
        String v = s.trim().toUpperCase(Locale.ROOT).replace(' ', '_').replace('-', '_');
        for (ChartCategory c : values()) {
            if (c.code.equals(v) || c.name().equals(v)) return c;
        }
        switch (v) {
            case "DP":
            case "DEPARTURE":   return DEPARTURE_PROCEDURE;
            case "ARRIVAL":     return ARRIVAL_PROCEDURE;
            case "IAP":         return APPROACH;
            default:
                throw new IllegalArgumentException("Unknown chart category: " + s);
        }
    }
}
