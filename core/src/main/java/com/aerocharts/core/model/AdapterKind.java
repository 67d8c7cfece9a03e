package com.aerocharts.core.model;

import java.util.Locale;

/** 백엔드 어댑터 종류(닫힌 집합) */
public enum AdapterKind {
    STATIC_HTML,
    FRAGMENT_FILTERED,
    JSON_API,
    BROWSER_AUTOMATION,
    OFFLINE_DATABASE;

    /** "static-html", "StaticHTML", "static_html" 모두 허용 */
    public static AdapterKind parse(String s) {
        if (s == null) throw new IllegalArgumentException("adapter kind is null");
        String norm = s.trim().replace('-', '_').replace(" ", "").toUpperCase(Locale.ROOT);
        for (AdapterKind k : values()) {
            if (k.name().equals(norm) || k.name().replace("_", "").equals(norm)) return k;
        }
        throw new IllegalArgumentException("Unknown adapter kind: " + s);
    }
}
