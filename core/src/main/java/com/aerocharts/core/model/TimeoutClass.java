package com.aerocharts.core.model;

import java.util.Locale;

/** 어댑터 호출 타임아웃 등급. 실제 시간은 ResolverConfig가 결정 */
public enum TimeoutClass {
    FAST, MODERATE, SLOW;

    public static TimeoutClass parse(String s) {
        if (s == null) throw new IllegalArgumentException("timeout class is null");
        return valueOf(s.trim().toUpperCase(Locale.ROOT));
    }
}
