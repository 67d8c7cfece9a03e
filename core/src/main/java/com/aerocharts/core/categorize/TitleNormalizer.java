package com.aerocharts.core.categorize;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** 악센트 제거 + 소문자 + 공백 정리 + 붙여 쓴 항법 약어 분리(VORDME → vor dme) */
final class TitleNormalizer {
    private static final Pattern MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern WS = Pattern.compile("\\s+");

    private static final String NAVAID = "vor|dme|ils|loc|ndb|gps|rnp|gnss|tacan|lpv";
    /** 단어 전체가 항법 약어 2개 이상으로만 이루어진 경우 */
    private static final Pattern GLUED = Pattern.compile("(?<![a-z])(?:" + NAVAID + "){2,}(?![a-z])");
    private static final Pattern PART = Pattern.compile(NAVAID);

    private TitleNormalizer() {}

    static String normalize(String s) {
        if (s == null) return "";
        String d = Normalizer.normalize(s, Normalizer.Form.NFD);
        d = MARKS.matcher(d).replaceAll("");
        d = d.toLowerCase(Locale.ROOT);
        d = splitGlued(d);
        return WS.matcher(d).replaceAll(" ").trim();
    }

    static String splitGlued(String lower) {
        Matcher m = GLUED.matcher(lower);
        if (!m.find()) return lower;
        StringBuilder sb = new StringBuilder(lower.length() + 8);
        int last = 0;
        do {
            sb.append(lower, last, m.start());
            Matcher p = PART.matcher(m.group());
            String sep = "";
            while (p.find()) {
                sb.append(sep).append(p.group());
                sep = " ";
            }
            last = m.end();
        } while (m.find());
        sb.append(lower, last, lower.length());
        return sb.toString();
    }
}
