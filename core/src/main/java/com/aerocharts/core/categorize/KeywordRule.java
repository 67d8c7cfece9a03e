package com.aerocharts.core.categorize;

import com.aerocharts.core.model.ChartCategory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * 분류 규칙 1개.
 * phrases: 부분 문자열 매칭(정규화된 제목 기준)
 * tokens: 약어. 앞뒤가 글자가 아닐 때만 매칭(복수형 s 허용)
 */
public final class KeywordRule {
    private final ChartCategory category;
    private final List<String> phrases;
    private final List<Pattern> tokens;

    private KeywordRule(ChartCategory category, List<String> phrases, List<String> tokens) {
        this.category = Objects.requireNonNull(category, "category");
        this.phrases = List.copyOf(phrases);
        List<Pattern> ps = new ArrayList<>(tokens.size());
        for (String t : tokens) {
            ps.add(Pattern.compile("(?<![a-z])" + Pattern.quote(TitleNormalizer.normalize(t)) + "s?(?![a-z])"));
        }
        this.tokens = List.copyOf(ps);
    }

    public static KeywordRule of(ChartCategory category, List<String> phrases, List<String> tokens) {
        List<String> norm = new ArrayList<>(phrases.size());
        for (String p : phrases) norm.add(TitleNormalizer.normalize(p));
        return new KeywordRule(category, norm, tokens);
    }

    public ChartCategory category() { return category; }

    /** normalizedTitle은 TitleNormalizer.normalize 결과여야 한다 */
    boolean matches(String normalizedTitle) {
        for (String p : phrases) {
            if (normalizedTitle.contains(p)) return true;
        }
        for (Pattern t : tokens) {
            if (t.matcher(normalizedTitle).find()) return true;
        }
        return false;
    }
}
