package com.aerocharts.core.categorize;

import com.aerocharts.core.model.ChartCategory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 차트 제목 → 분류. 순수 함수, 항상 값을 돌려준다.
 *
 * 규칙 순서가 의미를 가진다: 출발 → 도착 → 접근 → 지상 → (기본) 일반.
 * 첫 매칭이 이긴다. 예) "RNAV (GPS) RWY 04 SID" 는 RNAV가 있어도 출발.
 */
public final class ChartCategorizer {

    private static final List<KeywordRule> DEFAULT_RULES = List.of(
            KeywordRule.of(ChartCategory.DEPARTURE_PROCEDURE,
                    List.of("depart", "salida", "saida", "despegue", "decolagem",
                            "standard instrument dep"),
                    List.of("sid", "dp", "odp")),
            KeywordRule.of(ChartCategory.ARRIVAL_PROCEDURE,
                    List.of("arrival", "llegada", "chegada", "arrivee", "arrivo", "standard terminal arr"),
                    List.of("star")),
            KeywordRule.of(ChartCategory.APPROACH,
                    List.of("approach", "aproximacion", "aproximacao", "approche", "avvicinamento",
                            "rnav", "circling", "visual approach", "atterrissage"),
                    List.of("iap", "iac", "ils", "loc", "vor", "ndb", "gps", "rnp", "gls", "lpv",
                            "dme", "tacan", "lda", "sdf", "par", "vac")),
            KeywordRule.of(ChartCategory.GROUND,
                    List.of("airport diagram", "aerodrome chart", "aerodrome diagram", "aerodrome/heliport chart",
                            "ground movement", "taxi", "parking", "apron", "docking",
                            "plano de aerodromo", "plano de estacionamiento", "estacionamiento", "estacionamento",
                            "movimiento en tierra", "movimento no solo", "carta de aerodromo",
                            "carte d'aerodrome", "stationnement", "roulage", "rodaje", "plataforma"),
                    List.of("adc", "gmc", "apdc", "pdc"))
    );

    private final List<KeywordRule> rules;

    public ChartCategorizer() {
        this(DEFAULT_RULES);
    }

    /** 규칙 순서대로 평가(첫 매칭 승) */
    public ChartCategorizer(List<KeywordRule> rules) {
        this.rules = List.copyOf(Objects.requireNonNull(rules, "rules"));
    }

    public ChartCategory categorize(String title) {
        String t = TitleNormalizer.normalize(title);
        if (t.isEmpty()) return ChartCategory.GENERAL;
        for (KeywordRule r : rules) {
            if (r.matches(t)) return r.category();
        }
        return ChartCategory.GENERAL;
    }

    /** 어댑터가 섹션 힌트를 줬으면 그대로 사용 */
    public ChartCategory categorize(String title, Optional<ChartCategory> sectionHint) {
        if (sectionHint != null && sectionHint.isPresent()) return sectionHint.get();
        return categorize(title);
    }
}
