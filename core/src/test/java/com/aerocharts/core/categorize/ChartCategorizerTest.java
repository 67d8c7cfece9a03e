package com.aerocharts.core.categorize;

import com.aerocharts.core.model.ChartCategory;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ChartCategorizerTest {

    private final ChartCategorizer c = new ChartCategorizer();

    @Test
    void departure_wins_over_approach_when_both_match() {
        // SID + RNAV → 출발(규칙 순서 고정)
        assertEquals(ChartCategory.DEPARTURE_PROCEDURE, c.categorize("RNAV (GPS) RWY 04 SID"));
    }

    @Test
    void reference_titles() {
        assertEquals(ChartCategory.APPROACH, c.categorize("ILS OR LOC RWY 22"));
        assertEquals(ChartCategory.GROUND, c.categorize("AIRPORT DIAGRAM"));
        assertEquals(ChartCategory.GENERAL, c.categorize("ALTERNATE MINIMUMS"));
        assertEquals(ChartCategory.ARRIVAL_PROCEDURE, c.categorize("Llegada Normalizada RNAV"));
    }

    @Test
    void native_language_titles_with_accents() {
        assertEquals(ChartCategory.DEPARTURE_PROCEDURE, c.categorize("Carta de Saída Padrão por Instrumentos"));
        assertEquals(ChartCategory.ARRIVAL_PROCEDURE, c.categorize("CARTE D'ARRIVÉE NORMALISÉE"));
        assertEquals(ChartCategory.APPROACH, c.categorize("Carta de Aproximación por Instrumentos - VOR RWY 32L"));
        assertEquals(ChartCategory.GROUND, c.categorize("Plano de Estacionamiento y Atraque de Aeronaves"));
        assertEquals(ChartCategory.GROUND, c.categorize("Carta de Movimiento en Tierra"));
        assertEquals(ChartCategory.DEPARTURE_PROCEDURE, c.categorize("SALIDA NORMALIZADA VUELO INSTRUMENTAL"));
    }

    @Test
    void short_acronyms_match_only_as_tokens() {
        // "standard" 안의 star, "inside" 안의 sid 는 매칭 안 됨
        assertEquals(ChartCategory.GENERAL, c.categorize("Standard Noise Abatement"));
        assertEquals(ChartCategory.GENERAL, c.categorize("Inside Obstacle Data"));
        assertEquals(ChartCategory.ARRIVAL_PROCEDURE, c.categorize("STAR RWY 18 (BOKSU 1A)"));
        assertEquals(ChartCategory.DEPARTURE_PROCEDURE, c.categorize("SIDs RWY 36"));
        assertEquals(ChartCategory.APPROACH, c.categorize("VOR/DME RWY 10"));
        assertEquals(ChartCategory.GROUND, c.categorize("AD 2 LEMD ADC"));
    }

    @Test
    void glued_navaid_acronyms_are_split() {
        assertEquals(ChartCategory.APPROACH, c.categorize("VORDME RWY 12"));
        assertEquals(ChartCategory.APPROACH, c.categorize("ILSDME Z RWY 27"));
        assertEquals(ChartCategory.APPROACH, c.categorize("LOCDME RWY 09"));
        assertEquals("vor dme rwy 12", TitleNormalizer.normalize("VORDME RWY 12"));
        // 항법 약어로만 이루어진 단어가 아니면 그대로
        assertEquals("vortex area", TitleNormalizer.normalize("VORTEX AREA"));
        assertEquals(ChartCategory.GENERAL, c.categorize("Vortex Area"));
    }

    @Test
    void blank_or_null_title_is_general() {
        assertEquals(ChartCategory.GENERAL, c.categorize(""));
        assertEquals(ChartCategory.GENERAL, c.categorize("   "));
        assertEquals(ChartCategory.GENERAL, c.categorize((String) null));
    }

    @Test
    void section_hint_overrides_keywords() {
        assertEquals(ChartCategory.ARRIVAL_PROCEDURE,
                c.categorize("ILS RWY 22", Optional.of(ChartCategory.ARRIVAL_PROCEDURE)));
        assertEquals(ChartCategory.APPROACH, c.categorize("ILS RWY 22", Optional.empty()));
    }

    @Test
    void custom_rules_are_evaluated_in_given_order() {
        ChartCategorizer custom = new ChartCategorizer(List.of(
                KeywordRule.of(ChartCategory.GROUND, List.of("hot spot"), List.of()),
                KeywordRule.of(ChartCategory.APPROACH, List.of("rnav"), List.of())));
        assertEquals(ChartCategory.GROUND, custom.categorize("RNAV HOT SPOT"));
        assertEquals(ChartCategory.GENERAL, custom.categorize("SID RWY 01"));
    }
}
