package com.aerocharts.core.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChartsResultTest {

    @Test
    void groups_follow_category_order_and_keep_emission_order() {
        ChartsResult r = ChartsResult.builder()
                .identifier("KJFK").sourceId("faa").sourceName("FAA")
                .charts(List.of(
                        new ChartRecord("ILS RWY 22", "https://h/1.pdf", ChartCategory.APPROACH),
                        new ChartRecord("AIRPORT DIAGRAM", "https://h/2.pdf", ChartCategory.GROUND),
                        new ChartRecord("ILS RWY 04", "https://h/3.pdf", ChartCategory.APPROACH)))
                .fetchedAt(Instant.parse("2026-01-22T00:00:00Z"))
                .build();

        assertThat(r.byCategory().keySet()).containsExactly(ChartCategory.GROUND, ChartCategory.APPROACH);
        assertThat(r.byCategory().get(ChartCategory.APPROACH)).extracting(ChartRecord::getTitle)
                .containsExactly("ILS RWY 22", "ILS RWY 04");
        assertThat(r.totalCount()).isEqualTo(3);

        ChartsResult app = r.only(ChartCategory.APPROACH);
        assertThat(app.totalCount()).isEqualTo(2);
        assertThat(app.getFetchedAt()).isEqualTo(r.getFetchedAt());
        assertThat(r.only(ChartCategory.GENERAL).isEmpty()).isTrue();
    }

    @Test
    void category_parse_accepts_codes_names_and_aliases() {
        assertThat(ChartCategory.parse("sid")).isEqualTo(ChartCategory.DEPARTURE_PROCEDURE);
        assertThat(ChartCategory.parse("Arrival procedure")).isEqualTo(ChartCategory.ARRIVAL_PROCEDURE);
        assertThat(ChartCategory.parse("IAP")).isEqualTo(ChartCategory.APPROACH);
        assertThat(ChartCategory.parse("gnd")).isEqualTo(ChartCategory.GROUND);
        assertThatThrownBy(() -> ChartCategory.parse("XYZ")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void source_name_defaults_to_source_id() {
        ChartsResult r = ChartsResult.builder().identifier("NZAA").sourceId("new_zealand").build();
        assertThat(r.getSourceName()).isEqualTo("new_zealand");
        assertThat(r.isEmpty()).isTrue();
        assertThat(r.getFetchedAt()).isNotNull();
    }
}
