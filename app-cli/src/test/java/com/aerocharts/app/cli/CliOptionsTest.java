package com.aerocharts.app.cli;

import com.aerocharts.core.model.ChartCategory;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CliOptionsTest {

    @Test
    void identifier_only_uses_defaults() {
        CliOptions o = CliOptions.parse("kjfk");

        assertThat(o.getIdentifier()).isEqualTo("KJFK");
        assertThat(o.getSourceId()).isNull();
        assertThat(o.getCategory()).isNull();
        assertThat(o.isJson()).isFalse();
        assertThat(o.getRetries()).isZero();
        assertThat(o.getConfigPath()).isNull();
    }

    @Test
    void all_options_parsed_in_any_order() {
        CliOptions o = CliOptions.parse("--json", "-s", "Spain", "LEMD", "-c", "sid",
                "--config", "my.yml", "--retries", "2", "-v");

        assertThat(o.getIdentifier()).isEqualTo("LEMD");
        assertThat(o.getSourceId()).isEqualTo("spain");
        assertThat(o.getCategory()).isEqualTo(ChartCategory.DEPARTURE_PROCEDURE);
        assertThat(o.isJson()).isTrue();
        assertThat(o.isVerbose()).isTrue();
        assertThat(o.getConfigPath()).isEqualTo(Path.of("my.yml"));
        assertThat(o.getRetries()).isEqualTo(2);
    }

    @Test
    void list_sources_and_help_need_no_identifier() {
        assertThat(CliOptions.parse("--list-sources").isListSources()).isTrue();
        assertThat(CliOptions.parse("-h").isHelp()).isTrue();
    }

    @Test
    void usage_errors() {
        assertThatThrownBy(() -> CliOptions.parse()).hasMessage("missing airport identifier");
        assertThatThrownBy(() -> CliOptions.parse("KJFK", "EGLL")).hasMessageContaining("only one");
        assertThatThrownBy(() -> CliOptions.parse("KJFK", "--bogus")).hasMessage("unknown option: --bogus");
        assertThatThrownBy(() -> CliOptions.parse("KJFK", "-s")).hasMessage("-s needs a value");
        assertThatThrownBy(() -> CliOptions.parse("KJFK", "-c", "--json")).hasMessage("-c needs a value");
        assertThatThrownBy(() -> CliOptions.parse("KJFK", "-c", "XYZ")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CliOptions.parse("KJFK", "--retries", "11")).hasMessageContaining("0..10");
        assertThatThrownBy(() -> CliOptions.parse("KJFK", "--retries", "two")).hasMessageContaining("number");
    }
}
