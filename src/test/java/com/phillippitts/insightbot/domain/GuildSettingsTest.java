package com.phillippitts.insightbot.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GuildSettingsTest {

    @Test
    void shouldDefaultToDebateEveryFiveMinutesWithoutKey() {
        GuildSettings defaults = GuildSettings.defaults();

        assertThat(defaults.mode()).isEqualTo(AnalysisMode.DEBATE);
        assertThat(defaults.intervalSeconds()).isEqualTo(300);
        assertThat(defaults.hasApiKey()).isFalse();
    }

    @Test
    void shouldTreatBlankApiKeyAsUnset() {
        assertThat(new GuildSettings(AnalysisMode.SUMMARY, 60, "  ").apiKey()).isNull();
    }

    @Test
    void shouldNotExposeApiKeyInToString() {
        GuildSettings settings = new GuildSettings(AnalysisMode.SUMMARY, 60, "super-secret");

        assertThat(settings.toString()).doesNotContain("super-secret").contains("apiKey=set");
    }

    @Test
    void shouldParseModesCaseInsensitively() {
        assertThat(AnalysisMode.parse(" Summary ")).isEqualTo(AnalysisMode.SUMMARY);
        assertThat(AnalysisMode.parse("DEBATE")).isEqualTo(AnalysisMode.DEBATE);
        assertThatThrownBy(() -> AnalysisMode.parse("roast"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("roast");
        assertThat(AnalysisMode.parseOrDefault(null, AnalysisMode.DEBATE)).isEqualTo(AnalysisMode.DEBATE);
    }

    @Test
    void shouldRejectBlankIdentities() {
        assertThatThrownBy(() -> GuildId.of(" ")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> SpeakerId.of("")).isInstanceOf(IllegalArgumentException.class);
        assertThat(GuildId.of("g1")).isEqualTo(new GuildId("g1"));
    }
}
