package com.phillippitts.insightbot.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AnalysisResultTest {

    @Test
    void shouldCarryReportOnlyOnSuccess() {
        assertThat(AnalysisResult.success("").report()).isEmpty();
        assertThatThrownBy(() -> new AnalysisResult(AnalysisResult.Kind.FAILURE, "text", null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new AnalysisResult(AnalysisResult.Kind.SUCCESS, null, null))
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    void shouldMapEveryKindToCycleOutcome() {
        assertThat(CycleOutcome.of(AnalysisResult.Kind.SUCCESS)).isEqualTo(CycleOutcome.REPORTED);
        assertThat(CycleOutcome.of(AnalysisResult.Kind.NO_CREDENTIAL)).isEqualTo(CycleOutcome.NO_CREDENTIAL);
        assertThat(CycleOutcome.of(AnalysisResult.Kind.RATE_LIMITED)).isEqualTo(CycleOutcome.RATE_LIMITED);
        assertThat(CycleOutcome.of(AnalysisResult.Kind.UPLOAD_FAILED)).isEqualTo(CycleOutcome.UPLOAD_FAILED);
        assertThat(CycleOutcome.of(AnalysisResult.Kind.FAILURE)).isEqualTo(CycleOutcome.FAILED);
    }

    @Test
    void shouldOnlyFlagFinalTrigger() {
        assertThat(CycleTrigger.FINAL.isFinal()).isTrue();
        assertThat(CycleTrigger.SCHEDULED.isFinal()).isFalse();
        assertThat(CycleTrigger.MANUAL.isFinal()).isFalse();
    }
}
