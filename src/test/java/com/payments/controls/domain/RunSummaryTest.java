package com.payments.controls.domain;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RunSummaryTest {

    private static ControlDecision decision(String txId, String rail, ControlAction action) {
        return new ControlDecision(txId, rail, "2024-01-01", "u1", 10.0, false, action, List.of(), List.of());
    }

    @Test
    void countsActionsAndRails() {
        RunSummary summary = RunSummary.of(
                List.of(decision("t1", "ACH", ControlAction.BLOCK),
                        decision("t2", "CARD", ControlAction.ALLOW),
                        decision("t3", "CARD", ControlAction.ALLOW),
                        decision("t4", "CRYPTO", ControlAction.REVIEW)),
                List.of(),
                List.of());

        assertThat(summary.transactions()).isEqualTo(4);
        assertThat(summary.count(ControlAction.ALLOW)).isEqualTo(2);
        assertThat(summary.count(ControlAction.BLOCK)).isEqualTo(1);
        assertThat(summary.percent(ControlAction.ALLOW)).isEqualTo(50.0);
        assertThat(summary.railCounts()).containsEntry("CARD", 2).containsEntry("ACH", 1);
    }

    @Test
    void emptyRunHasZeroPercentages() {
        RunSummary summary = RunSummary.of(List.of(), List.of(), List.of());

        assertThat(summary.transactions()).isZero();
        assertThat(summary.percent(ControlAction.BLOCK)).isZero();
        assertThat(summary.count(ControlAction.REVIEW)).isZero();
    }
}
