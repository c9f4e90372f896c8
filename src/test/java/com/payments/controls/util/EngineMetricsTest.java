package com.payments.controls.util;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class EngineMetricsTest {

    @Test
    void snapshotReflectsCounters() {
        EngineMetrics metrics = new EngineMetrics();
        metrics.incrementRunSuccess();
        metrics.incrementRunSuccess();
        metrics.incrementRunFailure();
        metrics.recordTransactions(100);
        metrics.recordTransactions(50);
        metrics.recordControls(8);
        metrics.recordHits(12);
        metrics.recordLoadTime(40);
        metrics.recordEvaluationTime(15);
        metrics.recordWriteTime(7);

        Map<String, Long> snapshot = metrics.snapshot();

        assertThat(snapshot)
                .containsEntry("runs_success_total", 2L)
                .containsEntry("runs_failure_total", 1L)
                .containsEntry("transactions_evaluated_total", 150L)
                .containsEntry("controls_loaded_total", 8L)
                .containsEntry("hits_total", 12L)
                .containsEntry("load_time_ms_last", 40L)
                .containsEntry("evaluation_time_ms_last", 15L)
                .containsEntry("write_time_ms_last", 7L);
    }

    @Test
    void timingsKeepLastValue() {
        EngineMetrics metrics = new EngineMetrics();
        metrics.recordEvaluationTime(30);
        metrics.recordEvaluationTime(10);

        assertThat(metrics.snapshot()).containsEntry("evaluation_time_ms_last", 10L);
    }
}
