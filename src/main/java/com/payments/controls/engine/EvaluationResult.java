package com.payments.controls.engine;

import com.payments.controls.domain.ControlDecision;
import com.payments.controls.domain.ControlHit;
import com.payments.controls.domain.ControlMetric;
import com.payments.controls.domain.RunSummary;

import java.util.List;

/**
 * The three output tables of one engine run.
 */
public record EvaluationResult(
        List<ControlDecision> decisions,
        List<ControlHit> hits,
        List<ControlMetric> metrics
) {

    public EvaluationResult {
        decisions = List.copyOf(decisions);
        hits = List.copyOf(hits);
        metrics = List.copyOf(metrics);
    }

    public RunSummary summary() {
        return RunSummary.of(decisions, hits, metrics);
    }
}
