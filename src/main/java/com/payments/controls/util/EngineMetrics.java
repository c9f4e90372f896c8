package com.payments.controls.util;

import jakarta.enterprise.context.ApplicationScoped;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Lightweight in-process counters for engine observability.
 * <p>
 * Logged with the run summary. No external dependency required.
 */
@ApplicationScoped
public class EngineMetrics {

    private final AtomicLong runsSuccessTotal = new AtomicLong();
    private final AtomicLong runsFailureTotal = new AtomicLong();
    private final AtomicLong transactionsEvaluatedTotal = new AtomicLong();
    private final AtomicLong controlsLoadedTotal = new AtomicLong();
    private final AtomicLong hitsTotal = new AtomicLong();
    private final AtomicLong loadTimeMsLast = new AtomicLong();
    private final AtomicLong evaluationTimeMsLast = new AtomicLong();
    private final AtomicLong writeTimeMsLast = new AtomicLong();

    public void incrementRunSuccess() {
        runsSuccessTotal.incrementAndGet();
    }

    public void incrementRunFailure() {
        runsFailureTotal.incrementAndGet();
    }

    public void recordTransactions(long count) {
        transactionsEvaluatedTotal.addAndGet(count);
    }

    public void recordControls(long count) {
        controlsLoadedTotal.addAndGet(count);
    }

    public void recordHits(long count) {
        hitsTotal.addAndGet(count);
    }

    public void recordLoadTime(long ms) {
        loadTimeMsLast.set(ms);
    }

    public void recordEvaluationTime(long ms) {
        evaluationTimeMsLast.set(ms);
    }

    public void recordWriteTime(long ms) {
        writeTimeMsLast.set(ms);
    }

    public Map<String, Long> snapshot() {
        Map<String, Long> m = new LinkedHashMap<>();
        m.put("runs_success_total", runsSuccessTotal.get());
        m.put("runs_failure_total", runsFailureTotal.get());
        m.put("transactions_evaluated_total", transactionsEvaluatedTotal.get());
        m.put("controls_loaded_total", controlsLoadedTotal.get());
        m.put("hits_total", hitsTotal.get());
        m.put("load_time_ms_last", loadTimeMsLast.get());
        m.put("evaluation_time_ms_last", evaluationTimeMsLast.get());
        m.put("write_time_ms_last", writeTimeMsLast.get());
        return m;
    }
}
