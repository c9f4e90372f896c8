package com.payments.controls.service;

import com.payments.controls.config.EngineConfig;
import com.payments.controls.config.RunPaths;
import com.payments.controls.domain.Control;
import com.payments.controls.domain.ControlAction;
import com.payments.controls.domain.ControlDecision;
import com.payments.controls.domain.ControlHit;
import com.payments.controls.domain.ControlMetric;
import com.payments.controls.domain.RunSummary;
import com.payments.controls.domain.TransactionBatch;
import com.payments.controls.domain.TransactionBatchException;
import com.payments.controls.engine.ControlsEngine;
import com.payments.controls.engine.ControlsEngineException;
import com.payments.controls.engine.EvaluationResult;
import com.payments.controls.loader.ControlsLoadException;
import com.payments.controls.loader.ControlsLoader;
import com.payments.controls.loader.TransactionBatchLoader;
import com.payments.controls.output.CsvTableWriter;
import com.payments.controls.output.OutputTable;
import com.payments.controls.util.AlertLogger;
import com.payments.controls.util.EngineMetrics;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Orchestrates one controls run: load the batch and the control set, evaluate,
 * write the three output tables and log a summary.
 * <p>
 * <b>Fail-Fast Behavior:</b> a missing input file or required column aborts the run
 * before any control is evaluated, and nothing is written.
 */
@ApplicationScoped
public class ControlsRunService {

    private static final Logger LOG = Logger.getLogger(ControlsRunService.class);

    @Inject
    EngineConfig engineConfig;

    @Inject
    TransactionBatchLoader transactionBatchLoader;

    @Inject
    ControlsLoader controlsLoader;

    @Inject
    ControlsEngine controlsEngine;

    @Inject
    CsvTableWriter csvTableWriter;

    @Inject
    EngineMetrics engineMetrics;

    /**
     * Runs against the configured paths.
     */
    public RunSummary run() {
        return run(engineConfig.runPaths());
    }

    /**
     * Runs against explicit paths.
     *
     * @throws ControlsEngineException on any fatal error; no output is written in that case
     */
    public RunSummary run(RunPaths paths) {
        try {
            RunSummary summary = execute(paths);
            engineMetrics.incrementRunSuccess();
            return summary;
        } catch (ControlsEngineException e) {
            engineMetrics.incrementRunFailure();
            throw e;
        }
    }

    private RunSummary execute(RunPaths paths) {
        if (!Files.isRegularFile(paths.transactionsFile())) {
            AlertLogger.loadFailed("transactions", paths.transactionsFile().toString(), "file not found");
            throw new TransactionBatchException("Missing transactions file: " + paths.transactionsFile()
                    + ". Generate the synthetic batch before running the controls.");
        }
        if (!Files.isRegularFile(paths.controlsFile())) {
            AlertLogger.loadFailed("controls", paths.controlsFile().toString(), "file not found");
            throw new ControlsLoadException("Missing controls file: " + paths.controlsFile());
        }

        long loadStart = System.currentTimeMillis();
        TransactionBatch batch;
        List<Control> controls;
        try {
            batch = transactionBatchLoader.load(paths.transactionsFile());
        } catch (TransactionBatchException e) {
            AlertLogger.loadFailed("transactions", paths.transactionsFile().toString(), e.getMessage());
            throw e;
        }
        try {
            controls = controlsLoader.load(paths.controlsFile());
        } catch (ControlsLoadException e) {
            AlertLogger.loadFailed("controls", paths.controlsFile().toString(), e.getMessage());
            throw e;
        }
        engineMetrics.recordLoadTime(System.currentTimeMillis() - loadStart);
        engineMetrics.recordTransactions(batch.size());
        engineMetrics.recordControls(controls.size());

        long evaluationStart = System.currentTimeMillis();
        EvaluationResult result = controlsEngine.evaluate(batch, controls);
        engineMetrics.recordEvaluationTime(System.currentTimeMillis() - evaluationStart);
        engineMetrics.recordHits(result.hits().size());

        long writeStart = System.currentTimeMillis();
        csvTableWriter.writeAll(outputTables(paths, result));
        engineMetrics.recordWriteTime(System.currentTimeMillis() - writeStart);

        RunSummary summary = result.summary();
        logSummary(summary, paths);
        return summary;
    }

    static List<OutputTable> outputTables(RunPaths paths, EvaluationResult result) {
        List<Map<String, Object>> decisionRows = new ArrayList<>(result.decisions().size());
        for (ControlDecision decision : result.decisions()) {
            decisionRows.add(decision.toRow());
        }
        List<Map<String, Object>> hitRows = new ArrayList<>(result.hits().size());
        for (ControlHit hit : result.hits()) {
            hitRows.add(hit.toRow());
        }
        List<Map<String, Object>> metricRows = new ArrayList<>(result.metrics().size());
        for (ControlMetric metric : result.metrics()) {
            metricRows.add(metric.toRow());
        }
        return List.of(
                new OutputTable(paths.decisionsFile(), ControlDecision.COLUMNS, decisionRows),
                new OutputTable(paths.hitsFile(), ControlHit.COLUMNS, hitRows),
                new OutputTable(paths.metricsFile(), ControlMetric.COLUMNS, metricRows)
        );
    }

    private void logSummary(RunSummary summary, RunPaths paths) {
        LOG.info("Controls evaluated");
        LOG.infof("- Transactions: %,d", summary.transactions());
        LOG.infof("- Hits rows: %,d (%d controls fired)", summary.hits(), summary.controlsFired());
        for (ControlAction action : ControlAction.values()) {
            LOG.infof("- %s: %,d (%.2f%%)", action, summary.count(action), summary.percent(action));
        }
        summary.railCounts().forEach((rail, count) -> LOG.infof("- Rail %s: %,d", rail, count));
        LOG.infof("- Decisions written: %s", paths.decisionsFile());
        LOG.infof("- Hits written: %s", paths.hitsFile());
        LOG.infof("- Metrics written: %s", paths.metricsFile());
        if (LOG.isDebugEnabled()) {
            LOG.debugf("Engine metrics: %s", engineMetrics.snapshot());
        }
    }
}
