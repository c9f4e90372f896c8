package com.payments.controls.engine;

import com.payments.controls.domain.Control;
import com.payments.controls.domain.ControlHit;
import com.payments.controls.domain.Rail;
import com.payments.controls.domain.TransactionBatch;
import com.payments.controls.domain.TransactionRecord;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs every control against the rows of its rail and collects the hits.
 * <p>
 * Controls are independent: each one sees only its rail's rows and contributes its
 * own hit list. Lists are concatenated in control order, so the output does not
 * depend on whether controls ran sequentially or on the worker pool.
 */
@ApplicationScoped
public class RuleEvaluator {

    private static final Logger LOG = Logger.getLogger(RuleEvaluator.class);

    static final String BATCH_SOURCE = "transaction batch";

    @Inject
    ConditionMatcher conditionMatcher;

    @ConfigProperty(name = "app.evaluation.parallelism", defaultValue = "1")
    int parallelism;

    /**
     * Evaluates all controls.
     *
     * @param batch    the full transaction batch
     * @param controls the loaded controls, in load order
     * @return the flat hit list, one entry per (transaction, control) match
     * @throws com.payments.controls.domain.TransactionBatchException if a required column is absent
     */
    public List<ControlHit> evaluate(TransactionBatch batch, List<Control> controls) {
        batch.requireColumns(TransactionRecord.REQUIRED_FIELDS, BATCH_SOURCE);

        if (controls.isEmpty() || batch.isEmpty()) {
            LOG.debugf("Nothing to evaluate: %d controls, %d transactions", controls.size(), batch.size());
            return List.of();
        }

        Map<Rail, TransactionBatch> partitions = batch.partitionByRail();

        List<List<ControlHit>> perControl = parallelism > 1 && controls.size() > 1
                ? evaluateParallel(controls, partitions)
                : evaluateSequential(controls, partitions);

        List<ControlHit> hits = new ArrayList<>();
        for (List<ControlHit> controlHits : perControl) {
            hits.addAll(controlHits);
        }

        LOG.debugf("Evaluated %d controls over %d transactions: %d hits",
                controls.size(), batch.size(), hits.size());
        return hits;
    }

    /**
     * Evaluates one control against the rows of its rail.
     *
     * @param control   the control
     * @param railBatch rows whose rail equals the control's rail
     * @return the control's hits, in batch order
     */
    List<ControlHit> evaluateControl(Control control, TransactionBatch railBatch) {
        if (railBatch == null || railBatch.isEmpty()) {
            if (LOG.isDebugEnabled()) {
                LOG.debugf("Skipping control %s: no %s transactions", control.getControlId(), control.getRail());
            }
            return List.of();
        }

        boolean[] matches = conditionMatcher.match(railBatch, control);
        List<TransactionRecord> records = railBatch.getRecords();
        List<ControlHit> hits = new ArrayList<>();
        for (int i = 0; i < matches.length; i++) {
            if (matches[i]) {
                hits.add(ControlHit.of(control, records.get(i)));
            }
        }

        if (LOG.isDebugEnabled()) {
            LOG.debugf("Control %s (%s) matched %d of %d %s transactions - Action: %s",
                    control.getControlId(), control.getSeverity(), hits.size(), records.size(),
                    control.getRail(), control.getAction());
        }
        return hits;
    }

    private List<List<ControlHit>> evaluateSequential(List<Control> controls, Map<Rail, TransactionBatch> partitions) {
        List<List<ControlHit>> results = new ArrayList<>(controls.size());
        for (Control control : controls) {
            results.add(evaluateControl(control, partitions.get(control.getRail())));
        }
        return results;
    }

    private List<List<ControlHit>> evaluateParallel(List<Control> controls, Map<Rail, TransactionBatch> partitions) {
        int threads = Math.min(parallelism, controls.size());
        AtomicInteger threadIndex = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "control-evaluator-" + threadIndex.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        LOG.debugf("Evaluating %d controls on %d worker threads", controls.size(), threads);

        try {
            List<Callable<List<ControlHit>>> tasks = new ArrayList<>(controls.size());
            for (Control control : controls) {
                tasks.add(() -> evaluateControl(control, partitions.get(control.getRail())));
            }

            List<List<ControlHit>> results = new ArrayList<>(controls.size());
            for (Future<List<ControlHit>> future : executor.invokeAll(tasks)) {
                results.add(future.get());
            }
            return results;

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ControlsEngineException("Control evaluation interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw new ControlsEngineException("Control evaluation failed", cause);
        } finally {
            executor.shutdownNow();
        }
    }
}
