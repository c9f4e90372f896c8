package com.payments.controls.engine;

import com.payments.controls.domain.Control;
import com.payments.controls.domain.ControlDecision;
import com.payments.controls.domain.ControlHit;
import com.payments.controls.domain.ControlMetric;
import com.payments.controls.domain.TransactionBatch;
import com.payments.controls.util.AlertLogger;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Runs the three engine stages over one batch: rule evaluation, decision resolution
 * and monitoring aggregation.
 * <p>
 * The engine is pure with respect to its inputs. Evaluating the same batch against the
 * same controls twice yields equal results.
 */
@ApplicationScoped
public class ControlsEngine {

    private static final Logger LOG = Logger.getLogger(ControlsEngine.class);

    @Inject
    RuleEvaluator ruleEvaluator;

    @Inject
    DecisionResolver decisionResolver;

    @Inject
    MonitoringAggregator monitoringAggregator;

    @ConfigProperty(name = "app.monitoring.noisy-hit-rate-threshold", defaultValue = "0.05")
    double noisyHitRateThreshold;

    /**
     * Evaluates a batch against a control set.
     *
     * @param batch    the transactions
     * @param controls the controls, in declaration order
     * @return decisions, hits and metrics
     * @throws com.payments.controls.domain.TransactionBatchException if a required column is missing
     */
    public EvaluationResult evaluate(TransactionBatch batch, List<Control> controls) {
        List<ControlHit> hits = ruleEvaluator.evaluate(batch, controls);
        List<ControlDecision> decisions = decisionResolver.resolve(batch, hits);
        List<ControlMetric> metrics = monitoringAggregator.aggregate(batch, hits);

        reportControlHealth(controls, metrics);

        LOG.debugf("Evaluated %d transactions against %d controls: %d hits",
                batch.size(), controls.size(), hits.size());
        return new EvaluationResult(decisions, hits, metrics);
    }

    void reportControlHealth(List<Control> controls, List<ControlMetric> metrics) {
        Set<String> fired = new HashSet<>();
        for (ControlMetric metric : metrics) {
            fired.add(metric.controlId());
            if (metric.hitRate() > noisyHitRateThreshold) {
                AlertLogger.noisyControl(metric.controlId(), metric.hitRate(), noisyHitRateThreshold);
            }
        }
        Set<String> reported = new HashSet<>();
        for (Control control : controls) {
            if (!fired.contains(control.getControlId()) && reported.add(control.getControlId())) {
                AlertLogger.silentControl(control.getControlId(), control.getRail().name());
            }
        }
    }
}
