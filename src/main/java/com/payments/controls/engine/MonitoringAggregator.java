package com.payments.controls.engine;

import com.payments.controls.domain.ControlHit;
import com.payments.controls.domain.ControlMetric;
import com.payments.controls.domain.TransactionBatch;
import com.payments.controls.domain.TransactionRecord;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Scores how often each control fires and how well its hits line up with the
 * synthetic fraud label.
 * <p>
 * The hit rate denominator is the whole batch, all rails included, so rates compare
 * across rails. Controls that never fired get no row.
 */
@ApplicationScoped
public class MonitoringAggregator {

    private static final Logger LOG = Logger.getLogger(MonitoringAggregator.class);

    static final int METRIC_SCALE = 4;

    private static final Comparator<ControlMetric> BY_HITS_DESC =
            Comparator.comparingLong(ControlMetric::hits).reversed()
                    .thenComparing(ControlMetric::controlId);

    /**
     * Builds the metrics table.
     *
     * @param batch the full transaction batch, source of the label and the population size
     * @param hits  the hit list
     * @return one metric per control id with at least one hit, by descending hits
     */
    public List<ControlMetric> aggregate(TransactionBatch batch, List<ControlHit> hits) {
        if (hits.isEmpty() || batch.isEmpty()) {
            return List.of();
        }

        Map<TransactionKey, Boolean> labels = new HashMap<>(batch.size() * 2);
        for (TransactionRecord record : batch.getRecords()) {
            labels.putIfAbsent(new TransactionKey(record.getTransactionId(), record.getRail()), record.isFraudPattern());
        }

        Map<String, Tally> tallies = new LinkedHashMap<>();
        for (ControlHit hit : hits) {
            Tally tally = tallies.computeIfAbsent(hit.controlId(), k -> new Tally());
            tally.hits++;
            Boolean label = labels.get(new TransactionKey(hit.transactionId(), hit.rail()));
            if (label != null) {
                tally.labelled++;
                if (label) {
                    tally.flagged++;
                }
            }
        }

        int population = batch.size();
        List<ControlMetric> metrics = new ArrayList<>(tallies.size());
        tallies.forEach((controlId, tally) -> metrics.add(new ControlMetric(
                controlId,
                tally.hits,
                round((double) tally.hits / population),
                tally.labelled > 0 ? round((double) tally.flagged / tally.labelled) : 0.0
        )));
        metrics.sort(BY_HITS_DESC);

        LOG.debugf("Aggregated metrics for %d controls over %d transactions", metrics.size(), population);
        return metrics;
    }

    static double round(double value) {
        return new BigDecimal(value).setScale(METRIC_SCALE, RoundingMode.HALF_EVEN).doubleValue();
    }

    private record TransactionKey(String transactionId, String rail) {}

    private static final class Tally {
        long hits;
        long labelled;
        long flagged;
    }
}
