package com.payments.controls.engine;

import com.payments.controls.domain.ControlAction;
import com.payments.controls.domain.ControlDecision;
import com.payments.controls.domain.ControlHit;
import com.payments.controls.domain.TransactionBatch;
import com.payments.controls.domain.TransactionRecord;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Resolves the hit list into one decision per transaction.
 * <p>
 * The final action is the highest-priority triggered action (ALLOW &lt; REVIEW &lt; BLOCK).
 * One BLOCK hit overrides any number of REVIEW hits; hits are never scored or summed.
 * Transactions without hits resolve to ALLOW.
 */
@ApplicationScoped
public class DecisionResolver {

    private static final Logger LOG = Logger.getLogger(DecisionResolver.class);

    /**
     * Builds the decisions table.
     *
     * @param batch the full transaction batch
     * @param hits  the hit list produced by {@link RuleEvaluator}
     * @return one decision per row of the batch, in batch order
     */
    public List<ControlDecision> resolve(TransactionBatch batch, List<ControlHit> hits) {
        Map<String, List<ControlHit>> hitsByTransaction = new HashMap<>();
        for (ControlHit hit : hits) {
            hitsByTransaction.computeIfAbsent(hit.transactionId(), k -> new ArrayList<>(2)).add(hit);
        }

        List<ControlDecision> decisions = new ArrayList<>(batch.size());
        for (TransactionRecord record : batch.getRecords()) {
            List<ControlHit> transactionHits = hitsByTransaction.getOrDefault(record.getTransactionId(), List.of());
            decisions.add(resolveTransaction(record, transactionHits));
        }

        LOG.debugf("Resolved %d decisions from %d hits", decisions.size(), hits.size());
        return decisions;
    }

    ControlDecision resolveTransaction(TransactionRecord record, List<ControlHit> hits) {
        SortedSet<String> controlIds = new TreeSet<>();
        SortedSet<String> actions = new TreeSet<>();
        for (ControlHit hit : hits) {
            controlIds.add(hit.controlId());
            actions.add(hit.action());
        }

        ControlAction finalAction = ControlAction.resolve(actions);

        return new ControlDecision(
                record.getTransactionId(),
                record.getRail(),
                record.getTimestamp(),
                record.getUserId(),
                record.getAmount(),
                record.isFraudPattern(),
                finalAction,
                new ArrayList<>(controlIds),
                new ArrayList<>(actions)
        );
    }
}
