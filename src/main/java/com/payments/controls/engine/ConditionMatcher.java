package com.payments.controls.engine;

import com.payments.controls.domain.CompiledCondition;
import com.payments.controls.domain.Condition;
import com.payments.controls.domain.Control;
import com.payments.controls.domain.TransactionBatch;
import com.payments.controls.domain.TransactionRecord;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.util.List;

/**
 * Evaluates one control's condition set against a single-rail batch.
 * <p>
 * Produces one match flag per row, in batch order. All conditions are ANDed; an empty
 * condition set matches every row. A condition on a column the batch does not have
 * matches no row.
 */
@ApplicationScoped
public class ConditionMatcher {

    private static final Logger LOG = Logger.getLogger(ConditionMatcher.class);

    /**
     * Matches a control against every row of the batch.
     *
     * @param batch   rows of the control's rail
     * @param control the control
     * @return one flag per row
     */
    public boolean[] match(TransactionBatch batch, Control control) {
        return match(batch, control.getConditions(), control.getCompiledCondition());
    }

    private boolean[] match(TransactionBatch batch, List<Condition> conditions, CompiledCondition compiled) {
        boolean[] flags = new boolean[batch.size()];
        if (batch.isEmpty()) {
            return flags;
        }

        for (Condition condition : conditions) {
            if (!batch.hasColumn(condition.getField())) {
                if (LOG.isDebugEnabled()) {
                    LOG.debugf("Column %s absent from batch; condition %s matches no row",
                            condition.getField(), condition.getKey());
                }
                return flags;
            }
        }

        List<TransactionRecord> records = batch.getRecords();
        for (int i = 0; i < flags.length; i++) {
            flags[i] = compiled.matches(records.get(i));
        }
        return flags;
    }
}
