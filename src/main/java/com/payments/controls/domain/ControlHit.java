package com.payments.controls.domain;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One (transaction, control) match. Hits are never deduplicated when created.
 */
public record ControlHit(
        String transactionId,
        String rail,
        String controlId,
        String severity,
        String action,
        String description
) {

    public static final List<String> COLUMNS =
            List.of("tx_id", "rail", "control_id", "severity", "action", "description");

    public static ControlHit of(Control control, TransactionRecord record) {
        return new ControlHit(
                record.getTransactionId(),
                record.getRail(),
                control.getControlId(),
                control.getSeverity(),
                control.getAction(),
                control.getDescription()
        );
    }

    public Map<String, Object> toRow() {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("tx_id", transactionId);
        row.put("rail", rail);
        row.put("control_id", controlId);
        row.put("severity", severity);
        row.put("action", action);
        row.put("description", description);
        return row;
    }
}
