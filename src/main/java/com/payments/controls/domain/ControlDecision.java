package com.payments.controls.domain;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The resolved decision for one transaction.
 * <p>
 * Triggered control ids and actions are deduplicated and sorted lexicographically.
 * A transaction without hits resolves to ALLOW with both lists empty.
 */
public record ControlDecision(
        String transactionId,
        String rail,
        String timestamp,
        String userId,
        double amount,
        boolean fraudPattern,
        ControlAction finalAction,
        List<String> triggeredControls,
        List<String> triggeredActions
) {

    public static final String LIST_SEPARATOR = ", ";

    public static final List<String> COLUMNS = List.of(
            "tx_id", "rail", "timestamp", "user_id", "amount", "is_fraud_pattern",
            "final_action", "triggered_controls", "triggered_actions");

    public ControlDecision {
        triggeredControls = List.copyOf(triggeredControls);
        triggeredActions = List.copyOf(triggeredActions);
    }

    public String triggeredControlsDisplay() {
        return String.join(LIST_SEPARATOR, triggeredControls);
    }

    public String triggeredActionsDisplay() {
        return String.join(LIST_SEPARATOR, triggeredActions);
    }

    public Map<String, Object> toRow() {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("tx_id", transactionId);
        row.put("rail", rail);
        row.put("timestamp", timestamp);
        row.put("user_id", userId);
        row.put("amount", amount);
        row.put("is_fraud_pattern", fraudPattern);
        row.put("final_action", finalAction.name());
        row.put("triggered_controls", triggeredControlsDisplay());
        row.put("triggered_actions", triggeredActionsDisplay());
        return row;
    }
}
