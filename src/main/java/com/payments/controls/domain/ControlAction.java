package com.payments.controls.domain;

import java.util.Collection;

/**
 * Action a control contributes when it matches, ordered by priority.
 * <p>
 * Resolution is a strict override: the highest-priority action among the
 * triggered controls wins, there is no accumulation of weaker signals.
 */
public enum ControlAction {

    ALLOW(0),

    REVIEW(1),

    BLOCK(2);

    private final int priority;

    ControlAction(int priority) {
        this.priority = priority;
    }

    public int getPriority() {
        return priority;
    }

    /**
     * Parses an action string, ignoring case and surrounding whitespace.
     *
     * @param value the raw action
     * @return the action, or null if unrecognized
     */
    public static ControlAction fromString(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return switch (value.trim().toUpperCase()) {
            case "ALLOW" -> ALLOW;
            case "REVIEW" -> REVIEW;
            case "BLOCK" -> BLOCK;
            default -> null;
        };
    }

    /**
     * Resolves the single final action for a set of triggered actions.
     *
     * @param actions triggered action strings, possibly empty
     * @return the highest-priority recognized action, ALLOW if none
     */
    public static ControlAction resolve(Collection<String> actions) {
        ControlAction result = ALLOW;
        if (actions == null) {
            return result;
        }
        for (String action : actions) {
            ControlAction parsed = fromString(action);
            if (parsed != null && parsed.priority > result.priority) {
                result = parsed;
            }
        }
        return result;
    }
}
