package com.payments.controls.domain;

import com.payments.controls.engine.ConditionCompiler;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A declarative risk control.
 *
 * A control consists of:
 * - An id that names it in hits, decisions and metrics
 * - The rail it applies to (never evaluated against other rails)
 * - A severity label carried through to hits
 * - The action it contributes when it matches (ALLOW, REVIEW, BLOCK)
 * - A free-text description
 * - Conditions that must ALL hold for the control to match (AND logic)
 *
 * Conditions are resolved and compiled when the control is constructed; a control
 * is immutable afterwards.
 */
public final class Control {

    public static final String DEFAULT_SEVERITY = "MEDIUM";
    public static final String DEFAULT_ACTION = "REVIEW";

    private final String controlId;
    private final Rail rail;
    private final String severity;
    private final String action;
    private final String description;
    private final Map<String, Object> rawConditions;
    private final List<Condition> conditions;
    private final CompiledCondition compiledCondition;

    /**
     * Creates a control and resolves its conditions.
     *
     * @throws IllegalArgumentException if a condition cannot be resolved
     */
    public Control(String controlId, Rail rail, String severity, String action,
                   String description, Map<String, Object> conditions) {
        this.controlId = Objects.requireNonNull(controlId, "controlId");
        this.rail = Objects.requireNonNull(rail, "rail");
        this.severity = severity != null ? severity : DEFAULT_SEVERITY;
        this.action = action != null ? action : DEFAULT_ACTION;
        this.description = description != null ? description : "";
        this.rawConditions = conditions != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(conditions))
                : Collections.emptyMap();

        List<Condition> resolved = new ArrayList<>(this.rawConditions.size());
        this.rawConditions.forEach((key, expected) -> resolved.add(Condition.fromEntry(key, expected)));
        this.conditions = Collections.unmodifiableList(resolved);
        this.compiledCondition = ConditionCompiler.compileAll(this.conditions);
    }

    public Control(String controlId, Rail rail, String action, Map<String, Object> conditions) {
        this(controlId, rail, DEFAULT_SEVERITY, action, "", conditions);
    }

    public String getControlId() {
        return controlId;
    }

    public Rail getRail() {
        return rail;
    }

    public String getSeverity() {
        return severity;
    }

    public String getAction() {
        return action;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Conditions as declared, in declaration order.
     */
    public Map<String, Object> getRawConditions() {
        return rawConditions;
    }

    public List<Condition> getConditions() {
        return conditions;
    }

    public CompiledCondition getCompiledCondition() {
        return compiledCondition;
    }

    @Override
    public String toString() {
        return "Control{" +
               "controlId='" + controlId + '\'' +
               ", rail=" + rail +
               ", severity='" + severity + '\'' +
               ", action='" + action + '\'' +
               ", conditionsCount=" + conditions.size() +
               '}';
    }
}
