package com.payments.controls.engine;

import com.payments.controls.domain.CompiledCondition;
import com.payments.controls.domain.Condition;
import com.payments.controls.util.ValueCoercion;
import org.jboss.logging.Logger;

import java.util.Collection;
import java.util.List;

/**
 * Compiles resolved conditions into executable lambdas.
 * <p>
 * Each {@link Condition.Kind} maps to one compiler method; coercion rules are fixed
 * per kind at compile time so evaluation is a plain predicate call per row:
 * <ul>
 *   <li>MEMBERSHIP_IN: element equality against the list, no coercion</li>
 *   <li>NUMERIC_COMPARE: field coerced to a number, non-numeric never matches</li>
 *   <li>BOOLEAN_EQUALS: "true"/"false" strings coerced to booleans</li>
 *   <li>EQUALS: case-insensitive for string expectations, exact otherwise</li>
 * </ul>
 */
public final class ConditionCompiler {

    private static final Logger LOG = Logger.getLogger(ConditionCompiler.class);

    private static final CompiledCondition ALWAYS = record -> true;
    private static final CompiledCondition NEVER = record -> false;

    private ConditionCompiler() {}

    /**
     * Compiles a single condition.
     *
     * @param condition the condition to compile
     * @return a compiled condition
     */
    public static CompiledCondition compile(Condition condition) {
        String field = condition.getField();
        return switch (condition.getKind()) {
            case MEMBERSHIP_IN -> compileMembership(field, condition.getValues());
            case NUMERIC_COMPARE -> compileNumeric(field, condition.getOperator(), condition.getThreshold());
            case BOOLEAN_EQUALS -> compileBooleanEquals(field, (Boolean) condition.getValue());
            case EQUALS -> compileEquals(field, condition.getValue());
        };
    }

    /**
     * Compiles a list of conditions (AND logic - all must match).
     *
     * @param conditions the conditions to compile
     * @return a compiled condition; an empty list matches every row
     */
    public static CompiledCondition compileAll(Collection<Condition> conditions) {
        if (conditions == null || conditions.isEmpty()) {
            return ALWAYS;
        }
        if (conditions.size() == 1) {
            return compile(conditions.iterator().next());
        }

        CompiledCondition[] compiled = conditions.stream()
                .map(ConditionCompiler::compile)
                .toArray(CompiledCondition[]::new);

        return record -> {
            for (CompiledCondition c : compiled) {
                if (!c.matches(record)) {
                    return false;
                }
            }
            return true;
        };
    }

    // ========== Compiler Methods ==========

    private static CompiledCondition compileMembership(String field, List<Object> values) {
        if (values == null || values.isEmpty()) {
            return NEVER;
        }
        Object[] accepted = values.toArray();
        return record -> {
            Object actual = record.getField(field);
            if (actual == null) {
                return false;
            }
            for (Object candidate : accepted) {
                if (ValueCoercion.valuesEqual(actual, candidate)) {
                    return true;
                }
            }
            return false;
        };
    }

    private static CompiledCondition compileNumeric(String field, Condition.Operator operator, double threshold) {
        if (Double.isNaN(threshold)) {
            LOG.warnf("NaN threshold for field %s, condition never matches", field);
            return NEVER;
        }
        return record -> {
            Double actual = ValueCoercion.toDouble(record.getField(field));
            return actual != null && operator.test(actual, threshold);
        };
    }

    private static CompiledCondition compileBooleanEquals(String field, Boolean expected) {
        return record -> expected.equals(ValueCoercion.toBoolean(record.getField(field)));
    }

    private static CompiledCondition compileEquals(String field, Object expected) {
        if (expected == null) {
            return NEVER;
        }
        if (expected instanceof String text) {
            return record -> ValueCoercion.equalsIgnoreCase(record.getField(field), text);
        }
        return record -> ValueCoercion.valuesEqual(record.getField(field), expected);
    }
}
