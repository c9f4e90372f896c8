package com.payments.controls.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One resolved condition of a control.
 *
 * <p>Controls declare conditions as a flat mapping from condition key to expected value,
 * for example {@code amount_gt: 5000} or {@code return_code_in: [R01, R10]}. The key suffix
 * decides the kind of comparison. Keys are classified once, when the control is loaded,
 * into one of the {@link Kind} variants so evaluation never parses strings.
 *
 * <p>Key grammar:
 * <ul>
 *   <li>{@code <field>_in}: membership in a list</li>
 *   <li>{@code <field>_gt_days}, {@code _gte_days}, {@code _lt_days}, {@code _lte_days}:
 *       numeric comparison against the canonical {@code _days} column</li>
 *   <li>{@code <field>_gt}, {@code _gte}, {@code _lt}, {@code _lte}: numeric comparison</li>
 *   <li>{@code <field>} with a boolean value: boolean equality</li>
 *   <li>{@code <field>} with any other value: equality (case-insensitive for strings)</li>
 * </ul>
 */
public final class Condition {

    private static final Map<String, String> FIELD_ALIASES = Map.of(
            "account_age", "account_age_days",
            "wallet_age", "wallet_age_days"
    );

    private static final String IN_SUFFIX = "_in";
    private static final String DAYS_SUFFIX = "_days";

    private final String key;
    private final String field;
    private final Kind kind;
    private final Operator operator;
    private final Object value;
    private final List<Object> values;
    private final double threshold;

    private Condition(String key, String field, Kind kind, Operator operator,
                      Object value, List<Object> values, double threshold) {
        this.key = key;
        this.field = field;
        this.kind = kind;
        this.operator = operator;
        this.value = value;
        this.values = values;
        this.threshold = threshold;
    }

    /**
     * Resolves a condition key and its expected value.
     *
     * @param key      the condition key as written in the control definition
     * @param expected the expected value (scalar or list)
     * @return the resolved condition
     * @throws IllegalArgumentException if a comparison key carries a non-numeric value
     */
    public static Condition fromEntry(String key, Object expected) {
        Objects.requireNonNull(key, "Condition key is required");

        if (key.endsWith(IN_SUFFIX)) {
            String field = strip(key, IN_SUFFIX);
            return new Condition(key, field, Kind.MEMBERSHIP_IN, null, expected, toList(expected), Double.NaN);
        }

        for (Operator op : Operator.values()) {
            String daySuffix = op.suffix() + DAYS_SUFFIX;
            if (key.endsWith(daySuffix)) {
                return numeric(key, strip(key, daySuffix), op, expected);
            }
        }

        for (Operator op : Operator.values()) {
            if (key.endsWith(op.suffix())) {
                return numeric(key, strip(key, op.suffix()), op, expected);
            }
        }

        if (expected instanceof Boolean) {
            return new Condition(key, key, Kind.BOOLEAN_EQUALS, null, expected, null, Double.NaN);
        }
        return new Condition(key, key, Kind.EQUALS, null, expected, null, Double.NaN);
    }

    private static Condition numeric(String key, String field, Operator op, Object expected) {
        double threshold = toThreshold(key, expected);
        return new Condition(key, canonicalField(field), Kind.NUMERIC_COMPARE, op, expected, null, threshold);
    }

    /**
     * Maps the short field names used in control definitions to their column names.
     * {@code account_age} becomes {@code account_age_days}, {@code wallet_age} becomes
     * {@code wallet_age_days}. Other names are returned unchanged.
     */
    public static String canonicalField(String field) {
        return FIELD_ALIASES.getOrDefault(field, field);
    }

    private static String strip(String key, String suffix) {
        return key.substring(0, key.length() - suffix.length());
    }

    private static double toThreshold(String key, Object expected) {
        if (expected instanceof Number number) {
            return number.doubleValue();
        }
        if (expected instanceof String text) {
            try {
                return Double.parseDouble(text.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(
                        "Condition '" + key + "' expects a numeric value but got: " + expected, e);
            }
        }
        throw new IllegalArgumentException(
                "Condition '" + key + "' expects a numeric value but got: " + expected);
    }

    private static List<Object> toList(Object expected) {
        if (expected == null) {
            return Collections.emptyList();
        }
        if (expected instanceof List<?> list) {
            return Collections.unmodifiableList(new ArrayList<>(list));
        }
        return List.of(expected);
    }

    public String getKey() {
        return key;
    }

    /**
     * The column this condition reads, after suffix stripping and alias normalization.
     */
    public String getField() {
        return field;
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * The comparison operator, only set for {@link Kind#NUMERIC_COMPARE}.
     */
    public Operator getOperator() {
        return operator;
    }

    public Object getValue() {
        return value;
    }

    /**
     * Accepted values, only set for {@link Kind#MEMBERSHIP_IN}.
     */
    public List<Object> getValues() {
        return values;
    }

    /**
     * Numeric threshold, only meaningful for {@link Kind#NUMERIC_COMPARE}.
     */
    public double getThreshold() {
        return threshold;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Condition condition = (Condition) o;
        return Objects.equals(key, condition.key) &&
               Objects.equals(value, condition.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, value);
    }

    @Override
    public String toString() {
        return "Condition{" +
               "key='" + key + '\'' +
               ", field='" + field + '\'' +
               ", kind=" + kind +
               (operator != null ? ", operator=" + operator : "") +
               ", value=" + value +
               '}';
    }

    // ========== Inner Types ==========

    /**
     * Condition variants.
     */
    public enum Kind {

        /**
         * Field equals the expected value. Strings compare case-insensitively,
         * other scalars exactly.
         */
        EQUALS,

        /**
         * Field value is a member of the expected list.
         */
        MEMBERSHIP_IN,

        /**
         * Field, coerced to a number, compares against a numeric threshold.
         */
        NUMERIC_COMPARE,

        /**
         * Field, coerced to a boolean, equals the expected boolean.
         */
        BOOLEAN_EQUALS
    }

    /**
     * Numeric comparison operators, keyed by their condition-key suffix.
     */
    public enum Operator {

        GT("_gt"),

        GTE("_gte"),

        LT("_lt"),

        LTE("_lte");

        private final String suffix;
        Operator(String suffix) {
            this.suffix = suffix;
        }

        public String suffix() {
            return suffix;
        }

        /**
         * Applies the comparison. NaN on either side never matches.
         */
        public boolean test(double actual, double threshold) {
            return switch (this) {
                case GT -> actual > threshold;
                case GTE -> actual >= threshold;
                case LT -> actual < threshold;
                case LTE -> actual <= threshold;
            };
        }
    }
}
