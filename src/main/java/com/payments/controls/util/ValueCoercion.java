package com.payments.controls.util;

import java.util.Locale;

/**
 * Per-value coercions used by condition evaluation.
 * <p>
 * Coercion failures never throw; they return a value that fails the comparison,
 * so a malformed or absent signal cannot trigger a control.
 */
public final class ValueCoercion {

    private ValueCoercion() {}

    /**
     * Coerces a value to a number.
     *
     * @param value a cell value
     * @return the numeric value, or null when the value is absent or not numeric
     */
    public static Double toDouble(Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof String text) {
            String trimmed = text.trim();
            if (trimmed.isEmpty()) {
                return null;
            }
            try {
                return Double.parseDouble(trimmed);
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    /**
     * Coerces the string forms {@code "true"} and {@code "false"} (any case, surrounding
     * whitespace ignored) to booleans. Booleans pass through; anything else is returned
     * unchanged and therefore fails a boolean equality check.
     */
    public static Object toBoolean(Object value) {
        if (value instanceof Boolean) {
            return value;
        }
        if (value instanceof String text) {
            String normalized = text.trim().toLowerCase(Locale.ROOT);
            if ("true".equals(normalized)) {
                return Boolean.TRUE;
            }
            if ("false".equals(normalized)) {
                return Boolean.FALSE;
            }
        }
        return value;
    }

    /**
     * Element equality for membership and exact-equality conditions.
     * <p>
     * Two numbers are equal when their numeric values are equal, regardless of boxed type,
     * so a YAML {@code 7995} matches a CSV {@code 7995}. Strings never equal numbers.
     * A missing value equals nothing.
     */
    public static boolean valuesEqual(Object actual, Object expected) {
        if (actual == null || expected == null) {
            return false;
        }
        if (actual instanceof Number a && expected instanceof Number e) {
            return Double.compare(a.doubleValue(), e.doubleValue()) == 0
                    && !Double.isNaN(a.doubleValue());
        }
        return actual.equals(expected);
    }

    /**
     * Case-insensitive string equality; the actual value is rendered with {@code String.valueOf}.
     */
    public static boolean equalsIgnoreCase(Object actual, String expected) {
        if (actual == null || expected == null) {
            return false;
        }
        return String.valueOf(actual).toLowerCase(Locale.ROOT).equals(expected.toLowerCase(Locale.ROOT));
    }
}
