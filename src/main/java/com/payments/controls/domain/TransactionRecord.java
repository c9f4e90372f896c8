package com.payments.controls.domain;

import com.payments.controls.util.ValueCoercion;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One row of the unified transaction batch.
 *
 * <p>The record shape is rail-agnostic: every row carries the required columns and
 * whatever optional, rail-specific columns the batch has. Optional values are null
 * on rows where they do not apply.
 */
public final class TransactionRecord {

    public static final String TX_ID = "tx_id";
    public static final String RAIL = "rail";
    public static final String TIMESTAMP = "timestamp";
    public static final String USER_ID = "user_id";
    public static final String AMOUNT = "amount";
    public static final String IS_FRAUD_PATTERN = "is_fraud_pattern";

    /** Columns every batch must carry, in output order. */
    public static final List<String> REQUIRED_FIELDS =
            List.of(TX_ID, RAIL, TIMESTAMP, USER_ID, AMOUNT, IS_FRAUD_PATTERN);

    private final Map<String, Object> fields;

    public TransactionRecord(Map<String, Object> fields) {
        Objects.requireNonNull(fields, "fields");
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    /**
     * Returns a column value.
     *
     * @param name the column name
     * @return the value, or null when the column is absent or empty on this row
     */
    public Object getField(String name) {
        return fields.get(name);
    }

    public Map<String, Object> getFields() {
        return fields;
    }

    public String getTransactionId() {
        return asString(fields.get(TX_ID));
    }

    public String getRail() {
        return asString(fields.get(RAIL));
    }

    public String getTimestamp() {
        return asString(fields.get(TIMESTAMP));
    }

    public String getUserId() {
        return asString(fields.get(USER_ID));
    }

    /**
     * @return the amount, or NaN when the value is absent or not numeric
     */
    public double getAmount() {
        Double amount = ValueCoercion.toDouble(fields.get(AMOUNT));
        return amount != null ? amount : Double.NaN;
    }

    /**
     * The synthetic ground-truth label, used only for monitoring.
     */
    public boolean isFraudPattern() {
        return Boolean.TRUE.equals(ValueCoercion.toBoolean(fields.get(IS_FRAUD_PATTERN)));
    }

    private static String asString(Object value) {
        return value != null ? String.valueOf(value) : null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return fields.equals(((TransactionRecord) o).fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return "TransactionRecord{" +
               "txId='" + getTransactionId() + '\'' +
               ", rail='" + getRail() + '\'' +
               ", fields=" + fields.size() +
               '}';
    }
}
