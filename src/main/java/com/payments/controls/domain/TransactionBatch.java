package com.payments.controls.domain;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * An immutable batch of transaction rows sharing one column schema.
 * <p>
 * The schema matters for condition matching: a condition on a column the batch does
 * not have never matches, it does not fail.
 */
public final class TransactionBatch {

    private static final TransactionBatch EMPTY = new TransactionBatch(List.of(), List.of());

    private final List<String> columns;
    private final Set<String> columnIndex;
    private final List<TransactionRecord> records;

    public TransactionBatch(List<String> columns, List<TransactionRecord> records) {
        this.columns = List.copyOf(columns);
        this.columnIndex = Set.copyOf(columns);
        this.records = List.copyOf(records);
    }

    public static TransactionBatch empty() {
        return EMPTY;
    }

    /**
     * Builds a batch from row maps. The schema is the union of all row keys in
     * first-seen order.
     */
    public static TransactionBatch fromRows(List<Map<String, Object>> rows) {
        Set<String> columns = new LinkedHashSet<>();
        List<TransactionRecord> records = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            columns.addAll(row.keySet());
            records.add(new TransactionRecord(row));
        }
        return new TransactionBatch(new ArrayList<>(columns), records);
    }

    public List<String> getColumns() {
        return columns;
    }

    public boolean hasColumn(String name) {
        return columnIndex.contains(name);
    }

    public List<TransactionRecord> getRecords() {
        return records;
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    /**
     * Returns the required columns this batch lacks, in declaration order.
     */
    public List<String> missingColumns(Collection<String> required) {
        List<String> missing = new ArrayList<>();
        for (String column : required) {
            if (!hasColumn(column)) {
                missing.add(column);
            }
        }
        return missing;
    }

    /**
     * Fails if any required column is absent.
     *
     * @param required the required column names
     * @param source   where the batch came from, used in the error message
     * @throws TransactionBatchException naming the first missing column
     */
    public void requireColumns(Collection<String> required, String source) {
        List<String> missing = missingColumns(required);
        if (!missing.isEmpty()) {
            throw new TransactionBatchException(
                    "Missing required column '" + missing.get(0) + "' in " + source);
        }
    }

    /**
     * Splits the batch by rail in a single pass. Rows whose rail is not a known
     * rail are left out; every known rail has an entry, possibly empty.
     */
    public Map<Rail, TransactionBatch> partitionByRail() {
        Map<Rail, List<TransactionRecord>> buckets = new EnumMap<>(Rail.class);
        for (Rail rail : Rail.values()) {
            buckets.put(rail, new ArrayList<>());
        }
        for (TransactionRecord record : records) {
            for (Rail rail : Rail.values()) {
                if (rail.matches(record.getRail())) {
                    buckets.get(rail).add(record);
                    break;
                }
            }
        }
        Map<Rail, TransactionBatch> partitions = new EnumMap<>(Rail.class);
        buckets.forEach((rail, railRecords) -> partitions.put(rail, new TransactionBatch(columns, railRecords)));
        return Collections.unmodifiableMap(partitions);
    }

    @Override
    public String toString() {
        return "TransactionBatch{" +
               "columns=" + columns.size() +
               ", records=" + records.size() +
               '}';
    }
}
