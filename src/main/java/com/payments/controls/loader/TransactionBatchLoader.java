package com.payments.controls.loader;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.payments.controls.domain.TransactionBatch;
import com.payments.controls.domain.TransactionBatchException;
import com.payments.controls.domain.TransactionRecord;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Reads the unified transaction batch from CSV.
 * <p>
 * The first row is the header. Empty cells are missing values. Other cells are typed
 * one by one: {@code true}/{@code false} become booleans, integral text becomes a long,
 * decimal text becomes a double, anything else stays a string. The identity columns
 * ({@code tx_id}, {@code rail}, {@code timestamp}, {@code user_id}) are always strings.
 */
@ApplicationScoped
public class TransactionBatchLoader {

    private static final Logger LOG = Logger.getLogger(TransactionBatchLoader.class);

    private static final Pattern INTEGRAL = Pattern.compile("[-+]?\\d+");
    private static final Pattern DECIMAL = Pattern.compile("[-+]?(\\d+\\.?\\d*|\\.\\d+)([eE][-+]?\\d+)?");

    private static final Set<String> STRING_COLUMNS = Set.of(
            TransactionRecord.TX_ID, TransactionRecord.RAIL,
            TransactionRecord.TIMESTAMP, TransactionRecord.USER_ID);

    private final CsvMapper csvMapper = new CsvMapper();

    /**
     * Loads and validates a batch.
     *
     * @throws TransactionBatchException if the file is missing or unreadable, a required
     *                                   column is absent, or a row has an unusable required value
     */
    public TransactionBatch load(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new TransactionBatchException("Transactions file not found: " + path);
        }
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            TransactionBatch batch = read(reader, path.toString());
            LOG.infof("Loaded %d transactions from %s", batch.size(), path);
            return batch;
        } catch (IOException e) {
            throw new TransactionBatchException("Failed to read transactions file " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Reads a batch from CSV text.
     *
     * @param source where the text came from, used in messages
     */
    TransactionBatch read(Reader reader, String source) throws IOException {
        List<String[]> rows = new ArrayList<>();
        try (MappingIterator<String[]> iterator = csvMapper
                .readerFor(String[].class)
                .with(CsvParser.Feature.WRAP_AS_ARRAY)
                .with(CsvParser.Feature.SKIP_EMPTY_LINES)
                .readValues(reader)) {
            while (iterator.hasNext()) {
                String[] row = iterator.next();
                if (!isBlankRow(row)) {
                    rows.add(row);
                }
            }
        }

        if (rows.isEmpty()) {
            throw new TransactionBatchException("Transactions file " + source + " has no header row");
        }

        List<String> columns = new ArrayList<>(rows.get(0).length);
        for (String name : rows.get(0)) {
            columns.add(name.trim());
        }

        List<TransactionRecord> records = new ArrayList<>(rows.size() - 1);
        TransactionBatch schemaOnly = new TransactionBatch(columns, List.of());
        schemaOnly.requireColumns(TransactionRecord.REQUIRED_FIELDS, source);

        Set<String> seenIds = new HashSet<>();
        for (int i = 1; i < rows.size(); i++) {
            int line = i + 1;
            TransactionRecord record = toRecord(columns, rows.get(i), line, source);
            if (!seenIds.add(record.getTransactionId())) {
                throw new TransactionBatchException("Duplicate tx_id '" + record.getTransactionId()
                        + "' at line " + line + " of " + source);
            }
            records.add(record);
        }
        return new TransactionBatch(columns, records);
    }

    private TransactionRecord toRecord(List<String> columns, String[] cells, int line, String source) {
        if (cells.length > columns.size()) {
            throw new TransactionBatchException("Line " + line + " of " + source + " has "
                    + cells.length + " cells but the header has " + columns.size());
        }
        Map<String, Object> fields = new LinkedHashMap<>();
        for (int c = 0; c < columns.size(); c++) {
            String column = columns.get(c);
            String cell = c < cells.length ? cells[c] : null;
            fields.put(column, STRING_COLUMNS.contains(column) ? blankToNull(cell) : typeCell(cell));
        }

        requireText(fields, TransactionRecord.TX_ID, line, source);
        requireText(fields, TransactionRecord.RAIL, line, source);
        requireText(fields, TransactionRecord.TIMESTAMP, line, source);
        requireText(fields, TransactionRecord.USER_ID, line, source);

        if (!(fields.get(TransactionRecord.AMOUNT) instanceof Number)) {
            throw new TransactionBatchException("Non-numeric amount '" + fields.get(TransactionRecord.AMOUNT)
                    + "' at line " + line + " of " + source);
        }
        fields.put(TransactionRecord.IS_FRAUD_PATTERN,
                toLabel(fields.get(TransactionRecord.IS_FRAUD_PATTERN), line, source));

        return new TransactionRecord(fields);
    }

    private static void requireText(Map<String, Object> fields, String column, int line, String source) {
        if (fields.get(column) == null) {
            throw new TransactionBatchException("Missing required value '" + column + "' at line "
                    + line + " of " + source);
        }
    }

    private static Boolean toLabel(Object value, int line, String source) {
        if (value instanceof Boolean label) {
            return label;
        }
        if (value instanceof Long number && (number == 0L || number == 1L)) {
            return number == 1L;
        }
        throw new TransactionBatchException("Unparseable is_fraud_pattern '" + value + "' at line "
                + line + " of " + source);
    }

    /**
     * Types one CSV cell.
     *
     * @return null for an empty cell, otherwise a Boolean, Long, Double or String
     */
    static Object typeCell(String cell) {
        String text = blankToNull(cell);
        if (text == null) {
            return null;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        if ("true".equals(lower)) {
            return Boolean.TRUE;
        }
        if ("false".equals(lower)) {
            return Boolean.FALSE;
        }
        if (INTEGRAL.matcher(text).matches()) {
            try {
                return Long.parseLong(text);
            } catch (NumberFormatException e) {
                return Double.parseDouble(text);
            }
        }
        if (DECIMAL.matcher(text).matches()) {
            return Double.parseDouble(text);
        }
        return text;
    }

    private static String blankToNull(String cell) {
        if (cell == null) {
            return null;
        }
        String trimmed = cell.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private static boolean isBlankRow(String[] row) {
        return Arrays.stream(row).allMatch(cell -> cell == null || cell.isBlank());
    }
}
