package com.payments.controls.output;

import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvGenerator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.Writer;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes output tables as CSV with a header row.
 * <p>
 * All tables of a run are written to temporary files next to their targets first and
 * only moved into place once every table has been written. Existing targets are copied
 * aside before the moves and restored if a later move fails, so a failed run leaves the
 * previous outputs untouched.
 */
@ApplicationScoped
public class CsvTableWriter {

    private static final Logger LOG = Logger.getLogger(CsvTableWriter.class);

    private static final String TEMP_SUFFIX = ".tmp";

    private static final String BACKUP_SUFFIX = ".bak";

    private final CsvMapper csvMapper = new CsvMapper();

    /**
     * Writes every table, replacing existing files.
     *
     * @throws OutputWriteException if any table cannot be written
     */
    public void writeAll(List<OutputTable> tables) {
        List<Path> staged = new ArrayList<>(tables.size());
        try {
            for (OutputTable table : tables) {
                staged.add(stage(table));
            }
        } catch (IOException e) {
            discard(staged);
            throw new OutputWriteException("Failed to write output tables: " + e.getMessage(), e);
        }
        commit(tables, staged);
        for (OutputTable table : tables) {
            LOG.debugf("Wrote %d rows to %s", table.rows().size(), table.target());
        }
    }

    private Path stage(OutputTable table) throws IOException {
        Path target = table.target().toAbsolutePath();
        Path directory = target.getParent();
        if (directory != null) {
            Files.createDirectories(directory);
        }
        Path temp = Files.createTempFile(directory, target.getFileName().toString(), TEMP_SUFFIX);
        try (Writer writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
            write(table, writer);
        } catch (IOException e) {
            Files.deleteIfExists(temp);
            throw e;
        }
        return temp;
    }

    /**
     * Writes one table. The header row is written even when the table has no rows.
     */
    void write(OutputTable table, Writer writer) throws IOException {
        CsvSchema.Builder builder = CsvSchema.builder();
        for (String column : table.columns()) {
            builder.addColumn(column);
        }
        CsvSchema schema = builder.build().withoutHeader();

        try (SequenceWriter rows = csvMapper.writer(schema)
                .with(CsvGenerator.Feature.STRICT_CHECK_FOR_QUOTING)
                .writeValues(writer)) {
            Map<String, Object> header = new LinkedHashMap<>();
            for (String column : table.columns()) {
                header.put(column, column);
            }
            rows.write(header);
            for (Map<String, Object> row : table.rows()) {
                rows.write(formatRow(table.columns(), row));
            }
        }
    }

    private static Map<String, Object> formatRow(List<String> columns, Map<String, Object> row) {
        Map<String, Object> formatted = new LinkedHashMap<>();
        for (String column : columns) {
            formatted.put(column, formatValue(row.get(column)));
        }
        return formatted;
    }

    /**
     * Renders a cell. Missing values are empty cells; doubles are written in plain
     * notation with at least one decimal place.
     */
    static String formatValue(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Double number) {
            if (number.isNaN() || number.isInfinite()) {
                return "";
            }
            String plain = BigDecimal.valueOf(number).stripTrailingZeros().toPlainString();
            return plain.indexOf('.') >= 0 ? plain : plain + ".0";
        }
        if (value instanceof Boolean flag) {
            return flag ? "True" : "False";
        }
        return String.valueOf(value);
    }

    /**
     * Moves staged files onto their targets. If any move fails, targets already replaced
     * are restored from their backups and targets that did not exist are removed again.
     */
    private void commit(List<OutputTable> tables, List<Path> staged) {
        List<Path> backups = new ArrayList<>(tables.size());
        int moved = 0;
        try {
            for (OutputTable table : tables) {
                backups.add(backup(table.target().toAbsolutePath()));
            }
            for (; moved < tables.size(); moved++) {
                moveIntoPlace(staged.get(moved), tables.get(moved).target().toAbsolutePath());
            }
        } catch (IOException e) {
            rollback(tables, backups, moved);
            discard(staged);
            discard(backups);
            throw new OutputWriteException("Failed to write output tables: " + e.getMessage(), e);
        }
        discard(backups);
    }

    private static Path backup(Path target) throws IOException {
        if (!Files.isRegularFile(target)) {
            return null;
        }
        Path backup = Files.createTempFile(target.getParent(), target.getFileName().toString(), BACKUP_SUFFIX);
        Files.copy(target, backup, StandardCopyOption.REPLACE_EXISTING);
        return backup;
    }

    private static void rollback(List<OutputTable> tables, List<Path> backups, int moved) {
        for (int i = 0; i < moved; i++) {
            Path target = tables.get(i).target().toAbsolutePath();
            Path backup = i < backups.size() ? backups.get(i) : null;
            try {
                if (backup != null) {
                    moveIntoPlace(backup, target);
                } else {
                    Files.deleteIfExists(target);
                }
            } catch (IOException e) {
                LOG.errorf("Could not restore previous output %s: %s", target, e.getMessage());
            }
        }
    }

    private static void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            LOG.debugf("Atomic move not supported for %s, replacing in place", target);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void discard(List<Path> staged) {
        for (Path temp : staged) {
            if (temp == null) {
                continue;
            }
            try {
                Files.deleteIfExists(temp);
            } catch (IOException e) {
                LOG.warnf("Could not delete temporary file %s: %s", temp, e.getMessage());
            }
        }
    }
}
