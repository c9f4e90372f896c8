package com.payments.controls.output;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * One table to write: destination, column order and rows keyed by column name.
 */
public record OutputTable(Path target, List<String> columns, List<Map<String, Object>> rows) {

    public OutputTable {
        columns = List.copyOf(columns);
        rows = List.copyOf(rows);
    }
}
