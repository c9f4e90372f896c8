package com.payments.controls.domain;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Monitoring summary for one control that fired at least once.
 *
 * @param hits           number of hits
 * @param hitRate        hits over the whole batch population, rounded to 4 places
 * @param precisionProxy share of hits carrying the synthetic fraud label, rounded to 4 places.
 *                       A label correlation, not a real-world precision.
 */
public record ControlMetric(
        String controlId,
        long hits,
        double hitRate,
        double precisionProxy
) {

    public static final List<String> COLUMNS =
            List.of("control_id", "hits", "hit_rate", "precision_proxy");

    public Map<String, Object> toRow() {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("control_id", controlId);
        row.put("hits", hits);
        row.put("hit_rate", hitRate);
        row.put("precision_proxy", precisionProxy);
        return row;
    }
}
