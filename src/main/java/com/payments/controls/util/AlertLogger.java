package com.payments.controls.util;

import org.jboss.logging.Logger;

import java.util.HashMap;
import java.util.Map;

/**
 * Utility for sending structured alerts to monitoring systems.
 * <p>
 * Every alert is a single line prefixed with {@code ALERT:} so log aggregators can
 * pick it up; the structured payload is logged at debug level.
 */
public final class AlertLogger {

    private AlertLogger() {}

    private static final Logger LOG = Logger.getLogger(AlertLogger.class);

    public static void loadFailed(String component, String source, String error) {
        Map<String, Object> alertData = new HashMap<>();
        alertData.put("alert_type", "LOAD_FAILURE");
        alertData.put("severity", "CRITICAL");
        alertData.put("component", component);
        alertData.put("source", source);
        alertData.put("error", error);

        LOG.errorf("ALERT: Failed to load %s from %s. Error: %s", component, source, error);
        LOG.debugf("Alert details: %s", alertData);
    }

    public static void duplicateControlId(String controlId, String source) {
        Map<String, Object> alertData = new HashMap<>();
        alertData.put("alert_type", "DUPLICATE_CONTROL_ID");
        alertData.put("severity", "WARNING");
        alertData.put("control_id", controlId);
        alertData.put("source", source);

        LOG.warnf("ALERT: Control id %s is declared more than once in %s. Metrics for it are merged.",
                controlId, source);
        LOG.debugf("Alert details: %s", alertData);
    }

    public static void noisyControl(String controlId, double hitRate, double threshold) {
        Map<String, Object> alertData = new HashMap<>();
        alertData.put("alert_type", "NOISY_CONTROL");
        alertData.put("severity", "WARNING");
        alertData.put("control_id", controlId);
        alertData.put("hit_rate", hitRate);
        alertData.put("threshold", threshold);

        LOG.warnf("ALERT: Control %s hit %.4f of the batch, above the %.4f threshold",
                controlId, hitRate, threshold);
        LOG.debugf("Alert details: %s", alertData);
    }

    public static void silentControl(String controlId, String rail) {
        Map<String, Object> alertData = new HashMap<>();
        alertData.put("alert_type", "SILENT_CONTROL");
        alertData.put("severity", "INFO");
        alertData.put("control_id", controlId);
        alertData.put("rail", rail);

        LOG.infof("ALERT: Control %s on %s produced no hits", controlId, rail);
        LOG.debugf("Alert details: %s", alertData);
    }
}
