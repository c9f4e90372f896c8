package com.payments.controls.config;

import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.nio.file.Path;

/**
 * File locations for a controls run.
 * <p>
 * The transactions file and the three output tables live in the data directory;
 * the controls file path is independent of it.
 */
@ApplicationScoped
public class EngineConfig {

    @ConfigProperty(name = "app.controls.path", defaultValue = "controls/controls.yaml")
    String controlsPath;

    @ConfigProperty(name = "app.data.dir", defaultValue = "data")
    String dataDir;

    @ConfigProperty(name = "app.data.transactions-file", defaultValue = "combined_transactions.csv")
    String transactionsFile;

    @ConfigProperty(name = "app.output.decisions-file", defaultValue = "control_decisions.csv")
    String decisionsFile;

    @ConfigProperty(name = "app.output.hits-file", defaultValue = "control_hits.csv")
    String hitsFile;

    @ConfigProperty(name = "app.output.metrics-file", defaultValue = "control_metrics.csv")
    String metricsFile;

    /**
     * Resolves the configured names against the data directory.
     */
    public RunPaths runPaths() {
        Path data = Path.of(dataDir);
        return new RunPaths(
                data.resolve(transactionsFile),
                Path.of(controlsPath),
                data.resolve(decisionsFile),
                data.resolve(hitsFile),
                data.resolve(metricsFile)
        );
    }
}
