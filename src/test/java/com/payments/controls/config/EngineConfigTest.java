package com.payments.controls.config;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class EngineConfigTest {

    private static EngineConfig config(String dataDir) {
        EngineConfig config = new EngineConfig();
        config.controlsPath = "controls/controls.yaml";
        config.dataDir = dataDir;
        config.transactionsFile = "combined_transactions.csv";
        config.decisionsFile = "control_decisions.csv";
        config.hitsFile = "control_hits.csv";
        config.metricsFile = "control_metrics.csv";
        return config;
    }

    @Test
    void resolvesTablesAgainstDataDirectory() {
        RunPaths paths = config("data").runPaths();

        assertThat(paths.transactionsFile()).isEqualTo(Path.of("data", "combined_transactions.csv"));
        assertThat(paths.decisionsFile()).isEqualTo(Path.of("data", "control_decisions.csv"));
        assertThat(paths.hitsFile()).isEqualTo(Path.of("data", "control_hits.csv"));
        assertThat(paths.metricsFile()).isEqualTo(Path.of("data", "control_metrics.csv"));
    }

    @Test
    void controlsPathIsIndependentOfDataDirectory() {
        RunPaths paths = config("/var/run/controls-data").runPaths();

        assertThat(paths.controlsFile()).isEqualTo(Path.of("controls", "controls.yaml"));
        assertThat(paths.transactionsFile()).isEqualTo(Path.of("/var/run/controls-data", "combined_transactions.csv"));
    }
}
