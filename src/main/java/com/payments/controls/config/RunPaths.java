package com.payments.controls.config;

import java.nio.file.Path;

/**
 * Resolved input and output locations for one run.
 */
public record RunPaths(
        Path transactionsFile,
        Path controlsFile,
        Path decisionsFile,
        Path hitsFile,
        Path metricsFile
) {}
