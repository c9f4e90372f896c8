package com.payments.controls;

import com.payments.controls.engine.ControlsEngineException;
import com.payments.controls.service.ControlsRunService;
import io.quarkus.runtime.Quarkus;
import io.quarkus.runtime.QuarkusApplication;
import io.quarkus.runtime.annotations.QuarkusMain;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

/**
 * Command-line entry point. Runs the controls once against the configured paths and exits.
 * <p>
 * Exit code 0 on success, 1 on a fatal error. A failed run writes no output.
 */
@QuarkusMain
public class ControlsEngineApplication implements QuarkusApplication {

    private static final Logger LOG = Logger.getLogger(ControlsEngineApplication.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;

    @Inject
    ControlsRunService controlsRunService;

    public static void main(String[] args) {
        Quarkus.run(ControlsEngineApplication.class, args);
    }

    @Override
    public int run(String... args) {
        LOG.info("Payment Controls Engine starting...");
        try {
            controlsRunService.run();
            return EXIT_OK;
        } catch (ControlsEngineException e) {
            LOG.errorf("Controls run failed: %s", e.getMessage());
            return EXIT_FAILURE;
        }
    }
}
