package com.payments.controls.engine;

/**
 * Base class for fatal engine errors. A run that raises one produces no output.
 */
public class ControlsEngineException extends RuntimeException {

    public ControlsEngineException(String message) {
        super(message);
    }

    public ControlsEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
