package com.payments.controls.output;

import com.payments.controls.engine.ControlsEngineException;

/**
 * An output table could not be written. No output table is replaced when this is raised.
 */
public class OutputWriteException extends ControlsEngineException {

    public OutputWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
