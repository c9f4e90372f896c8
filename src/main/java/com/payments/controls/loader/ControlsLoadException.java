package com.payments.controls.loader;

import com.payments.controls.engine.ControlsEngineException;

/**
 * Fatal problem with the control set: a missing or unreadable file, a malformed document,
 * or a control that cannot be resolved.
 */
public class ControlsLoadException extends ControlsEngineException {

    public ControlsLoadException(String message) {
        super(message);
    }

    public ControlsLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
