package com.payments.controls.domain;

import com.payments.controls.engine.ControlsEngineException;

/**
 * Fatal problem with the transaction batch: a missing file, a missing required column,
 * or a row without a usable required value. Raised before any control is evaluated.
 */
public class TransactionBatchException extends ControlsEngineException {

    public TransactionBatchException(String message) {
        super(message);
    }

    public TransactionBatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
