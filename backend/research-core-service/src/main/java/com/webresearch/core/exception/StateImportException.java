package com.webresearch.core.exception;

/**
 * Persisted engine state could not be read or failed validation
 */
public class StateImportException extends ResearchEngineException {

    public StateImportException(String message) {
        super("STATE_CORRUPTED", message);
    }

    public StateImportException(String message, Throwable cause) {
        super("STATE_CORRUPTED", message, null, cause);
    }
}
