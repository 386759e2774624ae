package com.sedmap.exception;

/**
 * An external SED fitting process could not be started, timed out or exited
 * with a non-zero status.
 */
public class EngineRunException extends Exception {

    public EngineRunException(String message) {
        super(message);
    }

    public EngineRunException(String message, Throwable cause) {
        super(message, cause);
    }
}
