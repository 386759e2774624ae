package com.sedmap.exception;

/**
 * Base class of the errors raised by the pipeline. They are thrown as soon as
 * an inconsistent input is detected and are never retried.
 */
public class SedMapException extends RuntimeException {

    public SedMapException(String message) {
        super(message);
    }

    public SedMapException(String message, Throwable cause) {
        super(message, cause);
    }
}
