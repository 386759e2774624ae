package com.sedmap.exception;

public class UnsupportedEngineException extends SedMapException {

    public UnsupportedEngineException(String selector) {
        super("SED fitting engine not recognised: " + selector);
    }
}
