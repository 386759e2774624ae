package com.sedmap.exception;

/** Bad constructor or option argument (missing field, out of bounds value). */
public class ConfigurationException extends SedMapException {

    public ConfigurationException(String message) {
        super(message);
    }
}
