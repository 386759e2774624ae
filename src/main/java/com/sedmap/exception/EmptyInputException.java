package com.sedmap.exception;

public class EmptyInputException extends SedMapException {

    public EmptyInputException(String message) {
        super(message);
    }
}
