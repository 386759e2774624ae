package com.sedmap.exception;

import com.sedmap.model.Shape;

public class ShapeMismatchException extends SedMapException {

    public ShapeMismatchException(String message) {
        super(message);
    }

    public ShapeMismatchException(Shape first, Shape second, String context) {
        super(String.format("Array 1 has shape %s but array 2 has shape %s%s", first, second,
                context == null || context.isEmpty() ? "" : " " + context));
    }
}
