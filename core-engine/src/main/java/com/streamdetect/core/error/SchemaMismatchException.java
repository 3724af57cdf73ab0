package com.streamdetect.core.error;

/**
 * Thrown when a record does not match a detector's schema, or a schema names
 * an encoding kind that does not exist.
 */
public class SchemaMismatchException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public SchemaMismatchException(String message) {
        super(message);
    }
}
