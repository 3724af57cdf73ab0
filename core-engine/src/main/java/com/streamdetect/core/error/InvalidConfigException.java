package com.streamdetect.core.error;

import java.util.List;

/**
 * Thrown when a detector or engine configuration fails validation. Every
 * problem found is listed in the message; values are never clamped.
 */
public class InvalidConfigException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final List<String> errors;

    public InvalidConfigException(String subject, List<String> errors) {
        super("Invalid " + subject + ": " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
