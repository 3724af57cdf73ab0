package com.streamdetect.core.error;

/**
 * Wraps a failure raised while fitting a model for a detector.
 */
public class FitFailedException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    public FitFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
