package com.streamdetect.core.error;

/**
 * Thrown by a scoring backend asked to fit on fewer vectors than it needs.
 */
public class InsufficientDataException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    private final int available;
    private final int required;

    public InsufficientDataException(String backend, int available, int required) {
        super("Backend '" + backend + "' needs at least " + required
                + " samples to fit, got: " + available);
        this.available = available;
        this.required = required;
    }

    public int getAvailable() {
        return available;
    }

    public int getRequired() {
        return required;
    }
}
