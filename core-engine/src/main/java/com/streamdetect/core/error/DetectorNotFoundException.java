package com.streamdetect.core.error;

/**
 * Thrown when a management operation names a detector that is not registered.
 */
public class DetectorNotFoundException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public DetectorNotFoundException(String id) {
        super("Detector not found: '" + id + "'");
    }
}
