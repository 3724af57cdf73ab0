package com.streamdetect.core.error;

/**
 * Thrown when creating a detector under an id that is already registered.
 */
public class DetectorAlreadyExistsException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    public DetectorAlreadyExistsException(String id) {
        super("Detector already exists: '" + id + "'");
    }
}
