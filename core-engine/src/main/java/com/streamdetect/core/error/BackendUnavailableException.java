package com.streamdetect.core.error;

import java.util.Collection;

/**
 * Thrown when a detector asks for a scoring backend that is not registered.
 */
public class BackendUnavailableException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public BackendUnavailableException(String backend, Collection<String> available) {
        super("Unknown backend: '" + backend + "'. Supported backends: "
                + String.join(", ", available));
    }
}
