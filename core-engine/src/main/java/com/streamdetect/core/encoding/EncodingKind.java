package com.streamdetect.core.encoding;

import com.streamdetect.core.error.SchemaMismatchException;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * How a single record field is turned into numeric columns.
 */
public enum EncodingKind {

    /** Pass-through number. */
    NUMERIC("numeric"),

    /** Stable hash of the string form; no state. */
    HASH("hash"),

    /** Category to integer index; index 0 is reserved for unknown values. */
    LABEL("label"),

    /** One column per category plus a trailing unknown column. */
    ONEHOT("onehot"),

    /** Truthy/falsy value to 1.0/0.0. */
    BINARY("binary"),

    /** Category to its relative frequency in the training sample. */
    FREQUENCY("frequency");

    private final String value;

    EncodingKind(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * Resolve an encoding kind by its configuration name (case-insensitive).
     *
     * @param name configuration name, e.g. {@code "label"}
     * @return the matching kind
     * @throws SchemaMismatchException if the name is unknown
     */
    public static EncodingKind fromName(String name) {
        if (name != null) {
            String normalized = name.trim().toLowerCase(Locale.ROOT);
            for (EncodingKind kind : values()) {
                if (kind.value.equals(normalized)) {
                    return kind;
                }
            }
        }
        throw new SchemaMismatchException("Unknown encoding kind: '" + name + "'. Supported: "
                + Arrays.stream(values()).map(EncodingKind::value).collect(Collectors.joining(", ")));
    }
}
