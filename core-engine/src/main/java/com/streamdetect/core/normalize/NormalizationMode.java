package com.streamdetect.core.normalize;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Scale on which normalized scores are reported.
 */
public enum NormalizationMode {

    /** Robust sigmoid of the median/IQR-scaled raw score, in (0, 1). */
    STANDARDIZATION("standardization", 0.5),

    /** Standard score against the training raw scores. */
    ZSCORE("zscore", 2.0),

    /** Raw backend score, unchanged. */
    RAW("raw", Double.NaN);

    private final String value;
    private final double defaultThreshold;

    NormalizationMode(String value, double defaultThreshold) {
        this.value = value;
        this.defaultThreshold = defaultThreshold;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * @return the operational threshold used when none is configured;
     *         {@code NaN} for {@link #RAW}, whose default comes from the model
     */
    public double defaultThreshold() {
        return defaultThreshold;
    }

    /**
     * @param name configuration name, case-insensitive
     * @return the matching mode
     * @throws IllegalArgumentException if the name is unknown
     */
    @JsonCreator
    public static NormalizationMode fromName(String name) {
        if (name != null) {
            String normalized = name.trim().toLowerCase(Locale.ROOT);
            for (NormalizationMode mode : values()) {
                if (mode.value.equals(normalized)) {
                    return mode;
                }
            }
        }
        throw new IllegalArgumentException("Unknown normalization: '" + name + "'. Supported: "
                + Arrays.stream(values()).map(NormalizationMode::value).collect(Collectors.joining(", ")));
    }
}
