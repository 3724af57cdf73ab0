package com.streamdetect.core.buffer;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Statistic computed over a rolling window of a numeric column.
 */
public enum RollingStat {

    MEAN("mean"),
    /** Sample standard deviation (n - 1). */
    STD("std"),
    MIN("min"),
    MAX("max");

    private final String value;

    RollingStat(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * @param name configuration name, case-insensitive
     * @return the matching statistic
     * @throws IllegalArgumentException if the name is unknown
     */
    public static RollingStat fromName(String name) {
        if (name != null) {
            String normalized = name.trim().toLowerCase(Locale.ROOT);
            for (RollingStat stat : values()) {
                if (stat.value.equals(normalized)) {
                    return stat;
                }
            }
        }
        throw new IllegalArgumentException("Unknown rolling statistic: '" + name + "'. Supported: "
                + Arrays.stream(values()).map(RollingStat::value).collect(Collectors.joining(", ")));
    }
}
