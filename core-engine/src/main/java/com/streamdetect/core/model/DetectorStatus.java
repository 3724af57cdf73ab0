package com.streamdetect.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle status of a streaming detector.
 *
 * <p>
 * Transitions run {@code COLLECTING -> READY -> RETRAINING -> READY -> ...};
 * a reset returns any status to {@link #COLLECTING}.
 * </p>
 */
public enum DetectorStatus {

    /** Cold start: not enough samples for a first model. */
    COLLECTING("collecting"),

    /** A model is active and scoring. */
    READY("ready"),

    /** A model is active while a replacement is being fitted in the background. */
    RETRAINING("retraining");

    private final String value;

    DetectorStatus(String value) {
        this.value = value;
    }

    /**
     * @return wire name of this status
     */
    @JsonValue
    public String value() {
        return value;
    }

    /**
     * @return {@code true} when the detector has an active model
     */
    public boolean isScoring() {
        return this != COLLECTING;
    }
}
