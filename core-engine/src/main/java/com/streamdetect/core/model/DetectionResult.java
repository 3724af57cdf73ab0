package com.streamdetect.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Objects;

/**
 * Outcome of ingesting a single record.
 *
 * <p>
 * During cold start the score fields are {@code null} and
 * {@code samplesUntilReady} counts down to the first fit. Once a model is
 * active every result carries the version of the model that actually produced
 * its score, so a batch that straddles a model swap reports each record
 * accurately.
 * </p>
 *
 * <p>
 * A record rejected by schema validation carries an {@code error} message and
 * no scores; it was not appended to the buffer.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectionResult {

    private final int index;
    private final Double rawScore;
    private final Double normalizedScore;
    private final Boolean anomaly;
    private final int samplesUntilReady;
    private final int modelVersion;
    private final String error;

    private DetectionResult(Builder builder) {
        this.index = builder.index;
        this.rawScore = builder.rawScore;
        this.normalizedScore = builder.normalizedScore;
        this.anomaly = builder.anomaly;
        this.samplesUntilReady = builder.samplesUntilReady;
        this.modelVersion = builder.modelVersion;
        this.error = builder.error;
    }

    /**
     * Create a new {@link Builder}.
     *
     * @return builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link DetectionResult} instances.
     */
    public static class Builder {
        private int index;
        private Double rawScore;
        private Double normalizedScore;
        private Boolean anomaly;
        private int samplesUntilReady;
        private int modelVersion;
        private String error;

        public Builder index(int index) {
            this.index = index;
            return this;
        }

        public Builder rawScore(Double rawScore) {
            this.rawScore = rawScore;
            return this;
        }

        public Builder normalizedScore(Double normalizedScore) {
            this.normalizedScore = normalizedScore;
            return this;
        }

        public Builder anomaly(Boolean anomaly) {
            this.anomaly = anomaly;
            return this;
        }

        public Builder samplesUntilReady(int samplesUntilReady) {
            this.samplesUntilReady = samplesUntilReady;
            return this;
        }

        public Builder modelVersion(int modelVersion) {
            this.modelVersion = modelVersion;
            return this;
        }

        public Builder error(String error) {
            this.error = error;
            return this;
        }

        public DetectionResult build() {
            return new DetectionResult(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    /**
     * @return position of the record within the ingested batch
     */
    public int getIndex() {
        return index;
    }

    /**
     * @return backend-native score, {@code null} during cold start
     */
    public Double getRawScore() {
        return rawScore;
    }

    /**
     * @return score on the detector's normalization scale, {@code null} during
     *         cold start
     */
    public Double getNormalizedScore() {
        return normalizedScore;
    }

    /**
     * @return whether the record is anomalous, {@code null} during cold start
     */
    public Boolean getIsAnomaly() {
        return anomaly;
    }

    public int getSamplesUntilReady() {
        return samplesUntilReady;
    }

    /**
     * @return version of the model that scored this record, 0 when unscored
     */
    public int getModelVersion() {
        return modelVersion;
    }

    public String getError() {
        return error;
    }

    @JsonIgnore
    public boolean isScored() {
        return normalizedScore != null;
    }

    @JsonIgnore
    public boolean isRejected() {
        return error != null;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DetectionResult that))
            return false;
        return index == that.index
                && samplesUntilReady == that.samplesUntilReady
                && modelVersion == that.modelVersion
                && Objects.equals(rawScore, that.rawScore)
                && Objects.equals(normalizedScore, that.normalizedScore)
                && Objects.equals(anomaly, that.anomaly)
                && Objects.equals(error, that.error);
    }

    @Override
    public int hashCode() {
        return Objects.hash(index, rawScore, normalizedScore, anomaly, samplesUntilReady,
                modelVersion, error);
    }

    @Override
    public String toString() {
        return "DetectionResult{" +
                "index=" + index +
                ", rawScore=" + rawScore +
                ", normalizedScore=" + normalizedScore +
                ", isAnomaly=" + anomaly +
                ", samplesUntilReady=" + samplesUntilReady +
                ", modelVersion=" + modelVersion +
                (error != null ? ", error='" + error + '\'' : "") +
                '}';
    }
}
