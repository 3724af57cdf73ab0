package com.streamdetect.core.model;

import java.time.Instant;

/**
 * Point-in-time statistics of one streaming detector, as exposed by the
 * management operations.
 *
 * @since 1.0.0
 */
public final class DetectorStats {

    private final String id;
    private final String backend;
    private final DetectorStatus status;
    private final int modelVersion;
    private final long samplesCollected;
    private final int bufferSize;
    private final long totalProcessed;
    private final int samplesSinceRetrain;
    private final int samplesUntilReady;
    private final int minSamples;
    private final int retrainInterval;
    private final int windowSize;
    private final Double threshold;
    private final String normalization;
    private final long failedRetrains;
    private final Instant createdAt;
    private final Instant lastTrainedAt;

    private DetectorStats(Builder b) {
        this.id = b.id;
        this.backend = b.backend;
        this.status = b.status;
        this.modelVersion = b.modelVersion;
        this.samplesCollected = b.samplesCollected;
        this.bufferSize = b.bufferSize;
        this.totalProcessed = b.totalProcessed;
        this.samplesSinceRetrain = b.samplesSinceRetrain;
        this.samplesUntilReady = b.samplesUntilReady;
        this.minSamples = b.minSamples;
        this.retrainInterval = b.retrainInterval;
        this.windowSize = b.windowSize;
        this.threshold = b.threshold;
        this.normalization = b.normalization;
        this.failedRetrains = b.failedRetrains;
        this.createdAt = b.createdAt;
        this.lastTrainedAt = b.lastTrainedAt;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String backend;
        private DetectorStatus status;
        private int modelVersion;
        private long samplesCollected;
        private int bufferSize;
        private long totalProcessed;
        private int samplesSinceRetrain;
        private int samplesUntilReady;
        private int minSamples;
        private int retrainInterval;
        private int windowSize;
        private Double threshold;
        private String normalization;
        private long failedRetrains;
        private Instant createdAt;
        private Instant lastTrainedAt;

        public Builder id(String v) {
            this.id = v;
            return this;
        }

        public Builder backend(String v) {
            this.backend = v;
            return this;
        }

        public Builder status(DetectorStatus v) {
            this.status = v;
            return this;
        }

        public Builder modelVersion(int v) {
            this.modelVersion = v;
            return this;
        }

        public Builder samplesCollected(long v) {
            this.samplesCollected = v;
            return this;
        }

        public Builder bufferSize(int v) {
            this.bufferSize = v;
            return this;
        }

        public Builder totalProcessed(long v) {
            this.totalProcessed = v;
            return this;
        }

        public Builder samplesSinceRetrain(int v) {
            this.samplesSinceRetrain = v;
            return this;
        }

        public Builder samplesUntilReady(int v) {
            this.samplesUntilReady = v;
            return this;
        }

        public Builder minSamples(int v) {
            this.minSamples = v;
            return this;
        }

        public Builder retrainInterval(int v) {
            this.retrainInterval = v;
            return this;
        }

        public Builder windowSize(int v) {
            this.windowSize = v;
            return this;
        }

        public Builder threshold(Double v) {
            this.threshold = v;
            return this;
        }

        public Builder normalization(String v) {
            this.normalization = v;
            return this;
        }

        public Builder failedRetrains(long v) {
            this.failedRetrains = v;
            return this;
        }

        public Builder createdAt(Instant v) {
            this.createdAt = v;
            return this;
        }

        public Builder lastTrainedAt(Instant v) {
            this.lastTrainedAt = v;
            return this;
        }

        public DetectorStats build() {
            return new DetectorStats(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getId() {
        return id;
    }

    public String getBackend() {
        return backend;
    }

    public DetectorStatus getStatus() {
        return status;
    }

    public int getModelVersion() {
        return modelVersion;
    }

    /**
     * @return samples ingested since creation or the last reset
     */
    public long getSamplesCollected() {
        return samplesCollected;
    }

    public int getBufferSize() {
        return bufferSize;
    }

    /**
     * @return records offered to the detector, including rejected ones
     */
    public long getTotalProcessed() {
        return totalProcessed;
    }

    public int getSamplesSinceRetrain() {
        return samplesSinceRetrain;
    }

    public int getSamplesUntilReady() {
        return samplesUntilReady;
    }

    public int getMinSamples() {
        return minSamples;
    }

    public int getRetrainInterval() {
        return retrainInterval;
    }

    public int getWindowSize() {
        return windowSize;
    }

    public Double getThreshold() {
        return threshold;
    }

    public String getNormalization() {
        return normalization;
    }

    public long getFailedRetrains() {
        return failedRetrains;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getLastTrainedAt() {
        return lastTrainedAt;
    }

    public boolean isReady() {
        return status != null && status.isScoring();
    }

    @Override
    public String toString() {
        return "DetectorStats{" +
                "id='" + id + '\'' +
                ", backend='" + backend + '\'' +
                ", status=" + status +
                ", modelVersion=" + modelVersion +
                ", samplesCollected=" + samplesCollected +
                ", bufferSize=" + bufferSize +
                ", samplesSinceRetrain=" + samplesSinceRetrain +
                '}';
    }
}
