package com.streamdetect.core.model;

import java.util.List;

/**
 * Result of one ingest call on a streaming detector.
 *
 * <p>
 * {@code status}, {@code modelVersion} and the sample counters describe the
 * detector after the last record of the call was processed. Individual
 * results may report an older {@code modelVersion} when a background retrain
 * completed part-way through the batch.
 * </p>
 *
 * @since 1.0.0
 */
public final class IngestResult {

    private final DetectorStatus status;
    private final List<DetectionResult> results;
    private final int modelVersion;
    private final long samplesCollected;
    private final int samplesUntilReady;
    private final Double threshold;
    private final List<String> warnings;
    private final double processingTimeMs;

    public IngestResult(DetectorStatus status,
            List<DetectionResult> results,
            int modelVersion,
            long samplesCollected,
            int samplesUntilReady,
            Double threshold,
            List<String> warnings,
            double processingTimeMs) {
        this.status = status;
        this.results = List.copyOf(results);
        this.modelVersion = modelVersion;
        this.samplesCollected = samplesCollected;
        this.samplesUntilReady = samplesUntilReady;
        this.threshold = threshold;
        this.warnings = List.copyOf(warnings);
        this.processingTimeMs = processingTimeMs;
    }

    public DetectorStatus getStatus() {
        return status;
    }

    public List<DetectionResult> getResults() {
        return results;
    }

    public int getModelVersion() {
        return modelVersion;
    }

    public long getSamplesCollected() {
        return samplesCollected;
    }

    public int getSamplesUntilReady() {
        return samplesUntilReady;
    }

    /**
     * @return operational threshold applied to this call, {@code null} while no
     *         threshold can be resolved (raw scale before the first model)
     */
    public Double getThreshold() {
        return threshold;
    }

    /**
     * @return non-fatal problems surfaced by this call, such as a failed
     *         background retrain; each problem is reported once
     */
    public List<String> getWarnings() {
        return warnings;
    }

    public double getProcessingTimeMs() {
        return processingTimeMs;
    }

    @Override
    public String toString() {
        return "IngestResult{" +
                "status=" + status +
                ", results=" + results.size() +
                ", modelVersion=" + modelVersion +
                ", samplesCollected=" + samplesCollected +
                ", samplesUntilReady=" + samplesUntilReady +
                ", threshold=" + threshold +
                ", warnings=" + warnings +
                '}';
    }
}
