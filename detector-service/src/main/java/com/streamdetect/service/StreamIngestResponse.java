package com.streamdetect.service;

import com.streamdetect.core.model.DetectionResult;
import com.streamdetect.core.model.DetectorStatus;
import com.streamdetect.core.model.IngestResult;

import java.util.List;

/**
 * Logical stream-ingest response: the per-record results plus the detector
 * state after the call.
 */
public class StreamIngestResponse {

    private final String model;
    private final DetectorStatus status;
    private final List<DetectionResult> results;
    private final int modelVersion;
    private final long samplesCollected;
    private final int samplesUntilReady;
    private final Double threshold;
    private final List<String> warnings;
    private final double processingTimeMs;

    StreamIngestResponse(String model, IngestResult result) {
        this.model = model;
        this.status = result.getStatus();
        this.results = result.getResults();
        this.modelVersion = result.getModelVersion();
        this.samplesCollected = result.getSamplesCollected();
        this.samplesUntilReady = result.getSamplesUntilReady();
        this.threshold = result.getThreshold();
        this.warnings = result.getWarnings();
        this.processingTimeMs = result.getProcessingTimeMs();
    }

    public String getModel() {
        return model;
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

    public Double getThreshold() {
        return threshold;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    public double getProcessingTimeMs() {
        return processingTimeMs;
    }

    @Override
    public String toString() {
        return "StreamIngestResponse{model='" + model + "', status=" + status
                + ", results=" + results.size() + ", modelVersion=" + modelVersion + '}';
    }
}
