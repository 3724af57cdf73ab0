package com.streamdetect.service;

import com.streamdetect.core.model.DetectorStats;
import com.streamdetect.core.model.DetectorStatus;

/**
 * One line of the detector listing.
 */
public class DetectorSummary {

    private final String id;
    private final String backend;
    private final DetectorStatus status;
    private final int modelVersion;
    private final long samplesCollected;
    private final long totalProcessed;

    DetectorSummary(DetectorStats stats) {
        this.id = stats.getId();
        this.backend = stats.getBackend();
        this.status = stats.getStatus();
        this.modelVersion = stats.getModelVersion();
        this.samplesCollected = stats.getSamplesCollected();
        this.totalProcessed = stats.getTotalProcessed();
    }

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

    public long getSamplesCollected() {
        return samplesCollected;
    }

    public long getTotalProcessed() {
        return totalProcessed;
    }

    @Override
    public String toString() {
        return "DetectorSummary{id='" + id + "', backend='" + backend + "', status=" + status
                + ", modelVersion=" + modelVersion + '}';
    }
}
