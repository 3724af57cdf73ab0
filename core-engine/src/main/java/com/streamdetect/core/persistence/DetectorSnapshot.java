package com.streamdetect.core.persistence;

import com.fasterxml.jackson.databind.JsonNode;
import com.streamdetect.core.config.DetectorConfig;
import com.streamdetect.core.encoding.EncoderState;
import com.streamdetect.core.normalize.NormalizationState;

import java.time.Instant;

/**
 * Everything needed to bring a trained detector back: backend id, model
 * parameters and calibration, normalization state, encoder schema and
 * dictionaries, configuration and model version.
 *
 * <p>
 * The buffer and the lifecycle counters are not part of a snapshot; a
 * restored detector starts ready with an empty history.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectorSnapshot {

    private String id;
    private String backend;
    private DetectorConfig config;
    private JsonNode modelParameters;
    private double rawThreshold;
    private double contamination;
    private int dimensions;
    private int trainedOn;
    private Instant fittedAt;
    private NormalizationState normalization;
    private EncoderState encoder;
    private int windowSize;
    private int modelVersion;
    private Instant savedAt;

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getBackend() {
        return backend;
    }

    public void setBackend(String backend) {
        this.backend = backend;
    }

    public DetectorConfig getConfig() {
        return config;
    }

    public void setConfig(DetectorConfig config) {
        this.config = config;
    }

    /**
     * @return backend-specific parameters as a JSON tree
     */
    public JsonNode getModelParameters() {
        return modelParameters;
    }

    public void setModelParameters(JsonNode modelParameters) {
        this.modelParameters = modelParameters;
    }

    public double getRawThreshold() {
        return rawThreshold;
    }

    public void setRawThreshold(double rawThreshold) {
        this.rawThreshold = rawThreshold;
    }

    public double getContamination() {
        return contamination;
    }

    public void setContamination(double contamination) {
        this.contamination = contamination;
    }

    public int getDimensions() {
        return dimensions;
    }

    public void setDimensions(int dimensions) {
        this.dimensions = dimensions;
    }

    public int getTrainedOn() {
        return trainedOn;
    }

    public void setTrainedOn(int trainedOn) {
        this.trainedOn = trainedOn;
    }

    public Instant getFittedAt() {
        return fittedAt;
    }

    public void setFittedAt(Instant fittedAt) {
        this.fittedAt = fittedAt;
    }

    public NormalizationState getNormalization() {
        return normalization;
    }

    public void setNormalization(NormalizationState normalization) {
        this.normalization = normalization;
    }

    public EncoderState getEncoder() {
        return encoder;
    }

    public void setEncoder(EncoderState encoder) {
        this.encoder = encoder;
    }

    public int getWindowSize() {
        return windowSize;
    }

    public void setWindowSize(int windowSize) {
        this.windowSize = windowSize;
    }

    public int getModelVersion() {
        return modelVersion;
    }

    public void setModelVersion(int modelVersion) {
        this.modelVersion = modelVersion;
    }

    public Instant getSavedAt() {
        return savedAt;
    }

    public void setSavedAt(Instant savedAt) {
        this.savedAt = savedAt;
    }

    @Override
    public String toString() {
        return "DetectorSnapshot{" +
                "id='" + id + '\'' +
                ", backend='" + backend + '\'' +
                ", modelVersion=" + modelVersion +
                ", dimensions=" + dimensions +
                ", savedAt=" + savedAt +
                '}';
    }
}
