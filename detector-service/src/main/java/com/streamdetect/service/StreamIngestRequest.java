package com.streamdetect.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.streamdetect.core.config.DetectorConfig;

import java.util.List;
import java.util.Map;

/**
 * Logical stream-ingest request.
 *
 * <pre>
 * {
 *   "model": "payments",
 *   "data": [{"amount": 12.5, "country": "DE"}, ...],
 *   "backend": "ecod",
 *   "min_samples": 50,
 *   "retrain_interval": 100,
 *   "window_size": 1000,
 *   "threshold": 0.5,
 *   "contamination": 0.1,
 *   "normalization": "standardization",
 *   "rolling_windows": [5, 20],
 *   "lag_periods": [1],
 *   "schema": {"amount": "numeric", "country": "label"}
 * }
 * </pre>
 *
 * <p>
 * {@code data} is a record, a list of records, a list of numbers (one
 * positional record) or a list of number lists. Every setting except
 * {@code model} and {@code data} is optional; the detector settings are only
 * used when the call creates the detector, while {@code threshold} also
 * applies to the scores of this call.
 * </p>
 */
public class StreamIngestRequest {

    private String model;
    private JsonNode data;
    private String backend;
    private Integer minSamples;
    private Integer retrainInterval;
    private Integer windowSize;
    private Double threshold;
    private Double contamination;
    private String normalization;
    private List<Integer> rollingWindows;
    private List<String> rollingStats;
    private List<Integer> lagPeriods;
    private Map<String, String> schema;

    /**
     * @return detector configuration with defaults for every setting the
     *         request leaves out
     */
    public DetectorConfig toDetectorConfig() {
        DetectorConfig config = new DetectorConfig();
        if (backend != null) {
            config.setBackend(backend);
        }
        if (minSamples != null) {
            config.setMinSamples(minSamples);
        }
        if (retrainInterval != null) {
            config.setRetrainInterval(retrainInterval);
        }
        if (windowSize != null) {
            config.setWindowSize(windowSize);
        }
        if (contamination != null) {
            config.setContamination(contamination);
        }
        if (normalization != null) {
            config.setNormalization(normalization);
        }
        config.setThreshold(threshold);
        config.setRollingWindows(rollingWindows);
        config.setRollingStats(rollingStats);
        config.setLagPeriods(lagPeriods);
        config.setSchema(schema);
        return config;
    }

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public JsonNode getData() {
        return data;
    }

    public void setData(JsonNode data) {
        this.data = data;
    }

    public String getBackend() {
        return backend;
    }

    public void setBackend(String backend) {
        this.backend = backend;
    }

    public Integer getMinSamples() {
        return minSamples;
    }

    public void setMinSamples(Integer minSamples) {
        this.minSamples = minSamples;
    }

    public Integer getRetrainInterval() {
        return retrainInterval;
    }

    public void setRetrainInterval(Integer retrainInterval) {
        this.retrainInterval = retrainInterval;
    }

    public Integer getWindowSize() {
        return windowSize;
    }

    public void setWindowSize(Integer windowSize) {
        this.windowSize = windowSize;
    }

    public Double getThreshold() {
        return threshold;
    }

    public void setThreshold(Double threshold) {
        this.threshold = threshold;
    }

    public Double getContamination() {
        return contamination;
    }

    public void setContamination(Double contamination) {
        this.contamination = contamination;
    }

    public String getNormalization() {
        return normalization;
    }

    public void setNormalization(String normalization) {
        this.normalization = normalization;
    }

    public List<Integer> getRollingWindows() {
        return rollingWindows;
    }

    public void setRollingWindows(List<Integer> rollingWindows) {
        this.rollingWindows = rollingWindows;
    }

    public List<String> getRollingStats() {
        return rollingStats;
    }

    public void setRollingStats(List<String> rollingStats) {
        this.rollingStats = rollingStats;
    }

    public List<Integer> getLagPeriods() {
        return lagPeriods;
    }

    public void setLagPeriods(List<Integer> lagPeriods) {
        this.lagPeriods = lagPeriods;
    }

    public Map<String, String> getSchema() {
        return schema;
    }

    public void setSchema(Map<String, String> schema) {
        this.schema = schema;
    }

    @Override
    public String toString() {
        return "StreamIngestRequest{model='" + model + "', backend='" + backend + "'}";
    }
}
