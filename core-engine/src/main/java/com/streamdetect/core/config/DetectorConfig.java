package com.streamdetect.core.config;

import com.streamdetect.core.backend.AbstractBackendAdapter;
import com.streamdetect.core.backend.BackendRegistry;
import com.streamdetect.core.buffer.FeatureSpec;
import com.streamdetect.core.buffer.RollingStat;
import com.streamdetect.core.encoding.EncodingKind;
import com.streamdetect.core.error.InvalidConfigException;
import com.streamdetect.core.error.SchemaMismatchException;
import com.streamdetect.core.normalize.NormalizationMode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Configuration of one streaming detector.
 *
 * <p>
 * Plain JavaBean so that it can be populated by SnakeYAML (engine
 * configuration files), by the service layer from an ingest request, and by
 * Jackson when a persisted detector is restored. Call {@link #validate()}
 * before use: every problem is reported in one
 * {@link InvalidConfigException}, and no value is ever clamped into range.
 * </p>
 *
 * <h3>Defaults</h3>
 * <ul>
 * <li>{@code backend}: {@code ecod}</li>
 * <li>{@code minSamples}: 50, {@code retrainInterval}: 100,
 * {@code windowSize}: 1000</li>
 * <li>{@code threshold}: unset (the normalization mode's default)</li>
 * <li>{@code contamination}: 0.1, {@code normalization}:
 * {@code standardization}</li>
 * <li>no rolling windows or lag periods; all four rolling statistics</li>
 * <li>no declared schema (inferred at the first fit)</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class DetectorConfig {

    public static final int DEFAULT_MIN_SAMPLES = 50;
    public static final int DEFAULT_RETRAIN_INTERVAL = 100;
    public static final int DEFAULT_WINDOW_SIZE = 1000;
    public static final double DEFAULT_CONTAMINATION = 0.1;

    private String backend = BackendRegistry.DEFAULT_BACKEND;
    private int minSamples = DEFAULT_MIN_SAMPLES;
    private int retrainInterval = DEFAULT_RETRAIN_INTERVAL;
    private int windowSize = DEFAULT_WINDOW_SIZE;
    private Double threshold;
    private double contamination = DEFAULT_CONTAMINATION;
    private String normalization = NormalizationMode.STANDARDIZATION.value();
    private List<Integer> rollingWindows = new ArrayList<>();
    private List<String> rollingStats = defaultRollingStats();
    private List<Integer> lagPeriods = new ArrayList<>();
    private Map<String, String> schema = new LinkedHashMap<>();

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Check every setting.
     *
     * @throws InvalidConfigException listing all problems found
     */
    public void validate() {
        List<String> errors = collectErrors();
        if (!errors.isEmpty()) {
            throw new InvalidConfigException("DetectorConfig", errors);
        }
    }

    List<String> collectErrors() {
        List<String> errors = new ArrayList<>();

        if (backend == null || backend.isBlank()) {
            errors.add("'backend' is required");
        }
        if (minSamples < 1) {
            errors.add("'minSamples' must be >= 1, got: " + minSamples);
        }
        if (retrainInterval < 1) {
            errors.add("'retrainInterval' must be >= 1, got: " + retrainInterval);
        }
        if (windowSize < 1) {
            errors.add("'windowSize' must be >= 1, got: " + windowSize);
        }
        if (minSamples > windowSize) {
            errors.add("'minSamples' (" + minSamples + ") must not exceed 'windowSize' ("
                    + windowSize + ")");
        }
        if (!(contamination > 0.0 && contamination <= AbstractBackendAdapter.MAX_CONTAMINATION)) {
            errors.add("'contamination' must be in (0, " + AbstractBackendAdapter.MAX_CONTAMINATION
                    + "], got: " + contamination);
        }
        if (threshold != null && !Double.isFinite(threshold)) {
            errors.add("'threshold' must be a finite number, got: " + threshold);
        }
        try {
            NormalizationMode.fromName(normalization);
        } catch (IllegalArgumentException e) {
            errors.add(e.getMessage());
        }
        for (Integer window : rollingWindows) {
            if (window == null || window < 1) {
                errors.add("'rollingWindows' entries must be >= 1, got: " + window);
            }
        }
        for (String stat : rollingStats) {
            try {
                RollingStat.fromName(stat);
            } catch (IllegalArgumentException e) {
                errors.add(e.getMessage());
            }
        }
        for (Integer period : lagPeriods) {
            if (period == null || period < 1) {
                errors.add("'lagPeriods' entries must be >= 1, got: " + period);
            }
        }
        for (Map.Entry<String, String> entry : schema.entrySet()) {
            if (entry.getKey() == null || entry.getKey().isBlank()) {
                errors.add("'schema' field names must not be blank");
                continue;
            }
            try {
                EncodingKind.fromName(entry.getValue());
            } catch (SchemaMismatchException e) {
                errors.add("Schema field '" + entry.getKey() + "': " + e.getMessage());
            }
        }
        return errors;
    }

    // ---------------------------------------------------------------
    // Derived views
    // ---------------------------------------------------------------

    /**
     * @return the normalization mode; only valid after {@link #validate()}
     */
    public NormalizationMode normalizationMode() {
        return NormalizationMode.fromName(normalization);
    }

    /**
     * @return rolling and lag settings; only valid after {@link #validate()}
     */
    public FeatureSpec featureSpec() {
        List<RollingStat> stats = rollingStats.stream().map(RollingStat::fromName).toList();
        return new FeatureSpec(rollingWindows, stats, lagPeriods);
    }

    /**
     * @return a deep copy of this configuration
     */
    public DetectorConfig copy() {
        DetectorConfig copy = new DetectorConfig();
        copyInto(copy);
        return copy;
    }

    void copyInto(DetectorConfig target) {
        target.setBackend(backend);
        target.setMinSamples(minSamples);
        target.setRetrainInterval(retrainInterval);
        target.setWindowSize(windowSize);
        target.setThreshold(threshold);
        target.setContamination(contamination);
        target.setNormalization(normalization);
        target.setRollingWindows(rollingWindows);
        target.setRollingStats(rollingStats);
        target.setLagPeriods(lagPeriods);
        target.setSchema(schema);
    }

    private static List<String> defaultRollingStats() {
        List<String> stats = new ArrayList<>();
        for (RollingStat stat : RollingStat.values()) {
            stats.add(stat.value());
        }
        return stats;
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getBackend() {
        return backend;
    }

    /**
     * Set the backend name, normalised to lowercase.
     *
     * @param backend backend name or alias
     */
    public void setBackend(String backend) {
        this.backend = backend != null ? backend.trim().toLowerCase(Locale.ROOT) : null;
    }

    public int getMinSamples() {
        return minSamples;
    }

    public void setMinSamples(int minSamples) {
        this.minSamples = minSamples;
    }

    public int getRetrainInterval() {
        return retrainInterval;
    }

    public void setRetrainInterval(int retrainInterval) {
        this.retrainInterval = retrainInterval;
    }

    public int getWindowSize() {
        return windowSize;
    }

    public void setWindowSize(int windowSize) {
        this.windowSize = windowSize;
    }

    /**
     * @return configured operational threshold, {@code null} for the mode
     *         default
     */
    public Double getThreshold() {
        return threshold;
    }

    public void setThreshold(Double threshold) {
        this.threshold = threshold;
    }

    public double getContamination() {
        return contamination;
    }

    public void setContamination(double contamination) {
        this.contamination = contamination;
    }

    public String getNormalization() {
        return normalization;
    }

    public void setNormalization(String normalization) {
        this.normalization = normalization != null ? normalization.trim().toLowerCase(Locale.ROOT) : null;
    }

    public List<Integer> getRollingWindows() {
        return rollingWindows;
    }

    public void setRollingWindows(List<Integer> rollingWindows) {
        this.rollingWindows = rollingWindows != null ? new ArrayList<>(rollingWindows) : new ArrayList<>();
    }

    public List<String> getRollingStats() {
        return rollingStats;
    }

    /**
     * @param rollingStats statistic names; {@code null} restores the default
     *                     (all four)
     */
    public void setRollingStats(List<String> rollingStats) {
        this.rollingStats = rollingStats != null ? new ArrayList<>(rollingStats) : defaultRollingStats();
    }

    public List<Integer> getLagPeriods() {
        return lagPeriods;
    }

    public void setLagPeriods(List<Integer> lagPeriods) {
        this.lagPeriods = lagPeriods != null ? new ArrayList<>(lagPeriods) : new ArrayList<>();
    }

    /**
     * @return declared field encodings; empty when the schema is inferred
     */
    public Map<String, String> getSchema() {
        return schema;
    }

    public void setSchema(Map<String, String> schema) {
        this.schema = schema != null ? new LinkedHashMap<>(schema) : new LinkedHashMap<>();
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        DetectorConfig that = (DetectorConfig) o;
        return minSamples == that.minSamples
                && retrainInterval == that.retrainInterval
                && windowSize == that.windowSize
                && Double.compare(contamination, that.contamination) == 0
                && Objects.equals(backend, that.backend)
                && Objects.equals(threshold, that.threshold)
                && Objects.equals(normalization, that.normalization)
                && Objects.equals(rollingWindows, that.rollingWindows)
                && Objects.equals(rollingStats, that.rollingStats)
                && Objects.equals(lagPeriods, that.lagPeriods)
                && Objects.equals(schema, that.schema);
    }

    @Override
    public int hashCode() {
        return Objects.hash(backend, minSamples, retrainInterval, windowSize, threshold, contamination,
                normalization, rollingWindows, rollingStats, lagPeriods, schema);
    }

    @Override
    public String toString() {
        return "DetectorConfig{" +
                "backend='" + backend + '\'' +
                ", minSamples=" + minSamples +
                ", retrainInterval=" + retrainInterval +
                ", windowSize=" + windowSize +
                ", threshold=" + threshold +
                ", contamination=" + contamination +
                ", normalization='" + normalization + '\'' +
                ", rollingWindows=" + rollingWindows +
                ", rollingStats=" + rollingStats +
                ", lagPeriods=" + lagPeriods +
                ", schema=" + schema +
                '}';
    }
}
