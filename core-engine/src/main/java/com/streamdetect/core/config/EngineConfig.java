package com.streamdetect.core.config;

import com.streamdetect.core.error.InvalidConfigException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Top-level POJO for the engine YAML configuration.
 *
 * <p>
 * Expected YAML structure:
 * </p>
 *
 * <pre>
 * retrainThreads: 4
 * detectors:
 *   - id: checkout-amounts
 *     backend: ecod
 *     minSamples: 50
 *     schema:
 *       amount: numeric
 *       country: label
 * </pre>
 *
 * <p>
 * {@code retrainThreads} of {@code 0} (the default) uses an unbounded pool of
 * daemon threads. Call {@link #validate()} after loading.
 * </p>
 *
 * @since 1.0.0
 */
public class EngineConfig {

    private int retrainThreads;
    private List<DetectorDefinition> detectors = new ArrayList<>();

    /**
     * Validate the engine settings and every detector definition.
     *
     * <p>
     * Collects all errors and throws a single exception if anything is
     * invalid.
     * </p>
     *
     * @throws InvalidConfigException if one or more settings are invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        if (retrainThreads < 0) {
            errors.add("'retrainThreads' must be >= 0, got: " + retrainThreads);
        }

        Set<String> ids = new HashSet<>();
        for (int i = 0; i < detectors.size(); i++) {
            DetectorDefinition definition = Objects.requireNonNull(detectors.get(i),
                    "Detector definition at index " + i + " is null");
            try {
                definition.validate();
            } catch (InvalidConfigException e) {
                errors.add(e.getMessage());
            }
            if (definition.getId() != null && !ids.add(definition.getId())) {
                errors.add("Duplicate detector id: '" + definition.getId() + "'");
            }
        }

        if (!errors.isEmpty()) {
            throw new InvalidConfigException("engine configuration", errors);
        }
    }

    public int getRetrainThreads() {
        return retrainThreads;
    }

    public void setRetrainThreads(int retrainThreads) {
        this.retrainThreads = retrainThreads;
    }

    /**
     * @return unmodifiable list of detector definitions
     */
    public List<DetectorDefinition> getDetectors() {
        return Collections.unmodifiableList(detectors);
    }

    /**
     * Set the detector list (used by SnakeYAML during deserialization).
     */
    public void setDetectors(List<DetectorDefinition> detectors) {
        this.detectors = detectors != null ? new ArrayList<>(detectors) : new ArrayList<>();
    }

    @Override
    public String toString() {
        return "EngineConfig{retrainThreads=" + retrainThreads + ", detectors=" + detectors + '}';
    }
}
