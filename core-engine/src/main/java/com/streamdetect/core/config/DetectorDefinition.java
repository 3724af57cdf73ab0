package com.streamdetect.core.config;

import com.streamdetect.core.error.InvalidConfigException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A {@link DetectorConfig} with the id of the detector to create at startup.
 *
 * <pre>
 * detectors:
 *   - id: api-latency
 *     backend: isolation_forest
 *     minSamples: 100
 *     rollingWindows: [5, 20]
 * </pre>
 *
 * @since 1.0.0
 */
public class DetectorDefinition extends DetectorConfig {

    private String id;

    @Override
    public void validate() {
        List<String> errors = new ArrayList<>();
        if (id == null || id.isBlank()) {
            errors.add("'id' is required");
        }
        errors.addAll(collectErrors());
        if (!errors.isEmpty()) {
            throw new InvalidConfigException("detector '" + id + "'", errors);
        }
    }

    /**
     * @return the configuration without the id
     */
    public DetectorConfig toConfig() {
        DetectorConfig config = new DetectorConfig();
        copyInto(config);
        return config;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id != null ? id.trim() : null;
    }

    @Override
    public boolean equals(Object o) {
        if (!super.equals(o))
            return false;
        return Objects.equals(id, ((DetectorDefinition) o).id);
    }

    @Override
    public int hashCode() {
        return 31 * super.hashCode() + Objects.hashCode(id);
    }

    @Override
    public String toString() {
        return "DetectorDefinition{id='" + id + "', " + super.toString() + '}';
    }
}
