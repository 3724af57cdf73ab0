package com.streamdetect.core.encoding;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Persistable form of a {@link FeatureEncoder}: the schema plus every field's
 * learned dictionary.
 *
 * <p>
 * Plain mutable bean so that Jackson can read and write it without
 * annotations on the encoder classes.
 * </p>
 *
 * @since 1.0.0
 */
public class EncoderState {

    private Map<String, String> schema = new TreeMap<>();
    private boolean schemaInferred;
    private boolean fitted;
    private Map<String, FieldState> fields = new TreeMap<>();

    public Map<String, String> getSchema() {
        return schema;
    }

    public void setSchema(Map<String, String> schema) {
        this.schema = schema != null ? new TreeMap<>(schema) : new TreeMap<>();
    }

    public boolean isSchemaInferred() {
        return schemaInferred;
    }

    public void setSchemaInferred(boolean schemaInferred) {
        this.schemaInferred = schemaInferred;
    }

    public boolean isFitted() {
        return fitted;
    }

    public void setFitted(boolean fitted) {
        this.fitted = fitted;
    }

    public Map<String, FieldState> getFields() {
        return fields;
    }

    public void setFields(Map<String, FieldState> fields) {
        this.fields = fields != null ? new TreeMap<>(fields) : new TreeMap<>();
    }

    @Override
    public String toString() {
        return "EncoderState{schema=" + schema + ", fitted=" + fitted + '}';
    }

    /**
     * Learned state of one field. Only the properties relevant to the field's
     * kind are set.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class FieldState {

        private String kind;
        private Map<String, Integer> labels;
        private List<String> categories;
        private Map<String, Double> frequencies;
        private Double defaultValue;
        private Integer maxValue;

        public FieldState() {
        }

        public FieldState(String kind) {
            this.kind = kind;
        }

        public String getKind() {
            return kind;
        }

        public void setKind(String kind) {
            this.kind = kind;
        }

        public Map<String, Integer> getLabels() {
            return labels;
        }

        public void setLabels(Map<String, Integer> labels) {
            this.labels = labels != null ? new LinkedHashMap<>(labels) : null;
        }

        public List<String> getCategories() {
            return categories;
        }

        public void setCategories(List<String> categories) {
            this.categories = categories;
        }

        public Map<String, Double> getFrequencies() {
            return frequencies;
        }

        public void setFrequencies(Map<String, Double> frequencies) {
            this.frequencies = frequencies != null ? new LinkedHashMap<>(frequencies) : null;
        }

        public Double getDefaultValue() {
            return defaultValue;
        }

        public void setDefaultValue(Double defaultValue) {
            this.defaultValue = defaultValue;
        }

        public Integer getMaxValue() {
            return maxValue;
        }

        public void setMaxValue(Integer maxValue) {
            this.maxValue = maxValue;
        }

        FieldEncoder toEncoder() {
            EncodingKind encodingKind = EncodingKind.fromName(kind);
            return switch (encodingKind) {
                case NUMERIC -> NumericFieldEncoder.INSTANCE;
                case BINARY -> BinaryFieldEncoder.INSTANCE;
                case HASH -> new HashFieldEncoder(
                        maxValue != null ? maxValue : HashFieldEncoder.DEFAULT_MAX_VALUE);
                case LABEL -> new LabelFieldEncoder(labels != null ? labels : Map.of());
                case ONEHOT -> new OneHotFieldEncoder(categories);
                case FREQUENCY -> new FrequencyFieldEncoder(
                        frequencies != null ? frequencies : Map.of(),
                        defaultValue != null ? defaultValue : 0.0);
            };
        }
    }
}
