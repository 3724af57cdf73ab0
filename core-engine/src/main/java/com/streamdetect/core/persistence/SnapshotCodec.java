package com.streamdetect.core.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.Objects;

/**
 * Shared Jackson setup for persisted detectors, plus conversion of opaque
 * backend parameters to and from JSON trees.
 */
public final class SnapshotCodec {

    private static final ObjectMapper MAPPER = createMapper();

    private SnapshotCodec() {
        // utility class
    }

    /**
     * @return the mapper used for detector snapshots; do not reconfigure it
     */
    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /**
     * @return a new mapper with the snapshot settings, for callers that need
     *         their own instance
     */
    public static ObjectMapper createMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper;
    }

    public static JsonNode toTree(Object parameters) {
        Objects.requireNonNull(parameters, "Parameters must not be null");
        return MAPPER.valueToTree(parameters);
    }

    /**
     * @throws IllegalArgumentException if the tree does not describe a
     *                                  {@code type}
     */
    public static <T> T fromTree(JsonNode tree, Class<T> type) {
        Objects.requireNonNull(tree, "Parameter tree must not be null");
        try {
            return MAPPER.treeToValue(tree, type);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot read " + type.getSimpleName()
                    + " from persisted parameters: " + e.getOriginalMessage(), e);
        }
    }
}
