package com.streamdetect.core.encoding;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps each category to its relative frequency in the training sample.
 *
 * <p>
 * Each fit recomputes the frequencies of the values present in the sample
 * and keeps values learned by earlier fits. Unseen and missing values encode
 * as half of the smallest known frequency.
 * </p>
 */
final class FrequencyFieldEncoder implements FieldEncoder {

    private final Map<String, Double> frequencies;
    private final double defaultValue;

    FrequencyFieldEncoder(Map<String, Double> frequencies, double defaultValue) {
        this.frequencies = Collections.unmodifiableMap(new LinkedHashMap<>(frequencies));
        this.defaultValue = defaultValue;
    }

    static FrequencyFieldEncoder empty() {
        return new FrequencyFieldEncoder(Map.of(), 0.0);
    }

    @Override
    public EncodingKind kind() {
        return EncodingKind.FREQUENCY;
    }

    @Override
    public int dimension() {
        return 1;
    }

    @Override
    public void encode(Object value, double[] target, int offset) {
        if (value == null) {
            target[offset] = defaultValue;
            return;
        }
        target[offset] = frequencies.getOrDefault(value.toString(), defaultValue);
    }

    @Override
    public FieldEncoder extend(List<Object> values) {
        Map<String, Integer> counts = new HashMap<>();
        int total = 0;
        for (Object value : values) {
            if (value != null) {
                counts.merge(value.toString(), 1, Integer::sum);
                total++;
            }
        }
        if (total == 0) {
            return this;
        }
        Map<String, Double> updated = new LinkedHashMap<>(frequencies);
        for (Map.Entry<String, Integer> entry : counts.entrySet()) {
            updated.put(entry.getKey(), entry.getValue() / (double) total);
        }
        double min = Double.MAX_VALUE;
        for (double frequency : updated.values()) {
            min = Math.min(min, frequency);
        }
        return new FrequencyFieldEncoder(updated, min / 2.0);
    }

    @Override
    public List<String> columnNames(String field) {
        return List.of(field);
    }

    @Override
    public EncoderState.FieldState state() {
        EncoderState.FieldState state = new EncoderState.FieldState(EncodingKind.FREQUENCY.value());
        state.setFrequencies(new LinkedHashMap<>(frequencies));
        state.setDefaultValue(defaultValue);
        return state;
    }
}
