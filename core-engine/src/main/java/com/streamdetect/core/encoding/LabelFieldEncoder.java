package com.streamdetect.core.encoding;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Maps each category to a stable integer index.
 *
 * <p>
 * Index {@value #UNKNOWN} is reserved for values the dictionary has never
 * seen (and for missing values). New categories are appended with the next
 * free index, in sorted order within one fit, so an index once assigned keeps
 * its meaning for the life of the detector.
 * </p>
 */
final class LabelFieldEncoder implements FieldEncoder {

    static final int UNKNOWN = 0;

    private final Map<String, Integer> labels;

    LabelFieldEncoder(Map<String, Integer> labels) {
        this.labels = Collections.unmodifiableMap(new LinkedHashMap<>(labels));
    }

    @Override
    public EncodingKind kind() {
        return EncodingKind.LABEL;
    }

    @Override
    public int dimension() {
        return 1;
    }

    @Override
    public void encode(Object value, double[] target, int offset) {
        if (value == null) {
            target[offset] = UNKNOWN;
            return;
        }
        target[offset] = labels.getOrDefault(value.toString(), UNKNOWN);
    }

    @Override
    public FieldEncoder extend(List<Object> values) {
        TreeSet<String> unseen = new TreeSet<>();
        for (Object value : values) {
            if (value != null && !labels.containsKey(value.toString())) {
                unseen.add(value.toString());
            }
        }
        if (unseen.isEmpty()) {
            return this;
        }
        Map<String, Integer> extended = new LinkedHashMap<>(labels);
        int next = nextIndex();
        for (String category : unseen) {
            extended.put(category, next++);
        }
        return new LabelFieldEncoder(extended);
    }

    @Override
    public List<String> columnNames(String field) {
        return List.of(field);
    }

    @Override
    public EncoderState.FieldState state() {
        EncoderState.FieldState state = new EncoderState.FieldState(EncodingKind.LABEL.value());
        state.setLabels(new LinkedHashMap<>(labels));
        return state;
    }

    Map<String, Integer> labels() {
        return labels;
    }

    private int nextIndex() {
        int max = UNKNOWN;
        for (int index : labels.values()) {
            max = Math.max(max, index);
        }
        return max + 1;
    }
}
