package com.streamdetect.core.encoding;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * One column per category plus a trailing column for unknown values.
 *
 * <p>
 * The category set is learned at the first fit only (sorted, at most
 * {@value #MAX_CATEGORIES}) and frozen afterwards, so the encoded width never
 * changes while a detector is running. A missing value encodes as all zeros.
 * </p>
 */
final class OneHotFieldEncoder implements FieldEncoder {

    private static final Logger LOG = LoggerFactory.getLogger(OneHotFieldEncoder.class);

    static final int MAX_CATEGORIES = 100;

    static final String UNKNOWN_SUFFIX = "__unknown__";

    /** {@code null} until the first fit. */
    private final List<String> categories;
    private final Map<String, Integer> positions;

    OneHotFieldEncoder(List<String> categories) {
        this.categories = categories == null ? null : List.copyOf(categories);
        this.positions = new HashMap<>();
        if (this.categories != null) {
            for (int i = 0; i < this.categories.size(); i++) {
                positions.put(this.categories.get(i), i);
            }
        }
    }

    @Override
    public EncodingKind kind() {
        return EncodingKind.ONEHOT;
    }

    @Override
    public int dimension() {
        return (categories == null ? 0 : categories.size()) + 1;
    }

    @Override
    public void encode(Object value, double[] target, int offset) {
        int width = dimension();
        for (int i = 0; i < width; i++) {
            target[offset + i] = 0.0;
        }
        if (value == null) {
            return;
        }
        Integer position = positions.get(value.toString());
        target[offset + (position != null ? position : width - 1)] = 1.0;
    }

    @Override
    public FieldEncoder extend(List<Object> values) {
        if (categories != null) {
            return this;
        }
        TreeSet<String> distinct = new TreeSet<>();
        for (Object value : values) {
            if (value != null) {
                distinct.add(value.toString());
            }
        }
        List<String> learned = new ArrayList<>(distinct);
        if (learned.size() > MAX_CATEGORIES) {
            LOG.warn("One-hot field has {} categories; keeping the first {} in sorted order",
                    learned.size(), MAX_CATEGORIES);
            learned = learned.subList(0, MAX_CATEGORIES);
        }
        return new OneHotFieldEncoder(learned);
    }

    @Override
    public List<String> columnNames(String field) {
        List<String> names = new ArrayList<>();
        if (categories != null) {
            for (String category : categories) {
                names.add(field + "_" + category);
            }
        }
        names.add(field + "_" + UNKNOWN_SUFFIX);
        return names;
    }

    @Override
    public EncoderState.FieldState state() {
        EncoderState.FieldState state = new EncoderState.FieldState(EncodingKind.ONEHOT.value());
        state.setCategories(categories == null ? null : new ArrayList<>(categories));
        return state;
    }
}
