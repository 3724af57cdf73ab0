package com.streamdetect.core.encoding;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Maps boolean-like values to {@code 1.0} / {@code 0.0}.
 */
final class BinaryFieldEncoder implements FieldEncoder {

    static final BinaryFieldEncoder INSTANCE = new BinaryFieldEncoder();

    private static final Set<String> TRUTHY = Set.of("true", "yes", "1", "on", "t", "y");

    private BinaryFieldEncoder() {
    }

    @Override
    public EncodingKind kind() {
        return EncodingKind.BINARY;
    }

    @Override
    public int dimension() {
        return 1;
    }

    @Override
    public void encode(Object value, double[] target, int offset) {
        target[offset] = isTruthy(value) ? 1.0 : 0.0;
    }

    @Override
    public FieldEncoder extend(List<Object> values) {
        return this;
    }

    @Override
    public List<String> columnNames(String field) {
        return List.of(field);
    }

    @Override
    public EncoderState.FieldState state() {
        return new EncoderState.FieldState(EncodingKind.BINARY.value());
    }

    private static boolean isTruthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof Number n) {
            return n.doubleValue() != 0.0;
        }
        return TRUTHY.contains(value.toString().trim().toLowerCase(Locale.ROOT));
    }
}
