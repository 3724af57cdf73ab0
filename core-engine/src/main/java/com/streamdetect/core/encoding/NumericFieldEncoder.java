package com.streamdetect.core.encoding;

import java.util.List;

/**
 * Pass-through encoder for numeric fields. Missing and non-finite values
 * encode as {@code 0.0}; text that is not a number is rejected by
 * {@link FeatureSchema#validate} before it gets here.
 */
final class NumericFieldEncoder implements FieldEncoder {

    static final NumericFieldEncoder INSTANCE = new NumericFieldEncoder();

    private NumericFieldEncoder() {
    }

    @Override
    public EncodingKind kind() {
        return EncodingKind.NUMERIC;
    }

    @Override
    public int dimension() {
        return 1;
    }

    @Override
    public void encode(Object value, double[] target, int offset) {
        target[offset] = toDouble(value);
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
        return new EncoderState.FieldState(EncodingKind.NUMERIC.value());
    }

    /**
     * @return whether {@code value} is absent or can be read as a number
     */
    static boolean isReadable(Object value) {
        if (value instanceof String s) {
            try {
                Double.parseDouble(s.trim());
                return true;
            } catch (NumberFormatException e) {
                return false;
            }
        }
        return value == null || value instanceof Number || value instanceof Boolean;
    }

    static double toDouble(Object value) {
        double d;
        if (value instanceof Number n) {
            d = n.doubleValue();
        } else if (value instanceof Boolean b) {
            d = b ? 1.0 : 0.0;
        } else if (value instanceof String s) {
            try {
                d = Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                return 0.0;
            }
        } else {
            return 0.0;
        }
        return Double.isFinite(d) ? d : 0.0;
    }
}
