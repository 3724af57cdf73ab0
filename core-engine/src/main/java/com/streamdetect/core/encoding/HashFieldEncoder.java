package com.streamdetect.core.encoding;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.List;

/**
 * Hashes the string form of a value into {@code [0, maxValue)}.
 *
 * <p>
 * Suited to high-cardinality fields (user agents, addresses). The output is a
 * pure function of the value, so nothing is learned or persisted beyond the
 * modulus.
 * </p>
 */
final class HashFieldEncoder implements FieldEncoder {

    static final int DEFAULT_MAX_VALUE = 1_000_000;

    private final int maxValue;

    HashFieldEncoder(int maxValue) {
        if (maxValue < 1) {
            throw new IllegalArgumentException("maxValue must be >= 1, got: " + maxValue);
        }
        this.maxValue = maxValue;
    }

    @Override
    public EncodingKind kind() {
        return EncodingKind.HASH;
    }

    @Override
    public int dimension() {
        return 1;
    }

    @Override
    public void encode(Object value, double[] target, int offset) {
        target[offset] = value == null ? 0.0 : hash(value.toString());
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
        EncoderState.FieldState state = new EncoderState.FieldState(EncodingKind.HASH.value());
        state.setMaxValue(maxValue);
        return state;
    }

    double hash(String value) {
        byte[] digest = md5().digest(value.getBytes(StandardCharsets.UTF_8));
        // first 8 hex digits = first 4 bytes, read unsigned
        long prefix = ((digest[0] & 0xFFL) << 24)
                | ((digest[1] & 0xFFL) << 16)
                | ((digest[2] & 0xFFL) << 8)
                | (digest[3] & 0xFFL);
        return (double) (prefix % maxValue);
    }

    private static MessageDigest md5() {
        try {
            return MessageDigest.getInstance("MD5");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 digest is not available", e);
        }
    }
}
