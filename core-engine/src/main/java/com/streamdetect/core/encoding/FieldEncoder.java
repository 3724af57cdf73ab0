package com.streamdetect.core.encoding;

import java.util.List;

/**
 * Encoding strategy for one record field.
 *
 * <p>
 * Implementations are immutable. {@link #extend(List)} returns an encoder
 * whose dictionary contains everything the current one knows plus what the
 * new sample adds; stateless strategies return themselves. An index or column
 * that has been assigned never changes meaning.
 * </p>
 */
public interface FieldEncoder {

    EncodingKind kind();

    /**
     * @return number of columns this field occupies in the encoded vector
     */
    int dimension();

    /**
     * Write the encoding of {@code value} into {@code target} starting at
     * {@code offset}. {@code null} means the field was missing.
     */
    void encode(Object value, double[] target, int offset);

    /**
     * Learn from a sample of raw values for this field.
     *
     * @param values raw values, may contain {@code null}
     * @return an encoder that knows at least as much as this one
     */
    FieldEncoder extend(List<Object> values);

    /**
     * @param field the field name
     * @return one column name per dimension
     */
    List<String> columnNames(String field);

    /**
     * @return persistable state of this encoder
     */
    EncoderState.FieldState state();
}
