package com.streamdetect.core.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable record ingested by a streaming detector.
 *
 * <p>
 * A record is an ordered mapping of field name to scalar value (number,
 * string, boolean or {@code null}). Records are appended to a detector's
 * buffer as-is and are never mutated afterwards; encoding into a numeric
 * vector happens later with the encoder paired to the active model.
 * </p>
 *
 * <h3>Positional records</h3>
 * <p>
 * A plain list of numbers is accepted through {@link #ofValues(List)} and
 * exposed as fields {@code f0, f1, ...}.
 * </p>
 *
 * @since 1.0.0
 */
public final class Record {

    /** Prefix used for fields of positional records. */
    public static final String POSITIONAL_PREFIX = "f";

    private final Map<String, Object> fields;

    private Record(Map<String, Object> fields) {
        this.fields = Collections.unmodifiableMap(fields);
    }

    /**
     * Create a record from a field map. The map is copied.
     *
     * @param fields field name to value; must not be {@code null}
     * @return a new record
     * @throws NullPointerException     if {@code fields} or any key is {@code null}
     * @throws IllegalArgumentException if a value is not a scalar
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Record of(Map<String, ?> fields) {
        Objects.requireNonNull(fields, "Record fields must not be null");
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : fields.entrySet()) {
            String key = Objects.requireNonNull(entry.getKey(), "Field key must not be null");
            Object value = entry.getValue();
            if (value != null && !isScalar(value)) {
                throw new IllegalArgumentException("Field '" + key
                        + "' must be a number, string or boolean, got: "
                        + value.getClass().getSimpleName());
            }
            copy.put(key, value);
        }
        return new Record(copy);
    }

    /**
     * Create a positional record ({@code f0, f1, ...}) from a list of numbers.
     *
     * @param values the values in order; must not be {@code null}
     * @return a new record
     */
    public static Record ofValues(List<? extends Number> values) {
        Objects.requireNonNull(values, "Record values must not be null");
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < values.size(); i++) {
            Number n = values.get(i);
            map.put(POSITIONAL_PREFIX + i, n == null ? null : n.doubleValue());
        }
        return new Record(map);
    }

    /**
     * Convenience factory for positional records.
     *
     * @param values the values in order
     * @return a new record
     */
    public static Record ofValues(double... values) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < values.length; i++) {
            map.put(POSITIONAL_PREFIX + i, values[i]);
        }
        return new Record(map);
    }

    // ---------------------------------------------------------------
    // Field accessors
    // ---------------------------------------------------------------

    /**
     * @return unmodifiable view of all fields in insertion order
     */
    @JsonAnyGetter
    public Map<String, Object> getFields() {
        return fields;
    }

    public Set<String> fieldNames() {
        return fields.keySet();
    }

    public boolean hasField(String fieldName) {
        return fields.containsKey(fieldName);
    }

    /**
     * Retrieve a field value by name.
     *
     * @param fieldName the field name
     * @return optional containing the value, or empty if absent or {@code null}
     */
    public Optional<Object> getField(String fieldName) {
        return Optional.ofNullable(fields.get(fieldName));
    }

    /**
     * Retrieve a numeric field value, coercing numbers, booleans and
     * string-encoded numbers.
     *
     * @param fieldName the field name
     * @return optional containing the value as a {@code double}
     */
    public Optional<Double> getNumericField(String fieldName) {
        Object raw = fields.get(fieldName);
        if (raw instanceof Number n) {
            return Optional.of(n.doubleValue());
        }
        if (raw instanceof Boolean b) {
            return Optional.of(b ? 1.0 : 0.0);
        }
        if (raw instanceof String s) {
            try {
                return Optional.of(Double.parseDouble(s.trim()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    /**
     * Retrieve a field value as a string.
     *
     * @param fieldName the field name
     * @return optional containing the string form of the value
     */
    public Optional<String> getStringField(String fieldName) {
        Object raw = fields.get(fieldName);
        return raw == null ? Optional.empty() : Optional.of(raw.toString());
    }

    public int size() {
        return fields.size();
    }

    private static boolean isScalar(Object value) {
        return value instanceof Number || value instanceof String || value instanceof Boolean
                || value instanceof Character;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Record that))
            return false;
        return Objects.equals(fields, that.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fields);
    }

    @Override
    public String toString() {
        return "Record" + fields;
    }
}
