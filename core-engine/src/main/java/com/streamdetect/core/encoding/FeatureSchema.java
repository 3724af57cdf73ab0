package com.streamdetect.core.encoding;

import com.streamdetect.core.error.SchemaMismatchException;
import com.streamdetect.core.model.Record;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * Field name to {@link EncodingKind} mapping, iterated in sorted field order.
 *
 * <h3>Inference</h3>
 * <p>
 * When no schema is declared it is inferred once from the records of the
 * first fit: numbers become {@code numeric}, booleans {@code binary}, strings
 * with at most {@value #LABEL_CARDINALITY_LIMIT} distinct values {@code label}
 * and any other string field {@code hash}. A field whose values mix strings
 * with other types is treated as a string field.
 * </p>
 *
 * @since 1.0.0
 */
public final class FeatureSchema {

    /** Largest number of distinct string values still inferred as a label field. */
    public static final int LABEL_CARDINALITY_LIMIT = 20;

    private static final FeatureSchema EMPTY = new FeatureSchema(new TreeMap<>());

    private final Map<String, EncodingKind> kinds;

    private FeatureSchema(TreeMap<String, EncodingKind> kinds) {
        this.kinds = Collections.unmodifiableMap(kinds);
    }

    public static FeatureSchema empty() {
        return EMPTY;
    }

    /**
     * Build a schema from configuration.
     *
     * @param declared field name to kind name; {@code null} or empty yields the
     *                 empty schema
     * @return the schema
     * @throws SchemaMismatchException if a kind name is unknown
     */
    public static FeatureSchema of(Map<String, String> declared) {
        if (declared == null || declared.isEmpty()) {
            return EMPTY;
        }
        TreeMap<String, EncodingKind> kinds = new TreeMap<>();
        for (Map.Entry<String, String> entry : declared.entrySet()) {
            String field = Objects.requireNonNull(entry.getKey(), "Schema field must not be null");
            kinds.put(field, EncodingKind.fromName(entry.getValue()));
        }
        return new FeatureSchema(kinds);
    }

    /**
     * Infer a schema from a sample of records.
     *
     * @param records the sample; must not be {@code null}
     * @return the inferred schema, empty when the records carry no fields
     */
    public static FeatureSchema infer(List<Record> records) {
        Objects.requireNonNull(records, "Records must not be null");
        Map<String, FieldProfile> profiles = new LinkedHashMap<>();
        for (Record record : records) {
            for (Map.Entry<String, Object> entry : record.getFields().entrySet()) {
                profiles.computeIfAbsent(entry.getKey(), k -> new FieldProfile())
                        .observe(entry.getValue());
            }
        }
        TreeMap<String, EncodingKind> kinds = new TreeMap<>();
        profiles.forEach((field, profile) -> kinds.put(field, profile.kind()));
        return new FeatureSchema(kinds);
    }

    public boolean isEmpty() {
        return kinds.isEmpty();
    }

    public boolean contains(String field) {
        return kinds.containsKey(field);
    }

    public EncodingKind kindOf(String field) {
        return kinds.get(field);
    }

    /**
     * @return field names in sorted order
     */
    public Set<String> fieldNames() {
        return kinds.keySet();
    }

    /**
     * @return field name to kind name, sorted by field
     */
    public Map<String, String> toMap() {
        Map<String, String> map = new TreeMap<>();
        kinds.forEach((field, kind) -> map.put(field, kind.value()));
        return map;
    }

    /**
     * Reject a record carrying a field this schema does not declare, or text
     * that is not a number in a numeric field.
     *
     * @param record the record to check
     * @throws SchemaMismatchException on the first offending field
     */
    public void validate(Record record) {
        for (String field : record.fieldNames()) {
            if (!kinds.containsKey(field)) {
                throw new SchemaMismatchException("Field '" + field
                        + "' is not part of the schema " + kinds.keySet());
            }
            Object value = record.getFields().get(field);
            if (kinds.get(field) == EncodingKind.NUMERIC && !NumericFieldEncoder.isReadable(value)) {
                throw new SchemaMismatchException("Field '" + field + "' is numeric but got '" + value + "'");
            }
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof FeatureSchema that))
            return false;
        return kinds.equals(that.kinds);
    }

    @Override
    public int hashCode() {
        return kinds.hashCode();
    }

    @Override
    public String toString() {
        return "FeatureSchema" + toMap();
    }

    private static final class FieldProfile {
        private boolean sawString;
        private boolean sawNumber;
        private boolean sawBoolean;
        private final Set<String> distinct = new HashSet<>();

        void observe(Object value) {
            if (value == null) {
                return;
            }
            if (value instanceof Boolean) {
                sawBoolean = true;
            } else if (value instanceof Number) {
                sawNumber = true;
            } else {
                sawString = true;
            }
            if (distinct.size() <= LABEL_CARDINALITY_LIMIT) {
                distinct.add(value.toString());
            }
        }

        EncodingKind kind() {
            if (sawString) {
                return distinct.size() <= LABEL_CARDINALITY_LIMIT ? EncodingKind.LABEL : EncodingKind.HASH;
            }
            if (sawBoolean && !sawNumber) {
                return EncodingKind.BINARY;
            }
            return EncodingKind.NUMERIC;
        }
    }
}
