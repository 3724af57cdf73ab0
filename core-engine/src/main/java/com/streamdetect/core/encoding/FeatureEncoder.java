package com.streamdetect.core.encoding;

import com.streamdetect.core.error.SchemaMismatchException;
import com.streamdetect.core.model.Record;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Turns records into fixed-length {@code double[]} vectors.
 *
 * <p>
 * Instances are immutable: {@link #fit(List)} returns a new encoder whose
 * dictionaries extend this one's, which lets a detector publish a model
 * together with the exact encoder it was trained with. Columns follow the
 * sorted field order of the schema; a field contributes
 * {@link FieldEncoder#dimension()} consecutive columns.
 * </p>
 *
 * <h3>Schema lifecycle</h3>
 * <p>
 * A declared schema is fixed from construction. Otherwise the schema is
 * inferred at the first fit and fixed from then on; {@link #reset()} forgets
 * an inferred schema but keeps a declared one.
 * </p>
 *
 * @since 1.0.0
 */
public final class FeatureEncoder {

    private static final Logger LOG = LoggerFactory.getLogger(FeatureEncoder.class);

    private final FeatureSchema schema;
    private final boolean schemaInferred;
    private final boolean fitted;
    private final Map<String, FieldEncoder> encoders;

    private FeatureEncoder(FeatureSchema schema, boolean schemaInferred, boolean fitted,
            Map<String, FieldEncoder> encoders) {
        this.schema = schema;
        this.schemaInferred = schemaInferred;
        this.fitted = fitted;
        this.encoders = Collections.unmodifiableMap(new TreeMap<>(encoders));
    }

    /**
     * Create an unfitted encoder.
     *
     * @param declaredSchema field name to kind name; {@code null} or empty to
     *                       infer the schema at the first fit
     * @return a new encoder
     * @throws SchemaMismatchException if a declared kind is unknown
     */
    public static FeatureEncoder create(Map<String, String> declaredSchema) {
        FeatureSchema schema = FeatureSchema.of(declaredSchema);
        return new FeatureEncoder(schema, false, false, freshEncoders(schema));
    }

    /**
     * Rebuild an encoder from persisted state.
     *
     * @param state the persisted state; must not be {@code null}
     * @return an encoder equivalent to the one that produced {@code state}
     */
    public static FeatureEncoder fromState(EncoderState state) {
        Objects.requireNonNull(state, "EncoderState must not be null");
        FeatureSchema schema = FeatureSchema.of(state.getSchema());
        Map<String, FieldEncoder> encoders = freshEncoders(schema);
        for (Map.Entry<String, EncoderState.FieldState> entry : state.getFields().entrySet()) {
            if (!schema.contains(entry.getKey())) {
                throw new SchemaMismatchException("Persisted encoder field '" + entry.getKey()
                        + "' is missing from its schema");
            }
            encoders.put(entry.getKey(), entry.getValue().toEncoder());
        }
        return new FeatureEncoder(schema, state.isSchemaInferred(), state.isFitted(), encoders);
    }

    // ---------------------------------------------------------------
    // Fitting
    // ---------------------------------------------------------------

    /**
     * Learn from a sample of records.
     *
     * @param records training sample; must not be {@code null}
     * @return an encoder whose dictionaries extend this one's
     * @throws SchemaMismatchException if the schema has to be inferred and the
     *                                 records carry no fields
     */
    public FeatureEncoder fit(List<Record> records) {
        Objects.requireNonNull(records, "Records must not be null");
        FeatureSchema effective = schema;
        boolean inferred = schemaInferred;
        Map<String, FieldEncoder> current = encoders;

        if (effective.isEmpty()) {
            effective = FeatureSchema.infer(records);
            if (effective.isEmpty()) {
                throw new SchemaMismatchException("Cannot infer a schema: records carry no fields");
            }
            inferred = true;
            current = freshEncoders(effective);
            LOG.info("Inferred schema from {} record(s): {}", records.size(), effective.toMap());
        }

        Map<String, FieldEncoder> extended = new TreeMap<>();
        for (Map.Entry<String, FieldEncoder> entry : current.entrySet()) {
            String field = entry.getKey();
            List<Object> values = new ArrayList<>(records.size());
            for (Record record : records) {
                values.add(record.getFields().get(field));
            }
            extended.put(field, entry.getValue().extend(values));
        }
        return new FeatureEncoder(effective, inferred, true, extended);
    }

    /**
     * @return an unfitted encoder with the declared schema, or with no schema
     *         if it was inferred
     */
    public FeatureEncoder reset() {
        FeatureSchema kept = schemaInferred ? FeatureSchema.empty() : schema;
        return new FeatureEncoder(kept, false, false, freshEncoders(kept));
    }

    // ---------------------------------------------------------------
    // Encoding
    // ---------------------------------------------------------------

    /**
     * Check that every field of {@code record} is part of the schema and that
     * numeric fields hold numbers. Always passes while the schema is not yet
     * known.
     *
     * @throws SchemaMismatchException if the record carries an undeclared field
     *                                 or a non-numeric value in a numeric field
     */
    public void validate(Record record) {
        Objects.requireNonNull(record, "Record must not be null");
        if (!schema.isEmpty()) {
            schema.validate(record);
        }
    }

    /**
     * Encode one record. Fields of the schema missing from the record encode as
     * their kind's neutral value; fields outside the schema are ignored.
     *
     * @param record the record; must not be {@code null}
     * @return a new vector of length {@link #dimension()}
     */
    public double[] transform(Record record) {
        Objects.requireNonNull(record, "Record must not be null");
        double[] vector = new double[dimension()];
        int offset = 0;
        for (Map.Entry<String, FieldEncoder> entry : encoders.entrySet()) {
            FieldEncoder encoder = entry.getValue();
            encoder.encode(record.getFields().get(entry.getKey()), vector, offset);
            offset += encoder.dimension();
        }
        return vector;
    }

    /**
     * Encode records in order.
     *
     * @param records the records; must not be {@code null}
     * @return one row per record
     */
    public double[][] transformAll(List<Record> records) {
        Objects.requireNonNull(records, "Records must not be null");
        double[][] rows = new double[records.size()][];
        for (int i = 0; i < rows.length; i++) {
            rows[i] = transform(records.get(i));
        }
        return rows;
    }

    // ---------------------------------------------------------------
    // Introspection
    // ---------------------------------------------------------------

    public int dimension() {
        int dimension = 0;
        for (FieldEncoder encoder : encoders.values()) {
            dimension += encoder.dimension();
        }
        return dimension;
    }

    /**
     * @return one name per encoded column
     */
    public List<String> featureNames() {
        List<String> names = new ArrayList<>();
        encoders.forEach((field, encoder) -> names.addAll(encoder.columnNames(field)));
        return names;
    }

    /**
     * @return column indices of {@code numeric} fields, in column order
     */
    public int[] numericColumns() {
        List<Integer> columns = new ArrayList<>();
        int offset = 0;
        for (FieldEncoder encoder : encoders.values()) {
            if (encoder.kind() == EncodingKind.NUMERIC) {
                columns.add(offset);
            }
            offset += encoder.dimension();
        }
        return columns.stream().mapToInt(Integer::intValue).toArray();
    }

    public FeatureSchema schema() {
        return schema;
    }

    public boolean isFitted() {
        return fitted;
    }

    public boolean isSchemaInferred() {
        return schemaInferred;
    }

    /**
     * @return persistable copy of the schema and all dictionaries
     */
    public EncoderState state() {
        EncoderState state = new EncoderState();
        state.setSchema(schema.toMap());
        state.setSchemaInferred(schemaInferred);
        state.setFitted(fitted);
        Map<String, EncoderState.FieldState> fields = new TreeMap<>();
        encoders.forEach((field, encoder) -> fields.put(field, encoder.state()));
        state.setFields(fields);
        return state;
    }

    @Override
    public String toString() {
        return "FeatureEncoder{schema=" + schema.toMap()
                + ", fitted=" + fitted
                + ", dimension=" + dimension() + '}';
    }

    private static Map<String, FieldEncoder> freshEncoders(FeatureSchema schema) {
        Map<String, FieldEncoder> encoders = new TreeMap<>();
        for (String field : schema.fieldNames()) {
            encoders.put(field, switch (schema.kindOf(field)) {
                case NUMERIC -> NumericFieldEncoder.INSTANCE;
                case BINARY -> BinaryFieldEncoder.INSTANCE;
                case HASH -> new HashFieldEncoder(HashFieldEncoder.DEFAULT_MAX_VALUE);
                case LABEL -> new LabelFieldEncoder(Map.of());
                case ONEHOT -> new OneHotFieldEncoder(null);
                case FREQUENCY -> FrequencyFieldEncoder.empty();
            });
        }
        return encoders;
    }
}
