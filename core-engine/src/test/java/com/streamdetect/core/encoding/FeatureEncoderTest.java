package com.streamdetect.core.encoding;

import com.streamdetect.core.error.SchemaMismatchException;
import com.streamdetect.core.model.Record;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link FeatureEncoder} and its field encoders.
 */
class FeatureEncoderTest {

    @Test
    @DisplayName("Should infer numeric, label and binary kinds from the first fit")
    void shouldInferSchema() {
        FeatureEncoder encoder = FeatureEncoder.create(Map.of()).fit(List.of(
                record("amount", 12.5, "country", "DE", "vip", true),
                record("amount", 3.0, "country", "FR", "vip", false)));

        assertThat(encoder.isSchemaInferred()).isTrue();
        assertThat(encoder.schema().toMap()).containsExactly(
                Map.entry("amount", "numeric"),
                Map.entry("country", "label"),
                Map.entry("vip", "binary"));
        assertThat(encoder.featureNames()).containsExactly("amount", "country", "vip");
        assertThat(encoder.transform(record("amount", 12.5, "country", "FR", "vip", true)))
                .containsExactly(12.5, 2.0, 1.0);
    }

    @Test
    @DisplayName("Should infer hash encoding for high-cardinality strings")
    void shouldInferHashForManyDistinctValues() {
        List<Record> records = new ArrayList<>();
        for (int i = 0; i <= FeatureSchema.LABEL_CARDINALITY_LIMIT; i++) {
            records.add(record("user", "user-" + i));
        }

        FeatureEncoder encoder = FeatureEncoder.create(Map.of()).fit(records);

        assertThat(encoder.schema().kindOf("user")).isEqualTo(EncodingKind.HASH);
    }

    @Test
    @DisplayName("Should never renumber existing labels when new values arrive")
    void shouldKeepLabelIndicesStable() {
        FeatureEncoder first = FeatureEncoder.create(Map.of("country", "label"))
                .fit(List.of(record("country", "FR"), record("country", "DE")));
        FeatureEncoder second = first.fit(List.of(record("country", "US"), record("country", "AT")));

        assertThat(first.transform(record("country", "DE"))).containsExactly(1.0);
        assertThat(first.transform(record("country", "FR"))).containsExactly(2.0);
        assertThat(first.transform(record("country", "US"))).containsExactly(0.0);

        assertThat(second.transform(record("country", "DE"))).containsExactly(1.0);
        assertThat(second.transform(record("country", "FR"))).containsExactly(2.0);
        assertThat(second.transform(record("country", "AT"))).containsExactly(3.0);
        assertThat(second.transform(record("country", "US"))).containsExactly(4.0);
    }

    @Test
    @DisplayName("Should freeze one-hot categories at the first fit and route unseen values to the unknown column")
    void shouldFreezeOneHotWidth() {
        FeatureEncoder encoder = FeatureEncoder.create(Map.of("channel", "onehot"))
                .fit(List.of(record("channel", "web"), record("channel", "app")));

        assertThat(encoder.featureNames())
                .containsExactly("channel_app", "channel_web", "channel___unknown__");
        assertThat(encoder.transform(record("channel", "app"))).containsExactly(1.0, 0.0, 0.0);
        assertThat(encoder.transform(record("channel", "pos"))).containsExactly(0.0, 0.0, 1.0);

        FeatureEncoder refit = encoder.fit(List.of(record("channel", "pos")));
        assertThat(refit.dimension()).isEqualTo(3);
        assertThat(refit.transform(record("channel", "pos"))).containsExactly(0.0, 0.0, 1.0);
    }

    @Test
    @DisplayName("Should hash strings with the first eight hex digits of their MD5")
    void shouldHashDeterministically() {
        FeatureEncoder encoder = FeatureEncoder.create(Map.of("user", "hash"));

        assertThat(encoder.transform(record("user", "alpha"))).containsExactly(722147.0);
        assertThat(encoder.transform(record("user", "DE"))).containsExactly(514882.0);
    }

    @Test
    @DisplayName("Should treat true, yes, 1, on, t and y as binary true")
    void shouldEncodeBinaryValues() {
        FeatureEncoder encoder = FeatureEncoder.create(Map.of("flag", "binary"));

        for (Object truthy : List.of(true, "yes", "1", "ON", "t", "Y", 1)) {
            assertThat(encoder.transform(record("flag", truthy))).as("value %s", truthy).containsExactly(1.0);
        }
        for (Object falsy : List.of(false, "no", "0", "off", 0)) {
            assertThat(encoder.transform(record("flag", falsy))).as("value %s", falsy).containsExactly(0.0);
        }
    }

    @Test
    @DisplayName("Should encode relative frequencies with half the rarest as default")
    void shouldEncodeFrequencies() {
        FeatureEncoder encoder = FeatureEncoder.create(Map.of("method", "frequency")).fit(List.of(
                record("method", "GET"), record("method", "GET"),
                record("method", "GET"), record("method", "POST")));

        assertThat(encoder.transform(record("method", "GET"))[0]).isCloseTo(0.75, within(1e-12));
        assertThat(encoder.transform(record("method", "POST"))[0]).isCloseTo(0.25, within(1e-12));
        assertThat(encoder.transform(record("method", "PATCH"))[0]).isCloseTo(0.125, within(1e-12));
    }

    @Test
    @DisplayName("Should encode a missing declared field as its neutral value")
    void shouldEncodeMissingFieldAsNeutral() {
        FeatureEncoder encoder = FeatureEncoder.create(Map.of("amount", "numeric", "country", "label"))
                .fit(List.of(record("amount", 1.0, "country", "DE")));

        assertThat(encoder.transform(record("amount", 5.0))).containsExactly(5.0, 0.0);
    }

    @Test
    @DisplayName("Should reject a record with a field outside the schema")
    void shouldRejectUndeclaredField() {
        FeatureEncoder encoder = FeatureEncoder.create(Map.of("amount", "numeric"));

        assertThatThrownBy(() -> encoder.validate(record("amount", 1.0, "extra", 2.0)))
                .isInstanceOf(SchemaMismatchException.class)
                .hasMessageContaining("extra");
    }

    @Test
    @DisplayName("Should reject text that is not a number in a numeric field")
    void shouldRejectNonNumericText() {
        FeatureEncoder encoder = FeatureEncoder.create(Map.of("amount", "numeric"));

        assertThatThrownBy(() -> encoder.validate(record("amount", "twelve")))
                .isInstanceOf(SchemaMismatchException.class)
                .hasMessageContaining("amount");
        encoder.validate(record("amount", "12.5"));
        encoder.validate(record("amount", true));
        encoder.validate(record("amount", null));
    }

    @Test
    @DisplayName("Should accept any record before a schema has been inferred")
    void shouldNotValidateWithoutSchema() {
        FeatureEncoder encoder = FeatureEncoder.create(Map.of());

        encoder.validate(record("anything", 1.0));

        assertThat(encoder.isFitted()).isFalse();
    }

    @Test
    @DisplayName("Should reject an unknown encoding kind")
    void shouldRejectUnknownKind() {
        assertThatThrownBy(() -> FeatureEncoder.create(Map.of("amount", "embedding")))
                .isInstanceOf(SchemaMismatchException.class)
                .hasMessageContaining("embedding");
    }

    @Test
    @DisplayName("Should refuse to infer a schema from records without fields")
    void shouldRefuseEmptyInference() {
        FeatureEncoder encoder = FeatureEncoder.create(Map.of());

        assertThatThrownBy(() -> encoder.fit(List.of(Record.of(Map.of()))))
                .isInstanceOf(SchemaMismatchException.class);
    }

    @Test
    @DisplayName("Should list the columns of numeric fields only")
    void shouldReportNumericColumns() {
        FeatureEncoder encoder = FeatureEncoder.create(Map.of("a", "numeric", "b", "onehot", "c", "numeric"))
                .fit(List.of(record("a", 1.0, "b", "x", "c", 2.0)));

        assertThat(encoder.featureNames()).containsExactly("a", "b_x", "b___unknown__", "c");
        assertThat(encoder.numericColumns()).containsExactly(0, 3);
    }

    @Test
    @DisplayName("Should forget an inferred schema but keep a declared one on reset")
    void shouldResetSchema() {
        FeatureEncoder inferred = FeatureEncoder.create(Map.of()).fit(List.of(record("x", 1.0)));
        FeatureEncoder declared = FeatureEncoder.create(Map.of("x", "label")).fit(List.of(record("x", "a")));

        assertThat(inferred.reset().schema().isEmpty()).isTrue();
        assertThat(declared.reset().schema().toMap()).containsEntry("x", "label");
        assertThat(declared.reset().transform(record("x", "a"))).containsExactly(0.0);
    }

    @Test
    @DisplayName("Should rebuild an encoder with identical dictionaries from its state")
    void shouldRestoreFromState() {
        FeatureEncoder encoder = FeatureEncoder.create(Map.of(
                "country", "label", "channel", "onehot", "method", "frequency", "amount", "numeric"))
                .fit(List.of(
                        record("country", "DE", "channel", "web", "method", "GET", "amount", 1.0),
                        record("country", "FR", "channel", "app", "method", "GET", "amount", 2.0)));
        Record query = record("country", "FR", "channel", "web", "method", "PUT", "amount", 7.0);

        FeatureEncoder restored = FeatureEncoder.fromState(encoder.state());

        assertThat(restored.schema()).isEqualTo(encoder.schema());
        assertThat(restored.featureNames()).isEqualTo(encoder.featureNames());
        assertThat(restored.transform(query)).containsExactly(encoder.transform(query));
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static Record record(Object... keyValues) {
        Map<String, Object> fields = new HashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            fields.put((String) keyValues[i], keyValues[i + 1]);
        }
        return Record.of(fields);
    }
}
