package com.streamdetect.core.buffer;

import com.streamdetect.core.encoding.FeatureEncoder;
import com.streamdetect.core.model.Record;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ColumnarBuffer}.
 */
class ColumnarBufferTest {

    @Test
    @DisplayName("Should keep only the newest window_size records")
    void shouldDropOldestBeyondWindow() {
        ColumnarBuffer buffer = new ColumnarBuffer(5);
        for (int i = 1; i <= 6; i++) {
            buffer.append(value(i));
        }

        assertThat(buffer.size()).isEqualTo(5);
        assertThat(values(buffer.all())).containsExactly(2.0, 3.0, 4.0, 5.0, 6.0);
    }

    @Test
    @DisplayName("Should never exceed the window after a batch append")
    void shouldBoundBatchAppend() {
        ColumnarBuffer buffer = new ColumnarBuffer(3);
        buffer.appendBatch(List.of(value(1), value(2), value(3), value(4), value(5)));

        assertThat(buffer.size()).isEqualTo(3);
        assertThat(values(buffer.all())).containsExactly(3.0, 4.0, 5.0);
        assertThat(buffer.stats().getAppendedTotal()).isEqualTo(5);
    }

    @Test
    @DisplayName("Should return the last n records oldest first")
    void shouldReturnTail() {
        ColumnarBuffer buffer = new ColumnarBuffer(10);
        for (int i = 1; i <= 4; i++) {
            buffer.append(value(i));
        }

        assertThat(values(buffer.tail(2))).containsExactly(3.0, 4.0);
        assertThat(values(buffer.tail(10))).containsExactly(1.0, 2.0, 3.0, 4.0);
        assertThat(buffer.tail(0)).isEmpty();
    }

    @Test
    @DisplayName("Should hand out copies that later appends do not change")
    void shouldReturnPointInTimeCopies() {
        ColumnarBuffer buffer = new ColumnarBuffer(2);
        buffer.append(value(1));
        buffer.append(value(2));
        List<Record> snapshot = buffer.all();

        buffer.append(value(3));

        assertThat(values(snapshot)).containsExactly(1.0, 2.0);
        assertThat(values(buffer.all())).containsExactly(2.0, 3.0);
    }

    @Test
    @DisplayName("Should empty the buffer and its counters on clear")
    void shouldClear() {
        ColumnarBuffer buffer = new ColumnarBuffer(4);
        buffer.append(value(1));
        buffer.clear();

        BufferStats stats = buffer.stats();
        assertThat(stats.getSize()).isZero();
        assertThat(stats.getAppendedTotal()).isZero();
        assertThat(stats.getFieldNames()).isEmpty();
        assertThat(stats.getWindowSize()).isEqualTo(4);
    }

    @Test
    @DisplayName("Should report every field name seen")
    void shouldTrackFieldNames() {
        ColumnarBuffer buffer = new ColumnarBuffer(4);
        buffer.append(Record.of(Map.of("amount", 1.0)));
        buffer.append(Record.of(Map.of("country", "DE")));

        assertThat(buffer.stats().getFieldNames()).containsExactlyInAnyOrder("amount", "country");
    }

    @Test
    @DisplayName("Should reject a window smaller than one")
    void shouldRejectInvalidWindow() {
        assertThatThrownBy(() -> new ColumnarBuffer(0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("windowSize");
    }

    @Test
    @DisplayName("Should compute base, rolling and lag columns over the buffered records")
    void shouldComputeFeatures() {
        ColumnarBuffer buffer = new ColumnarBuffer(10);
        for (int i = 1; i <= 4; i++) {
            buffer.append(value(i));
        }
        FeatureEncoder encoder = FeatureEncoder.create(Map.of("x", "numeric"));
        FeatureSpec spec = new FeatureSpec(List.of(2), List.of(RollingStat.MEAN), List.of(1));

        FeatureMatrix matrix = buffer.features(encoder, spec);

        assertThat(matrix.columnNames()).containsExactly("x", "x_rolling_mean_2", "x_lag_1");
        assertThat(matrix.lastRow()).containsExactly(4.0, 3.5, 3.0);
    }

    @Test
    @DisplayName("Should expose rolling and lag features separately")
    void shouldComputeRollingAndLagSeparately() {
        ColumnarBuffer buffer = new ColumnarBuffer(10);
        buffer.appendBatch(List.of(value(2), value(4), value(9)));
        FeatureEncoder encoder = FeatureEncoder.create(Map.of("x", "numeric"));

        FeatureMatrix rolling = buffer.rollingFeatures(encoder, List.of(3), List.of(RollingStat.MAX));
        FeatureMatrix lags = buffer.lagFeatures(encoder, List.of(2));

        assertThat(rolling.columnNames()).containsExactly("x_rolling_max_3");
        assertThat(rolling.column("x_rolling_max_3")).containsExactly(2.0, 4.0, 9.0);
        assertThat(lags.column("x_lag_2")).containsExactly(0.0, 0.0, 2.0);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static Record value(double x) {
        return Record.of(Map.of("x", x));
    }

    private static List<Double> values(List<Record> records) {
        return records.stream()
                .map(r -> r.getNumericField("x").orElseThrow())
                .toList();
    }
}
