package com.streamdetect.core.buffer;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link FeatureEngine}.
 */
class FeatureEngineTest {

    private static final List<String> NAMES = List.of("a", "b");
    private static final int[] NUMERIC = {0, 1};

    @Test
    @DisplayName("Should use partial windows at the start of the history")
    void shouldUsePartialWindows() {
        double[] mean = FeatureEngine.rollingColumn(new double[] {1, 2, 3, 4}, 3, RollingStat.MEAN);

        assertThat(mean[0]).isEqualTo(1.0);
        assertThat(mean[1]).isEqualTo(1.5);
        assertThat(mean[2]).isEqualTo(2.0);
        assertThat(mean[3]).isEqualTo(3.0);
    }

    @Test
    @DisplayName("Should report 0.0 for the deviation of a single value")
    void shouldReturnZeroForUndefinedDeviation() {
        double[] std = FeatureEngine.rollingColumn(new double[] {5, 7, 9}, 2, RollingStat.STD);

        assertThat(std[0]).isZero();
        // sample deviation of {5, 7}
        assertThat(std[1]).isCloseTo(Math.sqrt(2.0), within(1e-12));
        assertThat(std[2]).isCloseTo(Math.sqrt(2.0), within(1e-12));
    }

    @Test
    @DisplayName("Should track rolling min and max")
    void shouldComputeMinAndMax() {
        double[] values = {4, 1, 8, 3};

        assertThat(FeatureEngine.rollingColumn(values, 2, RollingStat.MIN)).containsExactly(4, 1, 1, 3);
        assertThat(FeatureEngine.rollingColumn(values, 2, RollingStat.MAX)).containsExactly(4, 4, 8, 8);
    }

    @Test
    @DisplayName("Should fill unavailable lags with 0.0")
    void shouldZeroFillLags() {
        assertThat(FeatureEngine.lagColumn(new double[] {1, 2, 3}, 1)).containsExactly(0, 1, 2);
        assertThat(FeatureEngine.lagColumn(new double[] {1, 2, 3}, 5)).containsExactly(0, 0, 0);
    }

    @Test
    @DisplayName("Should name derived columns by field, statistic and window")
    void shouldNameColumns() {
        double[][] rows = {{1, 10}, {2, 20}, {3, 30}};
        FeatureSpec spec = new FeatureSpec(List.of(2), List.of(RollingStat.MEAN, RollingStat.STD), List.of(1));

        FeatureMatrix matrix = FeatureEngine.compute(NAMES, rows, NUMERIC, spec);

        assertThat(matrix.columnNames()).containsExactly(
                "a", "b",
                "a_rolling_mean_2", "b_rolling_mean_2",
                "a_rolling_std_2", "b_rolling_std_2",
                "a_lag_1", "b_lag_1");
        assertThat(matrix.rowCount()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should derive features from numeric columns only")
    void shouldSkipNonNumericColumns() {
        double[][] rows = {{1, 7}, {2, 7}};

        FeatureMatrix matrix = FeatureEngine.compute(NAMES, rows, new int[] {0},
                new FeatureSpec(List.of(), List.of(), List.of(1)));

        assertThat(matrix.columnNames()).containsExactly("a", "b", "a_lag_1");
    }

    @Test
    @DisplayName("Should always produce finite values")
    void shouldProduceFiniteValues() {
        double[][] rows = {{1, Double.NaN}, {Double.POSITIVE_INFINITY, 2}, {3, 4}};
        FeatureSpec spec = new FeatureSpec(List.of(1, 3), List.of(RollingStat.values()), List.of());

        FeatureMatrix matrix = FeatureEngine.compute(NAMES, rows, NUMERIC, spec);

        for (String name : matrix.columnNames()) {
            if (name.contains("_rolling_")) {
                assertThat(Arrays.stream(matrix.column(name)).boxed().toList()).allMatch(Double::isFinite);
            }
        }
    }

    @Test
    @DisplayName("Should return an unchanged matrix for an empty feature spec")
    void shouldPassThroughWithoutDerivedFeatures() {
        double[][] rows = {{1, 2}};

        FeatureMatrix matrix = FeatureEngine.compute(NAMES, rows, NUMERIC, FeatureSpec.none());

        assertThat(matrix.toRows()).isDeepEqualTo(rows);
    }

    @Test
    @DisplayName("Should require enough history for the widest window and the longest lag")
    void shouldComputeHistoryRequired() {
        assertThat(FeatureSpec.none().historyRequired()).isEqualTo(1);
        assertThat(new FeatureSpec(List.of(5, 20), List.of(RollingStat.MEAN), List.of(3)).historyRequired())
                .isEqualTo(20);
        assertThat(new FeatureSpec(List.of(2), List.of(RollingStat.MEAN), List.of(7)).historyRequired())
                .isEqualTo(8);
    }

    @Test
    @DisplayName("Should reject non-positive windows and lags")
    void shouldRejectInvalidSpec() {
        assertThatThrownBy(() -> new FeatureSpec(List.of(0), List.of(RollingStat.MEAN), List.of()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new FeatureSpec(List.of(), List.of(), List.of(-1)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
