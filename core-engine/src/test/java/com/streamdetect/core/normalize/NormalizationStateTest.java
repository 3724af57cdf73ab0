package com.streamdetect.core.normalize;

import com.streamdetect.core.backend.Model;
import org.apache.commons.math3.stat.StatUtils;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link NormalizationState}.
 */
class NormalizationStateTest {

    @Test
    @DisplayName("Should give training scores mean 0 and std 1 under z-score")
    void shouldStandardiseTrainingScores() {
        double[] scores = randomScores(500);
        NormalizationState state = NormalizationState.fit(NormalizationMode.ZSCORE, scores);

        double[] z = state.transform(scores);

        assertThat(StatUtils.mean(z)).isCloseTo(0.0, within(1e-6));
        assertThat(Math.sqrt(StatUtils.populationVariance(z))).isCloseTo(1.0, within(1e-6));
    }

    @Test
    @DisplayName("Should keep standardization strictly inside (0, 1)")
    void shouldStayInsideOpenInterval() {
        NormalizationState state = NormalizationState.fit(NormalizationMode.STANDARDIZATION, randomScores(200));

        for (double raw : new double[] {-1e300, -1e6, -3, 0, 0.5, 3, 1e6, 1e300}) {
            double normalized = state.transform(raw);
            assertThat(normalized).as("raw %s", raw).isGreaterThan(0.0).isLessThan(1.0);
        }
    }

    @Test
    @DisplayName("Should map the training median to 0.5 under standardization")
    void shouldCentreOnMedian() {
        NormalizationState state = NormalizationState.fit(NormalizationMode.STANDARDIZATION,
                new double[] {1, 2, 3, 4, 5});

        assertThat(state.getCentre()).isEqualTo(3.0);
        assertThat(state.getScale()).isEqualTo(2.0);
        assertThat(state.transform(3.0)).isCloseTo(0.5, within(1e-12));
        assertThat(state.transform(5.0)).isGreaterThan(0.5);
    }

    @Test
    @DisplayName("Should fall back to a scale of 1.0 when the spread is zero")
    void shouldHandleDegenerateSpread() {
        NormalizationState standard = NormalizationState.fit(NormalizationMode.STANDARDIZATION,
                new double[] {4, 4, 4, 4});
        NormalizationState zscore = NormalizationState.fit(NormalizationMode.ZSCORE, new double[] {4, 4, 4});

        assertThat(standard.getScale()).isEqualTo(1.0);
        assertThat(zscore.getScale()).isEqualTo(1.0);
        assertThat(zscore.transform(6.0)).isCloseTo(2.0, within(1e-6));
    }

    @Test
    @DisplayName("Should pass raw scores through unchanged")
    void shouldLeaveRawScores() {
        NormalizationState state = NormalizationState.fit(NormalizationMode.RAW, new double[] {1, 2});

        assertThat(state.transform(42.0)).isEqualTo(42.0);
    }

    @Test
    @DisplayName("Should resolve the threshold from override, then configuration, then mode default")
    void shouldResolveThreshold() {
        NormalizationState state = NormalizationState.fit(NormalizationMode.STANDARDIZATION, new double[] {1, 2});

        assertThat(state.resolveThreshold(0.9, 0.7, null)).isEqualTo(0.9);
        assertThat(state.resolveThreshold(null, 0.7, null)).isEqualTo(0.7);
        assertThat(state.resolveThreshold(null, null, null)).isEqualTo(0.5);
        assertThat(NormalizationState.resolveThreshold(NormalizationMode.ZSCORE, null, null, null))
                .isEqualTo(2.0);
    }

    @Test
    @DisplayName("Should use the model's calibrated raw threshold in raw mode")
    void shouldUseModelThresholdInRawMode() {
        Model model = new Model("ecod", new Object(), 3.25, 0.1, 2, 10, Instant.now());

        assertThat(NormalizationState.resolveThreshold(NormalizationMode.RAW, null, null, model))
                .isEqualTo(3.25);
        assertThat(NormalizationState.resolveThreshold(NormalizationMode.RAW, null, null, null)).isNull();
    }

    @Test
    @DisplayName("Should parse mode names and reject unknown ones")
    void shouldParseModes() {
        assertThat(NormalizationMode.fromName("ZScore")).isEqualTo(NormalizationMode.ZSCORE);
        assertThat(NormalizationMode.STANDARDIZATION.defaultThreshold()).isEqualTo(0.5);
        assertThatThrownBy(() -> NormalizationMode.fromName("minmax"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("minmax");
    }

    @Test
    @DisplayName("Should refuse to fit on no scores")
    void shouldRejectEmptyScores() {
        assertThatThrownBy(() -> NormalizationState.fit(NormalizationMode.ZSCORE, new double[0]))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static double[] randomScores(int n) {
        Random random = new Random(23L);
        double[] scores = new double[n];
        for (int i = 0; i < n; i++) {
            scores[i] = Math.abs(random.nextGaussian()) * 3.0;
        }
        return scores;
    }
}
