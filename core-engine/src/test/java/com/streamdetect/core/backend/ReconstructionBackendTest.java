package com.streamdetect.core.backend;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link ReconstructionBackend}.
 */
class ReconstructionBackendTest {

    @Test
    @DisplayName("Should flag a point far from the principal subspace")
    void shouldFlagPointOffTheSubspace() {
        ReconstructionBackend backend = new ReconstructionBackend();
        Model model = backend.fit(alongDiagonal(200), 0.05).getModel();

        double[] scores = backend.score(new double[][] {{0.5, 0.5}, {0.5, 5.0}}, model);

        assertThat(scores[1]).isGreaterThan(scores[0]);
        assertThat(scores[1]).isGreaterThan(model.getRawThreshold());
    }

    @Test
    @DisplayName("Should score points on the subspace close to zero")
    void shouldReconstructPointsOnTheSubspace() {
        ReconstructionBackend backend = new ReconstructionBackend();
        Model model = backend.fit(alongDiagonal(200), 0.1).getModel();

        double[] scores = backend.score(new double[][] {{0.3, 0.3}}, model);

        assertThat(scores[0]).isLessThan(0.01);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static double[][] alongDiagonal(int rows) {
        Random random = new Random(17L);
        double[][] vectors = new double[rows][];
        for (int i = 0; i < rows; i++) {
            double t = random.nextDouble();
            vectors[i] = new double[] {t, t + 0.02 * random.nextGaussian()};
        }
        return vectors;
    }
}
