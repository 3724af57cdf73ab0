package com.streamdetect.core.backend;

import com.fasterxml.jackson.databind.JsonNode;
import com.streamdetect.core.error.InsufficientDataException;
import com.streamdetect.core.persistence.SnapshotCodec;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Arrays;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Behaviour every registered backend must share.
 */
class BackendAdapterContractTest {

    private static final BackendRegistry BACKENDS = BackendRegistry.withDefaults();

    @ParameterizedTest(name = "{0}")
    @ValueSource(strings = {"ecod", "hbos", "isolation_forest", "rcf", "knn", "local_outlier_factor",
            "elliptic_envelope", "reconstruction"})
    @DisplayName("Should return one finite training score per vector")
    void shouldScoreEveryTrainingVector(String name) {
        BackendAdapter adapter = BACKENDS.create(name);
        double[][] vectors = uniform(100, 2, 11L);

        FitResult result = adapter.fit(vectors, 0.1);

        assertThat(result.getTrainingScores()).hasSize(100);
        assertThat(Arrays.stream(result.getTrainingScores()).boxed().toList()).allMatch(Double::isFinite);
        assertThat(result.getModel().getBackend()).isEqualTo(adapter.name());
        assertThat(result.getModel().getDimensions()).isEqualTo(2);
        assertThat(result.getModel().getTrainedOn()).isEqualTo(100);
        assertThat(result.getModel().getContamination()).isEqualTo(0.1);
    }

    @ParameterizedTest(name = "{0}")
    @ValueSource(strings = {"ecod", "hbos", "isolation_forest", "rcf", "knn", "local_outlier_factor",
            "elliptic_envelope", "reconstruction"})
    @DisplayName("Should calibrate the raw threshold so that about contamination of the training data exceeds it")
    void shouldCalibrateRawThreshold(String name) {
        FitResult result = BACKENDS.create(name).fit(uniform(100, 2, 5L), 0.1);

        double threshold = result.getModel().getRawThreshold();
        long flagged = Arrays.stream(result.getTrainingScores()).filter(s -> s >= threshold).count();

        assertThat(flagged).isBetween(5L, 25L);
    }

    @ParameterizedTest(name = "{0}")
    @ValueSource(strings = {"ecod", "hbos", "isolation_forest", "rcf", "knn", "local_outlier_factor",
            "elliptic_envelope"})
    @DisplayName("Should score a far-away point above an ordinary one and above the raw threshold")
    void shouldRankOutlierAboveInlier(String name) {
        BackendAdapter adapter = BACKENDS.create(name);
        Model model = adapter.fit(uniform(200, 2, 3L), 0.1).getModel();

        double[] scores = adapter.score(new double[][] {{0.5, 0.5}, {5.0, 5.0}}, model);

        assertThat(scores[1]).isGreaterThan(scores[0]);
        assertThat(scores[1]).isGreaterThan(model.getRawThreshold());
    }

    @ParameterizedTest(name = "{0}")
    @ValueSource(strings = {"ecod", "hbos", "isolation_forest", "rcf", "knn", "local_outlier_factor",
            "elliptic_envelope", "reconstruction"})
    @DisplayName("Should refuse to fit fewer vectors than its minimum")
    void shouldRefuseInsufficientData(String name) {
        BackendAdapter adapter = BACKENDS.create(name);
        double[][] vectors = uniform(adapter.minimumSamples() - 1, 2, 1L);

        assertThatThrownBy(() -> adapter.fit(vectors, 0.1))
                .isInstanceOf(InsufficientDataException.class)
                .hasMessageContaining(adapter.name());
    }

    @ParameterizedTest(name = "{0}")
    @ValueSource(strings = {"ecod", "hbos", "isolation_forest", "rcf", "knn", "local_outlier_factor",
            "elliptic_envelope", "reconstruction"})
    @DisplayName("Should reject contamination outside (0, 0.5]")
    void shouldRejectInvalidContamination(String name) {
        BackendAdapter adapter = BACKENDS.create(name);
        double[][] vectors = uniform(50, 2, 1L);

        assertThatThrownBy(() -> adapter.fit(vectors, 0.0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> adapter.fit(vectors, 0.6)).isInstanceOf(IllegalArgumentException.class);
    }

    @ParameterizedTest(name = "{0}")
    @ValueSource(strings = {"ecod", "hbos", "isolation_forest", "rcf", "knn", "local_outlier_factor",
            "elliptic_envelope", "reconstruction"})
    @DisplayName("Should reject vectors whose dimension differs from the model")
    void shouldRejectDimensionMismatch(String name) {
        BackendAdapter adapter = BACKENDS.create(name);
        Model model = adapter.fit(uniform(50, 2, 1L), 0.1).getModel();

        assertThatThrownBy(() -> adapter.score(new double[][] {{1.0, 2.0, 3.0}}, model))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("dimension");
    }

    @ParameterizedTest(name = "{0}")
    @ValueSource(strings = {"ecod", "hbos", "isolation_forest", "rcf", "knn", "local_outlier_factor",
            "elliptic_envelope", "reconstruction"})
    @DisplayName("Should score identically with parameters read back from JSON")
    void shouldScoreWithPersistedParameters(String name) {
        BackendAdapter adapter = BACKENDS.create(name);
        Model model = adapter.fit(uniform(60, 3, 9L), 0.1).getModel();
        double[][] query = uniform(10, 3, 99L);

        JsonNode tree = SnapshotCodec.toTree(model.getParameters());
        Object parameters = SnapshotCodec.fromTree(tree, adapter.parametersType());
        Model restored = new Model(model.getBackend(), parameters, model.getRawThreshold(),
                model.getContamination(), model.getDimensions(), model.getTrainedOn(), model.getFittedAt());

        assertThat(adapter.score(query, restored)).containsExactly(adapter.score(query, model), within(1e-9));
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    static double[][] uniform(int rows, int columns, long seed) {
        Random random = new Random(seed);
        double[][] vectors = new double[Math.max(rows, 0)][columns];
        for (double[] row : vectors) {
            for (int c = 0; c < columns; c++) {
                row[c] = random.nextDouble();
            }
        }
        return vectors;
    }
}
