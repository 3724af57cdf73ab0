package com.streamdetect.core.backend;

import com.fasterxml.jackson.databind.JsonNode;
import com.streamdetect.core.persistence.SnapshotCodec;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.streamdetect.core.backend.BackendAdapterContractTest.uniform;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link RandomCutForestBackend}.
 */
class RandomCutForestBackendTest {

    @Test
    @DisplayName("Should persist the forest as the library state instead of the training rows")
    void shouldPersistForestState() {
        RandomCutForestBackend backend = new RandomCutForestBackend(20, 64, 7L);
        Model model = backend.fit(uniform(120, 3, 5L), 0.1).getModel();

        JsonNode tree = SnapshotCodec.toTree(model.getParameters());

        assertThat(tree.has("trainingVectors")).isFalse();
        assertThat(tree.get("forestState").get("numberOfTrees").asInt()).isEqualTo(20);
        assertThat(tree.get("forestState").get("sampleSize").asInt()).isEqualTo(64);
        assertThat(tree.get("forestState").get("dimensions").asInt()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should rank an isolated point above the bulk after a JSON round trip")
    void shouldScoreOutlierAfterRestore() {
        RandomCutForestBackend backend = new RandomCutForestBackend();
        Model model = backend.fit(uniform(200, 2, 3L), 0.05).getModel();
        Object parameters = SnapshotCodec.fromTree(SnapshotCodec.toTree(model.getParameters()),
                backend.parametersType());
        Model restored = new Model(model.getBackend(), parameters, model.getRawThreshold(),
                model.getContamination(), model.getDimensions(), model.getTrainedOn(), model.getFittedAt());

        double[] scores = backend.score(new double[][] {{0.5, 0.5}, {6.0, 6.0}}, restored);

        assertThat(scores[1]).isGreaterThan(scores[0]);
        assertThat(scores[1]).isGreaterThan(model.getRawThreshold());
    }
}
