package com.streamdetect.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.streamdetect.core.error.DetectorNotFoundException;
import com.streamdetect.core.error.InvalidConfigException;
import com.streamdetect.core.model.DetectorStats;
import com.streamdetect.core.model.DetectorStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Unit tests for {@link DetectorService}.
 */
class DetectorServiceTest {

    private static final ObjectMapper JSON = new ObjectMapper();

    @TempDir
    Path dir;

    private DetectorService service;

    @AfterEach
    void tearDown() {
        if (service != null) {
            service.close();
        }
    }

    @Test
    @DisplayName("Should report collecting responses until min_samples and then score")
    void shouldCountDownToReady() throws IOException {
        service = start(true);

        JsonNode first = ingest("{\"model\":\"cpu\",\"data\":[0.5],\"min_samples\":3}");
        JsonNode second = ingest("{\"model\":\"cpu\",\"data\":[0.6],\"min_samples\":3}");
        JsonNode third = ingest("{\"model\":\"cpu\",\"data\":[0.7],\"min_samples\":3}");

        assertThat(first.get("status").asText()).isEqualTo("collecting");
        assertThat(first.get("samples_until_ready").asInt()).isEqualTo(2);
        assertThat(first.get("results").get(0).get("normalized_score").isNull()).isTrue();
        assertThat(second.get("samples_until_ready").asInt()).isEqualTo(1);

        assertThat(third.get("status").asText()).isEqualTo("ready");
        assertThat(third.get("model_version").asInt()).isEqualTo(1);
        assertThat(third.get("threshold").asDouble()).isEqualTo(0.5);
        JsonNode scored = third.get("results").get(0);
        assertThat(scored.get("normalized_score").isNumber()).isTrue();
        assertThat(scored.get("is_anomaly").isBoolean()).isTrue();
        assertThat(third.has("processing_time_ms")).isTrue();
        assertThat(third.get("warnings").isArray()).isTrue();
    }

    @Test
    @DisplayName("Should accept records and number lists as data")
    void shouldAcceptEveryDataShape() {
        RequestCodec codec = new RequestCodec();

        assertThat(codec.parseData(tree("{\"amount\": 1.5, \"country\": \"DE\"}")).getRecords()).hasSize(1);
        assertThat(codec.parseData(tree("[{\"amount\": 1.5}, {\"amount\": 2.5}]")).getRecords()).hasSize(2);
        assertThat(codec.parseData(tree("[1.0, 2.0, 3.0]")).getRecords()).singleElement()
                .satisfies(r -> assertThat(r.fieldNames()).containsExactly("f0", "f1", "f2"));
        assertThat(codec.parseData(tree("[[1.0, 2.0], [3.0, 4.0]]")).getRecords()).hasSize(2);
        assertThat(codec.parseData(tree("[]")).size()).isZero();
    }

    @Test
    @DisplayName("Should report malformed elements by position and keep the rest of the batch")
    void shouldParseElementsIndependently() {
        RequestCodec codec = new RequestCodec();

        ParsedData parsed = codec.parseData(tree("[{\"x\": 1.0}, {\"x\": {\"nested\": 2}}, [1.0, \"a\"], {\"x\": 3.0}]"));

        assertThat(parsed.size()).isEqualTo(4);
        assertThat(parsed.getRecords()).hasSize(2);
        assertThat(parsed.getRejected()).containsOnlyKeys(1, 2);
        assertThat(parsed.getRejected().get(1)).contains("'x'");
        assertThat(parsed.getRejected().get(2)).contains("only numbers");
    }

    @Test
    @DisplayName("Should flag a malformed element and still score the valid records of the batch")
    void shouldIsolateMalformedElement() throws IOException {
        service = start(true);
        ingest("{\"model\":\"iso\",\"data\":[{\"x\":0.1},{\"x\":0.2},{\"x\":0.3}],\"min_samples\":3}");

        JsonNode response = ingest("{\"model\":\"iso\",\"data\":[{\"x\":1.0},{\"x\":{\"nested\":2}},{\"x\":3.0}]}");

        JsonNode results = response.get("results");
        assertThat(results.size()).isEqualTo(3);
        assertThat(results.get(0).get("index").asInt()).isZero();
        assertThat(results.get(0).get("normalized_score").isNumber()).isTrue();
        assertThat(results.get(1).get("index").asInt()).isEqualTo(1);
        assertThat(results.get(1).get("error").asText()).contains("'x'");
        assertThat(results.get(1).get("normalized_score").isNull()).isTrue();
        assertThat(results.get(2).get("index").asInt()).isEqualTo(2);
        assertThat(results.get(2).get("normalized_score").isNumber()).isTrue();
        assertThat(response.get("samples_collected").asInt()).isEqualTo(5);
    }

    @Test
    @DisplayName("Should reject data that is not a record or a number list")
    void shouldRejectUnsupportedData() {
        service = start(true);

        assertThatThrownBy(() -> service.handleIngest("{\"model\":\"m\",\"data\":\"text\"}"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("'data'");
        assertThatThrownBy(() -> service.handleIngest("{\"data\":[1.0]}"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("'model'");
        assertThatThrownBy(() -> service.handleIngest("{ nope"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Malformed");
    }

    @Test
    @DisplayName("Should not create a detector from invalid settings")
    void shouldRejectInvalidSettings() {
        service = start(true);

        assertThatThrownBy(() -> service.handleIngest(
                "{\"model\":\"bad\",\"data\":[1.0],\"contamination\":0.8,\"window_size\":10,\"min_samples\":20}"))
                .isInstanceOfSatisfying(InvalidConfigException.class,
                        e -> assertThat(e.getErrors()).hasSize(2));
        assertThat(service.listDetectors()).isEmpty();
    }

    @Test
    @DisplayName("Should create a detector with the request's settings and keep them afterwards")
    void shouldCreateFromRequestSettings() {
        service = start(true);

        service.handleIngest("{\"model\":\"logins\",\"data\":[1.0],\"backend\":\"iforest\","
                + "\"min_samples\":10,\"window_size\":20,\"normalization\":\"zscore\","
                + "\"rolling_windows\":[3],\"lag_periods\":[1],\"schema\":{\"f0\":\"numeric\"}}");
        service.handleIngest("{\"model\":\"logins\",\"data\":[2.0],\"backend\":\"knn\",\"min_samples\":5}");

        DetectorStats stats = service.stats("logins");
        assertThat(stats.getBackend()).isEqualTo("isolation_forest");
        assertThat(stats.getMinSamples()).isEqualTo(10);
        assertThat(stats.getWindowSize()).isEqualTo(20);
        assertThat(stats.getNormalization()).isEqualTo("zscore");
        assertThat(stats.getSamplesCollected()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should apply the request threshold to the scores of that call")
    void shouldApplyRequestThreshold() {
        service = start(true);
        service.ingest(request("cpu", uniformRows(20, 1L), 20, null));

        StreamIngestResponse response = service.ingest(request("cpu", uniformRows(5, 2L), 20, 0.0));

        assertThat(response.getThreshold()).isEqualTo(0.0);
        assertThat(response.getResults()).allMatch(r -> Boolean.TRUE.equals(r.getIsAnomaly()));
    }

    @Test
    @DisplayName("Should list, reset and delete detectors")
    void shouldManageDetectors() {
        service = start(true);
        service.ingest(request("b-stream", uniformRows(12, 1L), 10, null));
        service.ingest(request("a-stream", uniformRows(3, 2L), 10, null));

        assertThat(service.listDetectors())
                .extracting(DetectorSummary::getId, DetectorSummary::getStatus)
                .containsExactly(
                        tuple("a-stream", DetectorStatus.COLLECTING),
                        tuple("b-stream", DetectorStatus.READY));

        service.reset("b-stream");
        assertThat(service.stats("b-stream").getStatus()).isEqualTo(DetectorStatus.COLLECTING);

        assertThat(service.delete("a-stream")).isTrue();
        assertThat(service.delete("a-stream")).isFalse();
        assertThatThrownBy(() -> service.stats("a-stream")).isInstanceOf(DetectorNotFoundException.class);
    }

    @Test
    @DisplayName("Should refuse to save a detector that has no model yet")
    void shouldRefuseSavingUntrainedDetector() {
        service = start(true);
        service.ingest(request("cold", uniformRows(2, 1L), 10, null));

        assertThatThrownBy(() -> service.save("cold")).isInstanceOf(IllegalStateException.class);
        assertThat(service.saveAll()).isZero();
    }

    @Test
    @DisplayName("Should save trained detectors on close and restore them on the next start")
    void shouldPersistAcrossRestarts() {
        service = start(true);
        service.ingest(request("trained", uniformRows(15, 1L), 10, null));
        service.ingest(request("cold", uniformRows(2, 2L), 10, null));
        service.close();
        service = null;

        assertThat(Files.exists(dir.resolve("models").resolve("trained.json"))).isTrue();
        assertThat(Files.exists(dir.resolve("models").resolve("cold.json"))).isFalse();

        service = start(true);
        assertThat(service.listDetectors()).singleElement().satisfies(summary -> {
            assertThat(summary.getId()).isEqualTo("trained");
            assertThat(summary.getStatus()).isEqualTo(DetectorStatus.READY);
            assertThat(summary.getModelVersion()).isEqualTo(1);
        });
        StreamIngestResponse response = service.ingest(request("trained", uniformRows(1, 3L), 10, null));
        assertThat(response.getResults().get(0).isScored()).isTrue();
    }

    @Test
    @DisplayName("Should skip restoring saved detectors when disabled")
    void shouldNotRestoreWhenDisabled() {
        service = start(true);
        service.ingest(request("trained", uniformRows(15, 1L), 10, null));
        service.save("trained");
        service.close();

        service = start(false);

        assertThat(service.listDetectors()).isEmpty();
    }

    @Test
    @DisplayName("Should remove the saved model when a detector is deleted")
    void shouldDeleteSavedModel() {
        service = start(true);
        service.ingest(request("trained", uniformRows(15, 1L), 10, null));
        service.save("trained");

        assertThat(service.delete("trained")).isTrue();

        assertThat(Files.exists(dir.resolve("models").resolve("trained.json"))).isFalse();
    }

    @Test
    @DisplayName("Should create the detectors defined in the engine configuration")
    void shouldCreatePredefinedDetectors() throws IOException {
        Path config = dir.resolve("detectors.yml");
        Files.writeString(config, "detectors:\n"
                + "  - id: payments\n"
                + "    minSamples: 5\n"
                + "    windowSize: 50\n"
                + "    backend: hbos\n");

        service = DetectorService.start(ServiceConfig.builder()
                .modelStoreDir(dir.resolve("models"))
                .engineConfigPath(config.toString())
                .build());

        assertThat(service.listDetectors()).extracting(DetectorSummary::getId).containsExactly("payments");
        assertThat(service.stats("payments").getBackend()).isEqualTo("hbos");
    }

    @Test
    @DisplayName("Should reject a blank model store directory")
    void shouldValidateServiceConfig() {
        assertThatThrownBy(() -> ServiceConfig.builder().modelStoreDir(Path.of("")).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("modelStoreDir");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private DetectorService start(boolean restore) {
        Path config = dir.resolve("empty-detectors.yml");
        try {
            Files.writeString(config, "detectors: []\n");
        } catch (IOException e) {
            throw new IllegalStateException(e);
        }
        return DetectorService.start(ServiceConfig.builder()
                .modelStoreDir(dir.resolve("models"))
                .restoreOnStart(restore)
                .autosaveOnShutdown(true)
                .engineConfigPath(config.toString())
                .build());
    }

    private JsonNode ingest(String json) throws IOException {
        return JSON.readTree(service.handleIngest(json));
    }

    private static JsonNode tree(String json) {
        try {
            return JSON.readTree(json);
        } catch (IOException e) {
            throw new IllegalStateException(e);
        }
    }

    private static StreamIngestRequest request(String model, JsonNode data, int minSamples, Double threshold) {
        StreamIngestRequest request = new StreamIngestRequest();
        request.setModel(model);
        request.setData(data);
        request.setMinSamples(minSamples);
        request.setWindowSize(100);
        request.setThreshold(threshold);
        return request;
    }

    private static JsonNode uniformRows(int n, long seed) {
        Random random = new Random(seed);
        StringBuilder json = new StringBuilder("[");
        for (int i = 0; i < n; i++) {
            if (i > 0) {
                json.append(',');
            }
            json.append('[').append(random.nextDouble()).append(',').append(random.nextDouble()).append(']');
        }
        return tree(json.append(']').toString());
    }
}
