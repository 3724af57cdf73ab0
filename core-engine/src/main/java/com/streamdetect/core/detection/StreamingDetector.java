package com.streamdetect.core.detection;

import com.streamdetect.core.backend.BackendAdapter;
import com.streamdetect.core.backend.BackendRegistry;
import com.streamdetect.core.backend.FitResult;
import com.streamdetect.core.backend.Model;
import com.streamdetect.core.buffer.ColumnarBuffer;
import com.streamdetect.core.buffer.FeatureMatrix;
import com.streamdetect.core.buffer.FeatureSpec;
import com.streamdetect.core.config.DetectorConfig;
import com.streamdetect.core.encoding.FeatureEncoder;
import com.streamdetect.core.error.InvalidConfigException;
import com.streamdetect.core.error.SchemaMismatchException;
import com.streamdetect.core.model.DetectionResult;
import com.streamdetect.core.model.DetectorStats;
import com.streamdetect.core.model.DetectorStatus;
import com.streamdetect.core.model.IngestResult;
import com.streamdetect.core.model.Record;
import com.streamdetect.core.normalize.NormalizationMode;
import com.streamdetect.core.normalize.NormalizationState;
import com.streamdetect.core.persistence.DetectorSnapshot;
import com.streamdetect.core.persistence.SnapshotCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Online anomaly detector for one logical stream.
 *
 * <h3>Lifecycle</h3>
 * <ul>
 * <li>{@code collecting}: records are buffered and reported with
 * {@code samplesUntilReady}. Once {@code max(minSamples,
 * backend.minimumSamples())} records have arrived the first model is fitted
 * synchronously and the record that completed the cold start is scored with
 * it. A failed first fit leaves the detector collecting and is retried on the
 * next record.</li>
 * <li>{@code ready}: every record is scored. After {@code retrainInterval}
 * records a copy of the buffer is handed to the retrain executor and the
 * detector moves to {@code retraining}.</li>
 * <li>{@code retraining}: scoring continues on the active model. A
 * successful fit is installed in one atomic swap with
 * {@code modelVersion + 1}; a failed fit keeps the old model and is reported
 * once in the {@code warnings} of the next ingest.</li>
 * </ul>
 * <p>
 * {@link #reset()} returns to {@code collecting} from any state.
 * </p>
 *
 * <h3>Concurrency</h3>
 * <p>
 * A per-detector lock serializes appends, counter updates, state
 * transitions and the capture of the scoring window. Feature computation and
 * scoring run outside the lock against the immutable {@link ModelSnapshot}
 * read at capture time, which is also the version reported with the result.
 * A generation counter, bumped by {@code reset} and {@code close}, makes a
 * background fit that finishes late drop its result.
 * </p>
 *
 * @since 1.0.0
 */
public class StreamingDetector implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(StreamingDetector.class);

    private final String id;
    private final DetectorConfig config;
    private final BackendAdapter backend;
    private final NormalizationMode normalizationMode;
    private final FeatureSpec featureSpec;
    private final ColumnarBuffer buffer;
    private final Executor retrainExecutor;
    private final int readyAt;
    private final Instant createdAt = Instant.now();

    private final ReentrantLock lock = new ReentrantLock();
    private final AtomicReference<ModelSnapshot> active = new AtomicReference<>();

    // ---- guarded by lock ----
    private FeatureEncoder encoder;
    private DetectorStatus status = DetectorStatus.COLLECTING;
    private long samplesCollected;
    private int samplesSinceRetrain;
    private long totalProcessed;
    private long failedRetrains;
    private long generation;
    private boolean closed;
    private Instant lastTrainedAt;
    private CompletableFuture<Void> retrainTask;
    private final List<String> pendingWarnings = new ArrayList<>();

    /**
     * Create a detector in the {@code collecting} state.
     *
     * @param id              detector id; must not be blank
     * @param config          configuration; validated and copied
     * @param backends        registry used to resolve {@code config.backend}
     * @param retrainExecutor executor for background retrains
     * @throws InvalidConfigException if the configuration is invalid
     * @throws com.streamdetect.core.error.BackendUnavailableException if the
     *                                backend is not registered
     */
    public StreamingDetector(String id, DetectorConfig config, BackendRegistry backends,
            Executor retrainExecutor) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Detector id must not be blank");
        }
        Objects.requireNonNull(config, "DetectorConfig must not be null");
        Objects.requireNonNull(backends, "BackendRegistry must not be null");
        this.retrainExecutor = Objects.requireNonNull(retrainExecutor, "Retrain executor must not be null");

        config.validate();
        this.id = id;
        this.backend = backends.create(config.getBackend());
        this.config = config.copy();
        this.config.setBackend(backend.name());
        this.normalizationMode = this.config.normalizationMode();
        this.featureSpec = this.config.featureSpec();
        this.readyAt = Math.max(this.config.getMinSamples(), backend.minimumSamples());
        if (readyAt > this.config.getWindowSize()) {
            throw new InvalidConfigException("DetectorConfig", List.of("backend '" + backend.name()
                    + "' needs at least " + readyAt + " samples but 'windowSize' is "
                    + this.config.getWindowSize()));
        }
        this.buffer = new ColumnarBuffer(this.config.getWindowSize());
        this.encoder = FeatureEncoder.create(this.config.getSchema());
    }

    /**
     * Rebuild a trained detector from a snapshot. It starts {@code ready} with
     * the persisted model version and an empty buffer.
     *
     * @throws IllegalArgumentException if the snapshot is inconsistent
     */
    public static StreamingDetector restore(DetectorSnapshot snapshot, BackendRegistry backends,
            Executor retrainExecutor) {
        Objects.requireNonNull(snapshot, "Snapshot must not be null");
        if (snapshot.getConfig() == null || snapshot.getModelParameters() == null
                || snapshot.getNormalization() == null || snapshot.getEncoder() == null) {
            throw new IllegalArgumentException("Snapshot of detector '" + snapshot.getId() + "' is incomplete");
        }
        DetectorConfig config = snapshot.getConfig().copy();
        config.setBackend(snapshot.getBackend());
        config.setWindowSize(snapshot.getWindowSize());

        StreamingDetector detector = new StreamingDetector(snapshot.getId(), config, backends, retrainExecutor);
        Object parameters = SnapshotCodec.fromTree(snapshot.getModelParameters(),
                detector.backend.parametersType());
        Model model = new Model(detector.backend.name(), parameters, snapshot.getRawThreshold(),
                snapshot.getContamination(), snapshot.getDimensions(), snapshot.getTrainedOn(),
                snapshot.getFittedAt() != null ? snapshot.getFittedAt() : Instant.now());
        FeatureEncoder encoder = FeatureEncoder.fromState(snapshot.getEncoder());

        int width = ColumnarBuffer.features(encoder, detector.featureSpec, List.of()).columnCount();
        if (width != model.getDimensions()) {
            throw new IllegalArgumentException("Snapshot of detector '" + snapshot.getId()
                    + "' encodes " + width + " feature(s) but its model expects " + model.getDimensions());
        }

        ModelSnapshot restored = new ModelSnapshot(model, snapshot.getNormalization(), encoder,
                detector.featureSpec, snapshot.getModelVersion(), Instant.now());
        detector.lock.lock();
        try {
            detector.active.set(restored);
            detector.encoder = encoder;
            detector.status = DetectorStatus.READY;
            detector.lastTrainedAt = model.getFittedAt();
        } finally {
            detector.lock.unlock();
        }
        LOG.info("Detector [{}] restored with model version {}", snapshot.getId(), snapshot.getModelVersion());
        return detector;
    }

    // ---------------------------------------------------------------
    // Ingest
    // ---------------------------------------------------------------

    /**
     * Ingest records in order. Records that fail schema validation are not
     * appended and come back with an {@code error}; the rest of the batch is
     * processed normally.
     *
     * @param records           records to ingest; must not be {@code null}
     * @param thresholdOverride operational threshold for this call only, or
     *                          {@code null}
     * @return per-record results plus the detector state after the call
     * @throws IllegalStateException if the detector is closed
     */
    public IngestResult ingest(List<Record> records, Double thresholdOverride) {
        return ingest(records, Map.of(), thresholdOverride);
    }

    /**
     * Ingest a batch some of whose elements were already rejected upstream,
     * for example because they could not be parsed into a {@link Record}.
     *
     * <p>
     * The batch has {@code records.size() + rejected.size()} positions.
     * Positions that are keys of {@code rejected} come back with that reason as
     * their {@code error}; the remaining positions take {@code records} in
     * order. If the detector is closed part way through, the results computed
     * so far are returned and the rest of the batch is skipped with a warning.
     * </p>
     *
     * @param records           parsed records, in batch order
     * @param rejected          batch position to rejection reason
     * @param thresholdOverride operational threshold for this call only, or
     *                          {@code null}
     * @throws IllegalArgumentException if a rejected position lies outside the
     *                                  batch
     * @throws IllegalStateException    if the detector is closed
     */
    public IngestResult ingest(List<Record> records, Map<Integer, String> rejected, Double thresholdOverride) {
        Objects.requireNonNull(records, "Records must not be null");
        Objects.requireNonNull(rejected, "Rejected map must not be null");
        int total = records.size() + rejected.size();
        for (Integer position : rejected.keySet()) {
            if (position == null || position < 0 || position >= total) {
                throw new IllegalArgumentException("Rejected position " + position
                        + " is outside a batch of " + total);
            }
        }
        long start = System.nanoTime();
        List<String> warnings = new ArrayList<>();
        List<DetectionResult> results = new ArrayList<>(total);

        lock.lock();
        try {
            ensureOpen();
        } finally {
            lock.unlock();
        }

        int next = 0;
        for (int i = 0; i < total; i++) {
            DetectionResult result = rejected.containsKey(i)
                    ? reject(i, rejected.get(i))
                    : ingestOne(i, records.get(next++), thresholdOverride, warnings);
            if (result == null) {
                warnings.add("Detector closed during ingest, " + (total - i) + " record(s) not processed");
                break;
            }
            results.add(result);
        }

        lock.lock();
        try {
            warnings.addAll(pendingWarnings);
            pendingWarnings.clear();
            ModelSnapshot current = active.get();
            return new IngestResult(status, results,
                    current != null ? current.getVersion() : 0,
                    samplesCollected,
                    samplesUntilReady(),
                    resolveThreshold(thresholdOverride, current),
                    warnings,
                    (System.nanoTime() - start) / 1_000_000.0);
        } finally {
            lock.unlock();
        }
    }

    public IngestResult ingest(List<Record> records) {
        return ingest(records, null);
    }

    private DetectionResult reject(int index, String reason) {
        LOG.warn("Detector [{}] rejected record {}: {}", id, index, reason);
        lock.lock();
        try {
            return DetectionResult.builder()
                    .index(index)
                    .samplesUntilReady(samplesUntilReady())
                    .error(reason)
                    .build();
        } finally {
            lock.unlock();
        }
    }

    /** Returns {@code null} once the detector has been closed. */
    private DetectionResult ingestOne(int index, Record record, Double thresholdOverride,
            List<String> warnings) {
        Objects.requireNonNull(record, "Record at index " + index + " is null");
        ModelSnapshot scoringModel;
        List<Record> window;

        lock.lock();
        try {
            if (closed) {
                return null;
            }
            try {
                encoder.validate(record);
            } catch (SchemaMismatchException e) {
                LOG.warn("Detector [{}] rejected record {}: {}", id, index, e.getMessage());
                return DetectionResult.builder()
                        .index(index)
                        .samplesUntilReady(samplesUntilReady())
                        .error(e.getMessage())
                        .build();
            }

            buffer.append(record);
            samplesCollected++;
            totalProcessed++;

            if (status == DetectorStatus.COLLECTING) {
                if (samplesCollected >= readyAt) {
                    fitInitialModel(warnings);
                }
                if (status == DetectorStatus.COLLECTING) {
                    return DetectionResult.builder()
                            .index(index)
                            .samplesUntilReady(samplesUntilReady())
                            .build();
                }
            } else {
                samplesSinceRetrain++;
                if (status == DetectorStatus.READY && samplesSinceRetrain >= config.getRetrainInterval()) {
                    startRetrain();
                }
            }

            scoringModel = active.get();
            window = buffer.tail(scoringModel.getFeatureSpec().historyRequired());
        } finally {
            lock.unlock();
        }

        return score(index, scoringModel, window, thresholdOverride);
    }

    private DetectionResult score(int index, ModelSnapshot snapshot, List<Record> window,
            Double thresholdOverride) {
        FeatureMatrix features = ColumnarBuffer.features(snapshot.getEncoder(), snapshot.getFeatureSpec(), window);
        double raw = backend.score(new double[][] { features.lastRow() }, snapshot.getModel())[0];
        double normalized = snapshot.getNormalization().transform(raw);
        Double threshold = resolveThreshold(thresholdOverride, snapshot);
        boolean anomaly = threshold != null && normalized >= threshold;
        if (anomaly) {
            LOG.debug("Detector [{}] flagged record {}: raw={} normalized={} threshold={}",
                    id, index, raw, normalized, threshold);
        }
        return DetectionResult.builder()
                .index(index)
                .rawScore(raw)
                .normalizedScore(normalized)
                .anomaly(anomaly)
                .samplesUntilReady(0)
                .modelVersion(snapshot.getVersion())
                .build();
    }

    // ---------------------------------------------------------------
    // Training
    // ---------------------------------------------------------------

    /** Runs under the lock; the only fit that blocks an ingest call. */
    private void fitInitialModel(List<String> warnings) {
        List<Record> records = buffer.all();
        try {
            ModelSnapshot first = train(records, encoder).withVersion(1);
            active.set(first);
            encoder = first.getEncoder();
            status = DetectorStatus.READY;
            samplesSinceRetrain = 0;
            lastTrainedAt = first.getInstalledAt();
            LOG.info("Detector [{}] trained first model on {} record(s) with backend '{}'",
                    id, records.size(), backend.name());
        } catch (RuntimeException e) {
            String message = "Initial fit failed, still collecting: " + e.getMessage();
            warnings.add(message);
            LOG.warn("Detector [{}] {}", id, message);
        }
    }

    /** Runs under the lock. */
    private void startRetrain() {
        List<Record> records = buffer.all();
        FeatureEncoder base = active.get().getEncoder();
        long expectedGeneration = generation;
        status = DetectorStatus.RETRAINING;
        LOG.debug("Detector [{}] starting background retrain on {} record(s)", id, records.size());
        try {
            retrainTask = CompletableFuture.runAsync(
                    () -> retrain(records, base, expectedGeneration), retrainExecutor);
        } catch (RejectedExecutionException e) {
            recordRetrainFailure("retrain could not be scheduled: " + e.getMessage());
        }
    }

    private void retrain(List<Record> records, FeatureEncoder base, long expectedGeneration) {
        ModelSnapshot trained = null;
        String failure = "retrain did not complete";
        try {
            trained = train(records, base);
        } catch (RuntimeException e) {
            failure = e.getMessage();
        } catch (Error e) {
            failure = e.toString();
            throw e;
        } finally {
            completeRetrain(trained, failure, records.size(), expectedGeneration);
        }
    }

    /** Takes the lock; called from the {@code finally} of {@link #retrain}. */
    private void completeRetrain(ModelSnapshot trained, String failure, int trainedOn, long expectedGeneration) {
        lock.lock();
        try {
            if (expectedGeneration != generation || closed) {
                LOG.debug("Detector [{}] dropping retrain result of an earlier generation", id);
                return;
            }
            if (trained != null) {
                ModelSnapshot installed = trained.withVersion(active.get().getVersion() + 1);
                active.set(installed);
                encoder = installed.getEncoder();
                lastTrainedAt = installed.getInstalledAt();
                samplesSinceRetrain = 0;
                status = DetectorStatus.READY;
                LOG.info("Detector [{}] installed model version {} trained on {} record(s)",
                        id, installed.getVersion(), trainedOn);
            } else {
                recordRetrainFailure(failure);
            }
        } finally {
            lock.unlock();
        }
    }

    /** Runs under the lock. */
    private void recordRetrainFailure(String reason) {
        failedRetrains++;
        samplesSinceRetrain = 0;
        status = DetectorStatus.READY;
        int version = active.get().getVersion();
        String warning = "Background retrain failed, keeping model version " + version + ": " + reason;
        pendingWarnings.add(warning);
        LOG.warn("Detector [{}] {}", id, warning);
    }

    private ModelSnapshot train(List<Record> records, FeatureEncoder base) {
        FeatureEncoder fitted = base.fit(records);
        double[][] vectors = ColumnarBuffer.features(fitted, featureSpec, records).toRows();
        FitResult result = backend.fit(vectors, config.getContamination());
        NormalizationState normalization = NormalizationState.fit(normalizationMode, result.getTrainingScores());
        return new ModelSnapshot(result.getModel(), normalization, fitted, featureSpec, 0, Instant.now());
    }

    // ---------------------------------------------------------------
    // Management
    // ---------------------------------------------------------------

    /**
     * Discard the buffer, the model and all counters and return to
     * {@code collecting}. A declared schema is kept, an inferred one is
     * forgotten. An in-flight retrain is cancelled and its result dropped.
     */
    public void reset() {
        lock.lock();
        try {
            ensureOpen();
            cancelRetrain();
            buffer.clear();
            active.set(null);
            encoder = encoder.reset();
            status = DetectorStatus.COLLECTING;
            samplesCollected = 0;
            samplesSinceRetrain = 0;
            totalProcessed = 0;
            failedRetrains = 0;
            lastTrainedAt = null;
            pendingWarnings.clear();
        } finally {
            lock.unlock();
        }
        LOG.info("Detector [{}] reset", id);
    }

    /**
     * Stop the detector: cancels an in-flight retrain and rejects further
     * ingest. Idempotent.
     */
    @Override
    public void close() {
        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            cancelRetrain();
        } finally {
            lock.unlock();
        }
        LOG.info("Detector [{}] closed", id);
    }

    /**
     * Wait for an in-flight background retrain to finish.
     *
     * @return {@code true} if no retrain is running any more
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean awaitRetrain(Duration timeout) throws InterruptedException {
        CompletableFuture<Void> task;
        lock.lock();
        try {
            task = retrainTask;
        } finally {
            lock.unlock();
        }
        if (task == null) {
            return true;
        }
        try {
            task.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (CancellationException e) {
            // cancelled by reset or close: nothing is running for this detector
            return true;
        } catch (ExecutionException e) {
            throw new IllegalStateException("Retrain task of detector '" + id + "' failed", e.getCause());
        }
    }

    /**
     * Capture the active model for persistence.
     *
     * @throws IllegalStateException if no model has been trained yet
     */
    public DetectorSnapshot snapshot() {
        ModelSnapshot current = active.get();
        if (current == null) {
            throw new IllegalStateException("Detector '" + id + "' has no trained model to save");
        }
        Model model = current.getModel();
        DetectorSnapshot snapshot = new DetectorSnapshot();
        snapshot.setId(id);
        snapshot.setBackend(backend.name());
        snapshot.setConfig(config.copy());
        snapshot.setModelParameters(SnapshotCodec.toTree(model.getParameters()));
        snapshot.setRawThreshold(model.getRawThreshold());
        snapshot.setContamination(model.getContamination());
        snapshot.setDimensions(model.getDimensions());
        snapshot.setTrainedOn(model.getTrainedOn());
        snapshot.setFittedAt(model.getFittedAt());
        snapshot.setNormalization(current.getNormalization());
        snapshot.setEncoder(current.getEncoder().state());
        snapshot.setWindowSize(config.getWindowSize());
        snapshot.setModelVersion(current.getVersion());
        snapshot.setSavedAt(Instant.now());
        return snapshot;
    }

    public DetectorStats stats() {
        lock.lock();
        try {
            ModelSnapshot current = active.get();
            return DetectorStats.builder()
                    .id(id)
                    .backend(backend.name())
                    .status(status)
                    .modelVersion(current != null ? current.getVersion() : 0)
                    .samplesCollected(samplesCollected)
                    .bufferSize(buffer.size())
                    .totalProcessed(totalProcessed)
                    .samplesSinceRetrain(samplesSinceRetrain)
                    .samplesUntilReady(samplesUntilReady())
                    .minSamples(config.getMinSamples())
                    .retrainInterval(config.getRetrainInterval())
                    .windowSize(config.getWindowSize())
                    .threshold(resolveThreshold(null, current))
                    .normalization(normalizationMode.value())
                    .failedRetrains(failedRetrains)
                    .createdAt(createdAt)
                    .lastTrainedAt(lastTrainedAt)
                    .build();
        } finally {
            lock.unlock();
        }
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    public String getId() {
        return id;
    }

    /**
     * @return a copy of the effective configuration
     */
    public DetectorConfig getConfig() {
        return config.copy();
    }

    public String getBackendName() {
        return backend.name();
    }

    public DetectorStatus getStatus() {
        lock.lock();
        try {
            return status;
        } finally {
            lock.unlock();
        }
    }

    public int getModelVersion() {
        ModelSnapshot current = active.get();
        return current != null ? current.getVersion() : 0;
    }

    public Optional<ModelSnapshot> activeModel() {
        return Optional.ofNullable(active.get());
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private int samplesUntilReady() {
        if (status != DetectorStatus.COLLECTING) {
            return 0;
        }
        return (int) Math.max(0, readyAt - samplesCollected);
    }

    private Double resolveThreshold(Double override, ModelSnapshot snapshot) {
        if (snapshot == null) {
            return NormalizationState.resolveThreshold(normalizationMode, override, config.getThreshold(), null);
        }
        return snapshot.getNormalization().resolveThreshold(override, config.getThreshold(), snapshot.getModel());
    }

    private void cancelRetrain() {
        generation++;
        if (retrainTask != null) {
            retrainTask.cancel(false);
            retrainTask = null;
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Detector '" + id + "' is closed");
        }
    }

    @Override
    public String toString() {
        return "StreamingDetector{id='" + id + "', backend='" + backend.name() + "', status="
                + getStatus() + ", modelVersion=" + getModelVersion() + '}';
    }
}
