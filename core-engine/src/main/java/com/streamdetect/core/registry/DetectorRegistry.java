package com.streamdetect.core.registry;

import com.streamdetect.core.backend.BackendRegistry;
import com.streamdetect.core.config.DetectorConfig;
import com.streamdetect.core.detection.StreamingDetector;
import com.streamdetect.core.error.DetectorAlreadyExistsException;
import com.streamdetect.core.error.DetectorNotFoundException;
import com.streamdetect.core.model.DetectorStats;
import com.streamdetect.core.model.IngestResult;
import com.streamdetect.core.model.Record;
import com.streamdetect.core.persistence.DetectorSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Concurrent catalog of named {@link StreamingDetector}s sharing one retrain
 * executor.
 *
 * <p>
 * Operations on different ids never block each other. A detector is fully
 * built and validated before it is published, so a failed creation (invalid
 * configuration, unknown backend, id already taken) leaves nothing behind.
 * </p>
 *
 * <h3>Retrain threads</h3>
 * <p>
 * Background fits run on daemon threads named {@code detector-retrain-N}: a
 * cached pool by default, or a fixed pool when a thread count is given.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectorRegistry implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(DetectorRegistry.class);

    private static final long SHUTDOWN_TIMEOUT_SECONDS = 10;

    private final ConcurrentMap<String, StreamingDetector> detectors = new ConcurrentHashMap<>();
    private final BackendRegistry backends;
    private final ExecutorService retrainExecutor;
    private volatile boolean closed;

    /**
     * Registry with the built-in backends and a cached retrain pool.
     */
    public DetectorRegistry() {
        this(BackendRegistry.withDefaults(), 0);
    }

    /**
     * @param backends       backend catalog
     * @param retrainThreads size of the retrain pool, {@code 0} for a cached
     *                       pool
     */
    public DetectorRegistry(BackendRegistry backends, int retrainThreads) {
        this(backends, createExecutor(retrainThreads));
    }

    /**
     * @param backends        backend catalog
     * @param retrainExecutor executor for background retrains; shut down by
     *                        {@link #close()}
     */
    public DetectorRegistry(BackendRegistry backends, ExecutorService retrainExecutor) {
        this.backends = Objects.requireNonNull(backends, "BackendRegistry must not be null");
        this.retrainExecutor = Objects.requireNonNull(retrainExecutor, "Retrain executor must not be null");
    }

    // ---------------------------------------------------------------
    // Creation and lookup
    // ---------------------------------------------------------------

    /**
     * Create and register a detector.
     *
     * @throws DetectorAlreadyExistsException if {@code id} is taken
     * @throws com.streamdetect.core.error.InvalidConfigException if the
     *                                        configuration is invalid
     * @throws com.streamdetect.core.error.BackendUnavailableException if the
     *                                        backend is unknown
     */
    public StreamingDetector create(String id, DetectorConfig config) {
        ensureOpen();
        if (detectors.containsKey(id)) {
            throw new DetectorAlreadyExistsException(id);
        }
        StreamingDetector detector = new StreamingDetector(id, config, backends, retrainExecutor);
        StreamingDetector existing = detectors.putIfAbsent(id, detector);
        if (existing != null) {
            detector.close();
            throw new DetectorAlreadyExistsException(id);
        }
        LOG.info("Created detector '{}' (backend={}, minSamples={}, retrainInterval={}, windowSize={})",
                id, detector.getBackendName(), config.getMinSamples(), config.getRetrainInterval(),
                config.getWindowSize());
        return detector;
    }

    /**
     * Return the detector registered under {@code id}, creating it with
     * {@code config} if there is none. An existing detector keeps its own
     * configuration.
     */
    public StreamingDetector getOrCreate(String id, DetectorConfig config) {
        StreamingDetector existing = detectors.get(id);
        if (existing != null) {
            return existing;
        }
        try {
            return create(id, config);
        } catch (DetectorAlreadyExistsException e) {
            // lost a creation race
            return require(id);
        }
    }

    public Optional<StreamingDetector> get(String id) {
        return Optional.ofNullable(detectors.get(id));
    }

    /**
     * @throws DetectorNotFoundException if there is no detector {@code id}
     */
    public StreamingDetector require(String id) {
        StreamingDetector detector = detectors.get(id);
        if (detector == null) {
            throw new DetectorNotFoundException(id);
        }
        return detector;
    }

    /**
     * @return stats of every detector, sorted by id
     */
    public List<DetectorStats> list() {
        List<DetectorStats> stats = new ArrayList<>();
        for (StreamingDetector detector : detectors.values()) {
            stats.add(detector.stats());
        }
        stats.sort(Comparator.comparing(DetectorStats::getId));
        return stats;
    }

    public int size() {
        return detectors.size();
    }

    // ---------------------------------------------------------------
    // Per-detector operations
    // ---------------------------------------------------------------

    /**
     * @throws DetectorNotFoundException if there is no detector {@code id}
     */
    public IngestResult ingest(String id, List<Record> records, Double thresholdOverride) {
        return require(id).ingest(records, thresholdOverride);
    }

    /**
     * @throws DetectorNotFoundException if there is no detector {@code id}
     */
    public void reset(String id) {
        require(id).reset();
    }

    /**
     * Remove and close a detector.
     *
     * @return {@code true} if a detector was removed
     */
    public boolean delete(String id) {
        StreamingDetector removed = detectors.remove(id);
        if (removed == null) {
            return false;
        }
        removed.close();
        LOG.info("Deleted detector '{}'", id);
        return true;
    }

    /**
     * @throws DetectorNotFoundException if there is no detector {@code id}
     * @throws IllegalStateException     if it has no trained model yet
     */
    public DetectorSnapshot snapshot(String id) {
        return require(id).snapshot();
    }

    /**
     * Register a detector rebuilt from a snapshot.
     *
     * @throws DetectorAlreadyExistsException if the snapshot's id is taken
     */
    public StreamingDetector restore(DetectorSnapshot snapshot) {
        ensureOpen();
        Objects.requireNonNull(snapshot, "Snapshot must not be null");
        if (detectors.containsKey(snapshot.getId())) {
            throw new DetectorAlreadyExistsException(snapshot.getId());
        }
        StreamingDetector detector = StreamingDetector.restore(snapshot, backends, retrainExecutor);
        StreamingDetector existing = detectors.putIfAbsent(snapshot.getId(), detector);
        if (existing != null) {
            detector.close();
            throw new DetectorAlreadyExistsException(snapshot.getId());
        }
        return detector;
    }

    public BackendRegistry getBackends() {
        return backends;
    }

    // ---------------------------------------------------------------
    // Shutdown
    // ---------------------------------------------------------------

    /**
     * Close every detector and stop the retrain executor. Idempotent.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        for (StreamingDetector detector : detectors.values()) {
            detector.close();
        }
        detectors.clear();
        retrainExecutor.shutdownNow();
        try {
            if (!retrainExecutor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                LOG.warn("Retrain executor did not terminate within {}s", SHUTDOWN_TIMEOUT_SECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        LOG.info("Detector registry closed");
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Detector registry is closed");
        }
    }

    static ExecutorService createExecutor(int threads) {
        if (threads < 0) {
            throw new IllegalArgumentException("retrainThreads must be >= 0, got: " + threads);
        }
        ThreadFactory factory = daemonThreadFactory();
        return threads == 0
                ? Executors.newCachedThreadPool(factory)
                : Executors.newFixedThreadPool(threads, factory);
    }

    private static ThreadFactory daemonThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "detector-retrain-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
