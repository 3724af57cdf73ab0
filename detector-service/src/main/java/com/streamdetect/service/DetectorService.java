package com.streamdetect.service;

import com.streamdetect.core.backend.BackendRegistry;
import com.streamdetect.core.config.DetectorDefinition;
import com.streamdetect.core.config.EngineConfig;
import com.streamdetect.core.config.EngineConfigLoader;
import com.streamdetect.core.detection.StreamingDetector;
import com.streamdetect.core.error.DetectorAlreadyExistsException;
import com.streamdetect.core.error.DetectorNotFoundException;
import com.streamdetect.core.model.DetectorStats;
import com.streamdetect.core.model.IngestResult;
import com.streamdetect.core.persistence.DetectorSnapshot;
import com.streamdetect.core.persistence.JsonModelStore;
import com.streamdetect.core.registry.DetectorRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Serving layer over a {@link DetectorRegistry}.
 *
 * <h3>Lifecycle</h3>
 * <ol>
 * <li>{@link #start(ServiceConfig)} loads the engine configuration, restores
 * saved detectors from the model store and creates the predefined ones that
 * were not restored</li>
 * <li>Requests are handled concurrently; each one touches a single
 * detector</li>
 * <li>{@link #close()} saves every trained detector (when autosave is on) and
 * closes the registry</li>
 * </ol>
 *
 * <p>
 * The HTTP transport is not part of this class: {@link #handleIngest(String)}
 * is the JSON-in / JSON-out entry point a transport binds to.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectorService implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(DetectorService.class);

    private final ServiceConfig config;
    private final DetectorRegistry registry;
    private final JsonModelStore store;
    private final RequestCodec codec = new RequestCodec();

    DetectorService(ServiceConfig config, DetectorRegistry registry, JsonModelStore store) {
        this.config = Objects.requireNonNull(config, "ServiceConfig must not be null");
        this.registry = Objects.requireNonNull(registry, "DetectorRegistry must not be null");
        this.store = Objects.requireNonNull(store, "JsonModelStore must not be null");
    }

    /**
     * Start a service from environment configuration.
     */
    public static DetectorService fromEnvironment() {
        return start(ServiceConfig.fromEnvironment());
    }

    /**
     * Start a service: load the engine configuration, then restore and create
     * detectors.
     *
     * @throws com.streamdetect.core.error.InvalidConfigException if the engine
     *                                                           configuration is
     *                                                           invalid
     */
    public static DetectorService start(ServiceConfig config) {
        LOG.info("Starting detector service with config: {}", config);

        // 1. Engine configuration
        EngineConfig engineConfig = config.getEngineConfigPath().isBlank()
                ? EngineConfigLoader.load()
                : EngineConfigLoader.fromFile(config.getEngineConfigPath());

        // 2. Registry + store
        DetectorRegistry registry = new DetectorRegistry(BackendRegistry.withDefaults(),
                engineConfig.getRetrainThreads());
        JsonModelStore store = new JsonModelStore(config.getModelStoreDir());
        DetectorService service = new DetectorService(config, registry, store);

        // 3. Saved detectors first, so a trained model wins over a fresh definition
        if (config.isRestoreOnStart()) {
            service.restoreAll();
        }

        // 4. Predefined detectors
        for (DetectorDefinition definition : engineConfig.getDetectors()) {
            if (registry.get(definition.getId()).isPresent()) {
                LOG.info("Detector '{}' restored from store; skipping its definition", definition.getId());
                continue;
            }
            registry.create(definition.getId(), definition.toConfig());
        }

        LOG.info("Detector service started with {} detector(s)", registry.size());
        return service;
    }

    // ---------------------------------------------------------------
    // Ingest
    // ---------------------------------------------------------------

    /**
     * Ingest the request's records into the detector it names, creating the
     * detector from the request's settings if it does not exist. Elements of
     * {@code data} that are not valid records come back as results with an
     * {@code error}; the rest of the batch is still ingested.
     *
     * @throws IllegalArgumentException if the request is malformed, its
     *                                  settings are invalid or its backend is
     *                                  unknown
     */
    public StreamIngestResponse ingest(StreamIngestRequest request) {
        Objects.requireNonNull(request, "Request must not be null");
        String model = request.getModel();
        if (model == null || model.isBlank()) {
            throw new IllegalArgumentException("'model' is required");
        }
        ParsedData data = codec.parseData(request.getData());
        StreamingDetector detector = registry.getOrCreate(model, request.toDetectorConfig());
        IngestResult result = detector.ingest(data.getRecords(), data.getRejected(), request.getThreshold());
        return new StreamIngestResponse(model, result);
    }

    /**
     * JSON entry point: parse the request, ingest and serialise the response.
     */
    public String handleIngest(String json) {
        return codec.write(ingest(codec.readRequest(json)));
    }

    // ---------------------------------------------------------------
    // Management
    // ---------------------------------------------------------------

    public List<DetectorSummary> listDetectors() {
        return registry.list().stream().map(DetectorSummary::new).toList();
    }

    /**
     * @throws DetectorNotFoundException if there is no detector {@code id}
     */
    public DetectorStats stats(String id) {
        return registry.require(id).stats();
    }

    /**
     * @throws DetectorNotFoundException if there is no detector {@code id}
     */
    public void reset(String id) {
        registry.reset(id);
    }

    /**
     * Remove a detector and its saved model.
     *
     * @return {@code true} if a live detector or a saved model was removed
     */
    public boolean delete(String id) {
        boolean removed = registry.delete(id);
        boolean deletedFile = store.delete(id);
        return removed || deletedFile;
    }

    /**
     * Persist one detector.
     *
     * @throws DetectorNotFoundException if there is no detector {@code id}
     * @throws IllegalStateException     if it has no trained model yet
     */
    public DetectorSnapshot save(String id) {
        DetectorSnapshot snapshot = registry.snapshot(id);
        store.save(snapshot);
        LOG.info("Saved detector '{}' (model version {})", id, snapshot.getModelVersion());
        return snapshot;
    }

    /**
     * Persist every detector that has a trained model.
     *
     * @return number of detectors saved
     */
    public int saveAll() {
        int saved = 0;
        for (DetectorStats stats : registry.list()) {
            if (!stats.isReady()) {
                LOG.debug("Skipping save of detector '{}' in state {}", stats.getId(), stats.getStatus());
                continue;
            }
            try {
                save(stats.getId());
                saved++;
            } catch (DetectorNotFoundException e) {
                LOG.debug("Detector '{}' was deleted before it could be saved", stats.getId());
            } catch (IllegalStateException e) {
                LOG.warn("Could not save detector '{}': {}", stats.getId(), e.getMessage());
            }
        }
        return saved;
    }

    public Optional<StreamingDetector> detector(String id) {
        return registry.get(id);
    }

    public ServiceConfig getConfig() {
        return config;
    }

    // ---------------------------------------------------------------
    // Shutdown
    // ---------------------------------------------------------------

    @Override
    public void close() {
        if (config.isAutosaveOnShutdown()) {
            int saved = saveAll();
            LOG.info("Saved {} detector(s) on shutdown", saved);
        }
        registry.close();
        LOG.info("Detector service stopped");
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private void restoreAll() {
        for (String id : store.list()) {
            Optional<DetectorSnapshot> snapshot = store.load(id);
            if (snapshot.isEmpty()) {
                continue;
            }
            try {
                registry.restore(snapshot.get());
                LOG.info("Restored detector '{}' at model version {}", id, snapshot.get().getModelVersion());
            } catch (DetectorAlreadyExistsException e) {
                LOG.warn("Detector '{}' already registered; saved model not restored", id);
            } catch (IllegalArgumentException | IllegalStateException e) {
                LOG.warn("Saved model for detector '{}' could not be restored: {}", id, e.getMessage());
            }
        }
    }
}
