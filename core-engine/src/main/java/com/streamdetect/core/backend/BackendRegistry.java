package com.streamdetect.core.backend;

import com.streamdetect.core.error.BackendUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Name-based catalog of {@link BackendAdapter} suppliers.
 *
 * <p>
 * Names are case-insensitive; aliases resolve to the canonical name. The
 * {@linkplain #withDefaults() default registry} contains:
 * </p>
 * <ul>
 * <li>{@code ecod} (the default backend)</li>
 * <li>{@code hbos}</li>
 * <li>{@code isolation_forest}, alias {@code iforest}</li>
 * <li>{@code rcf}, alias {@code random_cut_forest}</li>
 * <li>{@code local_outlier_factor}, alias {@code lof}</li>
 * <li>{@code knn}</li>
 * <li>{@code elliptic_envelope}, alias {@code mcd}</li>
 * <li>{@code reconstruction}, aliases {@code autoencoder} and {@code pca}</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class BackendRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(BackendRegistry.class);

    /** Backend used when a configuration does not name one. */
    public static final String DEFAULT_BACKEND = EcodBackend.NAME;

    private final Map<String, Supplier<? extends BackendAdapter>> suppliers = new ConcurrentHashMap<>();
    private final Map<String, String> aliases = new ConcurrentHashMap<>();

    /**
     * @return an empty registry
     */
    public static BackendRegistry empty() {
        return new BackendRegistry();
    }

    /**
     * @return a registry with every built-in backend
     */
    public static BackendRegistry withDefaults() {
        BackendRegistry registry = new BackendRegistry();
        registry.register(EcodBackend.NAME, EcodBackend::new);
        registry.register(HbosBackend.NAME, HbosBackend::new);
        registry.register(IsolationForestBackend.NAME, IsolationForestBackend::new, "iforest");
        registry.register(RandomCutForestBackend.NAME, RandomCutForestBackend::new, "random_cut_forest");
        registry.register(LocalOutlierFactorBackend.NAME, LocalOutlierFactorBackend::new, "lof");
        registry.register(KnnBackend.NAME, KnnBackend::new);
        registry.register(EllipticEnvelopeBackend.NAME, EllipticEnvelopeBackend::new, "mcd");
        registry.register(ReconstructionBackend.NAME, ReconstructionBackend::new, "autoencoder", "pca");
        return registry;
    }

    /**
     * Register a backend under a canonical name and optional aliases. A later
     * registration of the same name replaces the earlier one.
     *
     * @param name     canonical name; must not be blank
     * @param supplier creates a fresh adapter
     * @param aliases  alternative names
     */
    public void register(String name, Supplier<? extends BackendAdapter> supplier, String... aliases) {
        Objects.requireNonNull(supplier, "Backend supplier must not be null");
        String canonical = normalize(name);
        if (canonical.isEmpty()) {
            throw new IllegalArgumentException("Backend name must not be blank");
        }
        suppliers.put(canonical, supplier);
        this.aliases.put(canonical, canonical);
        for (String alias : aliases) {
            this.aliases.put(normalize(alias), canonical);
        }
        LOG.debug("Registered backend '{}' (aliases: {})", canonical, String.join(", ", aliases));
    }

    /**
     * Resolve a name or alias to its canonical backend name.
     *
     * @throws BackendUnavailableException if nothing is registered under it
     */
    public String resolve(String name) {
        String canonical = aliases.get(normalize(name));
        if (canonical == null) {
            throw new BackendUnavailableException(name, names());
        }
        return canonical;
    }

    /**
     * Create an adapter by name or alias.
     *
     * @throws BackendUnavailableException if nothing is registered under it
     */
    public BackendAdapter create(String name) {
        return suppliers.get(resolve(name)).get();
    }

    public boolean isAvailable(String name) {
        return aliases.containsKey(normalize(name));
    }

    /**
     * @return canonical names, sorted
     */
    public Set<String> names() {
        return new TreeSet<>(suppliers.keySet());
    }

    private static String normalize(String name) {
        return name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
    }
}
