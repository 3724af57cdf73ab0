package com.streamdetect.core.backend;

import com.streamdetect.core.error.BackendUnavailableException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link BackendRegistry}.
 */
class BackendRegistryTest {

    @Test
    @DisplayName("Should register every built-in backend")
    void shouldRegisterDefaults() {
        BackendRegistry registry = BackendRegistry.withDefaults();

        assertThat(registry.names()).containsExactly(
                "ecod", "elliptic_envelope", "hbos", "isolation_forest", "knn",
                "local_outlier_factor", "rcf", "reconstruction");
        assertThat(BackendRegistry.DEFAULT_BACKEND).isEqualTo("ecod");
    }

    @Test
    @DisplayName("Should resolve aliases to their canonical names regardless of case")
    void shouldResolveAliases() {
        BackendRegistry registry = BackendRegistry.withDefaults();

        assertThat(registry.resolve("iforest")).isEqualTo("isolation_forest");
        assertThat(registry.resolve("LOF")).isEqualTo("local_outlier_factor");
        assertThat(registry.resolve(" mcd ")).isEqualTo("elliptic_envelope");
        assertThat(registry.resolve("autoencoder")).isEqualTo("reconstruction");
        assertThat(registry.resolve("pca")).isEqualTo("reconstruction");
        assertThat(registry.resolve("random_cut_forest")).isEqualTo("rcf");
        assertThat(registry.create("iforest").name()).isEqualTo("isolation_forest");
    }

    @Test
    @DisplayName("Should report an unknown backend with the supported names")
    void shouldRejectUnknownBackend() {
        BackendRegistry registry = BackendRegistry.withDefaults();

        assertThat(registry.isAvailable("deep_svdd")).isFalse();
        assertThatThrownBy(() -> registry.create("deep_svdd"))
                .isInstanceOf(BackendUnavailableException.class)
                .hasMessageContaining("deep_svdd")
                .hasMessageContaining("ecod");
    }

    @Test
    @DisplayName("Should accept a custom backend registered at runtime")
    void shouldRegisterCustomBackend() {
        BackendRegistry registry = BackendRegistry.empty();
        registry.register("custom_knn", () -> new KnnBackend(), "neighbours");

        assertThat(registry.isAvailable("neighbours")).isTrue();
        assertThat(registry.create("custom_knn")).isInstanceOf(KnnBackend.class);
        assertThat(registry.names()).containsExactly("custom_knn");
    }

    @Test
    @DisplayName("Should hand out a fresh adapter per call")
    void shouldCreateFreshAdapters() {
        BackendRegistry registry = BackendRegistry.withDefaults();

        assertThat(registry.create("ecod")).isNotSameAs(registry.create("ecod"));
    }
}
