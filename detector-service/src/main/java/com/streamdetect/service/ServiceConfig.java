package com.streamdetect.service;

import java.nio.file.Path;

/**
 * Typed, immutable configuration of the detector service.
 *
 * <p>
 * Values are resolved from environment variables with defaults:
 * </p>
 * <ul>
 * <li>{@code MODEL_STORE_DIR} (default {@code models}): directory of saved
 * detectors</li>
 * <li>{@code RESTORE_ON_START} (default {@code true}): restore every saved
 * detector at startup</li>
 * <li>{@code AUTOSAVE_ON_SHUTDOWN} (default {@code true}): save every trained
 * detector when the service closes</li>
 * <li>{@code DETECTOR_CONFIG_PATH} (default empty): engine YAML file; empty
 * falls back to the classpath</li>
 * </ul>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for production, or the {@link Builder}
 * for programmatic / test scenarios. The builder validates inputs at
 * {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class ServiceConfig {

    private final Path modelStoreDir;
    private final boolean restoreOnStart;
    private final boolean autosaveOnShutdown;
    private final String engineConfigPath;

    private ServiceConfig(Builder b) {
        this.modelStoreDir = b.modelStoreDir;
        this.restoreOnStart = b.restoreOnStart;
        this.autosaveOnShutdown = b.autosaveOnShutdown;
        this.engineConfigPath = b.engineConfigPath;
    }

    /**
     * Build a {@link ServiceConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalArgumentException if a value is invalid
     */
    public static ServiceConfig fromEnvironment() {
        return new Builder()
                .modelStoreDir(Path.of(env("MODEL_STORE_DIR", "models")))
                .restoreOnStart(parseBooleanEnv("RESTORE_ON_START", "true"))
                .autosaveOnShutdown(parseBooleanEnv("AUTOSAVE_ON_SHUTDOWN", "true"))
                .engineConfigPath(env("DETECTOR_CONFIG_PATH", ""))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public Path getModelStoreDir() {
        return modelStoreDir;
    }

    public boolean isRestoreOnStart() {
        return restoreOnStart;
    }

    public boolean isAutosaveOnShutdown() {
        return autosaveOnShutdown;
    }

    /**
     * @return explicit engine configuration file, empty for automatic
     *         resolution
     */
    public String getEngineConfigPath() {
        return engineConfigPath;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link ServiceConfig}.
     */
    public static class Builder {
        private Path modelStoreDir = Path.of("models");
        private boolean restoreOnStart = true;
        private boolean autosaveOnShutdown = true;
        private String engineConfigPath = "";

        public Builder modelStoreDir(Path v) {
            this.modelStoreDir = v;
            return this;
        }

        public Builder restoreOnStart(boolean v) {
            this.restoreOnStart = v;
            return this;
        }

        public Builder autosaveOnShutdown(boolean v) {
            this.autosaveOnShutdown = v;
            return this;
        }

        public Builder engineConfigPath(String v) {
            this.engineConfigPath = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link ServiceConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public ServiceConfig build() {
            if (modelStoreDir == null || modelStoreDir.toString().isBlank()) {
                throw new IllegalArgumentException("modelStoreDir must not be null or blank");
            }
            if (engineConfigPath == null) {
                engineConfigPath = "";
            }
            return new ServiceConfig(this);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(String name, String defaultValue) {
        String value = System.getenv(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    private static boolean parseBooleanEnv(String name, String defaultValue) {
        String value = env(name, defaultValue).trim();
        if (value.equalsIgnoreCase("true")) {
            return true;
        }
        if (value.equalsIgnoreCase("false")) {
            return false;
        }
        throw new IllegalArgumentException(name + " must be 'true' or 'false', got: " + value);
    }

    @Override
    public String toString() {
        return "ServiceConfig{" +
                "modelStoreDir=" + modelStoreDir +
                ", restoreOnStart=" + restoreOnStart +
                ", autosaveOnShutdown=" + autosaveOnShutdown +
                ", engineConfigPath='" + engineConfigPath + '\'' +
                '}';
    }
}
