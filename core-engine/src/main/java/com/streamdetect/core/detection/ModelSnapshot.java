package com.streamdetect.core.detection;

import com.streamdetect.core.backend.Model;
import com.streamdetect.core.buffer.FeatureSpec;
import com.streamdetect.core.encoding.FeatureEncoder;
import com.streamdetect.core.normalize.NormalizationState;

import java.time.Instant;
import java.util.Objects;

/**
 * Everything scoring needs, published as one unit: the model, the
 * normalization state computed with it, the encoder whose dictionaries it was
 * trained with, the feature layout and the model version.
 *
 * <p>
 * Immutable. A detector swaps the whole snapshot in a single reference
 * update, so a reader sees either the old model with its old encoder or the
 * new model with its new encoder, never a mix.
 * </p>
 */
public final class ModelSnapshot {

    private final Model model;
    private final NormalizationState normalization;
    private final FeatureEncoder encoder;
    private final FeatureSpec featureSpec;
    private final int version;
    private final Instant installedAt;

    public ModelSnapshot(Model model, NormalizationState normalization, FeatureEncoder encoder,
            FeatureSpec featureSpec, int version, Instant installedAt) {
        this.model = Objects.requireNonNull(model, "Model must not be null");
        this.normalization = Objects.requireNonNull(normalization, "Normalization must not be null");
        this.encoder = Objects.requireNonNull(encoder, "Encoder must not be null");
        this.featureSpec = Objects.requireNonNull(featureSpec, "FeatureSpec must not be null");
        this.version = version;
        this.installedAt = Objects.requireNonNull(installedAt, "installedAt must not be null");
    }

    /**
     * @return a copy of this snapshot carrying another version number
     */
    ModelSnapshot withVersion(int newVersion) {
        return new ModelSnapshot(model, normalization, encoder, featureSpec, newVersion, Instant.now());
    }

    public Model getModel() {
        return model;
    }

    public NormalizationState getNormalization() {
        return normalization;
    }

    public FeatureEncoder getEncoder() {
        return encoder;
    }

    public FeatureSpec getFeatureSpec() {
        return featureSpec;
    }

    public int getVersion() {
        return version;
    }

    public Instant getInstalledAt() {
        return installedAt;
    }

    @Override
    public String toString() {
        return "ModelSnapshot{version=" + version + ", model=" + model + ", normalization="
                + normalization + '}';
    }
}
