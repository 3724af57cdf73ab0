package com.streamdetect.core.normalize;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.streamdetect.core.backend.Model;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;

import java.util.Objects;

/**
 * Maps raw backend scores onto the detector's reporting scale.
 *
 * <p>
 * Computed once per fit from the training raw scores and paired with the
 * model it was computed for:
 * </p>
 * <ul>
 * <li>{@code standardization}: centre is the median, scale the interquartile
 * range; {@code sigmoid((raw - centre) / (scale + eps))}, kept strictly
 * inside (0, 1).</li>
 * <li>{@code zscore}: centre is the mean, scale the population standard
 * deviation; {@code (raw - centre) / (scale + eps)}.</li>
 * <li>{@code raw}: identity.</li>
 * </ul>
 * <p>
 * A scale of zero is replaced by {@code 1.0}.
 * </p>
 *
 * @since 1.0.0
 */
public final class NormalizationState {

    static final double EPSILON = 1e-9;

    private static final double LOWEST = Double.MIN_NORMAL;
    private static final double HIGHEST = Math.nextDown(1.0);

    private final NormalizationMode mode;
    private final double centre;
    private final double scale;

    @JsonCreator
    public NormalizationState(@JsonProperty("mode") NormalizationMode mode,
            @JsonProperty("centre") double centre,
            @JsonProperty("scale") double scale) {
        this.mode = Objects.requireNonNull(mode, "Normalization mode must not be null");
        this.centre = centre;
        this.scale = scale;
    }

    /**
     * Compute the state for a freshly fitted model.
     *
     * @param mode           reporting scale
     * @param trainingScores raw scores of the training rows; must not be empty
     * @return the state
     */
    public static NormalizationState fit(NormalizationMode mode, double[] trainingScores) {
        Objects.requireNonNull(mode, "Normalization mode must not be null");
        Objects.requireNonNull(trainingScores, "Training scores must not be null");
        if (trainingScores.length == 0) {
            throw new IllegalArgumentException("Training scores must not be empty");
        }
        return switch (mode) {
            case STANDARDIZATION -> {
                Percentile percentile = new Percentile()
                        .withEstimationType(Percentile.EstimationType.R_7);
                percentile.setData(trainingScores);
                double median = percentile.evaluate(50.0);
                double iqr = percentile.evaluate(75.0) - percentile.evaluate(25.0);
                yield new NormalizationState(mode, median, spread(iqr));
            }
            case ZSCORE -> {
                double mean = StatUtils.mean(trainingScores);
                double std = Math.sqrt(StatUtils.populationVariance(trainingScores, mean));
                yield new NormalizationState(mode, mean, spread(std));
            }
            case RAW -> new NormalizationState(mode, 0.0, 1.0);
        };
    }

    /**
     * @param raw backend raw score
     * @return the score on this state's scale
     */
    public double transform(double raw) {
        return switch (mode) {
            case STANDARDIZATION -> {
                double z = (raw - centre) / (scale + EPSILON);
                double sigmoid = 1.0 / (1.0 + Math.exp(-z));
                yield Math.min(HIGHEST, Math.max(LOWEST, sigmoid));
            }
            case ZSCORE -> (raw - centre) / (scale + EPSILON);
            case RAW -> raw;
        };
    }

    public double[] transform(double[] raw) {
        double[] out = new double[raw.length];
        for (int i = 0; i < raw.length; i++) {
            out[i] = transform(raw[i]);
        }
        return out;
    }

    /**
     * Resolve the operational threshold: per-call override, then the
     * configured threshold, then this mode's default (for {@code raw}, the
     * model's contamination-calibrated raw threshold).
     *
     * @param override   per-call threshold, may be {@code null}
     * @param configured detector threshold, may be {@code null}
     * @param model      active model, may be {@code null} before the first fit
     * @return the threshold, or {@code null} if none can be resolved yet
     */
    public Double resolveThreshold(Double override, Double configured, Model model) {
        return resolveThreshold(mode, override, configured, model);
    }

    /**
     * Same resolution as {@link #resolveThreshold(Double, Double, Model)} for a
     * detector that has no state yet.
     */
    public static Double resolveThreshold(NormalizationMode mode, Double override, Double configured,
            Model model) {
        if (override != null) {
            return override;
        }
        if (configured != null) {
            return configured;
        }
        if (mode == NormalizationMode.RAW) {
            return model != null ? model.getRawThreshold() : null;
        }
        return mode.defaultThreshold();
    }

    public NormalizationMode getMode() {
        return mode;
    }

    public double getCentre() {
        return centre;
    }

    public double getScale() {
        return scale;
    }

    private static double spread(double value) {
        return value > 0.0 && Double.isFinite(value) ? value : 1.0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof NormalizationState that))
            return false;
        return mode == that.mode
                && Double.compare(centre, that.centre) == 0
                && Double.compare(scale, that.scale) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(mode, centre, scale);
    }

    @Override
    public String toString() {
        return "NormalizationState{mode=" + mode.value() + ", centre=" + centre + ", scale=" + scale + '}';
    }
}
