package com.streamdetect.core.backend;

import com.streamdetect.core.error.FitFailedException;
import com.streamdetect.core.error.InsufficientDataException;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Objects;

/**
 * Base class handling the parts every backend shares: input validation,
 * threshold calibration and model bookkeeping.
 *
 * <p>
 * Subclasses implement {@link #train} and {@link #compute}. After training,
 * the training rows are scored with the new parameters and the raw threshold
 * is set to the {@code (1 - contamination)} percentile of those scores
 * (linear interpolation, estimation type R-7), so that rescoring the training
 * set flags roughly a {@code contamination} fraction of it.
 * </p>
 *
 * @param <P> backend parameter type
 * @since 1.0.0
 */
public abstract class AbstractBackendAdapter<P> implements BackendAdapter {

    private static final Logger LOG = LoggerFactory.getLogger(AbstractBackendAdapter.class);

    /** Largest accepted contamination. */
    public static final double MAX_CONTAMINATION = 0.5;

    private final String name;
    private final int minimumSamples;
    private final Class<P> parametersType;

    protected AbstractBackendAdapter(String name, int minimumSamples, Class<P> parametersType) {
        this.name = Objects.requireNonNull(name, "Backend name must not be null");
        this.minimumSamples = minimumSamples;
        this.parametersType = Objects.requireNonNull(parametersType, "Parameters type must not be null");
    }

    @Override
    public final String name() {
        return name;
    }

    @Override
    public final int minimumSamples() {
        return minimumSamples;
    }

    @Override
    public final Class<P> parametersType() {
        return parametersType;
    }

    @Override
    public final FitResult fit(double[][] vectors, double contamination) {
        validateContamination(contamination);
        int dimensions = validateVectors(vectors);
        if (vectors.length < minimumSamples) {
            throw new InsufficientDataException(name, vectors.length, minimumSamples);
        }

        P parameters;
        double[] trainingScores;
        try {
            parameters = train(vectors, contamination);
            trainingScores = compute(vectors, parameters);
        } catch (IllegalArgumentException | IllegalStateException | ArithmeticException e) {
            throw new FitFailedException("Backend '" + name + "' failed to fit "
                    + vectors.length + " vector(s): " + e.getMessage(), e);
        }

        double rawThreshold = upperPercentile(trainingScores, contamination);
        Model model = new Model(name, parameters, rawThreshold, contamination, dimensions,
                vectors.length, Instant.now());
        LOG.debug("Backend [{}] fitted on {} x {} (rawThreshold={})",
                name, vectors.length, dimensions, rawThreshold);
        return new FitResult(model, trainingScores);
    }

    @Override
    public final double[] score(double[][] vectors, Model model) {
        Objects.requireNonNull(model, "Model must not be null");
        if (!name.equals(model.getBackend())) {
            throw new IllegalArgumentException("Model was trained by backend '" + model.getBackend()
                    + "', cannot score with '" + name + "'");
        }
        if (vectors.length == 0) {
            return new double[0];
        }
        int dimensions = validateVectors(vectors);
        if (dimensions != model.getDimensions()) {
            throw new IllegalArgumentException("Expected vectors of dimension " + model.getDimensions()
                    + ", got: " + dimensions);
        }
        return compute(vectors, model.getParameters(parametersType));
    }

    // ---------------------------------------------------------------
    // Subclass hooks
    // ---------------------------------------------------------------

    /**
     * Learn backend parameters. Input has been validated.
     */
    protected abstract P train(double[][] vectors, double contamination);

    /**
     * Raw scores, higher is more anomalous. Input has been validated.
     */
    protected abstract double[] compute(double[][] vectors, P parameters);

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    static double upperPercentile(double[] scores, double contamination) {
        Percentile percentile = new Percentile()
                .withEstimationType(Percentile.EstimationType.R_7);
        return percentile.evaluate(scores, (1.0 - contamination) * 100.0);
    }

    private static void validateContamination(double contamination) {
        if (!(contamination > 0.0 && contamination <= MAX_CONTAMINATION)) {
            throw new IllegalArgumentException("contamination must be in (0, " + MAX_CONTAMINATION
                    + "], got: " + contamination);
        }
    }

    private static int validateVectors(double[][] vectors) {
        Objects.requireNonNull(vectors, "Vectors must not be null");
        if (vectors.length == 0) {
            return 0;
        }
        int dimensions = Objects.requireNonNull(vectors[0], "Vector 0 is null").length;
        if (dimensions == 0) {
            throw new IllegalArgumentException("Vectors must have at least one dimension");
        }
        for (int i = 0; i < vectors.length; i++) {
            double[] row = Objects.requireNonNull(vectors[i], "Vector " + i + " is null");
            if (row.length != dimensions) {
                throw new IllegalArgumentException("Vector " + i + " has dimension " + row.length
                        + ", expected " + dimensions);
            }
            for (double v : row) {
                if (!Double.isFinite(v)) {
                    throw new IllegalArgumentException("Vector " + i + " contains a non-finite value");
                }
            }
        }
        return dimensions;
    }
}
