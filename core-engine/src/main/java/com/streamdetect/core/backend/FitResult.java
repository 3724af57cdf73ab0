package com.streamdetect.core.backend;

import java.util.Objects;

/**
 * Output of {@link BackendAdapter#fit}: the trained model and the raw scores
 * of the training rows, from which normalization state is derived.
 */
public final class FitResult {

    private final Model model;
    private final double[] trainingScores;

    public FitResult(Model model, double[] trainingScores) {
        this.model = Objects.requireNonNull(model, "Model must not be null");
        this.trainingScores = Objects.requireNonNull(trainingScores, "Training scores must not be null").clone();
    }

    public Model getModel() {
        return model;
    }

    public double[] getTrainingScores() {
        return trainingScores.clone();
    }
}
