package com.streamdetect.core.backend;

import com.streamdetect.core.error.InsufficientDataException;

/**
 * Contract for a pluggable anomaly-scoring algorithm.
 *
 * <p>
 * An adapter is stateless: everything learned by {@link #fit} lives in the
 * returned {@link Model}, which is immutable and can be shared between
 * threads. For every backend a higher raw score means more anomalous.
 * </p>
 *
 * <h3>Adding a backend</h3>
 * <p>
 * Implement this interface (usually by extending
 * {@link AbstractBackendAdapter}) and register a supplier with
 * {@link BackendRegistry#register}.
 * </p>
 *
 * @since 1.0.0
 */
public interface BackendAdapter {

    /**
     * @return canonical backend name, e.g. {@code "ecod"}
     */
    String name();

    /**
     * @return smallest training set {@link #fit} accepts
     */
    int minimumSamples();

    /**
     * @return class of the model parameters, used to read persisted models
     */
    Class<?> parametersType();

    /**
     * Train a model.
     *
     * @param vectors       training rows, all of the same length
     * @param contamination expected anomaly fraction in {@code (0, 0.5]}
     * @return the model plus the raw scores of the training rows
     * @throws InsufficientDataException if fewer than {@link #minimumSamples()}
     *                                   rows are supplied
     * @throws IllegalArgumentException  if the rows or contamination are invalid
     * @throws com.streamdetect.core.error.FitFailedException if the algorithm
     *                                   fails
     */
    FitResult fit(double[][] vectors, double contamination);

    /**
     * Score rows against a model produced by this adapter.
     *
     * @param vectors rows of the model's dimension
     * @param model   a model produced by this adapter
     * @return one raw score per row
     */
    double[] score(double[][] vectors, Model model);
}
