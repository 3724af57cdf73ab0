package com.streamdetect.core.backend;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable trained model: backend name, opaque backend parameters and the
 * raw threshold calibrated at fit time.
 *
 * <p>
 * The parameter object is owned by the backend that produced it and must not
 * be mutated after construction. Models are replaced wholesale on retrain.
 * </p>
 *
 * @since 1.0.0
 */
public final class Model {

    private final String backend;
    private final Object parameters;
    private final double rawThreshold;
    private final double contamination;
    private final int dimensions;
    private final int trainedOn;
    private final Instant fittedAt;

    public Model(String backend, Object parameters, double rawThreshold, double contamination,
            int dimensions, int trainedOn, Instant fittedAt) {
        this.backend = Objects.requireNonNull(backend, "Backend must not be null");
        this.parameters = Objects.requireNonNull(parameters, "Parameters must not be null");
        this.rawThreshold = rawThreshold;
        this.contamination = contamination;
        this.dimensions = dimensions;
        this.trainedOn = trainedOn;
        this.fittedAt = Objects.requireNonNull(fittedAt, "fittedAt must not be null");
    }

    public String getBackend() {
        return backend;
    }

    public Object getParameters() {
        return parameters;
    }

    /**
     * Typed access to the backend parameters.
     *
     * @throws IllegalStateException if the parameters are of another type
     */
    public <P> P getParameters(Class<P> type) {
        if (!type.isInstance(parameters)) {
            throw new IllegalStateException("Model of backend '" + backend + "' carries "
                    + parameters.getClass().getSimpleName() + ", expected " + type.getSimpleName());
        }
        return type.cast(parameters);
    }

    /**
     * @return the {@code (1 - contamination)} percentile of the training raw
     *         scores
     */
    public double getRawThreshold() {
        return rawThreshold;
    }

    public double getContamination() {
        return contamination;
    }

    /**
     * @return length of the vectors the model was trained on
     */
    public int getDimensions() {
        return dimensions;
    }

    /**
     * @return number of training rows
     */
    public int getTrainedOn() {
        return trainedOn;
    }

    public Instant getFittedAt() {
        return fittedAt;
    }

    @Override
    public String toString() {
        return "Model{" +
                "backend='" + backend + '\'' +
                ", rawThreshold=" + rawThreshold +
                ", contamination=" + contamination +
                ", dimensions=" + dimensions +
                ", trainedOn=" + trainedOn +
                ", fittedAt=" + fittedAt +
                '}';
    }
}
