package com.streamdetect.core.backend;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Distance to the k-th nearest training row, after per-column scaling.
 */
public class KnnBackend extends AbstractBackendAdapter<KnnBackend.Parameters> {

    public static final String NAME = "knn";

    static final int DEFAULT_NEIGHBORS = 5;

    private final int neighbors;

    public KnnBackend() {
        this(DEFAULT_NEIGHBORS);
    }

    public KnnBackend(int neighbors) {
        super(NAME, 3, Parameters.class);
        if (neighbors < 1) {
            throw new IllegalArgumentException("neighbors must be >= 1, got: " + neighbors);
        }
        this.neighbors = neighbors;
    }

    @Override
    protected Parameters train(double[][] vectors, double contamination) {
        ColumnScaler scaler = ColumnScaler.fit(vectors);
        int k = Math.min(neighbors, vectors.length - 1);
        return new Parameters(scaler, scaler.transform(vectors), k);
    }

    @Override
    protected double[] compute(double[][] vectors, Parameters parameters) {
        NearestNeighbors index = new NearestNeighbors(parameters.reference);
        double[] scores = new double[vectors.length];
        for (int i = 0; i < vectors.length; i++) {
            double[] point = parameters.scaler.transform(vectors[i]);
            int[] nearest = index.query(point, parameters.k);
            scores[i] = index.distance(point, nearest[nearest.length - 1]);
        }
        return scores;
    }

    public static final class Parameters {

        private final ColumnScaler scaler;
        private final double[][] reference;
        private final int k;

        @JsonCreator
        public Parameters(@JsonProperty("scaler") ColumnScaler scaler,
                @JsonProperty("reference") double[][] reference,
                @JsonProperty("k") int k) {
            this.scaler = scaler;
            this.reference = reference;
            this.k = k;
        }

        public ColumnScaler getScaler() {
            return scaler;
        }

        public double[][] getReference() {
            return reference;
        }

        public int getK() {
            return k;
        }
    }
}
