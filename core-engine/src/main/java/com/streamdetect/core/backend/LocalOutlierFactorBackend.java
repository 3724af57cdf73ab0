package com.streamdetect.core.backend;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Local outlier factor over per-column scaled rows.
 *
 * <p>
 * The k-distance and local reachability density of every training row are
 * computed at fit time (excluding the row itself from its own neighbourhood).
 * A query row scores the ratio of its neighbours' average density to its own;
 * values well above {@code 1} indicate a sparse region.
 * </p>
 */
public class LocalOutlierFactorBackend extends AbstractBackendAdapter<LocalOutlierFactorBackend.Parameters> {

    public static final String NAME = "local_outlier_factor";

    static final int DEFAULT_NEIGHBORS = 20;
    private static final double EPSILON = 1e-10;

    private final int neighbors;

    public LocalOutlierFactorBackend() {
        this(DEFAULT_NEIGHBORS);
    }

    public LocalOutlierFactorBackend(int neighbors) {
        super(NAME, 3, Parameters.class);
        if (neighbors < 1) {
            throw new IllegalArgumentException("neighbors must be >= 1, got: " + neighbors);
        }
        this.neighbors = neighbors;
    }

    @Override
    protected Parameters train(double[][] vectors, double contamination) {
        ColumnScaler scaler = ColumnScaler.fit(vectors);
        double[][] reference = scaler.transform(vectors);
        int n = reference.length;
        int k = Math.min(neighbors, n - 1);
        NearestNeighbors index = new NearestNeighbors(reference);

        int[][] neighborhoods = new int[n][];
        double[] kDistance = new double[n];
        for (int i = 0; i < n; i++) {
            // k + 1 because the row itself comes back first
            int[] nearest = index.query(reference[i], k + 1);
            int[] others = new int[k];
            int j = 0;
            for (int candidate : nearest) {
                if (candidate != i && j < k) {
                    others[j++] = candidate;
                }
            }
            neighborhoods[i] = others;
            kDistance[i] = index.distance(reference[i], others[k - 1]);
        }

        double[] density = new double[n];
        for (int i = 0; i < n; i++) {
            density[i] = reachabilityDensity(reference[i], neighborhoods[i], index, kDistance);
        }
        return new Parameters(scaler, reference, k, kDistance, density);
    }

    @Override
    protected double[] compute(double[][] vectors, Parameters parameters) {
        NearestNeighbors index = new NearestNeighbors(parameters.reference);
        double[] scores = new double[vectors.length];
        for (int i = 0; i < vectors.length; i++) {
            double[] point = parameters.scaler.transform(vectors[i]);
            int[] nearest = index.query(point, parameters.k);
            double density = reachabilityDensity(point, nearest, index, parameters.kDistance);
            double neighborDensity = 0.0;
            for (int o : nearest) {
                neighborDensity += parameters.density[o];
            }
            neighborDensity /= nearest.length;
            scores[i] = neighborDensity / density;
        }
        return scores;
    }

    private static double reachabilityDensity(double[] point, int[] neighborhood, NearestNeighbors index,
            double[] kDistance) {
        double total = 0.0;
        for (int o : neighborhood) {
            total += Math.max(kDistance[o], index.distance(point, o));
        }
        return 1.0 / (total / neighborhood.length + EPSILON);
    }

    public static final class Parameters {

        private final ColumnScaler scaler;
        private final double[][] reference;
        private final int k;
        private final double[] kDistance;
        private final double[] density;

        @JsonCreator
        public Parameters(@JsonProperty("scaler") ColumnScaler scaler,
                @JsonProperty("reference") double[][] reference,
                @JsonProperty("k") int k,
                @JsonProperty("kDistance") double[] kDistance,
                @JsonProperty("density") double[] density) {
            this.scaler = scaler;
            this.reference = reference;
            this.k = k;
            this.kDistance = kDistance;
            this.density = density;
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

        @JsonProperty("kDistance")
        public double[] getKDistance() {
            return kDistance;
        }

        public double[] getDensity() {
            return density;
        }
    }
}
