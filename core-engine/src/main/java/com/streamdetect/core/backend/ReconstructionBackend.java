package com.streamdetect.core.backend;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.apache.commons.math3.linear.EigenDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.stat.correlation.Covariance;

import java.util.Arrays;

/**
 * Reconstruction error of a linear autoencoder, i.e. principal component
 * analysis.
 *
 * <p>
 * Rows are scaled per column, projected onto the leading {@code k}
 * principal components ({@code k = ceil(d / 2)}, and {@code 0} for a single
 * column) and mapped back. The score is the squared distance between a row
 * and its reconstruction; rows that do not follow the correlation structure
 * of the training data reconstruct poorly.
 * </p>
 */
public class ReconstructionBackend extends AbstractBackendAdapter<ReconstructionBackend.Parameters> {

    public static final String NAME = "reconstruction";

    public ReconstructionBackend() {
        super(NAME, 3, Parameters.class);
    }

    @Override
    protected Parameters train(double[][] vectors, double contamination) {
        ColumnScaler scaler = ColumnScaler.fit(vectors);
        double[][] scaled = scaler.transform(vectors);
        int dimensions = scaled[0].length;
        int k = dimensions == 1 ? 0 : (dimensions + 1) / 2;
        if (k == 0) {
            return new Parameters(scaler, new double[0][]);
        }

        RealMatrix covariance = new Covariance(scaled).getCovarianceMatrix();
        EigenDecomposition eigen = new EigenDecomposition(covariance);
        double[] eigenvalues = eigen.getRealEigenvalues();
        Integer[] order = new Integer[dimensions];
        for (int i = 0; i < dimensions; i++) {
            order[i] = i;
        }
        Arrays.sort(order, (a, b) -> Double.compare(eigenvalues[b], eigenvalues[a]));

        double[][] components = new double[k][];
        for (int c = 0; c < k; c++) {
            components[c] = eigen.getEigenvector(order[c]).toArray();
        }
        return new Parameters(scaler, components);
    }

    @Override
    protected double[] compute(double[][] vectors, Parameters parameters) {
        double[] scores = new double[vectors.length];
        for (int i = 0; i < vectors.length; i++) {
            double[] x = parameters.scaler.transform(vectors[i]);
            double[] reconstruction = new double[x.length];
            for (double[] component : parameters.components) {
                double projection = 0.0;
                for (int d = 0; d < x.length; d++) {
                    projection += x[d] * component[d];
                }
                for (int d = 0; d < x.length; d++) {
                    reconstruction[d] += projection * component[d];
                }
            }
            scores[i] = ColumnScaler.squaredDistance(x, reconstruction);
        }
        return scores;
    }

    public static final class Parameters {

        private final ColumnScaler scaler;
        private final double[][] components;

        @JsonCreator
        public Parameters(@JsonProperty("scaler") ColumnScaler scaler,
                @JsonProperty("components") double[][] components) {
            this.scaler = scaler;
            this.components = components;
        }

        public ColumnScaler getScaler() {
            return scaler;
        }

        /**
         * @return unit-length principal axes, strongest first
         */
        public double[][] getComponents() {
            return components;
        }
    }
}
