package com.streamdetect.core.backend;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.SingularValueDecomposition;
import org.apache.commons.math3.stat.correlation.Covariance;

import java.util.Arrays;
import java.util.Comparator;

/**
 * One-class elliptic boundary: squared Mahalanobis distance from a robust
 * centre.
 *
 * <p>
 * Location and covariance are estimated on the {@code ceil(n * (1 -
 * contamination))} rows closest to the current estimate, refined by
 * concentration steps until the subset stops changing (a simplified minimum
 * covariance determinant). The covariance is ridge-regularized and inverted
 * through SVD, so collinear or constant columns do not break the fit.
 * </p>
 */
public class EllipticEnvelopeBackend extends AbstractBackendAdapter<EllipticEnvelopeBackend.Parameters> {

    public static final String NAME = "elliptic_envelope";

    static final int MAX_CONCENTRATION_STEPS = 10;
    private static final double RIDGE = 1e-6;

    public EllipticEnvelopeBackend() {
        super(NAME, 3, Parameters.class);
    }

    @Override
    protected Parameters train(double[][] vectors, double contamination) {
        ColumnScaler scaler = ColumnScaler.fit(vectors);
        double[][] scaled = scaler.transform(vectors);
        int n = scaled.length;
        int h = Math.max(2, Math.min(n, (int) Math.ceil(n * (1.0 - contamination))));

        Integer[] subset = allRows(n);
        double[] location = mean(scaled, subset);
        double[][] precision = precision(scaled, subset, location);

        for (int step = 0; step < MAX_CONCENTRATION_STEPS; step++) {
            double[] distances = new double[n];
            for (int i = 0; i < n; i++) {
                distances[i] = mahalanobis(scaled[i], location, precision);
            }
            Integer[] next = allRows(n);
            Arrays.sort(next, Comparator.comparingDouble((Integer i) -> distances[i]).thenComparing(i -> i));
            next = Arrays.copyOf(next, h);
            Arrays.sort(next);
            if (Arrays.equals(next, subset)) {
                break;
            }
            subset = next;
            location = mean(scaled, subset);
            precision = precision(scaled, subset, location);
        }
        return new Parameters(scaler, location, precision);
    }

    @Override
    protected double[] compute(double[][] vectors, Parameters parameters) {
        double[] scores = new double[vectors.length];
        for (int i = 0; i < vectors.length; i++) {
            scores[i] = mahalanobis(parameters.scaler.transform(vectors[i]), parameters.location,
                    parameters.precision);
        }
        return scores;
    }

    private static Integer[] allRows(int n) {
        Integer[] rows = new Integer[n];
        for (int i = 0; i < n; i++) {
            rows[i] = i;
        }
        return rows;
    }

    private static double[] mean(double[][] data, Integer[] rows) {
        double[] mean = new double[data[0].length];
        for (int r : rows) {
            for (int d = 0; d < mean.length; d++) {
                mean[d] += data[r][d];
            }
        }
        for (int d = 0; d < mean.length; d++) {
            mean[d] /= rows.length;
        }
        return mean;
    }

    private static double[][] precision(double[][] data, Integer[] rows, double[] location) {
        int dimensions = location.length;
        RealMatrix covariance;
        if (dimensions == 1) {
            double sum = 0.0;
            for (int r : rows) {
                double diff = data[r][0] - location[0];
                sum += diff * diff;
            }
            covariance = new Array2DRowRealMatrix(new double[][] { { sum / (rows.length - 1) } });
        } else {
            double[][] subset = new double[rows.length][];
            for (int i = 0; i < rows.length; i++) {
                subset[i] = data[rows[i]];
            }
            covariance = new Covariance(subset).getCovarianceMatrix();
        }
        for (int d = 0; d < dimensions; d++) {
            covariance.addToEntry(d, d, RIDGE);
        }
        return new SingularValueDecomposition(covariance).getSolver().getInverse().getData();
    }

    private static double mahalanobis(double[] x, double[] location, double[][] precision) {
        int dimensions = location.length;
        double[] diff = new double[dimensions];
        for (int d = 0; d < dimensions; d++) {
            diff[d] = x[d] - location[d];
        }
        double total = 0.0;
        for (int a = 0; a < dimensions; a++) {
            double row = 0.0;
            for (int b = 0; b < dimensions; b++) {
                row += precision[a][b] * diff[b];
            }
            total += diff[a] * row;
        }
        return Math.max(0.0, total);
    }

    public static final class Parameters {

        private final ColumnScaler scaler;
        private final double[] location;
        private final double[][] precision;

        @JsonCreator
        public Parameters(@JsonProperty("scaler") ColumnScaler scaler,
                @JsonProperty("location") double[] location,
                @JsonProperty("precision") double[][] precision) {
            this.scaler = scaler;
            this.location = location;
            this.precision = precision;
        }

        public ColumnScaler getScaler() {
            return scaler;
        }

        public double[] getLocation() {
            return location;
        }

        public double[][] getPrecision() {
            return precision;
        }
    }
}
