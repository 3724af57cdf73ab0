package com.streamdetect.core.backend;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.apache.commons.math3.stat.descriptive.moment.Skewness;

import java.util.Arrays;

/**
 * Empirical-cumulative-distribution outlier detection (ECOD).
 *
 * <p>
 * Each dimension is scored by how far into the tails of its training
 * distribution a value falls: {@code -log} of the left-tail and right-tail
 * empirical probabilities, summed across dimensions. The final score is the
 * largest of the left-tail sum, the right-tail sum and a skew-aware sum that
 * uses the left tail for negatively skewed dimensions and the right tail
 * otherwise. Tail probabilities use {@code (count + 1) / (n + 1)} so values
 * beyond the training range stay finite.
 * </p>
 *
 * <p>
 * Parameter-free and fast; the default backend.
 * </p>
 */
public class EcodBackend extends AbstractBackendAdapter<EcodBackend.Parameters> {

    public static final String NAME = "ecod";

    public EcodBackend() {
        super(NAME, 2, Parameters.class);
    }

    @Override
    protected Parameters train(double[][] vectors, double contamination) {
        int dimensions = vectors[0].length;
        double[][] sorted = new double[dimensions][];
        double[] skewness = new double[dimensions];
        Skewness skew = new Skewness();
        for (int d = 0; d < dimensions; d++) {
            double[] column = ColumnScaler.column(vectors, d);
            double s = skew.evaluate(column);
            skewness[d] = Double.isFinite(s) ? s : 0.0;
            Arrays.sort(column);
            sorted[d] = column;
        }
        return new Parameters(sorted, skewness);
    }

    @Override
    protected double[] compute(double[][] vectors, Parameters parameters) {
        double[][] sorted = parameters.sortedColumns;
        double[] scores = new double[vectors.length];
        for (int i = 0; i < vectors.length; i++) {
            double left = 0.0;
            double right = 0.0;
            double auto = 0.0;
            for (int d = 0; d < sorted.length; d++) {
                double[] column = sorted[d];
                double n = column.length;
                double value = vectors[i][d];
                double leftTail = (countAtMost(column, value) + 1) / (n + 1);
                double rightTail = (countAtLeast(column, value) + 1) / (n + 1);
                double l = -Math.log(leftTail);
                double r = -Math.log(rightTail);
                left += l;
                right += r;
                auto += parameters.skewness[d] < 0 ? l : r;
            }
            scores[i] = Math.max(auto, Math.max(left, right));
        }
        return scores;
    }

    private static int countAtMost(double[] sorted, double value) {
        int lo = 0;
        int hi = sorted.length;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (sorted[mid] <= value) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo;
    }

    private static int countAtLeast(double[] sorted, double value) {
        int lo = 0;
        int hi = sorted.length;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (sorted[mid] < value) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return sorted.length - lo;
    }

    /**
     * Sorted training values and skewness per dimension.
     */
    public static final class Parameters {

        private final double[][] sortedColumns;
        private final double[] skewness;

        @JsonCreator
        public Parameters(@JsonProperty("sortedColumns") double[][] sortedColumns,
                @JsonProperty("skewness") double[] skewness) {
            this.sortedColumns = sortedColumns;
            this.skewness = skewness;
        }

        public double[][] getSortedColumns() {
            return sortedColumns;
        }

        public double[] getSkewness() {
            return skewness;
        }
    }
}
