package com.streamdetect.core.backend;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Histogram-based outlier score (HBOS).
 *
 * <p>
 * One equal-width histogram per dimension, heights normalized so the
 * tallest bin is {@code 1.0}. A row scores {@code sum(log(1 / (h + alpha)))}
 * over its dimensions, where {@code h} is the height of the bin the value
 * falls into ({@code 0} outside the training range).
 * </p>
 */
public class HbosBackend extends AbstractBackendAdapter<HbosBackend.Parameters> {

    public static final String NAME = "hbos";

    static final int DEFAULT_BINS = 10;
    static final double ALPHA = 0.1;

    private final int bins;

    public HbosBackend() {
        this(DEFAULT_BINS);
    }

    public HbosBackend(int bins) {
        super(NAME, 2, Parameters.class);
        if (bins < 1) {
            throw new IllegalArgumentException("bins must be >= 1, got: " + bins);
        }
        this.bins = bins;
    }

    @Override
    protected Parameters train(double[][] vectors, double contamination) {
        int dimensions = vectors[0].length;
        double[] min = new double[dimensions];
        double[] width = new double[dimensions];
        double[][] heights = new double[dimensions][];
        for (int d = 0; d < dimensions; d++) {
            double lo = Double.POSITIVE_INFINITY;
            double hi = Double.NEGATIVE_INFINITY;
            for (double[] row : vectors) {
                lo = Math.min(lo, row[d]);
                hi = Math.max(hi, row[d]);
            }
            min[d] = lo;
            // a constant column collapses to a single bin
            int columnBins = hi > lo ? bins : 1;
            width[d] = hi > lo ? (hi - lo) / columnBins : 0.0;
            double[] counts = new double[columnBins];
            for (double[] row : vectors) {
                counts[binOf(row[d], lo, width[d], columnBins)]++;
            }
            double max = 0.0;
            for (double c : counts) {
                max = Math.max(max, c);
            }
            for (int b = 0; b < counts.length; b++) {
                counts[b] = counts[b] / max;
            }
            heights[d] = counts;
        }
        return new Parameters(min, width, heights);
    }

    @Override
    protected double[] compute(double[][] vectors, Parameters parameters) {
        double[] scores = new double[vectors.length];
        for (int i = 0; i < vectors.length; i++) {
            double score = 0.0;
            for (int d = 0; d < parameters.min.length; d++) {
                double height = heightOf(vectors[i][d], parameters.min[d], parameters.width[d],
                        parameters.heights[d]);
                score += Math.log(1.0 / (height + ALPHA));
            }
            scores[i] = score;
        }
        return scores;
    }

    private static double heightOf(double value, double min, double width, double[] heights) {
        if (width == 0.0) {
            return value == min ? heights[0] : 0.0;
        }
        double max = min + width * heights.length;
        if (value < min || value > max) {
            return 0.0;
        }
        return heights[binOf(value, min, width, heights.length)];
    }

    private static int binOf(double value, double min, double width, int bins) {
        if (width == 0.0) {
            return 0;
        }
        int bin = (int) Math.floor((value - min) / width);
        return Math.max(0, Math.min(bins - 1, bin));
    }

    /**
     * Histogram per dimension.
     */
    public static final class Parameters {

        private final double[] min;
        private final double[] width;
        private final double[][] heights;

        @JsonCreator
        public Parameters(@JsonProperty("min") double[] min,
                @JsonProperty("width") double[] width,
                @JsonProperty("heights") double[][] heights) {
            this.min = min;
            this.width = width;
            this.heights = heights;
        }

        public double[] getMin() {
            return min;
        }

        public double[] getWidth() {
            return width;
        }

        public double[][] getHeights() {
            return heights;
        }
    }
}
