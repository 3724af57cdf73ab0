package com.streamdetect.core.backend;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.apache.commons.math3.stat.StatUtils;

/**
 * Per-column standardization used by the distance-based backends so that no
 * single column dominates the metric. Columns with zero spread keep a scale of
 * {@code 1.0}.
 */
public final class ColumnScaler {

    private final double[] mean;
    private final double[] scale;

    @JsonCreator
    public ColumnScaler(@JsonProperty("mean") double[] mean, @JsonProperty("scale") double[] scale) {
        if (mean.length != scale.length) {
            throw new IllegalArgumentException("mean and scale differ in length");
        }
        this.mean = mean.clone();
        this.scale = scale.clone();
    }

    public static ColumnScaler fit(double[][] vectors) {
        int dimensions = vectors[0].length;
        double[] mean = new double[dimensions];
        double[] scale = new double[dimensions];
        for (int d = 0; d < dimensions; d++) {
            double[] column = column(vectors, d);
            mean[d] = StatUtils.mean(column);
            double std = Math.sqrt(StatUtils.populationVariance(column, mean[d]));
            scale[d] = std > 0.0 && Double.isFinite(std) ? std : 1.0;
        }
        return new ColumnScaler(mean, scale);
    }

    public double[] transform(double[] vector) {
        double[] out = new double[vector.length];
        for (int d = 0; d < vector.length; d++) {
            out[d] = (vector[d] - mean[d]) / scale[d];
        }
        return out;
    }

    public double[][] transform(double[][] vectors) {
        double[][] out = new double[vectors.length][];
        for (int i = 0; i < vectors.length; i++) {
            out[i] = transform(vectors[i]);
        }
        return out;
    }

    @JsonProperty("mean")
    public double[] getMean() {
        return mean.clone();
    }

    @JsonProperty("scale")
    public double[] getScale() {
        return scale.clone();
    }

    static double[] column(double[][] vectors, int d) {
        double[] column = new double[vectors.length];
        for (int i = 0; i < vectors.length; i++) {
            column[i] = vectors[i][d];
        }
        return column;
    }

    static double squaredDistance(double[] a, double[] b) {
        double sum = 0.0;
        for (int d = 0; d < a.length; d++) {
            double diff = a[d] - b[d];
            sum += diff * diff;
        }
        return sum;
    }
}
