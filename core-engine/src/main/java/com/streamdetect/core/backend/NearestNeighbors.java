package com.streamdetect.core.backend;

import java.util.Arrays;

/**
 * Brute-force k-nearest-neighbour search over a fixed reference set, in
 * Euclidean distance.
 */
final class NearestNeighbors {

    private final double[][] reference;

    NearestNeighbors(double[][] reference) {
        this.reference = reference;
    }

    /**
     * @return indices of the {@code k} reference rows closest to
     *         {@code point}, nearest first
     */
    int[] query(double[] point, int k) {
        int n = reference.length;
        Integer[] order = new Integer[n];
        double[] distances = new double[n];
        for (int i = 0; i < n; i++) {
            order[i] = i;
            distances[i] = ColumnScaler.squaredDistance(point, reference[i]);
        }
        Arrays.sort(order, (a, b) -> {
            int byDistance = Double.compare(distances[a], distances[b]);
            return byDistance != 0 ? byDistance : Integer.compare(a, b);
        });
        int count = Math.min(k, n);
        int[] nearest = new int[count];
        for (int i = 0; i < count; i++) {
            nearest[i] = order[i];
        }
        return nearest;
    }

    double distance(double[] point, int referenceIndex) {
        return Math.sqrt(ColumnScaler.squaredDistance(point, reference[referenceIndex]));
    }

    double[] row(int index) {
        return reference[index];
    }

    int size() {
        return reference.length;
    }
}
