package com.streamdetect.core.backend;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Isolation forest: an ensemble of random axis-parallel partition trees built
 * on sub-samples of the training set. Anomalies are isolated in fewer splits,
 * so the score {@code 2^(-E[h(x)] / c(psi))} is close to {@code 1} for them
 * and well below {@code 0.5} for ordinary rows.
 */
public class IsolationForestBackend extends AbstractBackendAdapter<IsolationForestBackend.Parameters> {

    public static final String NAME = "isolation_forest";

    static final int DEFAULT_TREES = 100;
    static final int DEFAULT_SUBSAMPLE = 256;
    private static final double EULER_GAMMA = 0.5772156649015329;

    private final int numberOfTrees;
    private final int subsampleSize;
    private final long seed;

    public IsolationForestBackend() {
        this(DEFAULT_TREES, DEFAULT_SUBSAMPLE, 42L);
    }

    public IsolationForestBackend(int numberOfTrees, int subsampleSize, long seed) {
        super(NAME, 8, Parameters.class);
        if (numberOfTrees < 1 || subsampleSize < 2) {
            throw new IllegalArgumentException("numberOfTrees must be >= 1 and subsampleSize >= 2");
        }
        this.numberOfTrees = numberOfTrees;
        this.subsampleSize = subsampleSize;
        this.seed = seed;
    }

    @Override
    protected Parameters train(double[][] vectors, double contamination) {
        Random random = new Random(seed);
        int psi = Math.min(subsampleSize, vectors.length);
        int heightLimit = (int) Math.ceil(Math.log(psi) / Math.log(2));
        List<Tree> trees = new ArrayList<>(numberOfTrees);
        for (int t = 0; t < numberOfTrees; t++) {
            int[] sample = sampleWithoutReplacement(vectors.length, psi, random);
            TreeBuilder builder = new TreeBuilder(vectors, random, heightLimit);
            builder.build(sample, 0);
            trees.add(builder.toTree());
        }
        return new Parameters(psi, trees);
    }

    @Override
    protected double[] compute(double[][] vectors, Parameters parameters) {
        double normalizer = averagePathLength(parameters.sampleSize);
        double[] scores = new double[vectors.length];
        for (int i = 0; i < vectors.length; i++) {
            double total = 0.0;
            for (Tree tree : parameters.trees) {
                total += tree.pathLength(vectors[i]);
            }
            double mean = total / parameters.trees.size();
            scores[i] = normalizer > 0 ? Math.pow(2.0, -mean / normalizer) : 0.5;
        }
        return scores;
    }

    /**
     * Average path length of an unsuccessful search in a binary search tree of
     * {@code n} nodes.
     */
    static double averagePathLength(int n) {
        if (n <= 1) {
            return 0.0;
        }
        if (n == 2) {
            return 1.0;
        }
        double harmonic = Math.log(n - 1.0) + EULER_GAMMA;
        return 2.0 * harmonic - 2.0 * (n - 1.0) / n;
    }

    private static int[] sampleWithoutReplacement(int n, int k, Random random) {
        int[] indices = new int[n];
        for (int i = 0; i < n; i++) {
            indices[i] = i;
        }
        for (int i = 0; i < k; i++) {
            int j = i + random.nextInt(n - i);
            int tmp = indices[i];
            indices[i] = indices[j];
            indices[j] = tmp;
        }
        int[] sample = new int[k];
        System.arraycopy(indices, 0, sample, 0, k);
        return sample;
    }

    // ---------------------------------------------------------------
    // Tree construction
    // ---------------------------------------------------------------

    private static final class TreeBuilder {
        private final double[][] data;
        private final Random random;
        private final int heightLimit;
        private final List<Integer> feature = new ArrayList<>();
        private final List<Double> split = new ArrayList<>();
        private final List<Integer> left = new ArrayList<>();
        private final List<Integer> right = new ArrayList<>();
        private final List<Integer> size = new ArrayList<>();

        TreeBuilder(double[][] data, Random random, int heightLimit) {
            this.data = data;
            this.random = random;
            this.heightLimit = heightLimit;
        }

        int build(int[] rows, int depth) {
            int node = feature.size();
            feature.add(-1);
            split.add(0.0);
            left.add(-1);
            right.add(-1);
            size.add(rows.length);
            if (depth >= heightLimit || rows.length <= 1) {
                return node;
            }

            List<Integer> candidates = new ArrayList<>();
            int dimensions = data[0].length;
            double[] lo = new double[dimensions];
            double[] hi = new double[dimensions];
            for (int d = 0; d < dimensions; d++) {
                lo[d] = Double.POSITIVE_INFINITY;
                hi[d] = Double.NEGATIVE_INFINITY;
                for (int r : rows) {
                    lo[d] = Math.min(lo[d], data[r][d]);
                    hi[d] = Math.max(hi[d], data[r][d]);
                }
                if (hi[d] > lo[d]) {
                    candidates.add(d);
                }
            }
            if (candidates.isEmpty()) {
                return node;
            }

            int d = candidates.get(random.nextInt(candidates.size()));
            double threshold = lo[d] + random.nextDouble() * (hi[d] - lo[d]);
            int leftCount = 0;
            for (int r : rows) {
                if (data[r][d] < threshold) {
                    leftCount++;
                }
            }
            int[] leftRows = new int[leftCount];
            int[] rightRows = new int[rows.length - leftCount];
            int li = 0;
            int ri = 0;
            for (int r : rows) {
                if (data[r][d] < threshold) {
                    leftRows[li++] = r;
                } else {
                    rightRows[ri++] = r;
                }
            }

            feature.set(node, d);
            split.set(node, threshold);
            left.set(node, build(leftRows, depth + 1));
            right.set(node, build(rightRows, depth + 1));
            return node;
        }

        Tree toTree() {
            return new Tree(
                    feature.stream().mapToInt(Integer::intValue).toArray(),
                    split.stream().mapToDouble(Double::doubleValue).toArray(),
                    left.stream().mapToInt(Integer::intValue).toArray(),
                    right.stream().mapToInt(Integer::intValue).toArray(),
                    size.stream().mapToInt(Integer::intValue).toArray());
        }
    }

    // ---------------------------------------------------------------
    // Parameters
    // ---------------------------------------------------------------

    /**
     * Flattened isolation tree. Node {@code 0} is the root; a node with
     * {@code feature == -1} is a leaf holding {@code size} training rows.
     */
    public static final class Tree {

        private final int[] feature;
        private final double[] split;
        private final int[] left;
        private final int[] right;
        private final int[] size;

        @JsonCreator
        public Tree(@JsonProperty("feature") int[] feature,
                @JsonProperty("split") double[] split,
                @JsonProperty("left") int[] left,
                @JsonProperty("right") int[] right,
                @JsonProperty("size") int[] size) {
            this.feature = feature;
            this.split = split;
            this.left = left;
            this.right = right;
            this.size = size;
        }

        double pathLength(double[] x) {
            int node = 0;
            int depth = 0;
            while (feature[node] >= 0) {
                node = x[feature[node]] < split[node] ? left[node] : right[node];
                depth++;
            }
            return depth + averagePathLength(size[node]);
        }

        public int[] getFeature() {
            return feature;
        }

        public double[] getSplit() {
            return split;
        }

        public int[] getLeft() {
            return left;
        }

        public int[] getRight() {
            return right;
        }

        public int[] getSize() {
            return size;
        }
    }

    public static final class Parameters {

        private final int sampleSize;
        private final List<Tree> trees;

        @JsonCreator
        public Parameters(@JsonProperty("sampleSize") int sampleSize,
                @JsonProperty("trees") List<Tree> trees) {
            this.sampleSize = sampleSize;
            this.trees = List.copyOf(trees);
        }

        public int getSampleSize() {
            return sampleSize;
        }

        public List<Tree> getTrees() {
            return trees;
        }
    }
}
