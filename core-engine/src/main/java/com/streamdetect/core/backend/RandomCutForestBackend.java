package com.streamdetect.core.backend;

import com.amazon.randomcutforest.RandomCutForest;
import com.amazon.randomcutforest.state.RandomCutForestMapper;
import com.amazon.randomcutforest.state.RandomCutForestState;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Random cut forest backed by the AWS {@code randomcutforest-core} library.
 *
 * <p>
 * The forest is built by streaming the training rows through
 * {@link RandomCutForest#update(double[])} with a fixed seed. It is persisted
 * as the library's own {@link RandomCutForestState}, including tree structure,
 * so a restored forest scores exactly like the one that was saved.
 * </p>
 */
public class RandomCutForestBackend extends AbstractBackendAdapter<RandomCutForestBackend.Parameters> {

    public static final String NAME = "rcf";

    static final int DEFAULT_TREES = 50;
    static final int DEFAULT_SAMPLE_SIZE = 256;

    private final int numberOfTrees;
    private final int sampleSize;
    private final long seed;

    public RandomCutForestBackend() {
        this(DEFAULT_TREES, DEFAULT_SAMPLE_SIZE, 42L);
    }

    public RandomCutForestBackend(int numberOfTrees, int sampleSize, long seed) {
        super(NAME, 8, Parameters.class);
        if (numberOfTrees < 1 || sampleSize < 1) {
            throw new IllegalArgumentException("numberOfTrees and sampleSize must be >= 1");
        }
        this.numberOfTrees = numberOfTrees;
        this.sampleSize = sampleSize;
        this.seed = seed;
    }

    @Override
    protected Parameters train(double[][] vectors, double contamination) {
        int effectiveSampleSize = Math.min(sampleSize, vectors.length);
        RandomCutForest forest = RandomCutForest.builder()
                .dimensions(vectors[0].length)
                .numberOfTrees(numberOfTrees)
                .sampleSize(effectiveSampleSize)
                .outputAfter(effectiveSampleSize)
                .randomSeed(seed)
                .parallelExecutionEnabled(false)
                .build();
        for (double[] row : vectors) {
            forest.update(row);
        }
        return new Parameters(forest);
    }

    @Override
    protected double[] compute(double[][] vectors, Parameters parameters) {
        RandomCutForest forest = parameters.forest();
        double[] scores = new double[vectors.length];
        synchronized (forest) {
            for (int i = 0; i < vectors.length; i++) {
                scores[i] = forest.getAnomalyScore(vectors[i]);
            }
        }
        return scores;
    }

    static RandomCutForestMapper stateMapper() {
        RandomCutForestMapper mapper = new RandomCutForestMapper();
        mapper.setSaveTreeStateEnabled(true);
        mapper.setSaveExecutorContextEnabled(true);
        return mapper;
    }

    /**
     * A trained forest. Serialised as its {@link RandomCutForestState}; either
     * side is derived from the other on first use.
     */
    public static final class Parameters {

        private RandomCutForest forest;
        private RandomCutForestState forestState;

        Parameters(RandomCutForest forest) {
            this.forest = forest;
        }

        @JsonCreator
        public Parameters(@JsonProperty("forestState") RandomCutForestState forestState) {
            if (forestState == null) {
                throw new IllegalArgumentException("Random cut forest state must not be null");
            }
            this.forestState = forestState;
        }

        synchronized RandomCutForest forest() {
            if (forest == null) {
                forest = stateMapper().toModel(forestState);
            }
            return forest;
        }

        @JsonProperty("forestState")
        public synchronized RandomCutForestState getForestState() {
            if (forestState == null) {
                RandomCutForest local = forest;
                synchronized (local) {
                    forestState = stateMapper().toState(local);
                }
            }
            return forestState;
        }
    }
}
