package com.lbs.anomaly.engine.isolationforest;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Isolation forest (Liu, Ting and Zhou, 2008) over small dense feature matrices.
 * Training is fully determined by the seed, so repeated fits on the same rows score identically.
 */
public class IsolationForest {

    private final int numTrees;
    private final int maxSamples;
    private final long seed;

    private List<IsolationTree> trees = Collections.emptyList();
    private int sampleSize;

    public IsolationForest(int numTrees, int maxSamples, long seed) {
        if (numTrees < 1) throw new IllegalArgumentException("numTrees must be positive");
        if (maxSamples < 2) throw new IllegalArgumentException("maxSamples must be at least 2");
        this.numTrees = numTrees;
        this.maxSamples = maxSamples;
        this.seed = seed;
    }

    public IsolationForest fit(double[][] rows) {
        if (rows.length == 0) throw new IllegalArgumentException("Cannot fit an isolation forest on no rows");
        this.sampleSize = Math.min(maxSamples, rows.length);
        int heightLimit = (int) Math.ceil(Math.log(sampleSize) / Math.log(2));
        Random random = new Random(seed);

        List<IsolationTree> grown = new ArrayList<>(numTrees);
        for (int i = 0; i < numTrees; i++) {
            grown.add(IsolationTree.grow(subsample(rows, sampleSize, random), heightLimit, random));
        }
        this.trees = grown;
        return this;
    }

    /**
     * Anomaly score s(x) = 2^(-E[h(x)] / c(psi)) in [0, 1]. Scores well above 0.5 are
     * isolated quickly; scores at or below 0.5 look like the bulk of the data.
     */
    public double score(double[] point) {
        if (trees.isEmpty()) throw new IllegalStateException("Isolation forest has not been fitted");
        double c = IsolationNode.averagePathLength(sampleSize);
        if (c <= 0) return 0.5;
        double total = 0.0;
        for (IsolationTree tree : trees) {
            total += tree.pathLength(point);
        }
        return Math.pow(2.0, -(total / trees.size()) / c);
    }

    public double[] scoreAll(double[][] rows) {
        double[] scores = new double[rows.length];
        for (int i = 0; i < rows.length; i++) {
            scores[i] = score(rows[i]);
        }
        return scores;
    }

    // Partial Fisher-Yates over row indices.
    private static double[][] subsample(double[][] rows, int size, Random random) {
        if (rows.length <= size) return rows.clone();
        int[] indices = new int[rows.length];
        for (int i = 0; i < indices.length; i++) indices[i] = i;
        double[][] sample = new double[size][];
        for (int i = 0; i < size; i++) {
            int j = i + random.nextInt(rows.length - i);
            int tmp = indices[i];
            indices[i] = indices[j];
            indices[j] = tmp;
            sample[i] = rows[indices[i]];
        }
        return sample;
    }
}
