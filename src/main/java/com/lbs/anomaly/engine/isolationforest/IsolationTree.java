package com.lbs.anomaly.engine.isolationforest;

import java.util.Random;

final class IsolationTree {

    private final IsolationNode root;

    private IsolationTree(IsolationNode root) {
        this.root = root;
    }

    static IsolationTree grow(double[][] sample, int heightLimit, Random random) {
        return new IsolationTree(grow(sample, 0, heightLimit, random));
    }

    private static IsolationNode grow(double[][] rows, int depth, int heightLimit, Random random) {
        int n = rows.length;
        if (depth >= heightLimit || n <= 1) {
            return IsolationNode.leaf(n);
        }

        int dims = rows[0].length;
        double[] mins = new double[dims];
        double[] maxs = new double[dims];
        int[] splittable = new int[dims];
        int candidates = 0;
        for (int f = 0; f < dims; f++) {
            double lo = Double.POSITIVE_INFINITY;
            double hi = Double.NEGATIVE_INFINITY;
            for (double[] row : rows) {
                lo = Math.min(lo, row[f]);
                hi = Math.max(hi, row[f]);
            }
            mins[f] = lo;
            maxs[f] = hi;
            if (lo < hi) splittable[candidates++] = f;
        }
        // Identical on every feature: nothing left to isolate.
        if (candidates == 0) {
            return IsolationNode.leaf(n);
        }

        int feature = splittable[random.nextInt(candidates)];
        double min = mins[feature];
        double max = maxs[feature];
        double cut = min + random.nextDouble() * (max - min);
        int leftCount = 0;
        for (double[] row : rows) {
            if (row[feature] < cut) leftCount++;
        }
        double[][] lower = new double[leftCount][];
        double[][] upper = new double[n - leftCount][];
        int li = 0, ui = 0;
        for (double[] row : rows) {
            if (row[feature] < cut) lower[li++] = row;
            else upper[ui++] = row;
        }

        return IsolationNode.split(feature, cut,
                grow(lower, depth + 1, heightLimit, random),
                grow(upper, depth + 1, heightLimit, random));
    }

    double pathLength(double[] point) {
        return root.pathLength(point, 0);
    }
}
