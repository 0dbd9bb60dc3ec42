package com.lbs.anomaly.engine.isolationforest;

/**
 * Node of an isolation tree. Leaves remember how many samples reached them so the
 * unresolved part of the path can be estimated with {@link #averagePathLength(int)}.
 */
final class IsolationNode {

    private final int splitFeature;
    private final double splitValue;
    private final IsolationNode left;
    private final IsolationNode right;
    private final int size;

    private IsolationNode(int splitFeature, double splitValue, IsolationNode left, IsolationNode right, int size) {
        this.splitFeature = splitFeature;
        this.splitValue = splitValue;
        this.left = left;
        this.right = right;
        this.size = size;
    }

    static IsolationNode split(int feature, double value, IsolationNode left, IsolationNode right) {
        return new IsolationNode(feature, value, left, right, 0);
    }

    static IsolationNode leaf(int size) {
        return new IsolationNode(-1, 0.0, null, null, size);
    }

    boolean isLeaf() {
        return left == null;
    }

    double pathLength(double[] point, int depth) {
        IsolationNode node = this;
        while (!node.isLeaf()) {
            node = point[node.splitFeature] < node.splitValue ? node.left : node.right;
            depth++;
        }
        return depth + averagePathLength(node.size);
    }

    /**
     * Expected path length of an unsuccessful BST search over {@code n} items:
     * c(n) = 2H(n-1) - 2(n-1)/n, with H(i) approximated by ln(i) + Euler's constant.
     */
    static double averagePathLength(int n) {
        if (n <= 1) return 0;
        if (n == 2) return 1;
        double harmonic = Math.log(n - 1.0) + 0.5772156649;
        return 2.0 * harmonic - (2.0 * (n - 1.0) / n);
    }
}
