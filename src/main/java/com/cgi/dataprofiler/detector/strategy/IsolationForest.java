package com.cgi.dataprofiler.detector.strategy;

import java.util.Random;

/**
 * Isolation forest over one numeric feature.
 * Each tree isolates values by random splits; values isolated in few splits
 * score close to 1.
 */
final class IsolationForest {

    private static final double EULER_GAMMA = 0.5772156649015329;

    private final Node[] trees;
    private final int subsampleSize;

    private IsolationForest(Node[] trees, int subsampleSize) {
        this.trees = trees;
        this.subsampleSize = subsampleSize;
    }

    /**
     * Grows a forest.
     *
     * @param values        Training values, not modified
     * @param treeCount     Number of trees
     * @param subsampleSize Values drawn per tree
     * @param random        Source of randomness
     * @return Fitted forest
     */
    static IsolationForest fit(double[] values, int treeCount, int subsampleSize, Random random) {
        int psi = Math.min(subsampleSize, values.length);
        int heightLimit = (int) Math.ceil(Math.log(Math.max(psi, 2)) / Math.log(2));
        Node[] trees = new Node[treeCount];
        double[] pool = values.clone();
        for (int t = 0; t < treeCount; t++) {
            // Partial shuffle puts a fresh subsample in the first psi slots
            for (int i = 0; i < psi; i++) {
                int j = i + random.nextInt(pool.length - i);
                double tmp = pool[i];
                pool[i] = pool[j];
                pool[j] = tmp;
            }
            double[] subsample = new double[psi];
            System.arraycopy(pool, 0, subsample, 0, psi);
            trees[t] = grow(subsample, 0, psi, 0, heightLimit, random);
        }
        return new IsolationForest(trees, psi);
    }

    /**
     * Anomaly score in (0, 1].
     */
    double score(double value) {
        double totalPath = 0.0;
        for (Node tree : trees) {
            totalPath += pathLength(tree, value, 0);
        }
        double meanPath = totalPath / trees.length;
        double normalizer = averagePathLength(subsampleSize);
        return normalizer > 0.0 ? Math.pow(2.0, -meanPath / normalizer) : 0.5;
    }

    private static Node grow(double[] values, int from, int to, int depth, int heightLimit, Random random) {
        int size = to - from;
        if (depth >= heightLimit || size <= 1) {
            return Node.leaf(size);
        }
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (int i = from; i < to; i++) {
            min = Math.min(min, values[i]);
            max = Math.max(max, values[i]);
        }
        if (min == max) {
            return Node.leaf(size);
        }

        double split = min + random.nextDouble() * (max - min);
        // Partition in place: [from, mid) below the split
        int mid = from;
        for (int i = from; i < to; i++) {
            if (values[i] < split) {
                double tmp = values[mid];
                values[mid] = values[i];
                values[i] = tmp;
                mid++;
            }
        }
        return Node.split(split,
                grow(values, from, mid, depth + 1, heightLimit, random),
                grow(values, mid, to, depth + 1, heightLimit, random));
    }

    private static double pathLength(Node node, double value, int depth) {
        if (node.left == null) {
            return depth + averagePathLength(node.size);
        }
        return pathLength(value < node.splitValue ? node.left : node.right, value, depth + 1);
    }

    /**
     * Average path length of an unsuccessful search in a binary search tree of n nodes.
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

    private static final class Node {
        private final double splitValue;
        private final Node left;
        private final Node right;
        private final int size;

        private Node(double splitValue, Node left, Node right, int size) {
            this.splitValue = splitValue;
            this.left = left;
            this.right = right;
            this.size = size;
        }

        static Node leaf(int size) {
            return new Node(Double.NaN, null, null, size);
        }

        static Node split(double splitValue, Node left, Node right) {
            return new Node(splitValue, left, right, 0);
        }
    }
}
