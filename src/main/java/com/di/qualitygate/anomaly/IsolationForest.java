package com.di.qualitygate.anomaly;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Isolation forest over dense numeric rows.
 * <p>
 * Each tree is grown on a random subsample of at most {@value #MAX_SAMPLES} rows by picking a
 * random splittable attribute and a uniform split value between its observed bounds, down to a
 * height limit of {@code ceil(log2(subsample))}. A row's anomaly score is
 * {@code 2^(-E[h(x)] / c(subsample))}: short average paths mean easy isolation and scores near 1.
 * All randomness comes from one {@link Random} seeded at construction, so fits are reproducible.
 */
public class IsolationForest {

    static final int MAX_SAMPLES = 256;

    private static final double EULER_GAMMA = 0.5772156649015329;

    private final int trees;
    private final long seed;
    private final List<Node> forest = new ArrayList<>();
    private int subsampleSize;

    public IsolationForest(int trees, long seed) {
        this.trees = trees;
        this.seed = seed;
    }

    public IsolationForest fit(double[][] data) {
        forest.clear();
        Random random = new Random(seed);
        int n = data.length;
        subsampleSize = Math.min(MAX_SAMPLES, n);
        int heightLimit = (int) Math.ceil(Math.log(Math.max(subsampleSize, 2)) / Math.log(2));
        int[] indices = new int[n];
        for (int t = 0; t < trees; t++) {
            for (int i = 0; i < n; i++) {
                indices[i] = i;
            }
            // partial Fisher-Yates: first subsampleSize slots are the sample
            for (int i = 0; i < subsampleSize; i++) {
                int j = i + random.nextInt(n - i);
                int tmp = indices[i];
                indices[i] = indices[j];
                indices[j] = tmp;
            }
            double[][] sample = new double[subsampleSize][];
            for (int i = 0; i < subsampleSize; i++) {
                sample[i] = data[indices[i]];
            }
            forest.add(grow(sample, 0, heightLimit, random));
        }
        return this;
    }

    /** Anomaly score in (0, 1] per row; higher is more anomalous. */
    public double[] score(double[][] data) {
        if (forest.isEmpty()) {
            throw new IllegalStateException("Isolation forest has not been fitted");
        }
        double normalizer = averagePathLength(subsampleSize);
        double[] scores = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            double total = 0;
            for (Node tree : forest) {
                total += pathLength(tree, data[i], 0);
            }
            double mean = total / forest.size();
            scores[i] = normalizer == 0 ? 0.5 : Math.pow(2, -mean / normalizer);
        }
        return scores;
    }

    private static Node grow(double[][] rows, int depth, int heightLimit, Random random) {
        if (depth >= heightLimit || rows.length <= 1) {
            return Node.leaf(rows.length);
        }
        int dims = rows[0].length;
        double[] min = new double[dims];
        double[] max = new double[dims];
        for (int d = 0; d < dims; d++) {
            min[d] = Double.POSITIVE_INFINITY;
            max[d] = Double.NEGATIVE_INFINITY;
            for (double[] row : rows) {
                min[d] = Math.min(min[d], row[d]);
                max[d] = Math.max(max[d], row[d]);
            }
        }
        List<Integer> splittable = new ArrayList<>();
        for (int d = 0; d < dims; d++) {
            if (max[d] > min[d]) {
                splittable.add(d);
            }
        }
        if (splittable.isEmpty()) {
            return Node.leaf(rows.length);
        }
        int attribute = splittable.get(random.nextInt(splittable.size()));
        double split = min[attribute] + random.nextDouble() * (max[attribute] - min[attribute]);
        List<double[]> left = new ArrayList<>();
        List<double[]> right = new ArrayList<>();
        for (double[] row : rows) {
            if (row[attribute] < split) {
                left.add(row);
            } else {
                right.add(row);
            }
        }
        return Node.split(attribute, split,
                grow(left.toArray(new double[0][]), depth + 1, heightLimit, random),
                grow(right.toArray(new double[0][]), depth + 1, heightLimit, random));
    }

    private static double pathLength(Node node, double[] row, int depth) {
        if (node.isLeaf()) {
            return depth + averagePathLength(node.size);
        }
        Node next = row[node.attribute] < node.split ? node.left : node.right;
        return pathLength(next, row, depth + 1);
    }

    /** Average path length of an unsuccessful BST search over {@code n} items. */
    static double averagePathLength(int n) {
        if (n > 2) {
            return 2.0 * (Math.log(n - 1.0) + EULER_GAMMA) - 2.0 * (n - 1.0) / n;
        }
        return n == 2 ? 1.0 : 0.0;
    }

    private static final class Node {
        final int attribute;
        final double split;
        final Node left;
        final Node right;
        final int size;

        private Node(int attribute, double split, Node left, Node right, int size) {
            this.attribute = attribute;
            this.split = split;
            this.left = left;
            this.right = right;
            this.size = size;
        }

        static Node leaf(int size) {
            return new Node(-1, 0, null, null, size);
        }

        static Node split(int attribute, double split, Node left, Node right) {
            return new Node(attribute, split, left, right, 0);
        }

        boolean isLeaf() {
            return left == null;
        }
    }
}
