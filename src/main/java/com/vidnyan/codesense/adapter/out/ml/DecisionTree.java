package com.vidnyan.codesense.adapter.out.ml;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Binary classification tree grown to purity with Gini impurity.
 *
 * At every node the candidate features are drawn at random until {@code featuresPerSplit}
 * non-constant features have been examined; the best threshold among them wins. A node that no
 * examined feature can split becomes a leaf holding the fraction of positive samples.
 */
final class DecisionTree {

    private final Node root;

    private DecisionTree(Node root) {
        this.root = root;
    }

    static DecisionTree fit(double[][] samples, int[] labels, int featuresPerSplit, Random random) {
        if (samples.length == 0 || samples.length != labels.length) {
            throw new IllegalArgumentException("samples and labels must be non-empty and aligned");
        }
        int[] rows = new int[samples.length];
        for (int i = 0; i < rows.length; i++) {
            rows[i] = i;
        }
        return new DecisionTree(new Builder(samples, labels, featuresPerSplit, random).grow(rows));
    }

    /**
     * Probability of the positive class for one vector.
     */
    double predictProbability(double[] vector) {
        Node node = root;
        while (!node.isLeaf()) {
            node = vector[node.feature] <= node.threshold ? node.left : node.right;
        }
        return node.probability;
    }

    int depth() {
        return root.depth();
    }

    private static final class Node {
        final int feature;
        final double threshold;
        final Node left;
        final Node right;
        final double probability;

        private Node(int feature, double threshold, Node left, Node right, double probability) {
            this.feature = feature;
            this.threshold = threshold;
            this.left = left;
            this.right = right;
            this.probability = probability;
        }

        static Node leaf(double probability) {
            return new Node(-1, 0.0, null, null, probability);
        }

        boolean isLeaf() {
            return left == null;
        }

        int depth() {
            return isLeaf() ? 0 : 1 + Math.max(left.depth(), right.depth());
        }
    }

    private record Split(int feature, double threshold, double impurity) {}

    private static final class Builder {
        private final double[][] samples;
        private final int[] labels;
        private final int featuresPerSplit;
        private final Random random;
        private final int featureCount;

        Builder(double[][] samples, int[] labels, int featuresPerSplit, Random random) {
            this.samples = samples;
            this.labels = labels;
            this.featuresPerSplit = Math.max(1, featuresPerSplit);
            this.random = random;
            this.featureCount = samples[0].length;
        }

        Node grow(int[] rows) {
            int positives = 0;
            for (int row : rows) {
                positives += labels[row];
            }
            double probability = (double) positives / rows.length;
            if (positives == 0 || positives == rows.length) {
                return Node.leaf(probability);
            }

            Split best = bestSplit(rows, positives);
            if (best == null) {
                return Node.leaf(probability);
            }
            int[] left = Arrays.stream(rows).filter(r -> samples[r][best.feature()] <= best.threshold()).toArray();
            int[] right = Arrays.stream(rows).filter(r -> samples[r][best.feature()] > best.threshold()).toArray();
            return new Node(best.feature(), best.threshold(), grow(left), grow(right), probability);
        }

        private Split bestSplit(int[] rows, int positives) {
            List<Integer> order = new ArrayList<>(featureCount);
            for (int f = 0; f < featureCount; f++) {
                order.add(f);
            }
            Collections.shuffle(order, random);

            double parent = gini(positives, rows.length);
            Split best = null;
            int examined = 0;
            for (int feature : order) {
                if (examined >= featuresPerSplit) {
                    break;
                }
                Split candidate = bestThreshold(rows, feature);
                if (candidate == null) {
                    // constant feature in this node
                    continue;
                }
                examined++;
                if (candidate.impurity() < parent - 1e-12 && (best == null || candidate.impurity() < best.impurity())) {
                    best = candidate;
                }
            }
            return best;
        }

        /**
         * Lowest weighted Gini over the midpoints between consecutive distinct values, or null if
         * the feature is constant on these rows.
         */
        private Split bestThreshold(int[] rows, int feature) {
            Integer[] sorted = new Integer[rows.length];
            for (int i = 0; i < rows.length; i++) {
                sorted[i] = rows[i];
            }
            Arrays.sort(sorted, (a, b) -> Double.compare(samples[a][feature], samples[b][feature]));
            if (samples[sorted[0]][feature] == samples[sorted[sorted.length - 1]][feature]) {
                return null;
            }

            int total = rows.length;
            int totalPositives = 0;
            for (int row : rows) {
                totalPositives += labels[row];
            }
            int leftCount = 0;
            int leftPositives = 0;
            Split best = null;
            for (int i = 0; i < total - 1; i++) {
                leftCount++;
                leftPositives += labels[sorted[i]];
                double value = samples[sorted[i]][feature];
                double next = samples[sorted[i + 1]][feature];
                if (value == next) {
                    continue;
                }
                int rightCount = total - leftCount;
                double impurity = (leftCount * gini(leftPositives, leftCount)
                        + rightCount * gini(totalPositives - leftPositives, rightCount)) / total;
                if (best == null || impurity < best.impurity()) {
                    best = new Split(feature, value + (next - value) / 2.0, impurity);
                }
            }
            return best;
        }

        private static double gini(int positives, int count) {
            double p = (double) positives / count;
            return 1.0 - p * p - (1.0 - p) * (1.0 - p);
        }
    }
}
