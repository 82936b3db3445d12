package com.vidnyan.codesense.adapter.out.ml;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Bagged ensemble of {@link DecisionTree}s with sqrt(features) candidates per split.
 * The positive-class probability is the mean of the trees' leaf probabilities.
 * Training is deterministic for a given seed.
 */
public final class RandomForest {

    private final List<DecisionTree> trees;

    private RandomForest(List<DecisionTree> trees) {
        this.trees = List.copyOf(trees);
    }

    public static RandomForest fit(double[][] samples, int[] labels, int treeCount, long seed) {
        if (treeCount < 1) {
            throw new IllegalArgumentException("treeCount must be positive");
        }
        if (samples.length == 0 || samples.length != labels.length) {
            throw new IllegalArgumentException("samples and labels must be non-empty and aligned");
        }
        int featuresPerSplit = Math.max(1, (int) Math.sqrt(samples[0].length));
        Random master = new Random(seed);
        List<DecisionTree> trees = new ArrayList<>(treeCount);
        for (int t = 0; t < treeCount; t++) {
            Random random = new Random(master.nextLong());
            double[][] bag = new double[samples.length][];
            int[] bagLabels = new int[samples.length];
            for (int i = 0; i < samples.length; i++) {
                int pick = random.nextInt(samples.length);
                bag[i] = samples[pick];
                bagLabels[i] = labels[pick];
            }
            trees.add(DecisionTree.fit(bag, bagLabels, featuresPerSplit, random));
        }
        return new RandomForest(trees);
    }

    /**
     * Probability in [0, 1] of the positive class.
     */
    public double predictProbability(double[] vector) {
        double sum = 0.0;
        for (DecisionTree tree : trees) {
            sum += tree.predictProbability(vector);
        }
        return sum / trees.size();
    }

    public int size() {
        return trees.size();
    }

    int maxDepth() {
        return trees.stream().mapToInt(DecisionTree::depth).max().orElse(0);
    }
}
