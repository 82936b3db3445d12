package com.vidnyan.codesense.adapter.out.ml;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RandomForestTest {

    // feature 0 separates the classes, feature 1 is noise
    private static final double[][] SAMPLES = {
            {0.1, 0.5}, {0.2, 0.1}, {0.15, 0.9}, {0.05, 0.3},
            {0.9, 0.5}, {0.8, 0.2}, {0.85, 0.7}, {0.95, 0.4}
    };
    private static final int[] LABELS = {0, 0, 0, 0, 1, 1, 1, 1};

    @Test
    void predictProbability_ShouldSeparateLinearlySeparableClasses() {
        RandomForest forest = RandomForest.fit(SAMPLES, LABELS, 50, 42L);

        assertEquals(50, forest.size());
        assertTrue(forest.predictProbability(new double[]{0.9, 0.5}) > 0.5);
        assertTrue(forest.predictProbability(new double[]{0.1, 0.5}) < 0.5);
    }

    @Test
    void fit_ShouldBeDeterministicForSeed() {
        RandomForest first = RandomForest.fit(SAMPLES, LABELS, 20, 7L);
        RandomForest second = RandomForest.fit(SAMPLES, LABELS, 20, 7L);

        double[] probe = {0.5, 0.5};
        assertEquals(first.predictProbability(probe), second.predictProbability(probe));
        assertEquals(first.maxDepth(), second.maxDepth());
    }

    @Test
    void predictProbability_ShouldStayInUnitInterval() {
        RandomForest forest = RandomForest.fit(SAMPLES, LABELS, 10, 1L);

        for (double x = 0.0; x <= 1.0; x += 0.1) {
            double p = forest.predictProbability(new double[]{x, 1.0 - x});
            assertTrue(p >= 0.0 && p <= 1.0, "probability " + p);
        }
    }

    @Test
    void decisionTree_ShouldBeSingleLeafForPureLabels() {
        DecisionTree tree = DecisionTree.fit(SAMPLES, new int[8], 2, new java.util.Random(3));

        assertEquals(0, tree.depth());
        assertEquals(0.0, tree.predictProbability(new double[]{0.9, 0.9}));
    }

    @Test
    void fit_ShouldRejectInvalidInput() {
        assertThrows(IllegalArgumentException.class, () -> RandomForest.fit(SAMPLES, LABELS, 0, 1L));
        assertThrows(IllegalArgumentException.class, () -> RandomForest.fit(SAMPLES, new int[3], 5, 1L));
    }
}
