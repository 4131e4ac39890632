package com.example.retrain.data;

import java.util.Arrays;
import java.util.Random;

/**
 * Deterministic train/test split shared by the training job and the quality evaluator,
 * so a model is always scored on rows it was not fitted on.
 *
 * @param trainIndices row indices of the training part
 * @param testIndices  row indices of the held-out part
 */
public record HoldoutSplit(int[] trainIndices, int[] testIndices) {

    public static final long DEFAULT_SEED = 42L;
    public static final double DEFAULT_TEST_FRACTION = 0.2;

    public HoldoutSplit {
        trainIndices = trainIndices.clone();
        testIndices = testIndices.clone();
    }

    @Override
    public int[] trainIndices() {
        return trainIndices.clone();
    }

    @Override
    public int[] testIndices() {
        return testIndices.clone();
    }

    public static HoldoutSplit of(int rows) {
        return of(rows, DEFAULT_TEST_FRACTION, DEFAULT_SEED);
    }

    /**
     * Fisher-Yates shuffle of {@code 0..rows-1} with a seeded {@link Random}; the first
     * {@code ceil(rows * testFraction)} shuffled indices form the test part.
     */
    public static HoldoutSplit of(int rows, double testFraction, long seed) {
        if (testFraction <= 0.0 || testFraction >= 1.0) {
            throw new IllegalArgumentException("testFraction must be in (0, 1), was " + testFraction);
        }
        int[] idx = new int[rows];
        for (int i = 0; i < rows; i++) idx[i] = i;
        Random rnd = new Random(seed);
        for (int i = rows - 1; i > 0; i--) {
            int j = rnd.nextInt(i + 1);
            int t = idx[i];
            idx[i] = idx[j];
            idx[j] = t;
        }
        int testSize = rows == 0 ? 0 : (int) Math.ceil(rows * testFraction);
        int[] test = new int[testSize];
        int[] train = new int[rows - testSize];
        System.arraycopy(idx, 0, test, 0, testSize);
        System.arraycopy(idx, testSize, train, 0, train.length);
        return new HoldoutSplit(train, test);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof HoldoutSplit h
                && Arrays.equals(trainIndices, h.trainIndices) && Arrays.equals(testIndices, h.testIndices);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(trainIndices) + Arrays.hashCode(testIndices);
    }

    @Override
    public String toString() {
        return "HoldoutSplit[train=" + trainIndices.length + " rows, test=" + Arrays.toString(testIndices) + "]";
    }
}
