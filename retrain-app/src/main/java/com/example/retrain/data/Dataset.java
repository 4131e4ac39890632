package com.example.retrain.data;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Numeric dataset: one feature vector and one target per row.
 *
 * <p>
 * Rows and targets are copied on construction. {@link #targets()} returns a copy; the rows
 * returned by {@link #features()} are the dataset's own and must not be modified. Equality
 * compares contents.
 * </p>
 *
 * @param featureNames column names of the features, in vector order
 * @param features     feature rows
 * @param targets      target per row, same order as {@code features}
 */
public record Dataset(List<String> featureNames, List<double[]> features, double[] targets) {

    public Dataset {
        featureNames = List.copyOf(featureNames);
        if (features.size() != targets.length) {
            throw new IllegalArgumentException(
                    "features/targets length mismatch: " + features.size() + " vs " + targets.length);
        }
        List<double[]> rows = new ArrayList<>(features.size());
        for (double[] row : features) {
            rows.add(row.clone());
        }
        features = List.copyOf(rows);
        targets = targets.clone();
    }

    /** Copy of the targets. */
    @Override
    public double[] targets() {
        return targets.clone();
    }

    public int size() {
        return targets.length;
    }

    public boolean isEmpty() {
        return targets.length == 0;
    }

    /** Rows at the given indices, in index order. */
    public Dataset select(int[] indices) {
        List<double[]> x = new ArrayList<>(indices.length);
        double[] y = new double[indices.length];
        for (int i = 0; i < indices.length; i++) {
            x.add(features.get(indices[i]));
            y[i] = targets[indices[i]];
        }
        return new Dataset(featureNames, x, y);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Dataset d)) return false;
        if (!featureNames.equals(d.featureNames) || !Arrays.equals(targets, d.targets)) return false;
        for (int i = 0; i < features.size(); i++) {
            if (!Arrays.equals(features.get(i), d.features.get(i))) return false;
        }
        return true;
    }

    @Override
    public int hashCode() {
        int h = 31 * featureNames.hashCode() + Arrays.hashCode(targets);
        for (double[] row : features) {
            h = 31 * h + Arrays.hashCode(row);
        }
        return h;
    }

    @Override
    public String toString() {
        return "Dataset[featureNames=" + featureNames + ", rows=" + targets.length + "]";
    }
}
