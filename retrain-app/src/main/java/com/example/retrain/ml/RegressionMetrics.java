package com.example.retrain.ml;

import org.apache.commons.math3.stat.StatUtils;

/**
 * Scores for regression predictions.
 */
public final class RegressionMetrics {

    private RegressionMetrics() {}

    /**
     * Coefficient of determination, {@code 1 - SS_res / SS_tot}.
     * A constant target (zero total variance) scores 1.0 for a perfect fit and 0.0 otherwise.
     */
    public static double r2(double[] actual, double[] predicted) {
        if (actual.length != predicted.length) {
            throw new IllegalArgumentException("length mismatch: " + actual.length + " vs " + predicted.length);
        }
        if (actual.length == 0) {
            throw new IllegalArgumentException("cannot score an empty sample");
        }
        double mean = StatUtils.mean(actual);
        double ssRes = 0.0;
        double ssTot = 0.0;
        for (int i = 0; i < actual.length; i++) {
            double r = actual[i] - predicted[i];
            double d = actual[i] - mean;
            ssRes += r * r;
            ssTot += d * d;
        }
        if (ssTot == 0.0) {
            return ssRes == 0.0 ? 1.0 : 0.0;
        }
        return 1.0 - ssRes / ssTot;
    }
}
