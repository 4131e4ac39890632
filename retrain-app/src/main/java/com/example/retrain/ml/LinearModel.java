package com.example.retrain.ml;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Arrays;
import java.util.List;

/**
 * Linear regression model: {@code y = beta[0] + sum(beta[i+1] * x[i])}.
 *
 * @param featureNames feature columns the model was fitted on, in coefficient order
 * @param beta         intercept followed by one coefficient per feature
 */
public record LinearModel(
        @JsonProperty("feature_names") List<String> featureNames,
        double[] beta) {

    public LinearModel {
        featureNames = List.copyOf(featureNames);
        if (beta == null || beta.length != featureNames.size() + 1) {
            throw new IllegalArgumentException("beta must hold an intercept plus one coefficient per feature");
        }
        beta = beta.clone();
    }

    /** Copy of the coefficients. */
    @Override
    public double[] beta() {
        return beta.clone();
    }

    public double predict(double[] x) {
        if (x.length != beta.length - 1) {
            throw new IllegalArgumentException("expected " + (beta.length - 1) + " features, got " + x.length);
        }
        double s = beta[0];
        for (int i = 0; i < x.length; i++) s += beta[i + 1] * x[i];
        return s;
    }

    /** One prediction per row. */
    public double[] predict(List<double[]> rows) {
        double[] out = new double[rows.size()];
        for (int i = 0; i < out.length; i++) out[i] = predict(rows.get(i));
        return out;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof LinearModel m && featureNames.equals(m.featureNames) && Arrays.equals(beta, m.beta);
    }

    @Override
    public int hashCode() {
        return 31 * featureNames.hashCode() + Arrays.hashCode(beta);
    }

    @Override
    public String toString() {
        return "LinearModel[featureNames=" + featureNames + ", beta=" + Arrays.toString(beta) + "]";
    }
}
