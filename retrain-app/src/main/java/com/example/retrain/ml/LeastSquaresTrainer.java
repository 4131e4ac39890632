package com.example.retrain.ml;

import com.example.retrain.data.Dataset;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.QRDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

/**
 * Ordinary least squares with an intercept, solved by QR decomposition.
 */
public class LeastSquaresTrainer {

    public LinearModel fit(Dataset data) {
        int n = data.size();
        int p = data.featureNames().size() + 1;
        if (n < p) {
            throw new IllegalArgumentException("need at least " + p + " rows to fit " + (p - 1) + " features, got " + n);
        }
        double[][] xa = new double[n][p];
        for (int i = 0; i < n; i++) {
            double[] row = data.features().get(i);
            xa[i][0] = 1.0;
            System.arraycopy(row, 0, xa[i], 1, row.length);
        }
        RealMatrix xm = new Array2DRowRealMatrix(xa, false);
        RealVector yv = new ArrayRealVector(data.targets(), true);
        RealVector b = new QRDecomposition(xm).getSolver().solve(yv);
        return new LinearModel(data.featureNames(), b.toArray());
    }
}
