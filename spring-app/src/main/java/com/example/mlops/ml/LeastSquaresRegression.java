package com.example.mlops.ml;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.QRDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularMatrixException;

import java.util.List;

/**
 * Ordinary least squares with an intercept, solved by QR decomposition.
 * {@code coefficients()[0]} is the intercept, followed by one weight per input column.
 */
public final class LeastSquaresRegression {

    private static final double SINGULARITY_THRESHOLD = 1e-10;

    private final double[] beta;

    private LeastSquaresRegression(double[] beta) {
        this.beta = beta;
    }

    /**
     * @throws IllegalArgumentException if there are fewer rows than coefficients
     * @throws SingularMatrixException  if the columns are linearly dependent
     */
    public static LeastSquaresRegression fit(List<double[]> xNoBias, List<Double> y) {
        if (xNoBias.isEmpty()) throw new IllegalArgumentException("no training rows");
        int n = xNoBias.size(), p = xNoBias.get(0).length + 1;
        if (n < p) throw new IllegalArgumentException("need at least " + p + " rows, got " + n);

        double[][] Xa = new double[n][p];
        double[] ya = new double[n];
        for (int i = 0; i < n; i++) {
            Xa[i][0] = 1.0;
            System.arraycopy(xNoBias.get(i), 0, Xa[i], 1, p - 1);
            ya[i] = y.get(i);
        }
        RealMatrix Xm = new Array2DRowRealMatrix(Xa, false);
        RealVector yv = new ArrayRealVector(ya, false);
        RealVector b = new QRDecomposition(Xm, SINGULARITY_THRESHOLD).getSolver().solve(yv);
        return new LeastSquaresRegression(b.toArray());
    }

    public double[] coefficients() {
        return beta.clone();
    }
}
