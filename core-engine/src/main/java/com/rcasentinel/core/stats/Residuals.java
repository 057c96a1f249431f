package com.rcasentinel.core.stats;

import org.apache.commons.math3.stat.regression.OLSMultipleLinearRegression;

/**
 * Ordinary least squares residuals, with intercept.
 *
 * @since 1.0.0
 */
public final class Residuals {

    private Residuals() {
    }

    /**
     * Regress {@code y} on the columns of {@code x} and return what is left.
     *
     * @param y response, one value per row
     * @param x design matrix, {@code x[row][column]}
     * @return residuals, same length as {@code y}
     * @throws org.apache.commons.math3.exception.MathIllegalArgumentException
     *         if there are too few rows for the number of columns
     * @throws org.apache.commons.math3.linear.SingularMatrixException
     *         if the design matrix is rank deficient
     */
    public static double[] of(double[] y, double[][] x) {
        OLSMultipleLinearRegression ols = new OLSMultipleLinearRegression();
        ols.newSampleData(y, x);
        return ols.estimateResiduals();
    }
}
