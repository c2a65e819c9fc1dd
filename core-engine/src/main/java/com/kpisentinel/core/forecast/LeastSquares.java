package com.kpisentinel.core.forecast;

/**
 * Penalised least squares via the normal equations.
 *
 * <p>
 * Solves {@code (XᵀX + diag(penalty)) β = Xᵀy} with Gaussian elimination and
 * partial pivoting. Design matrices here are small (tens of columns), so the
 * normal equations are adequate.
 * </p>
 * <p>
 * Both phases stop with a {@link ForecastException} when the calling thread
 * is interrupted.
 * </p>
 */
final class LeastSquares {

    private static final double JITTER = 1e-10;
    private static final double SINGULAR = 1e-14;

    private LeastSquares() {
    }

    /**
     * @param x       design matrix, one row per observation
     * @param y       targets
     * @param penalty ridge penalty per column (0 for unpenalised)
     * @return fitted coefficients
     * @throws ForecastException if the system is singular
     */
    static double[] fit(double[][] x, double[] y, double[] penalty) {
        int k = penalty.length;
        double[][] a = new double[k][k];
        double[] b = new double[k];
        for (int i = 0; i < x.length; i++) {
            checkInterrupted();
            double[] row = x[i];
            for (int p = 0; p < k; p++) {
                b[p] += row[p] * y[i];
                for (int q = p; q < k; q++) {
                    a[p][q] += row[p] * row[q];
                }
            }
        }
        for (int p = 0; p < k; p++) {
            for (int q = 0; q < p; q++) {
                a[p][q] = a[q][p];
            }
            a[p][p] += penalty[p] + JITTER;
        }
        return solve(a, b);
    }

    static double[] solve(double[][] a, double[] b) {
        int n = b.length;
        for (int col = 0; col < n; col++) {
            checkInterrupted();
            int pivot = col;
            for (int r = col + 1; r < n; r++) {
                if (Math.abs(a[r][col]) > Math.abs(a[pivot][col])) {
                    pivot = r;
                }
            }
            if (Math.abs(a[pivot][col]) < SINGULAR) {
                throw new ForecastException("Singular regression system at column " + col);
            }
            double[] tmpRow = a[col];
            a[col] = a[pivot];
            a[pivot] = tmpRow;
            double tmp = b[col];
            b[col] = b[pivot];
            b[pivot] = tmp;

            for (int r = col + 1; r < n; r++) {
                double factor = a[r][col] / a[col][col];
                b[r] -= factor * b[col];
                for (int c = col; c < n; c++) {
                    a[r][c] -= factor * a[col][c];
                }
            }
        }
        double[] solution = new double[n];
        for (int r = n - 1; r >= 0; r--) {
            double sum = b[r];
            for (int c = r + 1; c < n; c++) {
                sum -= a[r][c] * solution[c];
            }
            solution[r] = sum / a[r][r];
        }
        return solution;
    }

    private static void checkInterrupted() {
        if (Thread.currentThread().isInterrupted()) {
            throw new ForecastException("Regression interrupted");
        }
    }
}
