package com.market.sensitivity.smoothing;

import com.market.sensitivity.series.TimeSeries;

import java.util.ArrayList;
import java.util.List;

/**
 * Savitzky-Golay smoothing: each point is replaced by the value of a
 * least-squares polynomial fitted over the surrounding window.
 *
 * <p>Gaps are forward filled then back filled first. Interior points use the
 * precomputed central convolution coefficients; the first and last
 * {@code windowLength / 2} points are read off a polynomial fitted to the
 * first and last full window. Series with fewer than {@code windowLength + 1}
 * observations, or with no value at all, are returned unchanged.
 */
public class SavitzkyGolayFilter implements SmoothingFilter {

    public static final int DEFAULT_WINDOW_LENGTH = 21;
    public static final int DEFAULT_POLY_ORDER = 3;

    private final int windowLength;
    private final int polyOrder;
    private final int half;
    private final double[][] normalMatrix;
    private final double[] coefficients;

    public SavitzkyGolayFilter() {
        this(DEFAULT_WINDOW_LENGTH, DEFAULT_POLY_ORDER);
    }

    public SavitzkyGolayFilter(int windowLength, int polyOrder) {
        if (windowLength % 2 == 0 || windowLength < 1) {
            throw new IllegalArgumentException("windowLength must be a positive odd number, was " + windowLength);
        }
        if (polyOrder < 0 || polyOrder >= windowLength) {
            throw new IllegalArgumentException(
                    "polyOrder must be in [0, windowLength), was " + polyOrder);
        }
        this.windowLength = windowLength;
        this.polyOrder = polyOrder;
        this.half = windowLength / 2;
        this.normalMatrix = buildNormalMatrix();
        this.coefficients = centralCoefficients();
    }

    public int getWindowLength() {
        return windowLength;
    }

    public int getPolyOrder() {
        return polyOrder;
    }

    @Override
    public TimeSeries smooth(TimeSeries series) {
        int n = series.size();
        if (n < windowLength + 1 || series.presentCount() == 0) {
            return series;
        }

        TimeSeries filled = GapFiller.backFill(GapFiller.forwardFill(series));
        double[] y = new double[n];
        for (int i = 0; i < n; i++) {
            y[i] = filled.valueAt(i);
        }

        double[] out = new double[n];
        for (int i = half; i < n - half; i++) {
            double sum = 0;
            for (int j = -half; j <= half; j++) {
                sum += coefficients[j + half] * y[i + j];
            }
            out[i] = sum;
        }

        double[] head = fitWindow(y, 0);
        for (int i = 0; i < half; i++) {
            out[i] = evaluate(head, i - half);
        }
        int tailStart = n - windowLength;
        double[] tail = fitWindow(y, tailStart);
        for (int i = n - half; i < n; i++) {
            out[i] = evaluate(tail, i - tailStart - half);
        }

        List<Double> values = new ArrayList<>(n);
        for (double v : out) {
            values.add(v);
        }
        return series.withValues(values);
    }

    /**
     * Polynomial coefficients fitted to y[start, start + windowLength), with x
     * centered on the middle of the window.
     */
    private double[] fitWindow(double[] y, int start) {
        double[] rhs = new double[polyOrder + 1];
        for (int j = -half; j <= half; j++) {
            double value = y[start + half + j];
            double power = 1;
            for (int k = 0; k <= polyOrder; k++) {
                rhs[k] += power * value;
                power *= j;
            }
        }
        return solve(normalMatrix, rhs);
    }

    // c_j = sum_k h_k * j^k where (A^T A) h = e_0
    private double[] centralCoefficients() {
        double[] e0 = new double[polyOrder + 1];
        e0[0] = 1;
        double[] h = solve(normalMatrix, e0);

        double[] c = new double[windowLength];
        for (int j = -half; j <= half; j++) {
            c[j + half] = evaluate(h, j);
        }
        return c;
    }

    private double[][] buildNormalMatrix() {
        double[][] m = new double[polyOrder + 1][polyOrder + 1];
        for (int j = -half; j <= half; j++) {
            for (int a = 0; a <= polyOrder; a++) {
                for (int b = 0; b <= polyOrder; b++) {
                    m[a][b] += Math.pow(j, a + b);
                }
            }
        }
        return m;
    }

    private static double evaluate(double[] poly, double x) {
        double result = 0;
        for (int k = poly.length - 1; k >= 0; k--) {
            result = result * x + poly[k];
        }
        return result;
    }

    /**
     * Gaussian elimination with partial pivoting. Inputs are not modified.
     */
    static double[] solve(double[][] matrix, double[] rhs) {
        int n = rhs.length;
        double[][] a = new double[n][];
        for (int i = 0; i < n; i++) {
            a[i] = matrix[i].clone();
        }
        double[] b = rhs.clone();

        for (int col = 0; col < n; col++) {
            int pivot = col;
            for (int row = col + 1; row < n; row++) {
                if (Math.abs(a[row][col]) > Math.abs(a[pivot][col])) {
                    pivot = row;
                }
            }
            if (a[pivot][col] == 0) {
                throw new IllegalStateException("singular normal matrix");
            }
            double[] tmpRow = a[col];
            a[col] = a[pivot];
            a[pivot] = tmpRow;
            double tmp = b[col];
            b[col] = b[pivot];
            b[pivot] = tmp;

            for (int row = col + 1; row < n; row++) {
                double factor = a[row][col] / a[col][col];
                for (int k = col; k < n; k++) {
                    a[row][k] -= factor * a[col][k];
                }
                b[row] -= factor * b[col];
            }
        }

        double[] x = new double[n];
        for (int row = n - 1; row >= 0; row--) {
            double sum = b[row];
            for (int k = row + 1; k < n; k++) {
                sum -= a[row][k] * x[k];
            }
            x[row] = sum / a[row][row];
        }
        return x;
    }
}
