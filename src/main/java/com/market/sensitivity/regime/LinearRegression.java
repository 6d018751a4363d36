package com.market.sensitivity.regime;

import java.util.List;
import java.util.OptionalDouble;

/**
 * Slope of the ordinary least squares line y = a + b * x.
 */
public final class LinearRegression {

    /** Centered sum of squares below this fraction of the raw one counts as zero variance. */
    private static final double ZERO_VARIANCE_TOLERANCE = 1e-12;

    private LinearRegression() {}

    public static OptionalDouble slope(RegimeSample sample) {
        return slope(sample.getMarketReturns(), sample.getMetricValues());
    }

    /**
     * slope = Sxy / Sxx, computed on centered values.
     *
     * @return empty when a value is missing, fewer than 2 points exist, or x has
     *         zero variance
     */
    public static OptionalDouble slope(List<Double> x, List<Double> y) {
        if (x.size() != y.size()) {
            throw new IllegalArgumentException("x and y differ in length: " + x.size() + " vs " + y.size());
        }
        int n = x.size();
        if (n < 2) {
            return OptionalDouble.empty();
        }

        double sumX = 0;
        double sumY = 0;
        double sumX2 = 0;
        for (int i = 0; i < n; i++) {
            Double xi = x.get(i);
            Double yi = y.get(i);
            if (xi == null || yi == null) {
                return OptionalDouble.empty();
            }
            sumX += xi;
            sumY += yi;
            sumX2 += xi * xi;
        }
        double meanX = sumX / n;
        double meanY = sumY / n;

        double sxx = 0;
        double sxy = 0;
        for (int i = 0; i < n; i++) {
            double dx = x.get(i) - meanX;
            sxx += dx * dx;
            sxy += dx * (y.get(i) - meanY);
        }

        if (sxx <= ZERO_VARIANCE_TOLERANCE * sumX2) {
            return OptionalDouble.empty();
        }

        double slope = sxy / sxx;
        if (!Double.isFinite(slope)) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(slope);
    }
}
