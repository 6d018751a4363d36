package com.market.sensitivity.indicator;

import com.market.sensitivity.series.TimeSeries;

import java.util.ArrayList;
import java.util.List;

/**
 * Rolling gain to pain ratio.
 *
 * <p>ratio[i] = sum(r) / sum(|min(r, 0)|) over the returns in [i - window, i).
 * Positions before {@code window}, windows holding a missing return and
 * windows without any negative return are missing.
 *
 * <p>Each window is summed from scratch, so equal window contents always give
 * bit-identical ratios regardless of what preceded them.
 */
public final class PerformanceRatioEngine {

    public static final int DEFAULT_WINDOW = 90;

    private PerformanceRatioEngine() {}

    public static TimeSeries compute(TimeSeries returns) {
        return compute(returns, DEFAULT_WINDOW);
    }

    public static TimeSeries compute(TimeSeries returns, int window) {
        Windows.requireValid(window);
        int n = returns.size();
        List<Double> out = new ArrayList<>(n);

        for (int i = 0; i < n; i++) {
            out.add(i >= window ? windowRatio(returns.values().subList(i - window, i)) : null);
        }
        return returns.withValues(out);
    }

    static Double windowRatio(List<Double> window) {
        double gains = 0;
        double losses = 0;
        for (Double r : window) {
            if (r == null) {
                return null;
            }
            gains += r;
            if (r < 0) {
                losses -= r;
            }
        }
        return losses > 0 ? gains / losses : null;
    }
}
