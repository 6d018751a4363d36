package com.market.sensitivity.regime;

import com.market.sensitivity.indicator.Windows;
import com.market.sensitivity.series.TimeSeries;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Rolling dual-regime regression of a metric against benchmark returns.
 *
 * <p>For every position i from {@code window} on, the window [i - window, i)
 * is split into up-market and down-market observations. When both regimes hold
 * more than {@code window / 4} observations, the metric is regressed on the
 * market return within each regime and:
 * <ul>
 *   <li>upside = slope in the up regime</li>
 *   <li>downside = slope in the down regime</li>
 *   <li>composite = upside - downside</li>
 *   <li>independence = 1 - |upside * downside|</li>
 * </ul>
 * A window failing the count gate, or where either fit is undefined (missing
 * metric value, zero-variance market returns), leaves all four outputs missing.
 */
public final class RegimeSensitivityAnalyzer {

    public static final int DEFAULT_WINDOW = 90;

    private RegimeSensitivityAnalyzer() {}

    public static SensitivityBundle analyze(TimeSeries metric, TimeSeries marketReturns) {
        return analyze(metric, marketReturns, DEFAULT_WINDOW);
    }

    public static SensitivityBundle analyze(TimeSeries metric, TimeSeries marketReturns, int window) {
        Windows.requireValid(window);
        if (!metric.hasSameIndex(marketReturns)) {
            throw new IllegalArgumentException("metric and market returns must share the same dates");
        }

        int n = metric.size();
        List<Double> upside = new ArrayList<>(n);
        List<Double> downside = new ArrayList<>(n);
        List<Double> composite = new ArrayList<>(n);
        List<Double> independence = new ArrayList<>(n);

        for (int i = 0; i < n; i++) {
            Optional<RegimeSlopes> slopes = i >= window
                    ? slopesAt(metric.values().subList(i - window, i),
                               marketReturns.values().subList(i - window, i),
                               window)
                    : Optional.empty();

            if (slopes.isPresent()) {
                double up = slopes.get().upside();
                double down = slopes.get().downside();
                upside.add(up);
                downside.add(down);
                composite.add(up - down);
                independence.add(1 - Math.abs(up * down));
            } else {
                upside.add(null);
                downside.add(null);
                composite.add(null);
                independence.add(null);
            }
        }

        return SensitivityBundle.of(
                metric.withValues(upside),
                metric.withValues(downside),
                metric.withValues(composite),
                metric.withValues(independence));
    }

    static Optional<RegimeSlopes> slopesAt(List<Double> metricWindow, List<Double> marketWindow, int window) {
        RegimeSplit split = RegimeSplit.of(metricWindow, marketWindow);
        if (!split.isValid(window)) {
            return Optional.empty();
        }

        OptionalDouble up = LinearRegression.slope(split.up());
        OptionalDouble down = LinearRegression.slope(split.down());
        if (up.isEmpty() || down.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new RegimeSlopes(up.getAsDouble(), down.getAsDouble()));
    }

    record RegimeSlopes(double upside, double downside) {}
}
