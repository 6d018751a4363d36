package com.market.sensitivity.indicator;

import com.market.sensitivity.series.TimeSeries;

import java.util.ArrayList;
import java.util.List;

/**
 * Performance ratio over returns scaled by average true range.
 */
public final class VolatilityAdjustedRatioEngine {

    public static final int DEFAULT_WINDOW = 90;

    private VolatilityAdjustedRatioEngine() {}

    public static TimeSeries compute(TimeSeries returns, TimeSeries high, TimeSeries low, TimeSeries close) {
        return compute(returns, high, low, close, DEFAULT_WINDOW);
    }

    public static TimeSeries compute(TimeSeries returns, TimeSeries high, TimeSeries low, TimeSeries close,
                                     int window) {
        if (!returns.hasSameIndex(close)) {
            throw new IllegalArgumentException("returns and price bars must share the same dates");
        }
        TimeSeries atr = TrueRangeVolatility.compute(high, low, close, window);
        return PerformanceRatioEngine.compute(adjustedReturns(returns, atr), window);
    }

    /**
     * adjusted[t] = returns[t] / ATR[t], missing where ATR is missing or zero.
     */
    static TimeSeries adjustedReturns(TimeSeries returns, TimeSeries atr) {
        List<Double> out = new ArrayList<>(returns.size());
        for (int t = 0; t < returns.size(); t++) {
            Double r = returns.valueAt(t);
            Double range = atr.valueAt(t);
            out.add(r == null || range == null || range == 0d ? null : r / range);
        }
        return returns.withValues(out);
    }
}
