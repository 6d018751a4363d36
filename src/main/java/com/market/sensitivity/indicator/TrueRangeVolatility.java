package com.market.sensitivity.indicator;

import com.market.sensitivity.series.TimeSeries;

import java.util.ArrayList;
import java.util.List;

/**
 * Average true range over a rolling window.
 */
public final class TrueRangeVolatility {

    public static final int DEFAULT_WINDOW = 90;

    private TrueRangeVolatility() {}

    /**
     * True Range = max(high - low, |high - prev_close|, |low - prev_close|)
     * Without a previous close the range degrades to high - low.
     */
    public static TimeSeries trueRange(TimeSeries high, TimeSeries low, TimeSeries close) {
        requireSameIndex(high, low, close);

        List<Double> out = new ArrayList<>(high.size());
        for (int t = 0; t < high.size(); t++) {
            Double h = high.valueAt(t);
            Double l = low.valueAt(t);
            if (h == null || l == null) {
                out.add(null);
                continue;
            }

            double range = h - l;
            Double prevClose = t > 0 ? close.valueAt(t - 1) : null;
            if (prevClose != null) {
                range = Math.max(range, Math.max(Math.abs(h - prevClose), Math.abs(l - prevClose)));
            }
            out.add(range);
        }
        return high.withValues(out);
    }

    public static TimeSeries compute(TimeSeries high, TimeSeries low, TimeSeries close) {
        return compute(high, low, close, DEFAULT_WINDOW);
    }

    /**
     * ATR[i] = mean of True Range over [i - window + 1, i].
     * Missing for i < window - 1 or when any true range in the window is missing.
     */
    public static TimeSeries compute(TimeSeries high, TimeSeries low, TimeSeries close, int window) {
        Windows.requireValid(window);
        TimeSeries trueRange = trueRange(high, low, close);

        List<Double> out = new ArrayList<>(trueRange.size());
        for (int i = 0; i < trueRange.size(); i++) {
            if (i < window - 1) {
                out.add(null);
                continue;
            }

            double sum = 0;
            boolean complete = true;
            for (int j = i - window + 1; j <= i; j++) {
                Double tr = trueRange.valueAt(j);
                if (tr == null) {
                    complete = false;
                    break;
                }
                sum += tr;
            }
            out.add(complete ? sum / window : null);
        }
        return trueRange.withValues(out);
    }

    private static void requireSameIndex(TimeSeries high, TimeSeries low, TimeSeries close) {
        if (!high.hasSameIndex(low) || !high.hasSameIndex(close)) {
            throw new IllegalArgumentException("high, low and close must share the same dates");
        }
    }
}
