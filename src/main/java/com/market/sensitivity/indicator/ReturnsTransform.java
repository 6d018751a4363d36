package com.market.sensitivity.indicator;

import com.market.sensitivity.series.TimeSeries;

import java.util.ArrayList;
import java.util.List;

/**
 * Simple returns from a price series.
 */
public final class ReturnsTransform {

    private ReturnsTransform() {}

    /**
     * return[t] = (price[t] - price[t-1]) / price[t-1]
     * First entry is missing. A missing or zero prior price gives a missing return.
     */
    public static TimeSeries compute(TimeSeries prices) {
        List<Double> out = new ArrayList<>(prices.size());
        Double prev = null;
        for (Double price : prices.values()) {
            Double r = (prev == null || price == null) ? null : (price - prev) / prev;
            out.add(r);
            prev = price;
        }
        // a zero prior price yields +-Infinity or NaN here, stored as missing by TimeSeries
        return prices.withValues(out);
    }
}
