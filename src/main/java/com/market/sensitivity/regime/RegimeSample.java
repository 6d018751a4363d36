package com.market.sensitivity.regime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Paired (market return, metric value) observations that fell into one regime.
 * Market returns are always present; metric values may be missing.
 */
public final class RegimeSample {

    private final MarketRegime regime;
    private final List<Double> marketReturns;
    private final List<Double> metricValues;

    RegimeSample(MarketRegime regime, List<Double> marketReturns, List<Double> metricValues) {
        if (marketReturns.size() != metricValues.size()) {
            throw new IllegalArgumentException("market and metric samples differ in length");
        }
        this.regime = regime;
        this.marketReturns = Collections.unmodifiableList(new ArrayList<>(marketReturns));
        this.metricValues = Collections.unmodifiableList(new ArrayList<>(metricValues));
    }

    public MarketRegime getRegime() {
        return regime;
    }

    public List<Double> getMarketReturns() {
        return marketReturns;
    }

    public List<Double> getMetricValues() {
        return metricValues;
    }

    public int size() {
        return marketReturns.size();
    }
}
