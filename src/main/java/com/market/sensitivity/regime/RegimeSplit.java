package com.market.sensitivity.regime;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Up and down regime samples of one rolling window.
 */
public record RegimeSplit(RegimeSample up, RegimeSample down) {

    public static RegimeSplit of(List<Double> metric, List<Double> market) {
        if (metric.size() != market.size()) {
            throw new IllegalArgumentException("metric and market windows differ in length");
        }

        List<Double> upX = new ArrayList<>();
        List<Double> upY = new ArrayList<>();
        List<Double> downX = new ArrayList<>();
        List<Double> downY = new ArrayList<>();

        for (int i = 0; i < market.size(); i++) {
            Double x = market.get(i);
            Optional<MarketRegime> regime = MarketRegime.classify(x);
            if (regime.isEmpty()) {
                continue;
            }
            if (regime.get() == MarketRegime.UP) {
                upX.add(x);
                upY.add(metric.get(i));
            } else {
                downX.add(x);
                downY.add(metric.get(i));
            }
        }

        return new RegimeSplit(
                new RegimeSample(MarketRegime.UP, upX, upY),
                new RegimeSample(MarketRegime.DOWN, downX, downY));
    }

    /**
     * Both regimes need strictly more than window / 4 observations.
     */
    public boolean isValid(int window) {
        int threshold = window / 4;
        return up.size() > threshold && down.size() > threshold;
    }
}
