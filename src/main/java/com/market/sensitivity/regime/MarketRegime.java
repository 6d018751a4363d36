package com.market.sensitivity.regime;

import java.util.Optional;

/**
 * Direction of the benchmark for a single observation.
 * Flat (exactly zero) and missing market returns belong to neither regime.
 */
public enum MarketRegime {

    UP,
    DOWN;

    public static Optional<MarketRegime> classify(Double marketReturn) {
        if (marketReturn == null || marketReturn == 0d) {
            return Optional.empty();
        }
        return Optional.of(marketReturn > 0 ? UP : DOWN);
    }
}
