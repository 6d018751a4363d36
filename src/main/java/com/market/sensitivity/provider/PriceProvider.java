package com.market.sensitivity.provider;

import com.market.sensitivity.series.PriceBar;

import java.time.LocalDate;
import java.util.List;

/**
 * Source of daily price history.
 */
public interface PriceProvider {

    /**
     * Daily bars for {@code symbol} in [start, endExclusive), ascending by date.
     * Non-trading days are simply absent. Implementations return an empty list
     * when nothing could be retrieved.
     */
    List<PriceBar> fetchHistory(String symbol, LocalDate start, LocalDate endExclusive);

    String getName();
}
