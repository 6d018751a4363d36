package com.market.sensitivity.series;

import java.time.LocalDate;

/**
 * One daily OHLC bar as returned by a price provider.
 */
public record PriceBar(LocalDate date, double open, double high, double low, double close) {}
