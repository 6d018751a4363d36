package com.market.sensitivity.series;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.ToDoubleFunction;

/**
 * Daily price bars for one symbol, ascending by date.
 */
public final class PriceHistory {

    private final String symbol;
    private final List<PriceBar> bars;

    public PriceHistory(String symbol, List<PriceBar> bars) {
        this.symbol = symbol;
        // Later bars win on duplicate dates
        Map<LocalDate, PriceBar> byDate = new TreeMap<>();
        for (PriceBar bar : bars) {
            byDate.put(bar.date(), bar);
        }
        this.bars = List.copyOf(byDate.values());
    }

    public String getSymbol() {
        return symbol;
    }

    public List<PriceBar> getBars() {
        return bars;
    }

    public int size() {
        return bars.size();
    }

    public boolean isEmpty() {
        return bars.isEmpty();
    }

    public List<LocalDate> dates() {
        return bars.stream().map(PriceBar::date).toList();
    }

    public TimeSeries closes() {
        return column(PriceBar::close);
    }

    public TimeSeries highs() {
        return column(PriceBar::high);
    }

    public TimeSeries lows() {
        return column(PriceBar::low);
    }

    /**
     * Keeps only the bars whose date also appears in {@code other}.
     * Asset and benchmark calendars can differ (stocks vs crypto), the
     * pipeline needs both on one index.
     */
    public PriceHistory alignWith(PriceHistory other) {
        Set<LocalDate> otherDates = new HashSet<>(other.dates());
        List<PriceBar> kept = bars.stream()
                .filter(b -> otherDates.contains(b.date()))
                .toList();
        return new PriceHistory(symbol, kept);
    }

    private TimeSeries column(ToDoubleFunction<PriceBar> field) {
        List<Double> values = new ArrayList<>(bars.size());
        for (PriceBar bar : bars) {
            values.add(field.applyAsDouble(bar));
        }
        return TimeSeries.of(dates(), values);
    }
}
