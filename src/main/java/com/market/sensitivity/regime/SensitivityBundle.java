package com.market.sensitivity.regime;

import com.market.sensitivity.series.TimeSeries;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * The four sensitivity series produced for one metric, all on the metric's index.
 */
public final class SensitivityBundle {

    private final Map<SensitivityMeasure, TimeSeries> series;

    private SensitivityBundle(Map<SensitivityMeasure, TimeSeries> series) {
        this.series = Collections.unmodifiableMap(series);
    }

    public static SensitivityBundle of(TimeSeries upside, TimeSeries downside,
                                       TimeSeries composite, TimeSeries independence) {
        Map<SensitivityMeasure, TimeSeries> map = new EnumMap<>(SensitivityMeasure.class);
        map.put(SensitivityMeasure.UPSIDE_SENSITIVITY, upside);
        map.put(SensitivityMeasure.DOWNSIDE_SENSITIVITY, downside);
        map.put(SensitivityMeasure.COMPOSITE_SENSITIVITY, composite);
        map.put(SensitivityMeasure.MARKET_INDEPENDENCE, independence);
        return new SensitivityBundle(map);
    }

    public TimeSeries get(SensitivityMeasure measure) {
        return series.get(measure);
    }

    public TimeSeries upside() {
        return get(SensitivityMeasure.UPSIDE_SENSITIVITY);
    }

    public TimeSeries downside() {
        return get(SensitivityMeasure.DOWNSIDE_SENSITIVITY);
    }

    public TimeSeries composite() {
        return get(SensitivityMeasure.COMPOSITE_SENSITIVITY);
    }

    public TimeSeries independence() {
        return get(SensitivityMeasure.MARKET_INDEPENDENCE);
    }

    public Map<SensitivityMeasure, TimeSeries> asMap() {
        return series;
    }

    /**
     * Applies {@code transform} to each of the four series independently.
     */
    public SensitivityBundle map(UnaryOperator<TimeSeries> transform) {
        Map<SensitivityMeasure, TimeSeries> mapped = new EnumMap<>(SensitivityMeasure.class);
        series.forEach((measure, s) -> mapped.put(measure, transform.apply(s)));
        return new SensitivityBundle(mapped);
    }
}
