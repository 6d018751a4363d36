package com.market.sensitivity.analysis;

import com.market.sensitivity.regime.SensitivityBundle;
import com.market.sensitivity.regime.SensitivityMeasure;
import com.market.sensitivity.series.TimeSeries;
import lombok.Builder;
import lombok.Getter;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Output of one asset/benchmark analysis. All series share the aligned date index.
 */
@Getter
public class AnalysisResult {

    private final String symbol;

    private final String marketSymbol;

    private final int window;

    /**
     * Whether the sensitivity series went through the smoothing filter.
     */
    private final boolean smoothed;

    /**
     * Raw metric series (performance ratio, volatility-adjusted ratio).
     */
    private final Map<MetricType, TimeSeries> metrics;

    private final Map<MetricType, SensitivityBundle> sensitivities;

    private final TimeSeries assetPrices;

    private final TimeSeries marketPrices;

    @Builder
    private AnalysisResult(String symbol, String marketSymbol, int window, boolean smoothed,
                           Map<MetricType, TimeSeries> metrics,
                           Map<MetricType, SensitivityBundle> sensitivities,
                           TimeSeries assetPrices, TimeSeries marketPrices) {
        this.symbol = symbol;
        this.marketSymbol = marketSymbol;
        this.window = window;
        this.smoothed = smoothed;
        this.metrics = readOnlyCopy(metrics);
        this.sensitivities = readOnlyCopy(sensitivities);
        this.assetPrices = assetPrices;
        this.marketPrices = marketPrices;
    }

    public SensitivityBundle sensitivity(MetricType metric) {
        return sensitivities.get(metric);
    }

    public TimeSeries metric(MetricType metric) {
        return metrics.get(metric);
    }

    public AnalysisSummary summary() {
        Map<MetricType, Map<SensitivityMeasure, Double>> means = new EnumMap<>(MetricType.class);
        sensitivities.forEach((metric, bundle) -> {
            Map<SensitivityMeasure, Double> byMeasure = new LinkedHashMap<>();
            bundle.asMap().forEach((measure, series) -> {
                OptionalDouble mean = series.mean();
                byMeasure.put(measure, mean.isPresent() ? mean.getAsDouble() : null);
            });
            means.put(metric, byMeasure);
        });
        return new AnalysisSummary(symbol, means);
    }

    private static <V> Map<MetricType, V> readOnlyCopy(Map<MetricType, V> source) {
        Map<MetricType, V> copy = new EnumMap<>(MetricType.class);
        copy.putAll(source);
        return Collections.unmodifiableMap(copy);
    }
}
