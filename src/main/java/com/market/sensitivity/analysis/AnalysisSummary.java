package com.market.sensitivity.analysis;

import com.market.sensitivity.regime.SensitivityMeasure;

import java.util.Locale;
import java.util.Map;

/**
 * Mean of every sensitivity series per metric. A null mean means the series had
 * no defined value.
 */
public record AnalysisSummary(String symbol, Map<MetricType, Map<SensitivityMeasure, Double>> means) {

    public Double mean(MetricType metric, SensitivityMeasure measure) {
        return means.get(metric).get(measure);
    }

    public String toFormattedString() {
        StringBuilder sb = new StringBuilder();
        sb.append("Performance Analysis Summary: ").append(symbol).append('\n');
        means.forEach((metric, byMeasure) -> {
            sb.append('\n').append(metric.getDisplayName()).append(":\n");
            byMeasure.forEach((measure, mean) -> sb.append("  ").append(measure.getDisplayName()).append(": ")
                    .append(mean == null ? "n/a" : String.format(Locale.ROOT, "%.3f", mean))
                    .append('\n'));
        });
        return sb.toString();
    }
}
