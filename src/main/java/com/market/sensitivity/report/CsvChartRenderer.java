package com.market.sensitivity.report;

import com.market.sensitivity.analysis.AnalysisResult;
import com.market.sensitivity.analysis.MetricType;
import com.market.sensitivity.regime.SensitivityMeasure;
import com.market.sensitivity.series.TimeSeries;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Writes chart-ready CSV: rebased prices, raw metrics and every sensitivity series,
 * one row per aligned date.
 */
@Component
@Slf4j
public class CsvChartRenderer implements ChartRenderer {

    private static final double REBASE = 100.0;

    private final Path outputDir;

    public CsvChartRenderer(@Value("${analysis.output-dir:reports}") String outputDir) {
        this.outputDir = Path.of(outputDir);
    }

    @Override
    public Path render(AnalysisResult result) {
        long startTime = System.currentTimeMillis();
        Path file = outputDir.resolve(fileName(result.getSymbol()));

        List<String> header = new ArrayList<>();
        List<TimeSeries> columns = new ArrayList<>();

        header.add("asset_price_rebased");
        columns.add(rebase(result.getAssetPrices()));
        header.add("market_price_rebased");
        columns.add(rebase(result.getMarketPrices()));

        for (MetricType metric : MetricType.values()) {
            header.add(metric.getKey().toLowerCase(Locale.ROOT));
            columns.add(result.metric(metric));
            for (SensitivityMeasure measure : SensitivityMeasure.values()) {
                header.add(metric.getKey().toLowerCase(Locale.ROOT) + "." + measure.getKey());
                columns.add(result.sensitivity(metric).get(measure));
            }
        }

        TimeSeries index = result.getAssetPrices();
        try {
            Files.createDirectories(outputDir);
            try (PrintWriter writer = new PrintWriter(Files.newBufferedWriter(file, StandardCharsets.UTF_8))) {
                writer.println("date," + String.join(",", header));

                for (int i = 0; i < index.size(); i++) {
                    StringBuilder row = new StringBuilder(index.dateAt(i).format(DateTimeFormatter.ISO_LOCAL_DATE));
                    for (TimeSeries column : columns) {
                        row.append(',');
                        Double v = column.valueAt(i);
                        if (v != null) {
                            row.append(v);
                        }
                    }
                    writer.println(row);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write chart data for " + result.getSymbol(), e);
        }

        log.info("Wrote {} rows for {} to {} in {}ms", index.size(), result.getSymbol(), file,
                System.currentTimeMillis() - startTime);
        return file;
    }

    /**
     * price / first price * 100
     */
    static TimeSeries rebase(TimeSeries prices) {
        Double first = prices.firstPresent();
        List<Double> out = new ArrayList<>(prices.size());
        for (Double p : prices.values()) {
            out.add(first == null || p == null ? null : p / first * REBASE);
        }
        return prices.withValues(out);
    }

    private static String fileName(String symbol) {
        return symbol.replaceAll("[^A-Za-z0-9._-]", "_") + "_analysis.csv";
    }
}
