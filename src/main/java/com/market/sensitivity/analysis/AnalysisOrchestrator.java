package com.market.sensitivity.analysis;

import com.market.sensitivity.indicator.PerformanceRatioEngine;
import com.market.sensitivity.indicator.ReturnsTransform;
import com.market.sensitivity.indicator.VolatilityAdjustedRatioEngine;
import com.market.sensitivity.regime.RegimeSensitivityAnalyzer;
import com.market.sensitivity.regime.SensitivityBundle;
import com.market.sensitivity.series.PriceHistory;
import com.market.sensitivity.series.TimeSeries;
import com.market.sensitivity.service.PriceHistoryService;
import com.market.sensitivity.smoothing.SmoothingFilter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.EnumMap;
import java.util.Map;

/**
 * Runs the full pipeline for one asset against one benchmark:
 * 1. Fetch both price histories
 * 2. Align them on common dates
 * 3. Returns of both close series
 * 4. Performance ratio and volatility-adjusted ratio of the asset
 * 5. Regime sensitivities of each ratio against benchmark returns
 * 6. Optional smoothing of the eight sensitivity series
 */
@Service
@Slf4j
public class AnalysisOrchestrator {

    public static final int DEFAULT_WINDOW = 30;

    private final PriceHistoryService priceHistoryService;
    private final SmoothingFilter smoothingFilter;
    private final boolean smoothingEnabled;

    public AnalysisOrchestrator(PriceHistoryService priceHistoryService,
                                SmoothingFilter smoothingFilter,
                                @Value("${analysis.smoothing.enabled:true}") boolean smoothingEnabled) {
        this.priceHistoryService = priceHistoryService;
        this.smoothingFilter = smoothingFilter;
        this.smoothingEnabled = smoothingEnabled;
    }

    public AnalysisResult analyze(String symbol, String marketSymbol, LocalDate start, LocalDate endExclusive,
                                  int window) {
        log.info("Analyzing {} against {} ({} to {}, window {})", symbol, marketSymbol, start, endExclusive, window);

        PriceHistory market = priceHistoryService.fetch(marketSymbol, start, endExclusive);
        return analyze(symbol, market, start, endExclusive, window);
    }

    /**
     * Fetches only the asset; the benchmark history is supplied by the caller,
     * so a batch loads it once for all symbols.
     */
    public AnalysisResult analyze(String symbol, PriceHistory market, LocalDate start, LocalDate endExclusive,
                                  int window) {
        PriceHistory asset = priceHistoryService.fetch(symbol, start, endExclusive);
        return analyze(asset, market, window);
    }

    /**
     * Pipeline over already loaded histories. Performs no I/O.
     */
    public AnalysisResult analyze(PriceHistory assetHistory, PriceHistory marketHistory, int window) {
        PriceHistory asset = assetHistory.alignWith(marketHistory);
        PriceHistory market = marketHistory.alignWith(assetHistory);
        if (asset.isEmpty()) {
            throw new IllegalStateException(
                    assetHistory.getSymbol() + " and " + marketHistory.getSymbol() + " share no trading dates");
        }
        if (asset.size() < assetHistory.size() || market.size() < marketHistory.size()) {
            log.debug("Aligned {} and {} on {} common dates (dropped {} / {})",
                    asset.getSymbol(), market.getSymbol(), asset.size(),
                    assetHistory.size() - asset.size(), marketHistory.size() - market.size());
        }

        TimeSeries assetCloses = asset.closes();
        TimeSeries assetReturns = ReturnsTransform.compute(assetCloses);
        TimeSeries marketReturns = ReturnsTransform.compute(market.closes());

        Map<MetricType, TimeSeries> metrics = new EnumMap<>(MetricType.class);
        metrics.put(MetricType.PERFORMANCE_RATIO, PerformanceRatioEngine.compute(assetReturns, window));
        metrics.put(MetricType.VOLATILITY_ADJUSTED_RATIO, VolatilityAdjustedRatioEngine.compute(
                assetReturns, asset.highs(), asset.lows(), assetCloses, window));

        Map<MetricType, SensitivityBundle> sensitivities = new EnumMap<>(MetricType.class);
        metrics.forEach((metric, series) -> {
            SensitivityBundle bundle = RegimeSensitivityAnalyzer.analyze(series, marketReturns, window);
            log.debug("{} {}: {} of {} positions defined", asset.getSymbol(), metric.getKey(),
                    bundle.composite().presentCount(), bundle.composite().size());
            sensitivities.put(metric, smoothingEnabled ? bundle.map(smoothingFilter::smooth) : bundle);
        });

        log.info("Analysis of {} complete: {} aligned observations", asset.getSymbol(), asset.size());

        return AnalysisResult.builder()
                .symbol(asset.getSymbol())
                .marketSymbol(market.getSymbol())
                .window(window)
                .smoothed(smoothingEnabled)
                .metrics(metrics)
                .sensitivities(sensitivities)
                .assetPrices(assetCloses)
                .marketPrices(market.closes())
                .build();
    }
}
