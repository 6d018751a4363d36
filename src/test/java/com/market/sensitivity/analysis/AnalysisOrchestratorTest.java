package com.market.sensitivity.analysis;

import com.market.sensitivity.indicator.PerformanceRatioEngine;
import com.market.sensitivity.indicator.ReturnsTransform;
import com.market.sensitivity.regime.RegimeSensitivityAnalyzer;
import com.market.sensitivity.regime.SensitivityBundle;
import com.market.sensitivity.regime.SensitivityMeasure;
import com.market.sensitivity.series.PriceBar;
import com.market.sensitivity.series.PriceHistory;
import com.market.sensitivity.series.TestSeries;
import com.market.sensitivity.service.PriceHistoryService;
import com.market.sensitivity.smoothing.SavitzkyGolayFilter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("AnalysisOrchestrator Tests")
class AnalysisOrchestratorTest {

    private static final LocalDate START = LocalDate.of(2022, 1, 1);
    private static final LocalDate END = LocalDate.of(2022, 12, 31);
    private static final int WINDOW = 30;

    private PriceHistory asset;
    private PriceHistory market;
    private PriceHistoryService priceHistoryService;

    @BeforeEach
    void setUp() {
        asset = TestSeries.history("SOL-USD", START, TestSeries.walk(200, 50, 11L));
        market = TestSeries.history("BTC-USD", START, TestSeries.walk(200, 40000, 12L));
        priceHistoryService = mock(PriceHistoryService.class);
    }

    private AnalysisOrchestrator orchestrator(boolean smoothing) {
        return new AnalysisOrchestrator(priceHistoryService, new SavitzkyGolayFilter(), smoothing);
    }

    @Test
    @DisplayName("Unsmoothed output equals the composed core pipeline")
    void composesCorePipeline() {
        AnalysisResult result = orchestrator(false).analyze(asset, market, WINDOW);

        SensitivityBundle expected = RegimeSensitivityAnalyzer.analyze(
                PerformanceRatioEngine.compute(ReturnsTransform.compute(asset.closes()), WINDOW),
                ReturnsTransform.compute(market.closes()),
                WINDOW);

        SensitivityBundle actual = result.sensitivity(MetricType.PERFORMANCE_RATIO);
        for (SensitivityMeasure measure : SensitivityMeasure.values()) {
            assertThat(actual.get(measure)).isEqualTo(expected.get(measure));
        }
        assertThat(result.isSmoothed()).isFalse();
        assertThat(result.getWindow()).isEqualTo(WINDOW);
    }

    @Test
    @DisplayName("Every series shares the aligned index")
    void seriesShareIndex() {
        AnalysisResult result = orchestrator(true).analyze(asset, market, WINDOW);

        for (MetricType metric : MetricType.values()) {
            assertThat(result.metric(metric).hasSameIndex(result.getAssetPrices())).isTrue();
            for (SensitivityMeasure measure : SensitivityMeasure.values()) {
                assertThat(result.sensitivity(metric).get(measure).hasSameIndex(result.getAssetPrices())).isTrue();
            }
        }
        assertThat(result.getMarketPrices().hasSameIndex(result.getAssetPrices())).isTrue();
    }

    @Test
    @DisplayName("Smoothing fills the sensitivity series")
    void smoothingApplied() {
        AnalysisResult raw = orchestrator(false).analyze(asset, market, WINDOW);
        AnalysisResult smoothed = orchestrator(true).analyze(asset, market, WINDOW);

        assertThat(smoothed.isSmoothed()).isTrue();
        SensitivityBundle rawBundle = raw.sensitivity(MetricType.PERFORMANCE_RATIO);
        SensitivityBundle smoothBundle = smoothed.sensitivity(MetricType.PERFORMANCE_RATIO);
        assertThat(rawBundle.upside().presentCount()).isPositive().isLessThan(rawBundle.upside().size());
        assertThat(smoothBundle.upside().presentCount()).isEqualTo(smoothBundle.upside().size());
        assertThat(smoothed.metric(MetricType.PERFORMANCE_RATIO))
                .isEqualTo(raw.metric(MetricType.PERFORMANCE_RATIO));
    }

    @Test
    @DisplayName("Repeated runs give identical results")
    void idempotent() {
        AnalysisOrchestrator orchestrator = orchestrator(true);

        AnalysisResult first = orchestrator.analyze(asset, market, WINDOW);
        AnalysisResult second = orchestrator.analyze(asset, market, WINDOW);

        for (MetricType metric : MetricType.values()) {
            assertThat(second.metric(metric)).isEqualTo(first.metric(metric));
            for (SensitivityMeasure measure : SensitivityMeasure.values()) {
                assertThat(second.sensitivity(metric).get(measure))
                        .isEqualTo(first.sensitivity(metric).get(measure));
            }
        }
    }

    @Test
    @DisplayName("Asset and market are aligned on common dates")
    void alignsCalendars() {
        // weekdays only, as for an equity
        List<PriceBar> weekdays = asset.getBars().stream()
                .filter(b -> b.date().getDayOfWeek().getValue() <= 5)
                .collect(Collectors.toList());
        PriceHistory equity = new PriceHistory("AAPL", weekdays);

        AnalysisResult result = orchestrator(false).analyze(equity, market, WINDOW);

        assertThat(result.getAssetPrices().size()).isEqualTo(weekdays.size());
        assertThat(result.getMarketPrices().dates()).isEqualTo(result.getAssetPrices().dates());
        assertThat(result.getMarketSymbol()).isEqualTo("BTC-USD");
    }

    @Test
    @DisplayName("Disjoint calendars are rejected")
    void noCommonDates() {
        PriceHistory later = TestSeries.history("BTC-USD", START.plusYears(5), TestSeries.walk(50, 40000, 12L));

        assertThatThrownBy(() -> orchestrator(false).analyze(asset, later, WINDOW))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("share no trading dates");
    }

    @Test
    @DisplayName("Summary numbers do not depend on the default locale")
    void summaryLocale() {
        Map<SensitivityMeasure, Double> byMeasure = new EnumMap<>(SensitivityMeasure.class);
        byMeasure.put(SensitivityMeasure.UPSIDE_SENSITIVITY, 1.23456);
        byMeasure.put(SensitivityMeasure.DOWNSIDE_SENSITIVITY, null);
        AnalysisSummary summary = new AnalysisSummary("SOL-USD", Map.of(MetricType.PERFORMANCE_RATIO, byMeasure));

        Locale previous = Locale.getDefault();
        try {
            Locale.setDefault(Locale.GERMANY);
            assertThat(summary.toFormattedString())
                    .contains("Upside Sensitivity: 1.235")
                    .contains("Downside Sensitivity: n/a");
        } finally {
            Locale.setDefault(previous);
        }
    }

    @Test
    @DisplayName("Result maps are read-only")
    void resultIsReadOnly() {
        AnalysisResult result = orchestrator(false).analyze(asset, market, WINDOW);

        assertThatThrownBy(() -> result.getMetrics().remove(MetricType.PERFORMANCE_RATIO))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> result.getSensitivities().clear())
                .isInstanceOf(UnsupportedOperationException.class);
        assertThat(result.getMetrics()).containsOnlyKeys(MetricType.values());
    }

    @Test
    @DisplayName("Benchmark-supplied variant fetches only the asset")
    void fetchesAssetOnly() {
        when(priceHistoryService.fetch("SOL-USD", START, END)).thenReturn(asset);

        AnalysisResult result = orchestrator(false).analyze("SOL-USD", market, START, END, WINDOW);

        assertThat(result.getMarketSymbol()).isEqualTo("BTC-USD");
        verify(priceHistoryService).fetch("SOL-USD", START, END);
        verify(priceHistoryService, never()).fetch(eq("BTC-USD"), any(), any());
    }

    @Test
    @DisplayName("Fetching variant loads both histories through the service")
    void fetchesHistories() {
        when(priceHistoryService.fetch("SOL-USD", START, END)).thenReturn(asset);
        when(priceHistoryService.fetch("BTC-USD", START, END)).thenReturn(market);

        AnalysisResult result = orchestrator(false).analyze("SOL-USD", "BTC-USD", START, END, WINDOW);

        assertThat(result.getSymbol()).isEqualTo("SOL-USD");
        assertThat(result.getAssetPrices()).isEqualTo(asset.closes());
    }

    @Test
    @DisplayName("Summary holds one mean per metric and measure")
    void summary() {
        AnalysisSummary summary = orchestrator(false).analyze(asset, market, WINDOW).summary();

        assertThat(summary.means()).containsOnlyKeys(MetricType.values());
        for (MetricType metric : MetricType.values()) {
            assertThat(summary.means().get(metric)).containsOnlyKeys(SensitivityMeasure.values());
        }
        assertThat(summary.toFormattedString())
                .contains("SOL-USD")
                .contains("Performance Ratio:")
                .contains("Volatility-Adjusted Ratio:")
                .contains("  Upside Sensitivity: ")
                .contains("  Market Independence: ");
    }
}
