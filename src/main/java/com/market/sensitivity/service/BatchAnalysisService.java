package com.market.sensitivity.service;

import com.market.sensitivity.analysis.AnalysisOrchestrator;
import com.market.sensitivity.analysis.AnalysisResult;
import com.market.sensitivity.report.ChartRenderer;
import com.market.sensitivity.series.PriceHistory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Analyzes a list of symbols against one benchmark. The benchmark history is
 * loaded once; if that fails every symbol is recorded as failed. Otherwise each
 * symbol is independent: a failure is recorded and the batch moves on.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BatchAnalysisService {

    private final AnalysisOrchestrator orchestrator;
    private final PriceHistoryService priceHistoryService;
    private final ChartRenderer chartRenderer;

    public record BatchResult(Map<String, AnalysisResult> results, Map<String, String> failures, long totalTimeMs) {

        public boolean isComplete() {
            return failures.isEmpty();
        }
    }

    public BatchResult analyzeAll(List<String> symbols, String marketSymbol, LocalDate start, LocalDate endExclusive,
                                  int window) {
        Instant batchStart = Instant.now();
        Map<String, AnalysisResult> results = new LinkedHashMap<>();
        Map<String, String> failures = new LinkedHashMap<>();

        log.info("=== Batch analysis: {} symbols against {} ===", symbols.size(), marketSymbol);

        PriceHistory market;
        try {
            market = priceHistoryService.fetch(marketSymbol, start, endExclusive);
        } catch (Exception e) {
            log.error("Benchmark {} unavailable, skipping all symbols: {}", marketSymbol, e.getMessage(), e);
            symbols.forEach(symbol -> failures.put(symbol, "benchmark unavailable: " + e.getMessage()));
            return finish(batchStart, results, failures);
        }

        for (String symbol : symbols) {
            try {
                log.info("Working {} ...", symbol);
                AnalysisResult result = orchestrator.analyze(symbol, market, start, endExclusive, window);
                results.put(symbol, result);

                log.info("\n{}", result.summary().toFormattedString());
                chartRenderer.render(result);

            } catch (Exception e) {
                log.error("Error analyzing {}: {}", symbol, e.getMessage(), e);
                failures.put(symbol, e.getMessage());
            }
        }

        return finish(batchStart, results, failures);
    }

    private static BatchResult finish(Instant batchStart, Map<String, AnalysisResult> results,
                                      Map<String, String> failures) {
        long totalTime = Duration.between(batchStart, Instant.now()).toMillis();
        log.info("Batch finished in {}ms: {} succeeded, {} failed", totalTime, results.size(), failures.size());

        return new BatchResult(Collections.unmodifiableMap(results), Collections.unmodifiableMap(failures), totalTime);
    }
}
