package com.market.sensitivity.runner;

import com.market.sensitivity.analysis.AnalysisOrchestrator;
import com.market.sensitivity.service.BatchAnalysisService;
import com.market.sensitivity.service.BatchAnalysisService.BatchResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.List;

/**
 * Runs the configured batch once on startup.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(name = "analysis.runner.enabled", havingValue = "true", matchIfMissing = true)
public class AnalysisRunner implements CommandLineRunner {

    private final BatchAnalysisService batchAnalysisService;

    @Value("${analysis.symbols}")
    private List<String> symbols;

    @Value("${analysis.market-symbol:BTC-USD}")
    private String marketSymbol;

    @Value("${analysis.start-date:2020-01-01}")
    private String startDate;

    @Value("${analysis.end-date:2025-01-01}")
    private String endDate;

    @Value("${analysis.window:" + AnalysisOrchestrator.DEFAULT_WINDOW + "}")
    private int window;

    @Override
    public void run(String... args) {
        BatchResult result = batchAnalysisService.analyzeAll(symbols, marketSymbol,
                LocalDate.parse(startDate), LocalDate.parse(endDate), window);

        if (!result.isComplete()) {
            result.failures().forEach((symbol, reason) -> log.warn("{} skipped: {}", symbol, reason));
        }
    }
}
