package com.market.sensitivity.service;

import com.google.common.util.concurrent.RateLimiter;
import com.market.sensitivity.provider.PriceFetchException;
import com.market.sensitivity.provider.PriceProvider;
import com.market.sensitivity.series.PriceBar;
import com.market.sensitivity.series.PriceHistory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.List;

/**
 * Fetches price history through the configured provider with pacing and retries.
 */
@Service
@Slf4j
public class PriceHistoryService {

    private final PriceProvider priceProvider;
    private final RateLimiter rateLimiter;
    private final int maxRetries;
    private final long retryDelayMs;

    public PriceHistoryService(PriceProvider priceProvider,
                               @Value("${price.fetch.permits-per-second:2.0}") double permitsPerSecond,
                               @Value("${price.fetch.max-retries:3}") int maxRetries,
                               @Value("${price.fetch.retry-delay-ms:5000}") long retryDelayMs) {
        this.priceProvider = priceProvider;
        this.rateLimiter = RateLimiter.create(permitsPerSecond);
        this.maxRetries = Math.max(1, maxRetries);
        this.retryDelayMs = retryDelayMs;
    }

    /**
     * @throws PriceFetchException if no bars could be retrieved after all attempts
     */
    public PriceHistory fetch(String symbol, LocalDate start, LocalDate endExclusive) {
        if (!start.isBefore(endExclusive)) {
            throw new IllegalArgumentException("start " + start + " must be before end " + endExclusive);
        }

        List<PriceBar> bars = fetchWithRetry(symbol, start, endExclusive);
        if (bars.isEmpty()) {
            throw new PriceFetchException(symbol,
                    "no price history from " + priceProvider.getName() + " for " + start + " to " + endExclusive);
        }

        log.info("Loaded {} bars for {} ({} to {})", bars.size(), symbol, start, endExclusive);
        return new PriceHistory(symbol, bars);
    }

    private List<PriceBar> fetchWithRetry(String symbol, LocalDate start, LocalDate endExclusive) {
        for (int attempt = 1; attempt <= maxRetries; attempt++) {
            rateLimiter.acquire();
            try {
                List<PriceBar> bars = priceProvider.fetchHistory(symbol, start, endExclusive);
                if (!bars.isEmpty() || attempt == maxRetries) {
                    return bars;
                }
                log.warn("Empty history for {}, retry {}/{}", symbol, attempt, maxRetries);
            } catch (RuntimeException e) {
                log.warn("Fetch for {} failed (attempt {}/{}): {}", symbol, attempt, maxRetries, e.getMessage());
                if (attempt == maxRetries) {
                    throw new PriceFetchException(symbol, "fetch failed after " + maxRetries + " attempts", e);
                }
            }

            try {
                Thread.sleep(retryDelayMs);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                throw new PriceFetchException(symbol, "interrupted while waiting to retry", ie);
            }
        }
        return List.of();
    }
}
