package com.market.sensitivity.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.market.sensitivity.series.PriceBar;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Daily klines from Binance spot. Symbols are exchange pairs such as BTCUSDT.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(name = "price.provider", havingValue = "binance")
public class BinanceClient implements PriceProvider {

    private static final String INTERVAL = "1d";
    private static final int PAGE_LIMIT = 1000;

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;

    @Value("${binance.api.base-url:https://api.binance.com}")
    private String baseUrl;

    @Value("${binance.api.klines-endpoint:/api/v3/klines}")
    private String klinesEndpoint;

    @Override
    public String getName() {
        return "binance";
    }

    @Override
    public List<PriceBar> fetchHistory(String symbol, LocalDate start, LocalDate endExclusive) {
        List<PriceBar> bars = new ArrayList<>();
        long startTime = toMillis(start);
        long endTime = toMillis(endExclusive) - 1;

        while (startTime <= endTime) {
            List<PriceBar> page = fetchPage(symbol, startTime, endTime);
            if (page.isEmpty()) {
                break;
            }
            bars.addAll(page);

            LocalDate last = page.get(page.size() - 1).date();
            startTime = toMillis(last.plusDays(1));

            if (page.size() < PAGE_LIMIT) {
                break;
            }
        }

        log.debug("Fetched {} daily bars for {} from Binance", bars.size(), symbol);
        return bars;
    }

    private List<PriceBar> fetchPage(String symbol, long startTime, long endTime) {
        try {
            String url = UriComponentsBuilder.fromHttpUrl(baseUrl + klinesEndpoint)
                    .queryParam("symbol", symbol)
                    .queryParam("interval", INTERVAL)
                    .queryParam("startTime", startTime)
                    .queryParam("endTime", endTime)
                    .queryParam("limit", PAGE_LIMIT)
                    .toUriString();
            log.debug("Fetching klines from: {}", url);

            String response = restTemplate.getForObject(url, String.class);

            if (response == null || response.isBlank()) {
                log.warn("Empty response from Binance for {}", symbol);
                return Collections.emptyList();
            }

            return parseResponse(response);

        } catch (RestClientException e) {
            log.error("Error fetching klines for {} from Binance: {}", symbol, e.getMessage());
            return Collections.emptyList();
        }
    }

    List<PriceBar> parseResponse(String response) {
        List<PriceBar> bars = new ArrayList<>();

        try {
            JsonNode root = objectMapper.readTree(response);

            if (root.isArray()) {
                for (JsonNode node : root) {
                    bars.add(new PriceBar(
                            millisToDate(node.get(0).asLong()),
                            Double.parseDouble(node.get(1).asText()),
                            Double.parseDouble(node.get(2).asText()),
                            Double.parseDouble(node.get(3).asText()),
                            Double.parseDouble(node.get(4).asText())));
                }
            }

        } catch (Exception e) {
            log.error("Error parsing Binance response: {}", e.getMessage());
            return Collections.emptyList();
        }

        return bars;
    }

    private static LocalDate millisToDate(long millis) {
        return LocalDate.ofInstant(Instant.ofEpochMilli(millis), ZoneOffset.UTC);
    }

    private static long toMillis(LocalDate date) {
        return date.atStartOfDay(ZoneOffset.UTC).toInstant().toEpochMilli();
    }
}
