package com.market.sensitivity.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.market.sensitivity.series.PriceBar;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
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
 * Daily bars from the Yahoo Finance chart API. Symbols use Yahoo tickers
 * such as SOL-USD or AAPL.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(name = "price.provider", havingValue = "yahoo", matchIfMissing = true)
public class YahooFinanceClient implements PriceProvider {

    private static final String INTERVAL = "1d";
    private static final String USER_AGENT = "Mozilla/5.0 (compatible; regime-sensitivity)";

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;

    @Value("${yahoo.api.base-url:https://query1.finance.yahoo.com}")
    private String baseUrl;

    @Override
    public String getName() {
        return "yahoo";
    }

    @Override
    public List<PriceBar> fetchHistory(String symbol, LocalDate start, LocalDate endExclusive) {
        try {
            String url = UriComponentsBuilder.fromHttpUrl(baseUrl)
                    .path("/v8/finance/chart/{symbol}")
                    .queryParam("period1", toEpochSeconds(start))
                    .queryParam("period2", toEpochSeconds(endExclusive))
                    .queryParam("interval", INTERVAL)
                    .queryParam("events", "history")
                    .buildAndExpand(symbol)
                    .toUriString();
            log.debug("Fetching chart from: {}", url);

            HttpHeaders headers = new HttpHeaders();
            headers.set(HttpHeaders.USER_AGENT, USER_AGENT);
            ResponseEntity<String> response =
                    restTemplate.exchange(url, HttpMethod.GET, new HttpEntity<>(headers), String.class);

            String body = response.getBody();
            if (body == null || body.isBlank()) {
                log.warn("Empty response from Yahoo for {}", symbol);
                return Collections.emptyList();
            }

            List<PriceBar> bars = parseResponse(body, endExclusive);
            log.debug("Fetched {} daily bars for {} from Yahoo", bars.size(), symbol);
            return bars;

        } catch (RestClientException e) {
            log.error("Error fetching chart for {} from Yahoo: {}", symbol, e.getMessage());
            return Collections.emptyList();
        }
    }

    List<PriceBar> parseResponse(String response, LocalDate endExclusive) {
        List<PriceBar> bars = new ArrayList<>();

        try {
            JsonNode result = objectMapper.readTree(response).path("chart").path("result").path(0);
            if (result.isMissingNode()) {
                log.warn("Yahoo response carries no chart result");
                return bars;
            }

            ZoneOffset offset = ZoneOffset.ofTotalSeconds(result.path("meta").path("gmtoffset").asInt(0));
            JsonNode timestamps = result.path("timestamp");
            JsonNode quote = result.path("indicators").path("quote").path(0);

            int skipped = 0;
            for (int i = 0; i < timestamps.size(); i++) {
                JsonNode open = quote.path("open").path(i);
                JsonNode high = quote.path("high").path(i);
                JsonNode low = quote.path("low").path(i);
                JsonNode close = quote.path("close").path(i);
                if (!open.isNumber() || !high.isNumber() || !low.isNumber() || !close.isNumber()) {
                    skipped++;
                    continue;
                }

                LocalDate date = LocalDate.ofInstant(Instant.ofEpochSecond(timestamps.get(i).asLong()), offset);
                if (!date.isBefore(endExclusive)) {
                    continue;
                }
                bars.add(new PriceBar(date, open.asDouble(), high.asDouble(), low.asDouble(), close.asDouble()));
            }

            if (skipped > 0) {
                log.warn("Skipped {} incomplete Yahoo rows", skipped);
            }

        } catch (Exception e) {
            log.error("Error parsing Yahoo response: {}", e.getMessage());
            return Collections.emptyList();
        }

        return bars;
    }

    private static long toEpochSeconds(LocalDate date) {
        return date.atStartOfDay(ZoneOffset.UTC).toEpochSecond();
    }
}
