package com.market.sensitivity.config;

import com.market.sensitivity.smoothing.SavitzkyGolayFilter;
import com.market.sensitivity.smoothing.SmoothingFilter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

@Configuration
public class AppConfig {

    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder,
                                     @Value("${price.http.connect-timeout-ms:10000}") long connectTimeoutMs,
                                     @Value("${price.http.read-timeout-ms:30000}") long readTimeoutMs) {
        return builder
                .setConnectTimeout(Duration.ofMillis(connectTimeoutMs))
                .setReadTimeout(Duration.ofMillis(readTimeoutMs))
                .build();
    }

    @Bean
    public SmoothingFilter smoothingFilter(
            @Value("${analysis.smoothing.window-length:21}") int windowLength,
            @Value("${analysis.smoothing.poly-order:3}") int polyOrder) {
        return new SavitzkyGolayFilter(windowLength, polyOrder);
    }
}
