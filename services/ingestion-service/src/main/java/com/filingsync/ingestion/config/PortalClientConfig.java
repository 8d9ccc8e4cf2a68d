package com.filingsync.ingestion.config;

import com.filingsync.ingestion.client.RateLimiter;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

@Configuration
public class PortalClientConfig {

    @Bean
    @Qualifier("portalWebClient")
    WebClient portalWebClient(IngestionProperties properties) {
        int maxBytes = properties.getMaxInMemoryMb() * 1024 * 1024;
        ExchangeStrategies strategies = ExchangeStrategies.builder()
            .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(maxBytes))
            .build();
        HttpClient httpClient = HttpClient.create()
            .followRedirect(true)
            .responseTimeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()));
        return WebClient.builder()
            .baseUrl(properties.getBaseUrl())
            .defaultHeader("User-Agent", properties.getUserAgent())
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .exchangeStrategies(strategies)
            .build();
    }

    @Bean
    RateLimiter rateLimiter(IngestionProperties properties) {
        return new RateLimiter(
            properties.getMaxConcurrentRequests(),
            Duration.ofMillis(properties.getRequestIntervalMs())
        );
    }
}
