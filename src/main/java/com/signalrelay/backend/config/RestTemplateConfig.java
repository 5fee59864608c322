package com.signalrelay.backend.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

@Configuration
public class RestTemplateConfig {

    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder, TradingProperties tradingProperties) {
        Duration readTimeout = tradingProperties.getGatewayTimeout();
        return builder
            .setConnectTimeout(Duration.ofSeconds(5))
            .setReadTimeout(readTimeout)
            .additionalRequestCustomizers(request -> {
                request.getHeaders().add("User-Agent", "Signal-Relay/1.0");
                request.getHeaders().add("Accept", "application/json");
                request.getHeaders().add("Cache-Control", "no-cache");
            })
            .build();
    }
}
