package com.journeytide.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;

@Configuration
public class AppConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Gateway calls run inside the sweep, so they must never hang it.
     */
    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder, JourneyEngineProperties properties) {
        JourneyEngineProperties.Gateway gateway = properties.getGateway();
        return builder
                .setConnectTimeout(Duration.ofMillis(gateway.getConnectTimeoutMs()))
                .setReadTimeout(Duration.ofMillis(gateway.getReadTimeoutMs()))
                .build();
    }
}
