package com.chatintel.group.config;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

@Configuration
public class SourceClientConfig {

    @Bean
    public RestTemplate chatSourceRestTemplate(RestTemplateBuilder builder, GroupScraperProperties properties) {
        GroupScraperProperties.Source source = properties.getSource();
        return builder
                .setConnectTimeout(source.getConnectTimeout())
                .setReadTimeout(source.getReadTimeout())
                .build();
    }

    @Bean
    public CircuitBreaker chatSourceCircuitBreaker(GroupScraperProperties properties) {
        GroupScraperProperties.Source.CircuitBreaker settings = properties.getSource().getCircuitBreaker();
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .failureRateThreshold(settings.getFailureRateThreshold())
                .slidingWindowSize(settings.getSlidingWindowSize())
                .waitDurationInOpenState(settings.getWaitInOpenState())
                .build();
        return CircuitBreaker.of("chatSource", config);
    }
}
