package com.nofx.execution.config;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Guards for outbound exchange calls. No retry is configured: each call is
 * attempted once and failures are returned to the caller.
 */
@Configuration
public class LighterResilienceConfig {

    @Bean
    public CircuitBreaker lighterCircuitBreaker(
            @Value("${lighter.resilience.circuit.failure-rate-threshold:50}") float failureRateThreshold,
            @Value("${lighter.resilience.circuit.wait-open-seconds:30}") long waitOpenSeconds,
            @Value("${lighter.resilience.circuit.sliding-window-size:20}") int slidingWindowSize
    ) {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .failureRateThreshold(failureRateThreshold)
                .waitDurationInOpenState(Duration.ofSeconds(waitOpenSeconds))
                .slidingWindowSize(slidingWindowSize)
                .build();
        return CircuitBreaker.of("lighter", config);
    }

    @Bean
    public RateLimiter lighterRateLimiter(
            @Value("${lighter.resilience.rate.limit-per-second:8}") int limitPerSecond,
            @Value("${lighter.resilience.rate.timeout-ms:500}") long timeoutMs
    ) {
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(limitPerSecond)
                .timeoutDuration(Duration.ofMillis(timeoutMs))
                .build();
        return RateLimiter.of("lighter", config);
    }
}
