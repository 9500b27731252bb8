package com.growfolio.dataclient.config;

/*
 * 09/22/2026 - 10:00 AM
 * @author Growfolio Engineering
 */

import com.growfolio.common.exception.ApiExceptions.ApiException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Circuit breaker and retry for calls to the Growfolio API.
 */
@Slf4j
@Configuration
public class ResilienceConfig {

    public static final String GROWFOLIO_API = "growfolio-api";

    // ═══════════════════════════════════════════════════════════════════════════
    // CIRCUIT BREAKER CONFIGURATION
    // ═══════════════════════════════════════════════════════════════════════════

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry() {
        return circuitBreakerRegistryFor();
    }

    public static CircuitBreakerRegistry circuitBreakerRegistryFor() {
        CircuitBreakerConfig apiConfig = CircuitBreakerConfig.custom()
                .failureRateThreshold(50)                          // Open after 50% failures
                .slowCallDurationThreshold(Duration.ofSeconds(10))
                .waitDurationInOpenState(Duration.ofSeconds(30))   // Wait 30s before half-open
                .permittedNumberOfCallsInHalfOpenState(3)
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(20)
                .minimumNumberOfCalls(10)
                // only transport and server failures count against the API's health
                .recordException(e -> e instanceof ApiException api && api.isRetryable())
                .build();

        CircuitBreakerRegistry registry = CircuitBreakerRegistry.of(apiConfig);
        registry.circuitBreaker(GROWFOLIO_API).getEventPublisher()
                .onStateTransition(event ->
                        log.warn("Circuit breaker '{}' state transition: {} -> {}",
                                event.getCircuitBreakerName(),
                                event.getStateTransition().getFromState(),
                                event.getStateTransition().getToState()));
        return registry;
    }

    // ═══════════════════════════════════════════════════════════════════════════
    // RETRY CONFIGURATION
    // ═══════════════════════════════════════════════════════════════════════════

    @Bean
    public RetryRegistry retryRegistry(GrowfolioProperties properties) {
        return retryRegistryFor(properties.api());
    }

    /**
     * Linear backoff: the n-th retry waits n times the configured delay.
     */
    public static RetryRegistry retryRegistryFor(GrowfolioProperties.ApiConfig api) {
        long delayMillis = api.retryDelay().toMillis();
        RetryConfig apiConfig = RetryConfig.custom()
                .maxAttempts(api.maxRetryAttempts())
                .intervalFunction(attempt -> delayMillis * attempt)
                .retryOnException(e -> e instanceof ApiException api1 && api1.isRetryable())
                .build();

        RetryRegistry registry = RetryRegistry.of(apiConfig);
        registry.retry(GROWFOLIO_API).getEventPublisher()
                .onRetry(event -> log.debug("Retry '{}' attempt #{} after {}",
                        event.getName(),
                        event.getNumberOfRetryAttempts(),
                        event.getLastThrowable().getMessage()));
        return registry;
    }

    public static CircuitBreaker apiCircuitBreaker(CircuitBreakerRegistry registry) {
        return registry.circuitBreaker(GROWFOLIO_API);
    }

    public static Retry apiRetry(RetryRegistry registry) {
        return registry.retry(GROWFOLIO_API);
    }
}
