package com.bricks.sorter.config;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.UncheckedIOException;

/**
 * <h2>Resilience4j Configuration</h2>
 *
 * <p>
 * Defines the registries and the single resilience policy wrapped around every
 * catalog lookup (part breadcrumbs, part images). Only transport failures
 * ({@link UncheckedIOException}, which includes timeouts) are retried; an
 * HTTP error status is a definitive answer and goes straight to the caller's
 * fallback.
 * </p>
 */
@Configuration
public class Resilience4jConfig {

    /** Name shared by the retry and the circuit breaker. */
    public static final String CATALOG_LOOKUP = "catalogLookup";

    /**
     * Creates the global {@link RetryRegistry} with the catalog retry policy as default.
     *
     * @param props pipeline settings holding attempt count and back-off
     * @return a registry whose default configuration retries I/O failures only
     */
    @Bean
    public RetryRegistry retryRegistry(final SorterProperties props) {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(props.getRetry().getMaxAttempts())
                .waitDuration(props.getRetry().getWaitDuration())
                .retryExceptions(UncheckedIOException.class)
                .build();
        return RetryRegistry.of(config);
    }

    /**
     * Creates the global {@link CircuitBreakerRegistry} which holds all
     * configured {@link CircuitBreaker} instances.
     * <p>
     * Unknown parts answer 404 routinely, so only transport failures count
     * towards opening the breaker.
     * </p>
     *
     * @return a registry whose default breaker records I/O failures only
     */
    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry() {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .recordExceptions(UncheckedIOException.class)
                .build();
        return CircuitBreakerRegistry.of(config);
    }

    /**
     * Named {@link Retry} policy for catalog lookups.
     *
     * @param registry the global {@link RetryRegistry} to pull from
     * @return a {@link Retry} configured under the name "catalogLookup"
     */
    @Bean
    public Retry catalogRetry(final RetryRegistry registry) {
        return registry.retry(CATALOG_LOOKUP);
    }

    /**
     * Named {@link CircuitBreaker} for catalog lookups.
     * <p>
     * When the catalog keeps failing the breaker opens and the remaining parts of
     * the batch fall back immediately instead of waiting on timeouts.
     * </p>
     *
     * @param registry the global {@link CircuitBreakerRegistry} to pull from
     * @return a {@link CircuitBreaker} configured under the name "catalogLookup"
     */
    @Bean
    public CircuitBreaker catalogCircuitBreaker(final CircuitBreakerRegistry registry) {
        return registry.circuitBreaker(CATALOG_LOOKUP);
    }

}
