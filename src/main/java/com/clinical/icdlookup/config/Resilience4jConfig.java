package com.clinical.icdlookup.config;

import com.clinical.icdlookup.error.RegistryNetworkException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.ratelimiter.RateLimiterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * <h2>Resilience4j Configuration</h2>
 *
 * <p>
 * Defines the registries and the two policies guarding the ICD-11 registry:
 * a rate limiter applied to every outbound HTTP request and a circuit breaker
 * around each search, so that a registry outage sends lookups straight to the
 * offline catalog instead of waiting for one timeout per keystroke.
 * </p>
 */
@Configuration
public class Resilience4jConfig {

    /** Name shared by the registry circuit breaker and rate limiter. */
    public static final String REGISTRY = "icdRegistry";

    private static final int FAILURE_RATE_THRESHOLD = 50;

    private static final int SLIDING_WINDOW_SIZE = 10;

    private static final int MINIMUM_CALLS = 5;

    private static final Duration OPEN_STATE_WAIT = Duration.ofSeconds(30);

    /**
     * Circuit-breaker registry whose default configuration only counts
     * transport-level failures; auth and parse errors say nothing about
     * registry availability.
     *
     * @return registry with the registry-specific default configuration
     */
    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry() {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .failureRateThreshold(FAILURE_RATE_THRESHOLD)
                .slidingWindowSize(SLIDING_WINDOW_SIZE)
                .minimumNumberOfCalls(MINIMUM_CALLS)
                .waitDurationInOpenState(OPEN_STATE_WAIT)
                .recordExceptions(RegistryNetworkException.class)
                .build();
        return CircuitBreakerRegistry.of(config);
    }

    /**
     * Rate-limiter registry configured from {@code icd.registry.rate-limit}.
     *
     * @param props registry properties
     * @return registry with the configured default limit
     */
    @Bean
    public RateLimiterRegistry rateLimiterRegistry(final RegistryProperties props) {
        RegistryProperties.RateLimit limit = props.getRateLimit();
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitForPeriod(Math.max(limit.getPermitsPerSecond(), limit.getBurst()))
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .timeoutDuration(limit.getAcquireTimeout())
                .build();
        return RateLimiterRegistry.of(config);
    }

    /**
     * @param registry the global {@link CircuitBreakerRegistry} to pull from
     * @return the breaker guarding registry searches
     */
    @Bean
    public CircuitBreaker registryCircuitBreaker(final CircuitBreakerRegistry registry) {
        return registry.circuitBreaker(REGISTRY);
    }

    /**
     * @param registry the global {@link RateLimiterRegistry} to pull from
     * @return the limiter applied to each outbound registry request
     */
    @Bean
    public RateLimiter registryRateLimiter(final RateLimiterRegistry registry) {
        return registry.rateLimiter(REGISTRY);
    }

}
