package fr.lapetina.resilientfetch.pipeline;

import fr.lapetina.resilientfetch.infrastructure.http.CircuitBreakerOptions;
import fr.lapetina.resilientfetch.infrastructure.http.RateLimitOptions;

import java.util.Optional;

/**
 * Client scope policies, shared by every call issued through one built client.
 *
 * @param rateLimit quota, null when no rate limiter is configured
 * @param rateLimitRetry retry wrapped around the rate limiter to wait out denied admissions
 * @param circuitBreaker breaker settings, null when no breaker is configured
 */
public record ContainerOptions(
        RateLimitOptions rateLimit,
        RetryOptions rateLimitRetry,
        CircuitBreakerOptions circuitBreaker
) {
    private static final ContainerOptions NONE = new ContainerOptions(null, null, null);

    public ContainerOptions {
        rateLimitRetry = rateLimitRetry != null ? rateLimitRetry : RetryOptions.rateLimitDefaults();
    }

    public static ContainerOptions none() {
        return NONE;
    }

    public Optional<RateLimitOptions> rateLimitOptions() {
        return Optional.ofNullable(rateLimit);
    }

    public Optional<CircuitBreakerOptions> circuitBreakerOptions() {
        return Optional.ofNullable(circuitBreaker);
    }

    public ContainerOptions withRateLimit(RateLimitOptions newRateLimit, RetryOptions newRetry) {
        return new ContainerOptions(newRateLimit, newRetry, circuitBreaker);
    }

    public ContainerOptions withCircuitBreaker(CircuitBreakerOptions newCircuitBreaker) {
        return new ContainerOptions(rateLimit, rateLimitRetry, newCircuitBreaker);
    }
}
