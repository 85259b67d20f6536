package fr.lapetina.resilientfetch.pipeline;

import fr.lapetina.resilientfetch.domain.error.RateLimitException;
import fr.lapetina.resilientfetch.domain.model.FetchRequest;
import fr.lapetina.resilientfetch.infrastructure.http.RateLimitOptions;
import fr.lapetina.resilientfetch.infrastructure.http.RateLimiter;
import fr.lapetina.resilientfetch.infrastructure.metrics.FetchMetrics;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Admits the call through the shared limiter or rejects it with the time left in the window.
 */
public final class RateLimitPolicy implements Policy {

    private final RateLimiter limiter;
    private final FetchMetrics metrics;

    public RateLimitPolicy(RateLimiter limiter, FetchMetrics metrics) {
        this.limiter = Objects.requireNonNull(limiter, "Rate limiter is required");
        this.metrics = Objects.requireNonNull(metrics, "Metrics are required");
    }

    @Override
    public <R> CompletableFuture<R> apply(FetchRequest request, Invocation<R> next) {
        RateLimiter.Admission admission = limiter.tryAcquire();
        if (!admission.admitted()) {
            metrics.incrementRateLimitDenied(limiter.getName());
            RateLimitOptions options = limiter.getOptions();
            return CompletableFuture.failedFuture(new RateLimitException(
                    options.name(), options.limitForPeriod(), options.limitPeriod(),
                    admission.remainingTimeInWindow()));
        }
        return Futures.invoke(next, request);
    }

    public RateLimiter getLimiter() {
        return limiter;
    }

    @Override
    public String name() {
        return limiter.getName();
    }
}
