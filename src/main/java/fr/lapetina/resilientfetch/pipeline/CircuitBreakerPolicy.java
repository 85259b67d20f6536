package fr.lapetina.resilientfetch.pipeline;

import fr.lapetina.resilientfetch.domain.error.BreakerOpenException;
import fr.lapetina.resilientfetch.domain.model.FetchRequest;
import fr.lapetina.resilientfetch.infrastructure.http.CircuitBreaker;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Guards the inner chain with the shared circuit breaker and feeds it every outcome.
 */
public final class CircuitBreakerPolicy implements Policy {

    private final CircuitBreaker breaker;

    public CircuitBreakerPolicy(CircuitBreaker breaker) {
        this.breaker = Objects.requireNonNull(breaker, "Circuit breaker is required");
    }

    @Override
    public <R> CompletableFuture<R> apply(FetchRequest request, Invocation<R> next) {
        Optional<CircuitBreaker.Permit> permit = breaker.tryAcquire();
        if (permit.isEmpty()) {
            return CompletableFuture.failedFuture(
                    new BreakerOpenException(breaker.getName(), breaker.getState().name()));
        }

        long startNanos = System.nanoTime();
        CompletableFuture<R> result = new CompletableFuture<>();
        Futures.invoke(next, request).whenComplete((value, failure) -> {
            Throwable error = failure == null ? null : Futures.unwrap(failure);
            breaker.onResult(permit.get(), Duration.ofNanos(System.nanoTime() - startNanos), error);
            if (error == null) {
                result.complete(value);
            } else {
                result.completeExceptionally(error);
            }
        });
        return result;
    }

    public CircuitBreaker getBreaker() {
        return breaker;
    }

    @Override
    public String name() {
        return breaker.getName();
    }
}
