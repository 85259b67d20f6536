package fr.lapetina.resilientfetch.pipeline;

import fr.lapetina.resilientfetch.domain.error.FetchTimeoutException;
import fr.lapetina.resilientfetch.domain.model.FetchRequest;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Races the inner chain against a deadline.
 *
 * Expiry only drops interest in the inner result: the raw call keeps running unless the
 * transport honours the request's abort signal. A result arriving after the deadline is discarded.
 */
public final class TimeoutPolicy implements Policy {

    private final String name;
    private final Duration timeout;

    public TimeoutPolicy(String name, Duration timeout) {
        this.name = Objects.requireNonNull(name, "Name is required");
        this.timeout = Objects.requireNonNull(timeout, "Timeout is required");
    }

    @Override
    public <R> CompletableFuture<R> apply(FetchRequest request, Invocation<R> next) {
        // Own future, so that the deadline never completes (or cancels) the inner one
        CompletableFuture<R> guarded = new CompletableFuture<>();
        Futures.invoke(next, request).whenComplete((value, failure) -> {
            if (failure == null) {
                guarded.complete(value);
            } else {
                guarded.completeExceptionally(Futures.unwrap(failure));
            }
        });

        CompletableFuture<R> result = new CompletableFuture<>();
        guarded.orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS).whenComplete((value, failure) -> {
            if (failure == null) {
                result.complete(value);
                return;
            }
            Throwable error = Futures.unwrap(failure);
            result.completeExceptionally(error instanceof TimeoutException ? new FetchTimeoutException(timeout) : error);
        });
        return result;
    }

    public Duration getTimeout() {
        return timeout;
    }

    @Override
    public String name() {
        return name;
    }
}
