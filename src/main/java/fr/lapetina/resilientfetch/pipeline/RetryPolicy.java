package fr.lapetina.resilientfetch.pipeline;

import fr.lapetina.resilientfetch.domain.error.FetchException;
import fr.lapetina.resilientfetch.domain.error.HttpResponseException;
import fr.lapetina.resilientfetch.domain.error.RetryException;
import fr.lapetina.resilientfetch.domain.model.Attempt;
import fr.lapetina.resilientfetch.domain.model.FetchRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Re-invokes the inner chain until it succeeds, the rejection predicate says stop, or the
 * attempt budget is spent. Waits between attempts never block a thread.
 *
 * Only the outermost call-scope retry relabels: when it runs out of attempts on an HTTP
 * failure the predicate still wanted to retry, it fails with a {@link RetryException}
 * carrying the last response. Every other outcome propagates the last error unchanged.
 */
public final class RetryPolicy implements Policy {

    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    private final RetryOptions options;
    private final boolean relabelExhausted;
    private final BackoffCalculator backoff;
    private final Clock clock;

    public RetryPolicy(RetryOptions options, boolean relabelExhausted, BackoffCalculator backoff, Clock clock) {
        this.options = Objects.requireNonNull(options, "Retry options are required");
        this.relabelExhausted = relabelExhausted;
        this.backoff = Objects.requireNonNull(backoff, "Backoff calculator is required");
        this.clock = Objects.requireNonNull(clock, "Clock is required");
    }

    public RetryPolicy(RetryOptions options, boolean relabelExhausted) {
        this(options, relabelExhausted, new BackoffCalculator(), Clock.systemUTC());
    }

    @Override
    public <R> CompletableFuture<R> apply(FetchRequest request, Invocation<R> next) {
        CompletableFuture<R> result = new CompletableFuture<>();
        attempt(request, next, 1, new ArrayList<>(), result);
        return result;
    }

    private <R> void attempt(
            FetchRequest request,
            Invocation<R> next,
            int number,
            List<Attempt> history,
            CompletableFuture<R> result
    ) {
        if (result.isDone()) {
            // Cancelled by the caller while waiting
            return;
        }

        Instant startedAt = clock.instant();
        long startNanos = System.nanoTime();

        Futures.invoke(next, request).whenComplete((value, failure) -> {
            if (failure == null) {
                result.complete(value);
                return;
            }

            Throwable error = Futures.unwrap(failure);
            history.add(new Attempt(number, startedAt, Duration.ofNanos(System.nanoTime() - startNanos), error));

            RetryDecision decision;
            try {
                decision = options.getOnRejection().onRejection(error, number);
            } catch (RuntimeException predicateFailure) {
                predicateFailure.addSuppressed(error);
                result.completeExceptionally(predicateFailure);
                return;
            }

            if (decision.isStop()) {
                log.trace("Retry stopped by predicate: policy={}, request={}, attempt={}, error={}",
                        options.getName(), request, number, error.getClass().getSimpleName());
                result.completeExceptionally(error);
                return;
            }

            if (number >= options.getAttempts()) {
                log.trace("Retry attempts exhausted: policy={}, request={}, attempts={}",
                        options.getName(), request, history);
                result.completeExceptionally(exhausted(error, number));
                return;
            }

            Duration delay = decision.isBackoff() ? backoff.delayFor(options, number) : decision.delay();
            log.trace("Retry scheduled: policy={}, request={}, attempt={}/{}, delayMs={}, decision={}",
                    options.getName(), request, number + 1, options.getAttempts(), delay.toMillis(), decision);

            CompletableFuture.delayedExecutor(delay.toMillis(), TimeUnit.MILLISECONDS)
                    .execute(() -> attempt(request, next, number + 1, history, result));
        });
    }

    private Throwable exhausted(Throwable error, int attempts) {
        if (!relabelExhausted || !(error instanceof FetchException fetchError)) {
            return error;
        }
        return switch (fetchError.kind()) {
            case HTTP_RESPONSE -> new RetryException(((HttpResponseException) fetchError).getResponse(), attempts);
            case RETRY_EXHAUSTED, TIMEOUT, RATE_LIMITED, CIRCUIT_OPEN, SCHEMA_VALIDATION, TRANSPORT -> error;
        };
    }

    public RetryOptions getOptions() {
        return options;
    }

    public boolean isRelabelExhausted() {
        return relabelExhausted;
    }

    @Override
    public String name() {
        return options.getName();
    }
}
