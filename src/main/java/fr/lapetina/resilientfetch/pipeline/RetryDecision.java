package fr.lapetina.resilientfetch.pipeline;

import java.time.Duration;
import java.util.Objects;

/**
 * What a retry policy should do after a failed attempt.
 */
public final class RetryDecision {

    private enum Action {
        STOP,
        BACKOFF,
        DELAY
    }

    private static final RetryDecision STOP = new RetryDecision(Action.STOP, Duration.ZERO);
    private static final RetryDecision BACKOFF = new RetryDecision(Action.BACKOFF, Duration.ZERO);

    private final Action action;
    private final Duration delay;

    private RetryDecision(Action action, Duration delay) {
        this.action = action;
        this.delay = delay;
    }

    /** Give up and propagate the error. */
    public static RetryDecision stop() {
        return STOP;
    }

    /** Retry after the delay computed from the retry options. */
    public static RetryDecision backoff() {
        return BACKOFF;
    }

    /** Retry after exactly {@code delay}, e.g. a Retry-After header or the rest of a rate-limit window. */
    public static RetryDecision after(Duration delay) {
        Objects.requireNonNull(delay, "Delay is required");
        return new RetryDecision(Action.DELAY, delay.isNegative() ? Duration.ZERO : delay);
    }

    public boolean isStop() {
        return action == Action.STOP;
    }

    public boolean isBackoff() {
        return action == Action.BACKOFF;
    }

    /**
     * Explicit delay; only meaningful for decisions made with {@link #after(Duration)}.
     */
    public Duration delay() {
        return delay;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RetryDecision that)) return false;
        return action == that.action && delay.equals(that.delay);
    }

    @Override
    public int hashCode() {
        return Objects.hash(action, delay);
    }

    @Override
    public String toString() {
        return switch (action) {
            case STOP -> "stop";
            case BACKOFF -> "backoff";
            case DELAY -> "after " + delay.toMillis() + " ms";
        };
    }
}
