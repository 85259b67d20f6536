package fr.lapetina.resilientfetch.pipeline;

import java.time.Duration;
import java.util.Objects;

/**
 * Deadline of one attempt, with an optional retry running inside the deadline's scope.
 *
 * @param timeout deadline, null when the timeout is disabled
 * @param retry retry applied to each raw call within the timeout
 */
public record TimeoutOptions(String name, Duration timeout, RetryOptions retry) {

    public static final String DEFAULT_NAME = "fetch-timeout";
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

    private static final TimeoutOptions DISABLED = new TimeoutOptions(DEFAULT_NAME, null, RetryOptions.disabled());

    public TimeoutOptions {
        Objects.requireNonNull(name, "Name is required");
        if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        retry = retry != null ? retry : RetryOptions.disabled();
    }

    public static TimeoutOptions defaults() {
        return of(DEFAULT_TIMEOUT);
    }

    public static TimeoutOptions of(Duration timeout) {
        return new TimeoutOptions(DEFAULT_NAME, Objects.requireNonNull(timeout, "Timeout is required"), null);
    }

    public static TimeoutOptions disabled() {
        return DISABLED;
    }

    public boolean isEnabled() {
        return timeout != null;
    }

    public TimeoutOptions withRetry(RetryOptions newRetry) {
        return new TimeoutOptions(name, timeout, newRetry);
    }
}
