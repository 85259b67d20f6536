package fr.lapetina.resilientfetch.domain.error;

import java.time.Duration;

/**
 * Thrown when the rate limiter has no quota left in the current window.
 */
public final class RateLimitException extends FetchException {

    private final String limiterName;
    private final Duration remainingTimeInWindow;

    public RateLimitException(String limiterName, int limitForPeriod, Duration limitPeriod, Duration remainingTimeInWindow) {
        super("Rate limited by " + limiterName + ": more than " + limitForPeriod
                + " calls in " + limitPeriod.toMillis() + " ms, "
                + remainingTimeInWindow.toMillis() + " ms left in window");
        this.limiterName = limiterName;
        this.remainingTimeInWindow = remainingTimeInWindow;
    }

    public String getLimiterName() {
        return limiterName;
    }

    public Duration getRemainingTimeInWindow() {
        return remainingTimeInWindow;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.RATE_LIMITED;
    }
}
