package fr.lapetina.resilientfetch.infrastructure.http;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Fixed window rate limiter shared by every call issued through one client.
 *
 * There is no admission queue: a denied caller gets the time left in the current window
 * and decides on its own whether to wait and try again. Concurrent denied callers race
 * for the next window.
 */
public final class RateLimiter {

    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

    /**
     * Result of one admission attempt.
     *
     * @param admitted whether the call may proceed
     * @param remainingTimeInWindow time until the quota resets, zero when admitted
     */
    public record Admission(boolean admitted, Duration remainingTimeInWindow) {

        static final Admission GRANTED = new Admission(true, Duration.ZERO);

        static Admission denied(Duration remaining) {
            return new Admission(false, remaining);
        }
    }

    private final RateLimitOptions options;
    private final Clock clock;

    private Instant windowStart;
    private int remainingQuota;

    public RateLimiter(RateLimitOptions options, Clock clock) {
        this.options = Objects.requireNonNull(options, "Options are required");
        this.clock = Objects.requireNonNull(clock, "Clock is required");
        this.windowStart = clock.instant();
        this.remainingQuota = options.limitForPeriod();
    }

    public RateLimiter(RateLimitOptions options) {
        this(options, Clock.systemUTC());
    }

    public synchronized Admission tryAcquire() {
        Instant now = clock.instant();
        Instant windowEnd = windowStart.plus(options.limitPeriod());

        if (!now.isBefore(windowEnd)) {
            windowStart = now;
            windowEnd = now.plus(options.limitPeriod());
            remainingQuota = options.limitForPeriod();
        }

        if (remainingQuota > 0) {
            remainingQuota--;
            return Admission.GRANTED;
        }

        Duration remaining = Duration.between(now, windowEnd);
        log.trace("Rate limit reached: name={}, limit={}/{}ms, remainingMs={}",
                options.name(), options.limitForPeriod(), options.limitPeriod().toMillis(), remaining.toMillis());
        return Admission.denied(remaining);
    }

    public synchronized int getRemainingQuota() {
        return remainingQuota;
    }

    public String getName() {
        return options.name();
    }

    public RateLimitOptions getOptions() {
        return options;
    }

    @Override
    public synchronized String toString() {
        return "RateLimiter{" +
                "name='" + options.name() + '\'' +
                ", remainingQuota=" + remainingQuota +
                ", limitForPeriod=" + options.limitForPeriod() +
                '}';
    }
}
