package fr.lapetina.resilientfetch.infrastructure.http;

import java.time.Duration;
import java.util.Objects;

/**
 * Fixed window quota: at most {@code limitForPeriod} admissions per {@code limitPeriod}.
 */
public record RateLimitOptions(String name, int limitForPeriod, Duration limitPeriod) {

    public static final String DEFAULT_NAME = "fetch-rate-limiter";

    public RateLimitOptions {
        Objects.requireNonNull(name, "Name is required");
        Objects.requireNonNull(limitPeriod, "Limit period is required");
        if (limitForPeriod < 1) {
            throw new IllegalArgumentException("limitForPeriod must be >= 1");
        }
        if (limitPeriod.isNegative() || limitPeriod.isZero()) {
            throw new IllegalArgumentException("limitPeriod must be positive");
        }
    }

    public static RateLimitOptions of(int limitForPeriod, Duration limitPeriod) {
        return new RateLimitOptions(DEFAULT_NAME, limitForPeriod, limitPeriod);
    }
}
