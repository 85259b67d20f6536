package fr.lapetina.resilientfetch.domain.model;

import java.time.Duration;
import java.time.Instant;

/**
 * One pass through the inner part of a retry policy.
 * Lives only as long as the logical request that produced it.
 */
public record Attempt(int index, Instant startedAt, Duration duration, Throwable error) {

    public Attempt {
        if (index < 1) {
            throw new IllegalArgumentException("Attempt index starts at 1");
        }
    }

    public boolean succeeded() {
        return error == null;
    }

    @Override
    public String toString() {
        return "Attempt{index=" + index
                + ", durationMs=" + duration.toMillis()
                + ", outcome=" + (error == null ? "success" : error.getClass().getSimpleName())
                + '}';
    }
}
