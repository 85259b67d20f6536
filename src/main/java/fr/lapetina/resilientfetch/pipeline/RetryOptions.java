package fr.lapetina.resilientfetch.pipeline;

import java.time.Duration;
import java.util.Objects;

/**
 * Settings of one retry policy. Immutable; {@link #toBuilder()} derives variants.
 *
 * {@code attempts} is the total number of tries, the first one included.
 */
public final class RetryOptions {

    public static final String DEFAULT_NAME = "fetch-retry";
    public static final String RATE_LIMIT_NAME = "fetch-rate-limit-retry";

    private static final RetryOptions DEFAULTS = builder().build();

    private static final RetryOptions RATE_LIMIT_DEFAULTS = builder()
            .name(RATE_LIMIT_NAME)
            .attempts(2)
            .mode(RetryMode.CONSTANT)
            .onRejection(RetryPredicates.rateLimit())
            .build();

    private static final RetryOptions DISABLED = builder().name("retry-disabled").attempts(1).enabled(false).build();

    private final String name;
    private final boolean enabled;
    private final int attempts;
    private final Duration initialInterval;
    private final Duration maxInterval;
    private final RetryMode mode;
    private final double factor;
    private final double jitterAdjustment;
    private final boolean fastFirst;
    private final RejectionPredicate onRejection;

    private RetryOptions(Builder builder) {
        this.name = builder.name;
        this.enabled = builder.enabled;
        this.attempts = builder.attempts;
        this.initialInterval = builder.initialInterval;
        this.maxInterval = builder.maxInterval;
        this.mode = builder.mode;
        this.factor = builder.factor;
        this.jitterAdjustment = builder.jitterAdjustment;
        this.fastFirst = builder.fastFirst;
        this.onRejection = builder.onRejection;
    }

    /**
     * 3 attempts, jittered exponential backoff from 500 ms, factor 2, standard predicate.
     */
    public static RetryOptions defaults() {
        return DEFAULTS;
    }

    /**
     * 2 attempts, waiting out the rate-limit window between them.
     */
    public static RetryOptions rateLimitDefaults() {
        return RATE_LIMIT_DEFAULTS;
    }

    /**
     * Turns the retry policy off when used as an override.
     */
    public static RetryOptions disabled() {
        return DISABLED;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getName() { return name; }

    public boolean isEnabled() { return enabled; }

    public int getAttempts() { return attempts; }

    public Duration getInitialInterval() { return initialInterval; }

    public Duration getMaxInterval() { return maxInterval; }

    public RetryMode getMode() { return mode; }

    public double getFactor() { return factor; }

    public double getJitterAdjustment() { return jitterAdjustment; }

    public boolean isFastFirst() { return fastFirst; }

    public RejectionPredicate getOnRejection() { return onRejection; }

    public Builder toBuilder() {
        return new Builder()
                .name(name)
                .enabled(enabled)
                .attempts(attempts)
                .initialInterval(initialInterval)
                .maxInterval(maxInterval)
                .mode(mode)
                .factor(factor)
                .jitterAdjustment(jitterAdjustment)
                .fastFirst(fastFirst)
                .onRejection(onRejection);
    }

    @Override
    public String toString() {
        return "RetryOptions{" +
                "name='" + name + '\'' +
                ", enabled=" + enabled +
                ", attempts=" + attempts +
                ", initialIntervalMs=" + initialInterval.toMillis() +
                ", mode=" + mode +
                ", factor=" + factor +
                '}';
    }

    public static final class Builder {
        private String name = DEFAULT_NAME;
        private boolean enabled = true;
        private int attempts = 3;
        private Duration initialInterval = Duration.ofMillis(500);
        private Duration maxInterval = Duration.ofSeconds(30);
        private RetryMode mode = RetryMode.JITTER;
        private double factor = 2;
        private double jitterAdjustment = 0.5;
        private boolean fastFirst = false;
        private RejectionPredicate onRejection = RetryPredicates.standard();

        private Builder() {
        }

        public Builder name(String name) {
            this.name = Objects.requireNonNull(name, "Name is required");
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder attempts(int attempts) {
            if (attempts < 1) {
                throw new IllegalArgumentException("attempts must be >= 1 (it counts the first try)");
            }
            this.attempts = attempts;
            return this;
        }

        public Builder initialInterval(Duration initialInterval) {
            Objects.requireNonNull(initialInterval, "initialInterval is required");
            if (initialInterval.isNegative()) {
                throw new IllegalArgumentException("initialInterval must not be negative");
            }
            this.initialInterval = initialInterval;
            return this;
        }

        public Builder maxInterval(Duration maxInterval) {
            Objects.requireNonNull(maxInterval, "maxInterval is required");
            if (maxInterval.isNegative()) {
                throw new IllegalArgumentException("maxInterval must not be negative");
            }
            this.maxInterval = maxInterval;
            return this;
        }

        public Builder mode(RetryMode mode) {
            this.mode = Objects.requireNonNull(mode, "Mode is required");
            return this;
        }

        public Builder factor(double factor) {
            if (factor < 1) {
                throw new IllegalArgumentException("factor must be >= 1");
            }
            this.factor = factor;
            return this;
        }

        public Builder jitterAdjustment(double jitterAdjustment) {
            if (jitterAdjustment < 0 || jitterAdjustment > 1) {
                throw new IllegalArgumentException("jitterAdjustment must be between 0 and 1");
            }
            this.jitterAdjustment = jitterAdjustment;
            return this;
        }

        public Builder fastFirst(boolean fastFirst) {
            this.fastFirst = fastFirst;
            return this;
        }

        public Builder onRejection(RejectionPredicate onRejection) {
            this.onRejection = Objects.requireNonNull(onRejection, "onRejection is required");
            return this;
        }

        public RetryOptions build() {
            return new RetryOptions(this);
        }
    }
}
