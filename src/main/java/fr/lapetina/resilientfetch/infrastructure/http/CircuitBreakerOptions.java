package fr.lapetina.resilientfetch.infrastructure.http;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Settings of a sliding count circuit breaker. Immutable.
 */
public final class CircuitBreakerOptions {

    public static final String DEFAULT_NAME = "fetch-circuit-breaker";

    private final String name;
    private final CircuitBreaker.State initialState;
    private final double failureRateThreshold;
    private final double slowCallRateThreshold;
    private final Duration slowCallDurationThreshold;
    private final int permittedNumberOfCallsInHalfOpenState;
    private final Duration halfOpenStateMaxDelay;
    private final int slidingWindowSize;
    private final int minimumNumberOfCalls;
    private final Duration openStateDelay;
    private final Predicate<Throwable> onError;

    private CircuitBreakerOptions(Builder builder) {
        this.name = builder.name;
        this.initialState = builder.initialState;
        this.failureRateThreshold = builder.failureRateThreshold;
        this.slowCallRateThreshold = builder.slowCallRateThreshold;
        this.slowCallDurationThreshold = builder.slowCallDurationThreshold;
        this.permittedNumberOfCallsInHalfOpenState = builder.permittedNumberOfCallsInHalfOpenState;
        this.halfOpenStateMaxDelay = builder.halfOpenStateMaxDelay;
        this.slidingWindowSize = builder.slidingWindowSize;
        this.minimumNumberOfCalls = builder.minimumNumberOfCalls;
        this.openStateDelay = builder.openStateDelay;
        this.onError = builder.onError;
    }

    public static CircuitBreakerOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getName() { return name; }

    public CircuitBreaker.State getInitialState() { return initialState; }

    /** Failure percentage (0-100) at or above which the circuit opens. */
    public double getFailureRateThreshold() { return failureRateThreshold; }

    /** Slow call percentage (0-100) at or above which the circuit opens. */
    public double getSlowCallRateThreshold() { return slowCallRateThreshold; }

    public Duration getSlowCallDurationThreshold() { return slowCallDurationThreshold; }

    public int getPermittedNumberOfCallsInHalfOpenState() { return permittedNumberOfCallsInHalfOpenState; }

    /** Zero disables the half-open deadline. */
    public Duration getHalfOpenStateMaxDelay() { return halfOpenStateMaxDelay; }

    public int getSlidingWindowSize() { return slidingWindowSize; }

    public int getMinimumNumberOfCalls() { return minimumNumberOfCalls; }

    public Duration getOpenStateDelay() { return openStateDelay; }

    /** Decides whether an error counts as a failure; rejected errors are recorded as successes. */
    public Predicate<Throwable> getOnError() { return onError; }

    public Builder toBuilder() {
        return new Builder()
                .name(name)
                .initialState(initialState)
                .failureRateThreshold(failureRateThreshold)
                .slowCallRateThreshold(slowCallRateThreshold)
                .slowCallDurationThreshold(slowCallDurationThreshold)
                .permittedNumberOfCallsInHalfOpenState(permittedNumberOfCallsInHalfOpenState)
                .halfOpenStateMaxDelay(halfOpenStateMaxDelay)
                .slidingWindowSize(slidingWindowSize)
                .minimumNumberOfCalls(minimumNumberOfCalls)
                .openStateDelay(openStateDelay)
                .onError(onError);
    }

    @Override
    public String toString() {
        return "CircuitBreakerOptions{" +
                "name='" + name + '\'' +
                ", failureRateThreshold=" + failureRateThreshold +
                ", slowCallRateThreshold=" + slowCallRateThreshold +
                ", slidingWindowSize=" + slidingWindowSize +
                ", minimumNumberOfCalls=" + minimumNumberOfCalls +
                ", openStateDelayMs=" + openStateDelay.toMillis() +
                '}';
    }

    public static final class Builder {
        private String name = DEFAULT_NAME;
        private CircuitBreaker.State initialState = CircuitBreaker.State.CLOSED;
        private double failureRateThreshold = 50;
        private double slowCallRateThreshold = 100;
        private Duration slowCallDurationThreshold = Duration.ofSeconds(60);
        private int permittedNumberOfCallsInHalfOpenState = 2;
        private Duration halfOpenStateMaxDelay = Duration.ZERO;
        private int slidingWindowSize = 10;
        private int minimumNumberOfCalls = 10;
        private Duration openStateDelay = Duration.ofSeconds(60);
        private Predicate<Throwable> onError = error -> true;

        private Builder() {
        }

        public Builder name(String name) {
            this.name = Objects.requireNonNull(name, "Name is required");
            return this;
        }

        public Builder initialState(CircuitBreaker.State initialState) {
            this.initialState = Objects.requireNonNull(initialState, "Initial state is required");
            return this;
        }

        public Builder failureRateThreshold(double percent) {
            this.failureRateThreshold = requirePercentage(percent, "failureRateThreshold");
            return this;
        }

        public Builder slowCallRateThreshold(double percent) {
            this.slowCallRateThreshold = requirePercentage(percent, "slowCallRateThreshold");
            return this;
        }

        public Builder slowCallDurationThreshold(Duration threshold) {
            this.slowCallDurationThreshold = requirePositive(threshold, "slowCallDurationThreshold");
            return this;
        }

        public Builder permittedNumberOfCallsInHalfOpenState(int calls) {
            if (calls < 1) {
                throw new IllegalArgumentException("permittedNumberOfCallsInHalfOpenState must be >= 1");
            }
            this.permittedNumberOfCallsInHalfOpenState = calls;
            return this;
        }

        public Builder halfOpenStateMaxDelay(Duration delay) {
            Objects.requireNonNull(delay, "halfOpenStateMaxDelay is required");
            if (delay.isNegative()) {
                throw new IllegalArgumentException("halfOpenStateMaxDelay must not be negative");
            }
            this.halfOpenStateMaxDelay = delay;
            return this;
        }

        public Builder slidingWindowSize(int size) {
            if (size < 1) {
                throw new IllegalArgumentException("slidingWindowSize must be >= 1");
            }
            this.slidingWindowSize = size;
            return this;
        }

        public Builder minimumNumberOfCalls(int calls) {
            if (calls < 1) {
                throw new IllegalArgumentException("minimumNumberOfCalls must be >= 1");
            }
            this.minimumNumberOfCalls = calls;
            return this;
        }

        public Builder openStateDelay(Duration delay) {
            this.openStateDelay = requirePositive(delay, "openStateDelay");
            return this;
        }

        public Builder onError(Predicate<Throwable> onError) {
            this.onError = Objects.requireNonNull(onError, "onError is required");
            return this;
        }

        public CircuitBreakerOptions build() {
            return new CircuitBreakerOptions(this);
        }

        private static double requirePercentage(double percent, String field) {
            if (percent < 0 || percent > 100) {
                throw new IllegalArgumentException(field + " must be between 0 and 100");
            }
            return percent;
        }

        private static Duration requirePositive(Duration duration, String field) {
            Objects.requireNonNull(duration, field + " is required");
            if (duration.isNegative() || duration.isZero()) {
                throw new IllegalArgumentException(field + " must be positive");
            }
            return duration;
        }
    }
}
