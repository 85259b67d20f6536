package fr.lapetina.resilientfetch.pipeline;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Computes the wait before the next attempt when the predicate asks for a backoff.
 */
public final class BackoffCalculator {

    private final DoubleSupplier random;

    public BackoffCalculator() {
        this(() -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * @param random source of values in [0, 1), used by {@link RetryMode#JITTER}
     */
    public BackoffCalculator(DoubleSupplier random) {
        this.random = Objects.requireNonNull(random, "Random source is required");
    }

    /**
     * @param failedAttempt number of the attempt that just failed, starting at 1
     */
    public Duration delayFor(RetryOptions options, int failedAttempt) {
        if (options.isFastFirst() && failedAttempt == 1) {
            return Duration.ZERO;
        }

        double initial = options.getInitialInterval().toMillis();
        double max = options.getMaxInterval().toMillis();

        double delay = switch (options.getMode()) {
            case CONSTANT -> initial;
            case LINEAR -> Math.min(max, initial * failedAttempt);
            case EXPONENTIAL -> Math.min(max, initial * Math.pow(options.getFactor(), failedAttempt - 1));
            case JITTER -> jitter(Math.min(max, initial * Math.pow(options.getFactor(), failedAttempt - 1)),
                    options.getJitterAdjustment());
        };
        return Duration.ofMillis(Math.round(Math.max(0, delay)));
    }

    private double jitter(double delay, double adjustment) {
        double spread = delay * adjustment;
        double low = delay - spread;
        return low + random.getAsDouble() * 2 * spread;
    }
}
