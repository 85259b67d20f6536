package fr.lapetina.resilientfetch.infrastructure.http;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.Optional;

/**
 * Sliding count circuit breaker shared by every call issued through one client.
 *
 * States:
 * - CLOSED: calls pass through, outcomes are recorded in a window of the last N calls
 * - OPEN: failure or slow call rate reached its threshold, calls rejected immediately
 * - HALF_OPEN: after the open delay, a limited number of probe calls go through
 *
 * Every read-modify-write happens under the instance monitor; nothing here blocks.
 * Each transition starts a new generation. A {@link Permit} remembers the generation it was
 * granted in, and outcomes reported with a permit from an older generation are ignored.
 */
public final class CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    public enum State {
        CLOSED,
        OPEN,
        HALF_OPEN
    }

    enum Outcome {
        SUCCESS,
        FAILURE,
        SLOW_SUCCESS,
        SLOW_FAILURE;

        boolean failed() {
            return this == FAILURE || this == SLOW_FAILURE;
        }

        boolean slow() {
            return this == SLOW_SUCCESS || this == SLOW_FAILURE;
        }
    }

    /**
     * Proof that a call was let through, tied to the state generation that admitted it.
     */
    public record Permit(long generation, State grantedIn) {
    }

    private final CircuitBreakerOptions options;
    private final Clock clock;

    private final Deque<Outcome> window = new ArrayDeque<>();
    private State state;
    private long generation;
    private Instant lastTransition;
    private int halfOpenPermitsIssued;
    private int halfOpenSuccesses;

    public CircuitBreaker(CircuitBreakerOptions options, Clock clock) {
        this.options = Objects.requireNonNull(options, "Options are required");
        this.clock = Objects.requireNonNull(clock, "Clock is required");
        this.state = options.getInitialState();
        this.lastTransition = clock.instant();
    }

    public CircuitBreaker(CircuitBreakerOptions options) {
        this(options, Clock.systemUTC());
    }

    /**
     * Asks for permission to run a call. In HALF_OPEN each granted permit consumes one
     * probe slot.
     *
     * @return the permit to hand back to {@link #onResult(Permit, Duration, Throwable)},
     *         or empty if the call must be rejected
     */
    public synchronized Optional<Permit> tryAcquire() {
        refreshState();
        boolean permitted = switch (state) {
            case CLOSED -> true;
            case OPEN -> false;
            case HALF_OPEN -> {
                if (halfOpenPermitsIssued < options.getPermittedNumberOfCallsInHalfOpenState()) {
                    halfOpenPermitsIssued++;
                    yield true;
                }
                yield false;
            }
        };
        return permitted ? Optional.of(new Permit(generation, state)) : Optional.empty();
    }

    /**
     * Checks if a call is allowed through, without keeping the permit.
     *
     * @return true if the call should proceed, false if it must be rejected
     */
    public boolean tryAcquirePermission() {
        return tryAcquire().isPresent();
    }

    /**
     * Records the outcome of a call admitted with {@code permit}. Outcomes of calls admitted
     * before the latest transition are dropped, so only this state's own calls count.
     *
     * @param permit the permit returned by {@link #tryAcquire()}
     * @param duration how long the inner call took
     * @param error the failure, or null on success
     */
    public synchronized void onResult(Permit permit, Duration duration, Throwable error) {
        Objects.requireNonNull(permit, "Permit is required");
        refreshState();
        if (permit.generation() != generation) {
            log.debug("Ignoring outcome from an earlier state: name={}, grantedIn={}, state={}",
                    options.getName(), permit.grantedIn(), state);
            return;
        }
        record(classify(duration, error), error);
    }

    /**
     * Records an outcome against the current state, whatever state admitted the call.
     *
     * @param duration how long the inner call took
     * @param error the failure, or null on success
     */
    public synchronized void onResult(Duration duration, Throwable error) {
        refreshState();
        record(classify(duration, error), error);
    }

    private void record(Outcome outcome, Throwable error) {
        switch (state) {
            case CLOSED -> {
                window.addLast(outcome);
                while (window.size() > options.getSlidingWindowSize()) {
                    window.removeFirst();
                }
                evaluateClosedWindow();
            }
            case HALF_OPEN -> {
                if (outcome.failed()) {
                    transitionTo(State.OPEN);
                    log.warn("Circuit breaker OPENED (half-open probe failed): name={}, error={}",
                            options.getName(), describe(error));
                    return;
                }
                halfOpenSuccesses++;
                if (halfOpenSuccesses >= options.getPermittedNumberOfCallsInHalfOpenState()) {
                    transitionTo(State.CLOSED);
                    log.info("Circuit breaker CLOSED after recovery: name={}, probes={}",
                            options.getName(), halfOpenSuccesses);
                }
            }
            case OPEN -> {
                // Call admitted before the circuit opened; its outcome no longer matters.
            }
        }
    }

    /**
     * Forces the circuit to a specific state. For testing/admin use.
     */
    public synchronized void forceState(State newState) {
        State old = state;
        transitionTo(Objects.requireNonNull(newState, "State is required"));
        log.info("Circuit breaker forced from {} to {}: name={}", old, newState, options.getName());
    }

    public synchronized State getState() {
        refreshState();
        return state;
    }

    /**
     * Failure percentage over the recorded window, or -1 while fewer than the minimum
     * number of calls have been recorded.
     */
    public synchronized double getFailureRate() {
        if (window.size() < requiredCalls()) {
            return -1;
        }
        return rate(window.stream().filter(Outcome::failed).count());
    }

    public synchronized int getBufferedCalls() {
        return window.size();
    }

    public String getName() {
        return options.getName();
    }

    public CircuitBreakerOptions getOptions() {
        return options;
    }

    private Outcome classify(Duration duration, Throwable error) {
        boolean failed = error != null && options.getOnError().test(error);
        boolean slow = duration.compareTo(options.getSlowCallDurationThreshold()) >= 0;
        if (failed) {
            return slow ? Outcome.SLOW_FAILURE : Outcome.FAILURE;
        }
        return slow ? Outcome.SLOW_SUCCESS : Outcome.SUCCESS;
    }

    private void evaluateClosedWindow() {
        if (window.size() < requiredCalls()) {
            return;
        }
        double failureRate = rate(window.stream().filter(Outcome::failed).count());
        double slowCallRate = rate(window.stream().filter(Outcome::slow).count());

        if (failureRate >= options.getFailureRateThreshold()
                || slowCallRate >= options.getSlowCallRateThreshold()) {
            int calls = window.size();
            transitionTo(State.OPEN);
            log.warn("Circuit breaker OPENED: name={}, calls={}, failureRate={}, slowCallRate={}",
                    options.getName(), calls, failureRate, slowCallRate);
        }
    }

    /**
     * Applies the time based transitions: OPEN to HALF_OPEN after the open delay, and
     * HALF_OPEN back to OPEN when the probes did not complete within the max delay.
     */
    private void refreshState() {
        Instant now = clock.instant();
        if (state == State.OPEN && !now.isBefore(lastTransition.plus(options.getOpenStateDelay()))) {
            transitionTo(State.HALF_OPEN);
            log.info("Circuit breaker transitioning to HALF_OPEN: name={}", options.getName());
            return;
        }

        Duration maxDelay = options.getHalfOpenStateMaxDelay();
        if (state == State.HALF_OPEN && !maxDelay.isZero()
                && !now.isBefore(lastTransition.plus(maxDelay))) {
            transitionTo(State.OPEN);
            log.warn("Circuit breaker OPENED (half-open probes timed out): name={}, successes={}",
                    options.getName(), halfOpenSuccesses);
        }
    }

    private void transitionTo(State newState) {
        state = newState;
        generation++;
        lastTransition = clock.instant();
        halfOpenPermitsIssued = 0;
        halfOpenSuccesses = 0;
        if (newState != State.OPEN) {
            window.clear();
        }
    }

    private int requiredCalls() {
        return Math.min(options.getMinimumNumberOfCalls(), options.getSlidingWindowSize());
    }

    private double rate(long count) {
        return count * 100.0 / window.size();
    }

    private static String describe(Throwable error) {
        return error == null ? "slow call" : error.getClass().getSimpleName();
    }

    @Override
    public synchronized String toString() {
        return "CircuitBreaker{" +
                "name='" + options.getName() + '\'' +
                ", state=" + state +
                ", bufferedCalls=" + window.size() +
                '}';
    }
}
