package fr.lapetina.resilientfetch.domain.error;

/**
 * Thrown when a circuit breaker rejects a call without attempting it.
 */
public final class BreakerOpenException extends FetchException {

    private final String breakerName;

    public BreakerOpenException(String breakerName, String state) {
        super("Circuit breaker " + breakerName + " is " + state);
        this.breakerName = breakerName;
    }

    public String getBreakerName() {
        return breakerName;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.CIRCUIT_OPEN;
    }
}
