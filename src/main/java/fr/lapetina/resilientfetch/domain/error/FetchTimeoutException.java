package fr.lapetina.resilientfetch.domain.error;

import java.time.Duration;

/**
 * Thrown when a call did not settle within the configured timeout.
 */
public final class FetchTimeoutException extends FetchException {

    private final Duration timeout;

    public FetchTimeoutException(Duration timeout) {
        super("Timed out after " + timeout.toMillis() + " ms");
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.TIMEOUT;
    }
}
