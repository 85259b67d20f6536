package fr.lapetina.resilientfetch.domain.error;

/**
 * Base of every error surfaced by the fetch pipeline.
 *
 * Instances are created at the point of failure and never mutated afterwards.
 */
public abstract class FetchException extends RuntimeException {

    protected FetchException(String message) {
        super(message);
    }

    protected FetchException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract ErrorKind kind();

    /**
     * True for failures that carry a server response.
     */
    public boolean isHttpFailure() {
        return switch (kind()) {
            case HTTP_RESPONSE, RETRY_EXHAUSTED -> true;
            case TIMEOUT, RATE_LIMITED, CIRCUIT_OPEN, SCHEMA_VALIDATION, TRANSPORT -> false;
        };
    }
}
