package fr.lapetina.resilientfetch.domain.error;

import com.fasterxml.jackson.databind.JsonNode;
import fr.lapetina.resilientfetch.domain.model.ResponseEnvelope;

/**
 * Thrown when the retry budget ran out on a retryable HTTP failure.
 * Carries the response of the last attempt.
 */
public final class RetryException extends HttpResponseException {

    static final String CONTEXT = "Retry Error: Ran out of retry attempts.";

    private final int attempts;

    public RetryException(ResponseEnvelope<JsonNode> lastResponse, int attempts) {
        super(lastResponse, CONTEXT);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.RETRY_EXHAUSTED;
    }
}
