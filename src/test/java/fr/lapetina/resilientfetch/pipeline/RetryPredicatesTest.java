package fr.lapetina.resilientfetch.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import fr.lapetina.resilientfetch.domain.error.BreakerOpenException;
import fr.lapetina.resilientfetch.domain.error.FetchTimeoutException;
import fr.lapetina.resilientfetch.domain.error.HttpResponseException;
import fr.lapetina.resilientfetch.domain.error.RateLimitException;
import fr.lapetina.resilientfetch.domain.error.TransportException;
import fr.lapetina.resilientfetch.domain.model.ResponseEnvelope;
import fr.lapetina.resilientfetch.integration.MutableClock;
import fr.lapetina.resilientfetch.integration.StubTransport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RetryPredicatesTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
    private final RejectionPredicate standard = RetryPredicates.standard(clock);

    private static HttpResponseException httpError(int status, Map<String, String> headers) {
        return new HttpResponseException(new ResponseEnvelope<JsonNode>(
                StubTransport.response(status, "application/json", "{}", headers), null, true, "{}"));
    }

    private static RateLimitException rateLimited(Duration remaining) {
        return new RateLimitException("limiter", 2, Duration.ofMillis(400), remaining);
    }

    @Test
    @DisplayName("should back off on server errors and 429")
    void shouldBackOffOnRetryableStatus() {
        assertThat(standard.onRejection(httpError(500, Map.of()), 1).isBackoff()).isTrue();
        assertThat(standard.onRejection(httpError(503, Map.of()), 1).isBackoff()).isTrue();
        assertThat(standard.onRejection(httpError(429, Map.of()), 1).isBackoff()).isTrue();
    }

    @Test
    @DisplayName("should stop on client errors")
    void shouldStopOnClientErrors() {
        assertThat(standard.onRejection(httpError(400, Map.of()), 1).isStop()).isTrue();
        assertThat(standard.onRejection(httpError(404, Map.of()), 1).isStop()).isTrue();
    }

    @Test
    @DisplayName("should honour Retry-After in seconds")
    void shouldHonourRetryAfterSeconds() {
        RetryDecision decision = standard.onRejection(httpError(503, Map.of("Retry-After", "2")), 1);

        assertThat(decision).isEqualTo(RetryDecision.after(Duration.ofSeconds(2)));
    }

    @Test
    @DisplayName("should honour Retry-After as an HTTP date")
    void shouldHonourRetryAfterDate() {
        RetryDecision decision = standard.onRejection(
                httpError(429, Map.of("Retry-After", "Mon, 1 Jan 2024 00:00:05 GMT")), 1);

        assertThat(decision.delay()).isEqualTo(Duration.ofSeconds(5));
    }

    @Test
    @DisplayName("should back off when Retry-After cannot be parsed")
    void shouldIgnoreInvalidRetryAfter() {
        assertThat(standard.onRejection(httpError(503, Map.of("Retry-After", "soon")), 1).isBackoff()).isTrue();
    }

    @Test
    @DisplayName("should back off on timeouts and transport failures")
    void shouldBackOffOnTimeoutAndTransport() {
        assertThat(standard.onRejection(new FetchTimeoutException(Duration.ofSeconds(1)), 1).isBackoff()).isTrue();
        assertThat(standard.onRejection(new TransportException("reset", null), 1).isBackoff()).isTrue();
    }

    @Test
    @DisplayName("should stop on open circuit and unclassified errors")
    void shouldStopOnNonRetryable() {
        assertThat(standard.onRejection(new BreakerOpenException("breaker", "OPEN"), 1).isStop()).isTrue();
        assertThat(standard.onRejection(new IllegalStateException("bug"), 1).isStop()).isTrue();
    }

    @Test
    @DisplayName("should wait out the rate limit window with a margin")
    void shouldWaitOutRateLimitWindow() {
        RetryDecision decision = RetryPredicates.rateLimit().onRejection(rateLimited(Duration.ofMillis(120)), 1);

        assertThat(decision.delay()).isEqualTo(Duration.ofMillis(170));
        assertThat(RetryPredicates.rateLimit().onRejection(httpError(500, Map.of()), 1).isStop()).isTrue();
    }
}
