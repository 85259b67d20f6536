package fr.lapetina.resilientfetch.pipeline;

import fr.lapetina.resilientfetch.domain.error.ErrorKind;
import fr.lapetina.resilientfetch.domain.error.FetchException;
import fr.lapetina.resilientfetch.domain.error.HttpResponseException;
import fr.lapetina.resilientfetch.domain.error.RateLimitException;

import java.net.http.HttpHeaders;
import java.time.Clock;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Built-in rejection predicates.
 */
public final class RetryPredicates {

    /** Added to the remaining window so the retried admission lands in the next window. */
    static final Duration RATE_LIMIT_MARGIN = Duration.ofMillis(50);

    private RetryPredicates() {
    }

    /**
     * Call scope default: retries 429 and 5xx responses (honouring Retry-After), timeouts and
     * transport failures; waits out rate limits; stops on everything else.
     */
    public static RejectionPredicate standard() {
        return standard(Clock.systemUTC());
    }

    public static RejectionPredicate standard(Clock clock) {
        return (error, attempt) -> {
            if (!(error instanceof FetchException fetchError)) {
                return RetryDecision.stop();
            }
            return switch (fetchError.kind()) {
                case HTTP_RESPONSE -> forResponse((HttpResponseException) fetchError, clock);
                case RATE_LIMITED -> RetryDecision.after(((RateLimitException) fetchError).getRemainingTimeInWindow());
                case TIMEOUT, TRANSPORT -> RetryDecision.backoff();
                case RETRY_EXHAUSTED, CIRCUIT_OPEN, SCHEMA_VALIDATION -> RetryDecision.stop();
            };
        };
    }

    /**
     * Rate-limit admission default: waits out the current window, stops on anything else.
     */
    public static RejectionPredicate rateLimit() {
        return (error, attempt) -> {
            if (error instanceof FetchException fetchError
                    && fetchError.kind() == ErrorKind.RATE_LIMITED) {
                Duration remaining = ((RateLimitException) fetchError).getRemainingTimeInWindow();
                return RetryDecision.after(remaining.plus(RATE_LIMIT_MARGIN));
            }
            return RetryDecision.stop();
        };
    }

    /**
     * Retries any failure with the configured backoff.
     */
    public static RejectionPredicate always() {
        return (error, attempt) -> RetryDecision.backoff();
    }

    static boolean isRetryableStatus(int status) {
        return status == 429 || status >= 500;
    }

    private static RetryDecision forResponse(HttpResponseException error, Clock clock) {
        if (!isRetryableStatus(error.getStatus())) {
            return RetryDecision.stop();
        }
        return retryAfter(error.getResponse().headers(), clock)
                .map(RetryDecision::after)
                .orElse(RetryDecision.backoff());
    }

    /**
     * Parses a Retry-After header given either as delta-seconds or as an HTTP-date.
     */
    static Optional<Duration> retryAfter(HttpHeaders headers, Clock clock) {
        Optional<String> value = headers.firstValue("Retry-After").map(String::trim);
        if (value.isEmpty() || value.get().isEmpty()) {
            return Optional.empty();
        }
        String raw = value.get();
        try {
            long seconds = Long.parseLong(raw);
            return Optional.of(Duration.ofSeconds(Math.max(0, seconds)));
        } catch (NumberFormatException notSeconds) {
            try {
                ZonedDateTime at = ZonedDateTime.parse(raw, DateTimeFormatter.RFC_1123_DATE_TIME);
                Duration until = Duration.between(clock.instant(), at.toInstant());
                return Optional.of(until.isNegative() ? Duration.ZERO : until);
            } catch (DateTimeParseException notDate) {
                return Optional.empty();
            }
        }
    }
}
