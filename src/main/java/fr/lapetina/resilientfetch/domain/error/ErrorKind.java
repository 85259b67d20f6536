package fr.lapetina.resilientfetch.domain.error;

/**
 * Discriminant of the fetch error taxonomy.
 * Callers dispatch on it with a switch instead of instanceof chains.
 */
public enum ErrorKind {
    /** Non-2xx, non-redirect response from the server */
    HTTP_RESPONSE,

    /** Retry budget exhausted on an HTTP-level failure */
    RETRY_EXHAUSTED,

    /** Deadline elapsed before the call settled */
    TIMEOUT,

    /** Rate limiter denied admission */
    RATE_LIMITED,

    /** Circuit breaker rejected the call without attempting it */
    CIRCUIT_OPEN,

    /** JSON body did not satisfy the configured schema */
    SCHEMA_VALIDATION,

    /** Network-level failure of the raw call (connection refused, reset, ...) */
    TRANSPORT
}
