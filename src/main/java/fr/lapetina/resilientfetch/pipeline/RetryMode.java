package fr.lapetina.resilientfetch.pipeline;

/**
 * Shape of the delay between two attempts when the rejection predicate asks for a backoff.
 */
public enum RetryMode {
    /** Always the initial interval. */
    CONSTANT,
    /** Initial interval times the attempt number. */
    LINEAR,
    /** Initial interval times factor^(attempt - 1). */
    EXPONENTIAL,
    /** Exponential, then sampled uniformly within +/- jitterAdjustment of the delay. */
    JITTER
}
