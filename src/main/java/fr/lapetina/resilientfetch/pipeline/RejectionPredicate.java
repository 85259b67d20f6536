package fr.lapetina.resilientfetch.pipeline;

/**
 * Decides, after a failed attempt, whether and when a retry policy tries again.
 */
@FunctionalInterface
public interface RejectionPredicate {

    /**
     * @param error the unwrapped failure of the attempt
     * @param attempt number of the attempt that just failed, starting at 1
     */
    RetryDecision onRejection(Throwable error, int attempt);
}
