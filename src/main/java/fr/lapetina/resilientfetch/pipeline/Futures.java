package fr.lapetina.resilientfetch.pipeline;

import fr.lapetina.resilientfetch.domain.model.FetchRequest;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Small helpers around {@link CompletableFuture} shared by the policies.
 */
public final class Futures {

    private Futures() {
    }

    /**
     * Calls the invocation, turning a synchronous throw or a null future into a failed future.
     */
    public static <R> CompletableFuture<R> invoke(Invocation<R> invocation, FetchRequest request) {
        try {
            CompletableFuture<R> future = invocation.proceed(request);
            if (future == null) {
                return CompletableFuture.failedFuture(
                        new IllegalStateException("Invocation returned no future for " + request));
            }
            return future;
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    /**
     * Strips the completion wrappers added by dependent stages.
     */
    public static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
