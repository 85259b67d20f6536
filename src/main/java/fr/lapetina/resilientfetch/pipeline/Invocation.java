package fr.lapetina.resilientfetch.pipeline;

import fr.lapetina.resilientfetch.domain.model.FetchRequest;

import java.util.concurrent.CompletableFuture;

/**
 * The rest of the chain as seen from one policy: the next policy, or the raw call itself.
 *
 * @param <R> result type of the call
 */
@FunctionalInterface
public interface Invocation<R> {

    CompletableFuture<R> proceed(FetchRequest request);
}
