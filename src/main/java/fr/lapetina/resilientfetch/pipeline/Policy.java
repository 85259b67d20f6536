package fr.lapetina.resilientfetch.pipeline;

import fr.lapetina.resilientfetch.domain.model.FetchRequest;

import java.util.concurrent.CompletableFuture;

/**
 * One reliability concern wrapped around the rest of the chain.
 *
 * A policy may pass the request through, delay it, reject it without calling {@code next},
 * or call {@code next} several times. It classifies and propagates failures, never swallows them.
 */
public interface Policy {

    <R> CompletableFuture<R> apply(FetchRequest request, Invocation<R> next);

    String name();
}
