package fr.lapetina.resilientfetch.infrastructure.http;

import fr.lapetina.resilientfetch.domain.model.FetchRequest;
import fr.lapetina.resilientfetch.domain.model.RawResponse;

import java.util.concurrent.CompletableFuture;

/**
 * The raw network call. Implementations buffer the whole body, report network
 * failures as {@link fr.lapetina.resilientfetch.domain.error.TransportException}, and
 * honour the request's abort signal when they can.
 */
@FunctionalInterface
public interface RawTransport {

    CompletableFuture<RawResponse> send(FetchRequest request);
}
