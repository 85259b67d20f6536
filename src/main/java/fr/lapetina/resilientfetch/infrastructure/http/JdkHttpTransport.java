package fr.lapetina.resilientfetch.infrastructure.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.resilientfetch.domain.error.TransportException;
import fr.lapetina.resilientfetch.domain.model.FetchRequest;
import fr.lapetina.resilientfetch.domain.model.RawResponse;
import fr.lapetina.resilientfetch.domain.model.RequestInit;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Raw transport over java.net.http.HttpClient, non-blocking.
 *
 * Redirect handling is a client setting in java.net.http, so two clients are kept:
 * one following redirects and one returning them as-is.
 */
public final class JdkHttpTransport implements RawTransport {

    private static final String JSON_MEDIA_TYPE = "application/json";

    private final HttpClient followingClient;
    private final HttpClient nonFollowingClient;
    private final ObjectMapper objectMapper;

    public JdkHttpTransport(Duration connectTimeout, ObjectMapper objectMapper) {
        Objects.requireNonNull(connectTimeout, "Connect timeout is required");
        this.objectMapper = Objects.requireNonNull(objectMapper, "ObjectMapper is required");

        this.followingClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        this.nonFollowingClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NEVER)
                .build();
    }

    public JdkHttpTransport() {
        this(Duration.ofSeconds(10), JsonMapper.shared());
    }

    @Override
    public CompletableFuture<RawResponse> send(FetchRequest request) {
        RequestInit init = request.init();
        Optional<CompletableFuture<?>> abortSignal = init.abortSignal();
        if (abortSignal.isPresent() && abortSignal.get().isDone()) {
            return CompletableFuture.failedFuture(
                    new TransportException("Request aborted before sending: " + request, null));
        }

        HttpRequest httpRequest;
        try {
            httpRequest = buildHttpRequest(request);
        } catch (IllegalArgumentException e) {
            return CompletableFuture.failedFuture(
                    new TransportException("Invalid request: " + request + ": " + e.getMessage(), e));
        }
        HttpClient client = init.followRedirects() ? followingClient : nonFollowingClient;

        CompletableFuture<HttpResponse<byte[]>> sent =
                client.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofByteArray());
        abortSignal.ifPresent(signal -> watchAbort(signal, sent));

        CompletableFuture<RawResponse> result = new CompletableFuture<>();
        sent.whenComplete((response, failure) -> {
            if (failure == null) {
                result.complete(toRawResponse(response));
            } else {
                result.completeExceptionally(classify(request, failure));
            }
        });
        return result;
    }

    /**
     * Cancels {@code sent} when the signal fires. Once {@code sent} is done the stage left on the
     * signal is cancelled and drops its reference, so a long-lived signal keeps nothing alive.
     */
    private static void watchAbort(CompletableFuture<?> signal, CompletableFuture<?> sent) {
        AtomicReference<CompletableFuture<?>> inFlight = new AtomicReference<>(sent);
        CompletableFuture<?> watcher = signal.whenComplete((value, failure) -> {
            CompletableFuture<?> pending = inFlight.getAndSet(null);
            if (pending != null) {
                pending.cancel(true);
            }
        });
        sent.whenComplete((response, failure) -> {
            inFlight.set(null);
            watcher.cancel(false);
        });
    }

    private HttpRequest buildHttpRequest(FetchRequest request) {
        RequestInit init = request.init();
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(request.uri())
                .method(init.method(), bodyPublisher(init));
        init.headers().forEach(builder::header);
        return builder.build();
    }

    private HttpRequest.BodyPublisher bodyPublisher(RequestInit init) {
        Optional<Object> body = init.body();
        if (body.isEmpty()) {
            return HttpRequest.BodyPublishers.noBody();
        }

        Object value = body.get();
        if (value instanceof byte[] bytes) {
            return HttpRequest.BodyPublishers.ofByteArray(bytes);
        }
        if (value instanceof String text) {
            return HttpRequest.BodyPublishers.ofString(text, StandardCharsets.UTF_8);
        }

        boolean json = init.header("Content-Type")
                .map(contentType -> contentType.toLowerCase(Locale.ROOT).contains(JSON_MEDIA_TYPE))
                .orElse(false);
        if (!json) {
            throw new IllegalArgumentException("Body of type " + value.getClass().getName()
                    + " needs a Content-Type of " + JSON_MEDIA_TYPE);
        }
        try {
            return HttpRequest.BodyPublishers.ofByteArray(objectMapper.writeValueAsBytes(value));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize request body to JSON", e);
        }
    }

    private static RawResponse toRawResponse(HttpResponse<byte[]> response) {
        return new RawResponse(
                response.statusCode(),
                null,
                response.headers(),
                response.uri(),
                response.previousResponse().isPresent(),
                response.body());
    }

    private static Throwable classify(FetchRequest request, Throwable failure) {
        Throwable cause = failure;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }

        if (cause instanceof CancellationException) {
            return new TransportException("Request aborted: " + request, cause);
        }
        if (cause instanceof IOException) {
            return new TransportException("Transport failure: " + request + ": "
                    + cause.getClass().getSimpleName() + ": " + cause.getMessage(), cause);
        }
        return cause;
    }
}
