package fr.lapetina.resilientfetch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import fr.lapetina.resilientfetch.domain.error.BreakerOpenException;
import fr.lapetina.resilientfetch.domain.error.FetchException;
import fr.lapetina.resilientfetch.domain.error.FetchTimeoutException;
import fr.lapetina.resilientfetch.domain.error.HttpResponseException;
import fr.lapetina.resilientfetch.domain.error.RateLimitException;
import fr.lapetina.resilientfetch.domain.error.RetryException;
import fr.lapetina.resilientfetch.domain.error.SchemaValidationException;
import fr.lapetina.resilientfetch.domain.model.FetchRequest;
import fr.lapetina.resilientfetch.domain.model.RequestInit;
import fr.lapetina.resilientfetch.domain.model.ResponseEnvelope;
import fr.lapetina.resilientfetch.domain.schema.ResponseSchema;
import fr.lapetina.resilientfetch.infrastructure.http.CircuitBreaker;
import fr.lapetina.resilientfetch.infrastructure.http.JdkHttpTransport;
import fr.lapetina.resilientfetch.infrastructure.http.JsonMapper;
import fr.lapetina.resilientfetch.infrastructure.http.RateLimiter;
import fr.lapetina.resilientfetch.infrastructure.http.RawTransport;
import fr.lapetina.resilientfetch.infrastructure.http.ResponseMaterializer;
import fr.lapetina.resilientfetch.infrastructure.metrics.FetchMetrics;
import fr.lapetina.resilientfetch.pipeline.BackoffCalculator;
import fr.lapetina.resilientfetch.pipeline.CircuitBreakerPolicy;
import fr.lapetina.resilientfetch.pipeline.ContainerOptions;
import fr.lapetina.resilientfetch.pipeline.Futures;
import fr.lapetina.resilientfetch.pipeline.Policy;
import fr.lapetina.resilientfetch.pipeline.PolicyChain;
import fr.lapetina.resilientfetch.pipeline.RateLimitPolicy;
import fr.lapetina.resilientfetch.pipeline.RequestOptions;
import fr.lapetina.resilientfetch.pipeline.RetryOptions;
import fr.lapetina.resilientfetch.pipeline.RetryPolicy;
import fr.lapetina.resilientfetch.pipeline.TimeoutOptions;
import fr.lapetina.resilientfetch.pipeline.TimeoutPolicy;
import fr.lapetina.resilientfetch.pipeline.hook.HookRunner;
import org.slf4j.Logger;
import org.slf4j.MDC;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * A built fetch client: runs each call through the configured policies and returns a
 * materialized, validated response or a classified {@link FetchException}.
 *
 * <p>The client owns its circuit breaker and rate limiter; every call through it shares
 * them. Instances are thread-safe.
 *
 * @param <T> type of the validated response data
 */
public final class ResilientFetch<T> {

    /** MDC key whose value, when set, is sent as the correlation id. */
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String CORRELATION_ID_HEADER = "X-Correlation-Id";

    private final RequestInit baseInit;
    private final RequestOptions<T> baseOptions;
    private final Logger log;
    private final RawTransport transport;
    private final ResponseMaterializer materializer;
    private final FetchMetrics metrics;
    private final Clock clock;
    private final BackoffCalculator backoff;

    private final RateLimiter rateLimiter;
    private final CircuitBreaker circuitBreaker;
    private final PolicyChain containerChain;

    ResilientFetch(FetchBuilder<T> builder) {
        this.baseInit = builder.init();
        this.baseOptions = new RequestOptions<>(builder.timeout(), builder.retry(), builder.schema(), builder.hooks());
        this.log = builder.logger();
        this.transport = builder.transport() != null ? builder.transport() : new JdkHttpTransport();
        this.materializer = new ResponseMaterializer();
        this.metrics = builder.metrics() != null ? builder.metrics() : FetchMetrics.global();
        this.clock = builder.clock();
        this.backoff = new BackoffCalculator();

        ContainerOptions container = builder.container();
        this.rateLimiter = container.rateLimitOptions()
                .map(options -> new RateLimiter(options, clock))
                .orElse(null);
        this.circuitBreaker = container.circuitBreakerOptions()
                .map(options -> new CircuitBreaker(options, clock))
                .orElse(null);
        this.containerChain = buildContainerChain(container);

        if (circuitBreaker != null) {
            metrics.registerBreakerState(circuitBreaker.getName(), () -> switch (circuitBreaker.getState()) {
                case CLOSED -> 0;
                case HALF_OPEN -> 1;
                case OPEN -> 2;
            });
        }

        log.debug("Fetch client built: containerPolicies={}, timeout={}, retry={}",
                containerChain, builder.timeout(), builder.retry());
    }

    /**
     * Default client: see {@link FetchBuilder#create()}.
     */
    public static ResilientFetch<JsonNode> defaults() {
        return DefaultHolder.INSTANCE;
    }

    public CompletableFuture<ResponseEnvelope<T>> fetch(String url) {
        return fetch(url, RequestInit.empty(), RequestOptions.empty());
    }

    public CompletableFuture<ResponseEnvelope<T>> fetch(String url, RequestInit init) {
        return fetch(url, init, RequestOptions.empty());
    }

    /**
     * Issues one logical request.
     *
     * @param url target URL
     * @param init call init, merged over the builder's base init
     * @param options call scope overrides; each set field replaces the builder's
     * @return future completed with the envelope, or failed with a {@link FetchException}
     *         (or whatever a post-response error hook replaced it with)
     */
    public CompletableFuture<ResponseEnvelope<T>> fetch(String url, RequestInit init, RequestOptions<T> options) {
        long startNanos = System.nanoTime();
        RequestOptions<T> resolved = baseOptions.mergedWith(options);
        HookRunner<T> hooks = new HookRunner<>(resolved.hooks());

        FetchRequest request;
        try {
            request = hooks.beforeRequest(new FetchRequest(url, withCorrelationId(baseInit.merge(init))));
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }

        ResponseSchema<T> schema = resolved.schema();
        PolicyChain chain = containerChain.then(buildCallChain(resolved));

        CompletableFuture<ResponseEnvelope<T>> result = new CompletableFuture<>();
        chain.<ResponseEnvelope<T>>execute(request, attempt -> sendOnce(attempt, schema)).whenComplete((envelope, failure) -> {
            Duration latency = Duration.ofNanos(System.nanoTime() - startNanos);
            if (failure == null) {
                metrics.recordLatency(request.method(), "success", latency);
                try {
                    result.complete(hooks.afterSuccess(request, envelope));
                } catch (RuntimeException hookFailure) {
                    result.completeExceptionally(hookFailure);
                }
                return;
            }

            Throwable error = Futures.unwrap(failure);
            if (!(error instanceof FetchException fetchError)) {
                metrics.recordLatency(request.method(), "unclassified", latency);
                log.error("Request failed unexpectedly: method={}, url={}, errorType={}, error={}",
                        request.method(), request.url(), error.getClass().getSimpleName(), error.getMessage(), error);
                result.completeExceptionally(error);
                return;
            }

            metrics.recordLatency(request.method(), fetchError.kind().name().toLowerCase(Locale.ROOT), latency);
            metrics.incrementErrorCount(fetchError.kind());
            logFailure(request, fetchError);
            try {
                result.completeExceptionally(hooks.afterError(request, fetchError));
            } catch (RuntimeException hookFailure) {
                result.completeExceptionally(hookFailure);
            }
        });
        return result;
    }

    public ResponseEnvelope<T> fetchSync(String url) {
        return fetchSync(url, RequestInit.empty(), RequestOptions.empty());
    }

    public ResponseEnvelope<T> fetchSync(String url, RequestInit init) {
        return fetchSync(url, init, RequestOptions.empty());
    }

    /**
     * Blocking variant of {@link #fetch(String, RequestInit, RequestOptions)}.
     *
     * @throws FetchException the classified failure, unwrapped from the future
     */
    public ResponseEnvelope<T> fetchSync(String url, RequestInit init, RequestOptions<T> options) {
        try {
            return fetch(url, init, options).join();
        } catch (CompletionException e) {
            Throwable cause = Futures.unwrap(e);
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw e;
        }
    }

    public Optional<CircuitBreaker> getCircuitBreaker() {
        return Optional.ofNullable(circuitBreaker);
    }

    public Optional<RateLimiter> getRateLimiter() {
        return Optional.ofNullable(rateLimiter);
    }

    public FetchMetrics getMetrics() {
        return metrics;
    }

    private PolicyChain buildContainerChain(ContainerOptions container) {
        List<Policy> policies = new ArrayList<>();
        if (rateLimiter != null) {
            RetryOptions admissionRetry = container.rateLimitRetry();
            if (admissionRetry.isEnabled()) {
                policies.add(new RetryPolicy(admissionRetry, false, backoff, clock));
            }
            policies.add(new RateLimitPolicy(rateLimiter, metrics));
        }
        if (circuitBreaker != null) {
            policies.add(new CircuitBreakerPolicy(circuitBreaker));
        }
        return new PolicyChain(policies);
    }

    private PolicyChain buildCallChain(RequestOptions<T> options) {
        List<Policy> policies = new ArrayList<>();
        RetryOptions retry = options.retry();
        if (retry.isEnabled()) {
            policies.add(new RetryPolicy(retry, true, backoff, clock));
        }
        TimeoutOptions timeout = options.timeout();
        if (timeout.isEnabled()) {
            policies.add(new TimeoutPolicy(timeout.name(), timeout.timeout()));
            if (timeout.retry().isEnabled()) {
                policies.add(new RetryPolicy(timeout.retry(), false, backoff, clock));
            }
        }
        return new PolicyChain(policies);
    }

    private CompletableFuture<ResponseEnvelope<T>> sendOnce(FetchRequest request, ResponseSchema<T> schema) {
        URI uri = request.uri();
        if (log.isDebugEnabled()) {
            log.debug("Sending request: method={}, host={}, path={}, query={}, headers={}, body={}",
                    request.method(), uri.getHost(), uri.getPath(), uri.getQuery(),
                    request.init().headers(), describeBody(request.init()));
        }
        metrics.incrementAttemptCount(request.method(), String.valueOf(uri.getHost()));
        return transport.send(request).thenApply(raw -> materializer.materialize(raw, schema));
    }

    private RequestInit withCorrelationId(RequestInit init) {
        if (init.header(CORRELATION_ID_HEADER).isPresent()) {
            return init;
        }
        String correlationId = MDC.get(CORRELATION_ID_MDC_KEY);
        if (correlationId == null || correlationId.isBlank()) {
            correlationId = UUID.randomUUID().toString();
        }
        return init.toBuilder().header(CORRELATION_ID_HEADER, correlationId).build();
    }

    private void logFailure(FetchRequest request, FetchException error) {
        URI uri = request.uri();
        String method = request.method();
        String host = uri.getHost();
        String path = uri.getPath();
        String query = uri.getQuery();

        switch (error.kind()) {
            case HTTP_RESPONSE -> {
                ResponseEnvelope<JsonNode> response = ((HttpResponseException) error).getResponse();
                log.error("Request failed: method={}, host={}, path={}, query={}, status={}, statusText={}, "
                                + "responseHeaders={}, responseBody={}, error={}",
                        method, host, path, query, response.status(), response.statusText(),
                        response.headers().map(), response.dataString(), error.getMessage());
            }
            case RETRY_EXHAUSTED -> {
                RetryException retry = (RetryException) error;
                ResponseEnvelope<JsonNode> response = retry.getResponse();
                log.error("Request failed after retries: method={}, host={}, path={}, query={}, attempts={}, "
                                + "status={}, statusText={}, responseHeaders={}, responseBody={}",
                        method, host, path, query, retry.getAttempts(), response.status(), response.statusText(),
                        response.headers().map(), response.dataString());
            }
            case TIMEOUT -> log.error("Request timed out: method={}, host={}, path={}, query={}, timeoutMs={}",
                    method, host, path, query, ((FetchTimeoutException) error).getTimeout().toMillis());
            case RATE_LIMITED -> {
                RateLimitException rateLimit = (RateLimitException) error;
                log.error("Request rate limited: method={}, host={}, path={}, query={}, limiter={}, remainingMs={}",
                        method, host, path, query, rateLimit.getLimiterName(),
                        rateLimit.getRemainingTimeInWindow().toMillis());
            }
            case CIRCUIT_OPEN -> log.error("Request rejected by circuit breaker: method={}, host={}, path={}, "
                            + "query={}, breaker={}",
                    method, host, path, query, ((BreakerOpenException) error).getBreakerName());
            case SCHEMA_VALIDATION -> log.error("Response failed schema validation: method={}, host={}, path={}, "
                            + "query={}, issues={}",
                    method, host, path, query, ((SchemaValidationException) error).getIssues());
            case TRANSPORT -> log.error("Request transport failure: method={}, host={}, path={}, query={}, error={}",
                    method, host, path, query, error.getMessage());
        }
    }

    private static String describeBody(RequestInit init) {
        return init.body().map(body -> {
            if (body instanceof String text) {
                return text;
            }
            if (body instanceof byte[] bytes) {
                return "<" + bytes.length + " bytes>";
            }
            try {
                return JsonMapper.shared().writeValueAsString(body);
            } catch (JsonProcessingException e) {
                return String.valueOf(body);
            }
        }).orElse(null);
    }

    private static final class DefaultHolder {
        private static final ResilientFetch<JsonNode> INSTANCE = FetchBuilder.create().build();
    }
}
