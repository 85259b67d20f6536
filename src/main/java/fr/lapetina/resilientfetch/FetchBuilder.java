package fr.lapetina.resilientfetch;

import com.fasterxml.jackson.databind.JsonNode;
import fr.lapetina.resilientfetch.domain.model.RequestInit;
import fr.lapetina.resilientfetch.domain.schema.ResponseSchema;
import fr.lapetina.resilientfetch.infrastructure.config.FetchConfig;
import fr.lapetina.resilientfetch.infrastructure.http.CircuitBreakerOptions;
import fr.lapetina.resilientfetch.infrastructure.http.RateLimitOptions;
import fr.lapetina.resilientfetch.infrastructure.http.RawTransport;
import fr.lapetina.resilientfetch.infrastructure.metrics.FetchMetrics;
import fr.lapetina.resilientfetch.pipeline.ContainerOptions;
import fr.lapetina.resilientfetch.pipeline.RetryOptions;
import fr.lapetina.resilientfetch.pipeline.TimeoutOptions;
import fr.lapetina.resilientfetch.pipeline.hook.FetchHooks;
import io.micrometer.core.instrument.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

/**
 * Immutable, copy-on-set builder of {@link ResilientFetch} clients. Every {@code with*}
 * method returns a new builder, so a partially configured builder can be shared and
 * specialized from several threads.
 *
 * <p>Usage:
 * <pre>{@code
 * ResilientFetch<User> users = FetchBuilder.create()
 *         .withSchema(ResponseSchema.of(User.class))
 *         .withTimeout(Duration.ofSeconds(5))
 *         .withRateLimit(10, Duration.ofSeconds(1))
 *         .withCircuitBreaker(CircuitBreakerOptions.defaults())
 *         .build();
 *
 * User user = users.fetchSync("https://api.example.com/users/1").data().orElseThrow();
 * }</pre>
 *
 * @param <T> type of the validated response data
 */
public final class FetchBuilder<T> {

    private final RequestInit init;
    private final TimeoutOptions timeout;
    private final RetryOptions retry;
    private final ContainerOptions container;
    private final Logger logger;
    private final ResponseSchema<T> schema;
    private final FetchHooks<T> hooks;
    private final RawTransport transport;
    private final FetchMetrics metrics;
    private final Clock clock;

    private FetchBuilder(
            RequestInit init,
            TimeoutOptions timeout,
            RetryOptions retry,
            ContainerOptions container,
            Logger logger,
            ResponseSchema<T> schema,
            FetchHooks<T> hooks,
            RawTransport transport,
            FetchMetrics metrics,
            Clock clock
    ) {
        this.init = init;
        this.timeout = timeout;
        this.retry = retry;
        this.container = container;
        this.logger = logger;
        this.schema = schema;
        this.hooks = hooks;
        this.transport = transport;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Builder with the default policies: 10 s timeout, 3 attempts with jittered backoff,
     * no rate limit, no circuit breaker, JSON data as a Jackson tree.
     */
    public static FetchBuilder<JsonNode> create() {
        return new FetchBuilder<>(
                RequestInit.empty(),
                TimeoutOptions.defaults(),
                RetryOptions.defaults(),
                ContainerOptions.none(),
                LoggerFactory.getLogger(ResilientFetch.class),
                ResponseSchema.json(),
                FetchHooks.<JsonNode>none(),
                null,
                null,
                Clock.systemUTC());
    }

    /**
     * Base init merged under every call's init; call values win.
     */
    public FetchBuilder<T> withInit(RequestInit newInit) {
        Objects.requireNonNull(newInit, "Init is required");
        return new FetchBuilder<>(newInit, timeout, retry, container, logger, schema, hooks, transport, metrics, clock);
    }

    public FetchBuilder<T> withTimeout(Duration newTimeout) {
        return withTimeout(TimeoutOptions.of(newTimeout));
    }

    public FetchBuilder<T> withTimeout(TimeoutOptions newTimeout) {
        Objects.requireNonNull(newTimeout, "Timeout options are required");
        return new FetchBuilder<>(init, newTimeout, retry, container, logger, schema, hooks, transport, metrics, clock);
    }

    public FetchBuilder<T> withoutTimeout() {
        return withTimeout(TimeoutOptions.disabled());
    }

    public FetchBuilder<T> withRetry(RetryOptions newRetry) {
        Objects.requireNonNull(newRetry, "Retry options are required");
        return new FetchBuilder<>(init, timeout, newRetry, container, logger, schema, hooks, transport, metrics, clock);
    }

    public FetchBuilder<T> withoutRetry() {
        return withRetry(RetryOptions.disabled());
    }

    /**
     * Client-wide limit, with the default admission retry (waits out the window once).
     */
    public FetchBuilder<T> withRateLimit(int limitForPeriod, Duration limitPeriod) {
        return withRateLimit(RateLimitOptions.of(limitForPeriod, limitPeriod), RetryOptions.rateLimitDefaults());
    }

    public FetchBuilder<T> withRateLimit(RateLimitOptions rateLimit, RetryOptions admissionRetry) {
        Objects.requireNonNull(rateLimit, "Rate limit options are required");
        Objects.requireNonNull(admissionRetry, "Admission retry options are required");
        return new FetchBuilder<>(init, timeout, retry, container.withRateLimit(rateLimit, admissionRetry),
                logger, schema, hooks, transport, metrics, clock);
    }

    public FetchBuilder<T> withCircuitBreaker(CircuitBreakerOptions circuitBreaker) {
        Objects.requireNonNull(circuitBreaker, "Circuit breaker options are required");
        return new FetchBuilder<>(init, timeout, retry, container.withCircuitBreaker(circuitBreaker),
                logger, schema, hooks, transport, metrics, clock);
    }

    public FetchBuilder<T> withLogger(Logger newLogger) {
        Objects.requireNonNull(newLogger, "Logger is required");
        return new FetchBuilder<>(init, timeout, retry, container, newLogger, schema, hooks, transport, metrics, clock);
    }

    /**
     * Validates JSON bodies against {@code newSchema}, changing the data type.
     * A post-response success hook is typed by the data and is therefore dropped.
     */
    public <U> FetchBuilder<U> withSchema(ResponseSchema<U> newSchema) {
        Objects.requireNonNull(newSchema, "Schema is required");
        return new FetchBuilder<>(init, timeout, retry, container, logger, newSchema, hooks.<U>retyped(),
                transport, metrics, clock);
    }

    public FetchBuilder<T> withHooks(FetchHooks<T> newHooks) {
        Objects.requireNonNull(newHooks, "Hooks are required");
        return new FetchBuilder<>(init, timeout, retry, container, logger, schema, newHooks, transport, metrics, clock);
    }

    public FetchBuilder<T> withTransport(RawTransport newTransport) {
        Objects.requireNonNull(newTransport, "Transport is required");
        return new FetchBuilder<>(init, timeout, retry, container, logger, schema, hooks, newTransport, metrics, clock);
    }

    public FetchBuilder<T> withMetrics(FetchMetrics newMetrics) {
        Objects.requireNonNull(newMetrics, "Metrics are required");
        return new FetchBuilder<>(init, timeout, retry, container, logger, schema, hooks, transport, newMetrics, clock);
    }

    public FetchBuilder<T> withClock(Clock newClock) {
        Objects.requireNonNull(newClock, "Clock is required");
        return new FetchBuilder<>(init, timeout, retry, container, logger, schema, hooks, transport, metrics, newClock);
    }

    /**
     * Applies a loaded configuration on top of this builder. Rate limiting and circuit
     * breaking are only switched on when their sections are enabled. Retry predicates
     * already set on this builder are kept.
     */
    public FetchBuilder<T> fromConfig(FetchConfig config) {
        Objects.requireNonNull(config, "Config is required");

        FetchBuilder<T> configured = this
                .withInit(init.merge(config.getInit().toRequestInit()))
                .withTimeout(config.getTimeout().toOptions())
                .withRetry(config.getRetry().toOptions(retry.isEnabled() ? retry : RetryOptions.defaults()));

        if (config.getRateLimit().isEnabled()) {
            configured = configured.withRateLimit(
                    config.getRateLimit().toOptions(),
                    config.getRateLimit().toRetryOptions());
        }
        if (config.getCircuitBreaker().isEnabled()) {
            configured = configured.withCircuitBreaker(config.getCircuitBreaker().toOptions());
        }

        FetchConfig.MetricsConfig metricsConfig = config.getMetrics();
        FetchMetrics configuredMetrics;
        if (!metricsConfig.isEnabled()) {
            configuredMetrics = FetchMetrics.noop();
        } else if (metricsConfig.isPrometheus()) {
            configuredMetrics = FetchMetrics.prometheus(metricsConfig.getPrefix());
        } else {
            configuredMetrics = new FetchMetrics(Metrics.globalRegistry, metricsConfig.getPrefix());
        }
        return configured.withMetrics(configuredMetrics);
    }

    public ResilientFetch<T> build() {
        return new ResilientFetch<>(this);
    }

    RequestInit init() { return init; }

    TimeoutOptions timeout() { return timeout; }

    RetryOptions retry() { return retry; }

    ContainerOptions container() { return container; }

    Logger logger() { return logger; }

    ResponseSchema<T> schema() { return schema; }

    FetchHooks<T> hooks() { return hooks; }

    RawTransport transport() { return transport; }

    FetchMetrics metrics() { return metrics; }

    Clock clock() { return clock; }
}
