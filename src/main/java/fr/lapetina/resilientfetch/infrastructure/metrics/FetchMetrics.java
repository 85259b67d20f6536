package fr.lapetina.resilientfetch.infrastructure.metrics;

import fr.lapetina.resilientfetch.domain.error.ErrorKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Metrics;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Micrometer meters of the fetch pipeline.
 *
 * Provides:
 * - Attempt counter per method and host
 * - Latency timer per method and outcome
 * - Error counters by kind
 * - Rate-limit denial counter
 * - Circuit breaker state gauge
 */
public final class FetchMetrics implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(FetchMetrics.class);

    public static final String DEFAULT_PREFIX = "resilient_fetch";

    private final MeterRegistry registry;
    private final String prefix;

    // Cache for dynamic meters
    private final ConcurrentHashMap<String, Counter> attemptCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> latencyTimers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<ErrorKind, Counter> errorCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> denialCounters = new ConcurrentHashMap<>();

    public FetchMetrics(MeterRegistry registry, String prefix) {
        this.registry = Objects.requireNonNull(registry, "Registry is required");
        this.prefix = Objects.requireNonNull(prefix, "Prefix is required");
    }

    /**
     * Meters registered in Micrometer's global composite registry.
     */
    public static FetchMetrics global() {
        return new FetchMetrics(Metrics.globalRegistry, DEFAULT_PREFIX);
    }

    /**
     * Meters that go nowhere.
     */
    public static FetchMetrics noop() {
        return new FetchMetrics(new CompositeMeterRegistry(), DEFAULT_PREFIX);
    }

    /**
     * Dedicated Prometheus registry with JVM and system metrics, exposed through {@link #scrape()}.
     */
    public static FetchMetrics prometheus(String prefix) {
        PrometheusMeterRegistry registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        new JvmMemoryMetrics().bindTo(registry);
        new JvmGcMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);
        new ProcessorMetrics().bindTo(registry);

        log.info("Prometheus fetch metrics initialized with prefix: {}", prefix);
        return new FetchMetrics(registry, prefix);
    }

    /**
     * Counts one raw call sent to the transport.
     */
    public void incrementAttemptCount(String method, String host) {
        String key = method + ":" + host;
        attemptCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_attempts_total")
                        .description("Raw calls sent to the transport")
                        .tag("method", method)
                        .tag("host", host)
                        .register(registry)
        ).increment();
    }

    /**
     * Records the latency of one logical request, retries included.
     */
    public void recordLatency(String method, String outcome, Duration latency) {
        String key = method + ":" + outcome;
        latencyTimers.computeIfAbsent(key, k ->
                Timer.builder(prefix + "_request_latency")
                        .description("Logical request latency")
                        .tag("method", method)
                        .tag("outcome", outcome)
                        .publishPercentiles(0.5, 0.9, 0.95, 0.99)
                        .register(registry)
        ).record(latency);
    }

    public void incrementErrorCount(ErrorKind kind) {
        errorCounters.computeIfAbsent(kind, k ->
                Counter.builder(prefix + "_errors_total")
                        .description("Terminal failures by kind")
                        .tag("kind", kind.name())
                        .register(registry)
        ).increment();
    }

    public void incrementRateLimitDenied(String limiterName) {
        denialCounters.computeIfAbsent(limiterName, k ->
                Counter.builder(prefix + "_rate_limit_denied_total")
                        .description("Admissions denied by the rate limiter")
                        .tag("limiter", limiterName)
                        .register(registry)
        ).increment();
    }

    /**
     * Registers a gauge for a circuit breaker state (0=CLOSED, 1=HALF_OPEN, 2=OPEN).
     */
    public void registerBreakerState(String breakerName, Supplier<Number> stateValue) {
        Gauge.builder(prefix + "_circuit_breaker_state", stateValue, s -> s.get().doubleValue())
                .description("Circuit breaker state (0=CLOSED, 1=HALF_OPEN, 2=OPEN)")
                .tag("breaker", breakerName)
                .strongReference(true)
                .register(registry);
    }

    /**
     * Returns the Prometheus scrape output.
     *
     * @throws IllegalStateException if the meters are not backed by a Prometheus registry
     */
    public String scrape() {
        if (registry instanceof PrometheusMeterRegistry prometheus) {
            return prometheus.scrape();
        }
        throw new IllegalStateException("Metrics are not backed by a Prometheus registry: "
                + registry.getClass().getSimpleName());
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    public String getPrefix() {
        return prefix;
    }

    @Override
    public void close() {
        if (registry != Metrics.globalRegistry) {
            registry.close();
        }
    }
}
