package fr.lapetina.resilientfetch.infrastructure.metrics;

import fr.lapetina.resilientfetch.domain.error.ErrorKind;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FetchMetricsTest {

    private SimpleMeterRegistry registry;
    private FetchMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new FetchMetrics(registry, "test");
    }

    @Test
    @DisplayName("should count attempts per method and host")
    void shouldCountAttempts() {
        metrics.incrementAttemptCount("GET", "api.example.com");
        metrics.incrementAttemptCount("GET", "api.example.com");
        metrics.incrementAttemptCount("POST", "api.example.com");

        assertThat(registry.get("test_attempts_total").tag("method", "GET").counter().count()).isEqualTo(2.0);
        assertThat(registry.get("test_attempts_total").tag("method", "POST").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should record latency by outcome")
    void shouldRecordLatency() {
        metrics.recordLatency("GET", "success", Duration.ofMillis(120));

        assertThat(registry.get("test_request_latency").tag("outcome", "success").timer()
                .totalTime(TimeUnit.MILLISECONDS)).isEqualTo(120.0);
    }

    @Test
    @DisplayName("should count errors by kind and rate limit denials")
    void shouldCountErrorsAndDenials() {
        metrics.incrementErrorCount(ErrorKind.TIMEOUT);
        metrics.incrementRateLimitDenied("limiter");

        assertThat(registry.get("test_errors_total").tag("kind", "TIMEOUT").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("test_rate_limit_denied_total").tag("limiter", "limiter").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    @DisplayName("should expose the breaker state as a gauge")
    void shouldExposeBreakerState() {
        AtomicInteger state = new AtomicInteger();
        metrics.registerBreakerState("breaker", state::get);
        state.set(2);

        assertThat(registry.get("test_circuit_breaker_state").tag("breaker", "breaker").gauge().value())
                .isEqualTo(2.0);
    }

    @Test
    @DisplayName("should only scrape a Prometheus registry")
    void shouldScrapePrometheusOnly() {
        assertThatThrownBy(metrics::scrape).isInstanceOf(IllegalStateException.class);

        try (FetchMetrics prometheus = FetchMetrics.prometheus("scrape_test")) {
            prometheus.incrementErrorCount(ErrorKind.TRANSPORT);
            assertThat(prometheus.scrape()).contains("scrape_test_errors_total");
        }
    }
}
