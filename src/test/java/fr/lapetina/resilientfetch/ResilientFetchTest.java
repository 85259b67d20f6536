package fr.lapetina.resilientfetch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.resilientfetch.domain.error.BreakerOpenException;
import fr.lapetina.resilientfetch.domain.error.FetchTimeoutException;
import fr.lapetina.resilientfetch.domain.error.HttpResponseException;
import fr.lapetina.resilientfetch.domain.error.RateLimitException;
import fr.lapetina.resilientfetch.domain.error.RetryException;
import fr.lapetina.resilientfetch.domain.error.SchemaValidationException;
import fr.lapetina.resilientfetch.domain.error.TransportException;
import fr.lapetina.resilientfetch.domain.model.RequestInit;
import fr.lapetina.resilientfetch.domain.model.ResponseEnvelope;
import fr.lapetina.resilientfetch.domain.schema.ResponseSchema;
import fr.lapetina.resilientfetch.infrastructure.config.ConfigLoader;
import fr.lapetina.resilientfetch.infrastructure.http.CircuitBreaker;
import fr.lapetina.resilientfetch.infrastructure.http.CircuitBreakerOptions;
import fr.lapetina.resilientfetch.infrastructure.http.RateLimitOptions;
import fr.lapetina.resilientfetch.infrastructure.metrics.FetchMetrics;
import fr.lapetina.resilientfetch.integration.MutableClock;
import fr.lapetina.resilientfetch.integration.StubTransport;
import fr.lapetina.resilientfetch.pipeline.RequestOptions;
import fr.lapetina.resilientfetch.pipeline.RetryMode;
import fr.lapetina.resilientfetch.pipeline.RetryOptions;
import fr.lapetina.resilientfetch.pipeline.hook.FetchHooks;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResilientFetchTest {

    private static final String URL = "https://api.example.com/test";

    public record User(String id, String name, int age) {
    }

    private StubTransport transport;
    private SimpleMeterRegistry registry;

    @BeforeEach
    void setUp() {
        transport = new StubTransport();
        registry = new SimpleMeterRegistry();
    }

    private FetchBuilder<JsonNode> builder() {
        return FetchBuilder.create()
                .withTransport(transport)
                .withMetrics(new FetchMetrics(registry, "test"))
                .withRetry(RetryOptions.builder()
                        .initialInterval(Duration.ofMillis(10))
                        .mode(RetryMode.CONSTANT)
                        .build());
    }

    @Nested
    class Materialization {

        @Test
        @DisplayName("should validate the body against the schema")
        void shouldReturnValidatedData() {
            transport.respond(StubTransport.json(200, "{\"id\":\"1\",\"name\":\"Test User\",\"age\":25}"));
            ResilientFetch<User> client = builder().withSchema(ResponseSchema.of(User.class)).build();

            ResponseEnvelope<User> response = client.fetchSync(URL);

            assertThat(response.ok()).isTrue();
            assertThat(response.data()).contains(new User("1", "Test User", 25));
            assertThat(transport.lastRequest().method()).isEqualTo("GET");
        }

        @Test
        @DisplayName("should return the JSON tree by default")
        void shouldReturnJsonTree() throws Exception {
            transport.respond(StubTransport.json(200, "{\"id\":\"1\",\"name\":\"Test User\",\"age\":25}"));

            ResponseEnvelope<JsonNode> response = builder().build().fetch(URL).get(5, TimeUnit.SECONDS);

            assertThat(response.data()).contains(new ObjectMapper()
                    .readTree("{\"id\":\"1\",\"name\":\"Test User\",\"age\":25}"));
        }

        @Test
        @DisplayName("should number every schema issue in the error message")
        void shouldListEverySchemaIssue() {
            transport.respond(StubTransport.json(200, "{\"id\":123,\"name\":456,\"age\":\"x\"}"));
            ResilientFetch<User> client = builder().withSchema(ResponseSchema.of(User.class)).build();

            assertThatThrownBy(() -> client.fetchSync(URL))
                    .isInstanceOfSatisfying(SchemaValidationException.class, error -> {
                        assertThat(error.getIssues()).hasSize(3);
                        assertThat(error.getMessage())
                                .contains("1. Expected string, received number at \"id\"")
                                .contains("2. Expected string, received number at \"name\"")
                                .contains("3. Expected number, received string at \"age\"");
                    });
        }

        @Test
        @DisplayName("should fail with schema issues without retrying")
        void shouldFailOnSchemaMismatch() {
            transport.respond(StubTransport.json(200, "{\"id\":\"1\",\"name\":\"Test User\",\"age\":\"old\"}"));
            ResilientFetch<User> client = builder().withSchema(ResponseSchema.of(User.class)).build();

            assertThatThrownBy(() -> client.fetchSync(URL))
                    .isInstanceOfSatisfying(SchemaValidationException.class,
                            error -> assertThat(error.getIssues().get(0).path()).isEqualTo("age"));
            assertThat(transport.callCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("should return a text body without data")
        void shouldReturnTextBody() {
            transport.respond(StubTransport.text(200, "plain"));

            ResponseEnvelope<JsonNode> response = builder().build().fetchSync(URL);

            assertThat(response.isJson()).isFalse();
            assertThat(response.dataString()).isEqualTo("plain");
        }
    }

    @Nested
    class Retry {

        @Test
        @DisplayName("should give up after the configured attempts with the last response")
        void shouldExhaustAttempts() {
            transport.respond(StubTransport.json(500, "{\"error\":\"Database down\"}"));

            assertThatThrownBy(() -> builder().build().fetchSync(URL))
                    .isInstanceOfSatisfying(RetryException.class, error -> {
                        assertThat(error.getAttempts()).isEqualTo(3);
                        assertThat(error.getStatus()).isEqualTo(500);
                        assertThat(error.getMessage()).contains("Database down");
                    });
            assertThat(transport.callCount()).isEqualTo(3);
            assertThat(registry.get("test_errors_total").tag("kind", "RETRY_EXHAUSTED").counter().count())
                    .isEqualTo(1.0);
            assertThat(registry.get("test_attempts_total").counter().count()).isEqualTo(3.0);
        }

        @Test
        @DisplayName("should not retry a client error")
        void shouldNotRetryClientError() {
            transport.respond(StubTransport.json(404, "{}"));

            assertThatThrownBy(() -> builder().build().fetchSync(URL))
                    .isExactlyInstanceOf(HttpResponseException.class);
            assertThat(transport.callCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("should recover when a retried call succeeds")
        void shouldRecover() {
            transport.thenRespond(StubTransport.json(503, "{}"))
                    .respond(StubTransport.json(200, "{\"ok\":true}"));

            ResponseEnvelope<JsonNode> response = builder().build().fetchSync(URL);

            assertThat(response.status()).isEqualTo(200);
            assertThat(transport.callCount()).isEqualTo(2);
        }

        @Test
        @DisplayName("should retry transport failures and surface the last one")
        void shouldRetryTransportFailures() {
            transport.fail(new TransportException("Connection refused", null));

            assertThatThrownBy(() -> builder().build().fetchSync(URL))
                    .isInstanceOf(TransportException.class);
            assertThat(transport.callCount()).isEqualTo(3);
        }

        @Test
        @DisplayName("should not retry an unclassified error")
        void shouldNotRetryUnclassifiedError() {
            transport.fail(new IllegalStateException("bug in transport"));

            assertThatThrownBy(() -> builder().build().fetchSync(URL))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessage("bug in transport");
            assertThat(transport.callCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("should let call options override the client retry")
        void shouldApplyCallScopeRetry() {
            transport.respond(StubTransport.json(500, "{}"));
            ResilientFetch<JsonNode> client = builder().build();

            assertThatThrownBy(() -> client.fetchSync(URL, RequestInit.empty(),
                    RequestOptions.<JsonNode>empty().withRetry(RetryOptions.disabled())))
                    .isExactlyInstanceOf(HttpResponseException.class);
            assertThat(transport.callCount()).isEqualTo(1);
        }
    }

    @Nested
    class Timeout {

        @Test
        @DisplayName("should time out every attempt of a slow call")
        void shouldTimeOutEachAttempt() {
            transport.delay(Duration.ofMillis(600));
            ResilientFetch<JsonNode> client = builder()
                    .withTimeout(Duration.ofMillis(200))
                    .withRetry(RetryOptions.builder()
                            .attempts(2)
                            .initialInterval(Duration.ofMillis(10))
                            .mode(RetryMode.CONSTANT)
                            .build())
                    .build();

            assertThatThrownBy(() -> client.fetchSync(URL))
                    .isInstanceOfSatisfying(FetchTimeoutException.class,
                            error -> assertThat(error.getTimeout()).isEqualTo(Duration.ofMillis(200)));
            assertThat(transport.callCount()).isEqualTo(2);
        }

        @Test
        @DisplayName("should wait for a slow call when the timeout is disabled")
        void shouldWaitWithoutTimeout() {
            transport.delay(Duration.ofMillis(300));

            ResponseEnvelope<JsonNode> response = builder().withoutTimeout().build().fetchSync(URL);

            assertThat(response.ok()).isTrue();
        }
    }

    @Nested
    class RateLimit {

        @Test
        @DisplayName("should delay calls beyond the quota to the next window")
        void shouldWaitOutWindow() {
            ResilientFetch<JsonNode> client = builder().withRateLimit(2, Duration.ofMillis(400)).build();

            client.fetchSync(URL);
            client.fetchSync(URL);
            client.fetchSync(URL);

            List<Long> offsets = transport.sendOffsetsMillis();
            assertThat(offsets).hasSize(3);
            assertThat(offsets.get(1)).isLessThan(200);
            assertThat(offsets.get(2)).isGreaterThanOrEqualTo(300);
        }

        @Test
        @DisplayName("should reject calls beyond the quota when admission retry is off")
        void shouldRejectWithoutAdmissionRetry() {
            ResilientFetch<JsonNode> client = builder()
                    .withRateLimit(RateLimitOptions.of(1, Duration.ofSeconds(10)), RetryOptions.disabled())
                    .build();

            client.fetchSync(URL);

            assertThatThrownBy(() -> client.fetchSync(URL))
                    .isInstanceOfSatisfying(RateLimitException.class,
                            error -> assertThat(error.getRemainingTimeInWindow()).isPositive());
            assertThat(transport.callCount()).isEqualTo(1);
            assertThat(registry.get("test_rate_limit_denied_total").counter().count()).isEqualTo(1.0);
        }
    }

    @Nested
    class CircuitBreaking {

        private MutableClock clock;
        private ResilientFetch<JsonNode> client;

        @BeforeEach
        void setUp() {
            clock = new MutableClock();
            client = builder()
                    .withoutRetry()
                    .withClock(clock)
                    .withCircuitBreaker(CircuitBreakerOptions.builder()
                            .slidingWindowSize(2)
                            .minimumNumberOfCalls(2)
                            .failureRateThreshold(50)
                            .permittedNumberOfCallsInHalfOpenState(1)
                            .openStateDelay(Duration.ofSeconds(30))
                            .build())
                    .build();
        }

        @Test
        @DisplayName("should reject calls without reaching the transport once open")
        void shouldOpenAfterFailures() {
            transport.respond(StubTransport.json(500, "{}"));

            assertThatThrownBy(() -> client.fetchSync(URL)).isInstanceOf(HttpResponseException.class);
            assertThatThrownBy(() -> client.fetchSync(URL)).isInstanceOf(HttpResponseException.class);
            assertThatThrownBy(() -> client.fetchSync(URL)).isInstanceOf(BreakerOpenException.class);

            assertThat(transport.callCount()).isEqualTo(2);
            assertThat(client.getCircuitBreaker()).hasValueSatisfying(
                    breaker -> assertThat(breaker.getState()).isEqualTo(CircuitBreaker.State.OPEN));
            assertThat(registry.get("test_circuit_breaker_state").gauge().value()).isEqualTo(2.0);
        }

        @Test
        @DisplayName("should close again after a successful probe")
        void shouldRecoverThroughHalfOpen() {
            transport.respond(StubTransport.json(500, "{}"));
            assertThatThrownBy(() -> client.fetchSync(URL)).isInstanceOf(HttpResponseException.class);
            assertThatThrownBy(() -> client.fetchSync(URL)).isInstanceOf(HttpResponseException.class);

            clock.advance(Duration.ofSeconds(30));
            transport.respond(StubTransport.json(200, "{}"));

            assertThat(client.fetchSync(URL).ok()).isTrue();
            assertThat(client.getCircuitBreaker().orElseThrow().getState()).isEqualTo(CircuitBreaker.State.CLOSED);
        }

        @Test
        @DisplayName("should reopen after a failed probe")
        void shouldReopenOnFailedProbe() {
            transport.respond(StubTransport.json(500, "{}"));
            assertThatThrownBy(() -> client.fetchSync(URL)).isInstanceOf(HttpResponseException.class);
            assertThatThrownBy(() -> client.fetchSync(URL)).isInstanceOf(HttpResponseException.class);

            clock.advance(Duration.ofSeconds(30));

            assertThatThrownBy(() -> client.fetchSync(URL)).isInstanceOf(HttpResponseException.class);
            assertThatThrownBy(() -> client.fetchSync(URL)).isInstanceOf(BreakerOpenException.class);
            assertThat(transport.callCount()).isEqualTo(3);
        }
    }

    @Nested
    class Concurrency {

        private static final int CALLERS = 12;

        private ExecutorService executor;

        @BeforeEach
        void setUp() {
            executor = Executors.newFixedThreadPool(6);
        }

        @AfterEach
        void tearDown() {
            executor.shutdownNow();
        }

        @Test
        @DisplayName("should admit exactly the limit of one window across concurrent callers")
        void shouldShareRateLimitAcrossCallers() throws Exception {
            ResilientFetch<JsonNode> client = builder()
                    .withRateLimit(RateLimitOptions.of(3, Duration.ofSeconds(10)), RetryOptions.disabled())
                    .build();

            List<Throwable> failures = failuresOf(fireConcurrently(client));

            assertThat(failures).filteredOn(failure -> failure == null).hasSize(3);
            assertThat(failures).filteredOn(failure -> failure instanceof RateLimitException).hasSize(CALLERS - 3);
            assertThat(transport.callCount()).isEqualTo(3);
        }

        @Test
        @DisplayName("should let only the permitted probes through a half-open breaker under contention")
        void shouldShareHalfOpenBudgetAcrossCallers() throws Exception {
            MutableClock clock = new MutableClock();
            ResilientFetch<JsonNode> client = builder()
                    .withoutRetry()
                    .withClock(clock)
                    .withCircuitBreaker(CircuitBreakerOptions.builder()
                            .slidingWindowSize(2)
                            .minimumNumberOfCalls(2)
                            .failureRateThreshold(50)
                            .permittedNumberOfCallsInHalfOpenState(2)
                            .openStateDelay(Duration.ofSeconds(30))
                            .build())
                    .build();
            transport.respond(StubTransport.json(500, "{}"));
            assertThatThrownBy(() -> client.fetchSync(URL)).isInstanceOf(HttpResponseException.class);
            assertThatThrownBy(() -> client.fetchSync(URL)).isInstanceOf(HttpResponseException.class);

            clock.advance(Duration.ofSeconds(30));
            CompletableFuture<Void> release = new CompletableFuture<>();
            transport.respond(StubTransport.json(200, "{}")).holdUntil(release);

            List<CompletableFuture<ResponseEnvelope<JsonNode>>> calls = fireConcurrently(client);
            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
            while (calls.stream().filter(CompletableFuture::isDone).count() < CALLERS - 2
                    && System.nanoTime() < deadline) {
                Thread.sleep(10);
            }
            assertThat(transport.callCount()).isEqualTo(4);

            release.complete(null);
            List<Throwable> failures = failuresOf(calls);

            assertThat(failures).filteredOn(failure -> failure == null).hasSize(2);
            assertThat(failures).filteredOn(failure -> failure instanceof BreakerOpenException).hasSize(CALLERS - 2);
            assertThat(client.getCircuitBreaker().orElseThrow().getState()).isEqualTo(CircuitBreaker.State.CLOSED);
        }

        private List<CompletableFuture<ResponseEnvelope<JsonNode>>> fireConcurrently(ResilientFetch<JsonNode> client)
                throws Exception {
            CountDownLatch start = new CountDownLatch(1);
            List<Future<CompletableFuture<ResponseEnvelope<JsonNode>>>> submitted = new ArrayList<>();
            for (int i = 0; i < CALLERS; i++) {
                submitted.add(executor.submit(() -> {
                    start.await();
                    return client.fetch(URL);
                }));
            }
            start.countDown();

            List<CompletableFuture<ResponseEnvelope<JsonNode>>> calls = new ArrayList<>();
            for (Future<CompletableFuture<ResponseEnvelope<JsonNode>>> future : submitted) {
                calls.add(future.get(5, TimeUnit.SECONDS));
            }
            return calls;
        }

        private List<Throwable> failuresOf(List<CompletableFuture<ResponseEnvelope<JsonNode>>> calls)
                throws Exception {
            List<Throwable> failures = new ArrayList<>();
            for (CompletableFuture<ResponseEnvelope<JsonNode>> call : calls) {
                try {
                    call.get(5, TimeUnit.SECONDS);
                    failures.add(null);
                } catch (ExecutionException e) {
                    failures.add(e.getCause());
                }
            }
            return failures;
        }
    }

    @Nested
    class Hooks {

        @Test
        @DisplayName("should send the request rewritten by the pre-request hook")
        void shouldRewriteRequest() {
            ResilientFetch<JsonNode> client = builder()
                    .withHooks(FetchHooks.<JsonNode>none().withPreRequest(request -> Optional.of(
                            request.withInit(request.init().toBuilder().header("Authorization", "Bearer token").build()))))
                    .build();

            client.fetchSync(URL);

            assertThat(transport.lastRequest().init().header("Authorization")).contains("Bearer token");
        }

        @Test
        @DisplayName("should return the response rewritten by the success hook")
        void shouldRewriteResponse() throws Exception {
            JsonNode replaced = new ObjectMapper().readTree("{\"rewritten\":true}");
            ResilientFetch<JsonNode> client = builder()
                    .withHooks(FetchHooks.<JsonNode>none().withPostResponseSuccess(
                            (request, response) -> Optional.of(response.withData(replaced))))
                    .build();

            assertThat(client.fetchSync(URL).data()).contains(replaced);
        }

        @Test
        @DisplayName("should fail with the error returned by the error hook")
        void shouldReplaceError() {
            transport.respond(StubTransport.json(404, "{}"));
            AtomicReference<Integer> seenStatus = new AtomicReference<>();
            IllegalArgumentException replacement = new IllegalArgumentException("user not found");
            ResilientFetch<JsonNode> client = builder()
                    .withHooks(FetchHooks.<JsonNode>none().withPostResponseError((request, error, response) -> {
                        seenStatus.set(response.map(ResponseEnvelope::status).orElse(null));
                        return Optional.of(replacement);
                    }))
                    .build();

            assertThatThrownBy(() -> client.fetchSync(URL)).isSameAs(replacement);
            assertThat(seenStatus.get()).isEqualTo(404);
        }

        @Test
        @DisplayName("should let call hooks override client hooks slot by slot")
        void shouldMergeCallHooks() {
            ResilientFetch<JsonNode> client = builder()
                    .withHooks(FetchHooks.<JsonNode>none().withPreRequest(
                            request -> Optional.of(request.withUrl(URL + "?from=client"))))
                    .build();

            client.fetchSync(URL, RequestInit.empty(), RequestOptions.<JsonNode>empty().withHooks(
                    FetchHooks.<JsonNode>none().withPreRequest(request -> Optional.of(request.withUrl(URL + "?from=call")))));

            assertThat(transport.lastRequest().url()).isEqualTo(URL + "?from=call");
        }
    }

    @Nested
    class Requests {

        @Test
        @DisplayName("should merge the call init over the client init")
        void shouldMergeInit() {
            ResilientFetch<JsonNode> client = builder()
                    .withInit(RequestInit.builder().header("Accept", "application/json").header("X-Client", "base").build())
                    .build();

            client.fetchSync(URL, RequestInit.builder().method("POST").header("X-Client", "call").jsonBody("{}").build());

            RequestInit sent = transport.lastRequest().init();
            assertThat(sent.method()).isEqualTo("POST");
            assertThat(sent.header("Accept")).contains("application/json");
            assertThat(sent.header("X-Client")).contains("call");
        }

        @Test
        @DisplayName("should propagate the correlation id from the MDC")
        void shouldPropagateCorrelationId() {
            MDC.put(ResilientFetch.CORRELATION_ID_MDC_KEY, "corr-123");
            try {
                builder().build().fetchSync(URL);
            } finally {
                MDC.remove(ResilientFetch.CORRELATION_ID_MDC_KEY);
            }

            assertThat(transport.lastRequest().init().header(ResilientFetch.CORRELATION_ID_HEADER)).contains("corr-123");
        }

        @Test
        @DisplayName("should generate a correlation id when none is set")
        void shouldGenerateCorrelationId() {
            builder().build().fetchSync(URL);

            assertThat(transport.lastRequest().init().header(ResilientFetch.CORRELATION_ID_HEADER))
                    .hasValueSatisfying(id -> assertThat(id).isNotBlank());
        }

        @Test
        @DisplayName("should keep an explicit correlation id")
        void shouldKeepExplicitCorrelationId() {
            builder().build().fetchSync(URL,
                    RequestInit.builder().header(ResilientFetch.CORRELATION_ID_HEADER, "explicit").build());

            assertThat(transport.lastRequest().init().header(ResilientFetch.CORRELATION_ID_HEADER)).contains("explicit");
        }

        @Test
        @DisplayName("should build the policies described by a configuration file")
        void shouldBuildFromConfig() {
            ResilientFetch<JsonNode> client = FetchBuilder.create()
                    .fromConfig(new ConfigLoader("test-config.yaml").load())
                    .withTransport(transport)
                    .build();

            client.fetchSync(URL);

            assertThat(client.getRateLimiter()).hasValueSatisfying(
                    limiter -> assertThat(limiter.getName()).isEqualTo("test-limiter"));
            assertThat(client.getCircuitBreaker()).hasValueSatisfying(
                    breaker -> assertThat(breaker.getName()).isEqualTo("test-breaker"));
            assertThat(transport.lastRequest().init().header("User-Agent")).contains("resilient-fetch-test");
        }
    }
}
