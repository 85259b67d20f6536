package fr.lapetina.resilientfetch.infrastructure.config;

import fr.lapetina.resilientfetch.domain.model.RequestInit;
import fr.lapetina.resilientfetch.infrastructure.http.CircuitBreaker;
import fr.lapetina.resilientfetch.infrastructure.http.CircuitBreakerOptions;
import fr.lapetina.resilientfetch.infrastructure.http.RateLimitOptions;
import fr.lapetina.resilientfetch.pipeline.RetryMode;
import fr.lapetina.resilientfetch.pipeline.RetryOptions;
import fr.lapetina.resilientfetch.pipeline.TimeoutOptions;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Root configuration object of a fetch client.
 * Designed to be populated from YAML. Predicates and hooks are code-only.
 */
public class FetchConfig {

    private InitConfig init = new InitConfig();
    private TimeoutConfig timeout = new TimeoutConfig();
    private RetryConfig retry = new RetryConfig();
    private RateLimitConfig rateLimit = new RateLimitConfig();
    private CircuitBreakerConfig circuitBreaker = new CircuitBreakerConfig();
    private MetricsConfig metrics = new MetricsConfig();

    // Getters and Setters
    public InitConfig getInit() { return init; }
    public void setInit(InitConfig init) { this.init = init; }

    public TimeoutConfig getTimeout() { return timeout; }
    public void setTimeout(TimeoutConfig timeout) { this.timeout = timeout; }

    public RetryConfig getRetry() { return retry; }
    public void setRetry(RetryConfig retry) { this.retry = retry; }

    public RateLimitConfig getRateLimit() { return rateLimit; }
    public void setRateLimit(RateLimitConfig rateLimit) { this.rateLimit = rateLimit; }

    public CircuitBreakerConfig getCircuitBreaker() { return circuitBreaker; }
    public void setCircuitBreaker(CircuitBreakerConfig circuitBreaker) { this.circuitBreaker = circuitBreaker; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    /**
     * Base request init merged under every call's init.
     */
    public static class InitConfig {
        private String method = RequestInit.DEFAULT_METHOD;
        private Map<String, String> headers = new LinkedHashMap<>();
        private boolean followRedirects = true;

        public String getMethod() { return method; }
        public void setMethod(String method) { this.method = method; }

        public Map<String, String> getHeaders() { return headers; }
        public void setHeaders(Map<String, String> headers) { this.headers = headers; }

        public boolean isFollowRedirects() { return followRedirects; }
        public void setFollowRedirects(boolean followRedirects) { this.followRedirects = followRedirects; }

        public RequestInit toRequestInit() {
            RequestInit.Builder builder = RequestInit.builder()
                    .headers(headers != null ? headers : Map.of())
                    .followRedirects(followRedirects);
            if (method != null) {
                builder.method(method);
            }
            return builder.build();
        }
    }

    /**
     * Per-attempt deadline, with an optional retry inside it.
     */
    public static class TimeoutConfig {
        private boolean enabled = true;
        private long timeoutMs = TimeoutOptions.DEFAULT_TIMEOUT.toMillis();
        private RetryConfig retry;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public long getTimeoutMs() { return timeoutMs; }
        public void setTimeoutMs(long timeoutMs) { this.timeoutMs = timeoutMs; }

        public RetryConfig getRetry() { return retry; }
        public void setRetry(RetryConfig retry) { this.retry = retry; }

        public TimeoutOptions toOptions() {
            if (!enabled) {
                return TimeoutOptions.disabled();
            }
            TimeoutOptions options = TimeoutOptions.of(Duration.ofMillis(timeoutMs));
            return retry == null ? options : options.withRetry(retry.toOptions(RetryOptions.defaults()));
        }
    }

    /**
     * Retry settings, applied on top of a base so that the base's predicate is kept.
     */
    public static class RetryConfig {
        private boolean enabled = true;
        private String name;
        private int attempts = 3;
        private long initialIntervalMs = 500;
        private long maxIntervalMs = 30000;
        private String mode = "jitter";
        private double factor = 2.0;
        private double jitterAdjustment = 0.5;
        private boolean fastFirst = false;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public int getAttempts() { return attempts; }
        public void setAttempts(int attempts) { this.attempts = attempts; }

        public long getInitialIntervalMs() { return initialIntervalMs; }
        public void setInitialIntervalMs(long initialIntervalMs) { this.initialIntervalMs = initialIntervalMs; }

        public long getMaxIntervalMs() { return maxIntervalMs; }
        public void setMaxIntervalMs(long maxIntervalMs) { this.maxIntervalMs = maxIntervalMs; }

        public String getMode() { return mode; }
        public void setMode(String mode) { this.mode = mode; }

        public double getFactor() { return factor; }
        public void setFactor(double factor) { this.factor = factor; }

        public double getJitterAdjustment() { return jitterAdjustment; }
        public void setJitterAdjustment(double jitterAdjustment) { this.jitterAdjustment = jitterAdjustment; }

        public boolean isFastFirst() { return fastFirst; }
        public void setFastFirst(boolean fastFirst) { this.fastFirst = fastFirst; }

        public RetryOptions toOptions(RetryOptions base) {
            if (!enabled) {
                return RetryOptions.disabled();
            }
            RetryOptions.Builder builder = base.toBuilder()
                    .attempts(attempts)
                    .initialInterval(Duration.ofMillis(initialIntervalMs))
                    .maxInterval(Duration.ofMillis(maxIntervalMs))
                    .mode(parseMode(mode))
                    .factor(factor)
                    .jitterAdjustment(jitterAdjustment)
                    .fastFirst(fastFirst);
            if (name != null) {
                builder.name(name);
            }
            return builder.build();
        }

        private static RetryMode parseMode(String mode) {
            try {
                return RetryMode.valueOf(mode.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException | NullPointerException e) {
                throw new ConfigLoader.ConfigurationException("Unknown retry mode: " + mode, e);
            }
        }
    }

    /**
     * Client-wide fixed window rate limit. Disabled unless configured.
     */
    public static class RateLimitConfig {
        private boolean enabled = false;
        private String name = RateLimitOptions.DEFAULT_NAME;
        private int limitForPeriod = 10;
        private long limitPeriodMs = 1000;
        private RetryConfig retry;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public int getLimitForPeriod() { return limitForPeriod; }
        public void setLimitForPeriod(int limitForPeriod) { this.limitForPeriod = limitForPeriod; }

        public long getLimitPeriodMs() { return limitPeriodMs; }
        public void setLimitPeriodMs(long limitPeriodMs) { this.limitPeriodMs = limitPeriodMs; }

        public RetryConfig getRetry() { return retry; }
        public void setRetry(RetryConfig retry) { this.retry = retry; }

        public RateLimitOptions toOptions() {
            return new RateLimitOptions(name, limitForPeriod, Duration.ofMillis(limitPeriodMs));
        }

        public RetryOptions toRetryOptions() {
            return retry == null
                    ? RetryOptions.rateLimitDefaults()
                    : retry.toOptions(RetryOptions.rateLimitDefaults());
        }
    }

    /**
     * Client-wide circuit breaker. Disabled unless configured.
     */
    public static class CircuitBreakerConfig {
        private boolean enabled = false;
        private String name = CircuitBreakerOptions.DEFAULT_NAME;
        private String initialState = "closed";
        private double failureRateThreshold = 50;
        private double slowCallRateThreshold = 100;
        private long slowCallDurationThresholdMs = 60000;
        private int permittedNumberOfCallsInHalfOpenState = 2;
        private long halfOpenStateMaxDelayMs = 0;
        private int slidingWindowSize = 10;
        private int minimumNumberOfCalls = 10;
        private long openStateDelayMs = 60000;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public String getInitialState() { return initialState; }
        public void setInitialState(String initialState) { this.initialState = initialState; }

        public double getFailureRateThreshold() { return failureRateThreshold; }
        public void setFailureRateThreshold(double threshold) { this.failureRateThreshold = threshold; }

        public double getSlowCallRateThreshold() { return slowCallRateThreshold; }
        public void setSlowCallRateThreshold(double threshold) { this.slowCallRateThreshold = threshold; }

        public long getSlowCallDurationThresholdMs() { return slowCallDurationThresholdMs; }
        public void setSlowCallDurationThresholdMs(long ms) { this.slowCallDurationThresholdMs = ms; }

        public int getPermittedNumberOfCallsInHalfOpenState() { return permittedNumberOfCallsInHalfOpenState; }
        public void setPermittedNumberOfCallsInHalfOpenState(int calls) { this.permittedNumberOfCallsInHalfOpenState = calls; }

        public long getHalfOpenStateMaxDelayMs() { return halfOpenStateMaxDelayMs; }
        public void setHalfOpenStateMaxDelayMs(long ms) { this.halfOpenStateMaxDelayMs = ms; }

        public int getSlidingWindowSize() { return slidingWindowSize; }
        public void setSlidingWindowSize(int slidingWindowSize) { this.slidingWindowSize = slidingWindowSize; }

        public int getMinimumNumberOfCalls() { return minimumNumberOfCalls; }
        public void setMinimumNumberOfCalls(int minimumNumberOfCalls) { this.minimumNumberOfCalls = minimumNumberOfCalls; }

        public long getOpenStateDelayMs() { return openStateDelayMs; }
        public void setOpenStateDelayMs(long openStateDelayMs) { this.openStateDelayMs = openStateDelayMs; }

        public CircuitBreakerOptions toOptions() {
            CircuitBreaker.State state;
            try {
                state = CircuitBreaker.State.valueOf(initialState.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
            } catch (IllegalArgumentException | NullPointerException e) {
                throw new ConfigLoader.ConfigurationException("Unknown circuit breaker state: " + initialState, e);
            }
            return CircuitBreakerOptions.builder()
                    .name(name)
                    .initialState(state)
                    .failureRateThreshold(failureRateThreshold)
                    .slowCallRateThreshold(slowCallRateThreshold)
                    .slowCallDurationThreshold(Duration.ofMillis(slowCallDurationThresholdMs))
                    .permittedNumberOfCallsInHalfOpenState(permittedNumberOfCallsInHalfOpenState)
                    .halfOpenStateMaxDelay(Duration.ofMillis(halfOpenStateMaxDelayMs))
                    .slidingWindowSize(slidingWindowSize)
                    .minimumNumberOfCalls(minimumNumberOfCalls)
                    .openStateDelay(Duration.ofMillis(openStateDelayMs))
                    .build();
        }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private boolean enabled = true;
        private String prefix = "resilient_fetch";
        private boolean prometheus = false;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }

        public boolean isPrometheus() { return prometheus; }
        public void setPrometheus(boolean prometheus) { this.prometheus = prometheus; }
    }
}
