package fr.lapetina.resilientfetch.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Transport-level settings of a request: method, headers, body and redirect handling.
 * Immutable and thread-safe.
 *
 * Header names keep their insertion order and casing, lookups ignore case.
 * The body may be absent, a String, a byte[] or any object; objects are serialized
 * to JSON by the transport when the Content-Type is application/json.
 */
public final class RequestInit {

    public static final String DEFAULT_METHOD = "GET";

    private static final RequestInit EMPTY = builder().build();

    private final String method;
    private final Map<String, String> headers;
    private final Object body;
    private final Boolean followRedirects;
    private final CompletableFuture<?> abortSignal;

    private RequestInit(Builder builder) {
        this.method = builder.method != null ? builder.method.toUpperCase(Locale.ROOT) : null;
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(builder.headers));
        this.body = builder.body;
        this.followRedirects = builder.followRedirects;
        this.abortSignal = builder.abortSignal;
    }

    public static RequestInit empty() {
        return EMPTY;
    }

    public static RequestInit of(String method) {
        return builder().method(method).build();
    }

    /**
     * HTTP method, GET when none was set.
     */
    public String method() {
        return method != null ? method : DEFAULT_METHOD;
    }

    public Map<String, String> headers() {
        return headers;
    }

    public Optional<String> header(String name) {
        return findKey(headers, name).map(headers::get);
    }

    public Optional<Object> body() {
        return Optional.ofNullable(body);
    }

    public boolean followRedirects() {
        return followRedirects == null || followRedirects;
    }

    /**
     * Caller-owned cancellation signal. Completing it asks the transport to abandon the call.
     * Policies never complete or observe it.
     */
    public Optional<CompletableFuture<?>> abortSignal() {
        return Optional.ofNullable(abortSignal);
    }

    /**
     * Returns a new init where every field set in {@code override} wins.
     * Headers are merged key by key, case-insensitively.
     */
    public RequestInit merge(RequestInit override) {
        if (override == null) {
            return this;
        }
        Builder merged = toBuilder();
        if (override.method != null) {
            merged.method(override.method);
        }
        override.headers.forEach(merged::header);
        if (override.body != null) {
            merged.body(override.body);
        }
        if (override.followRedirects != null) {
            merged.followRedirects(override.followRedirects);
        }
        if (override.abortSignal != null) {
            merged.abortSignal(override.abortSignal);
        }
        return merged.build();
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.method = method;
        builder.headers.putAll(headers);
        builder.body = body;
        builder.followRedirects = followRedirects;
        builder.abortSignal = abortSignal;
        return builder;
    }

    public static Builder builder() {
        return new Builder();
    }

    private static Optional<String> findKey(Map<String, String> map, String name) {
        return map.keySet().stream()
                .filter(key -> key.equalsIgnoreCase(name))
                .findFirst();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RequestInit that)) return false;
        return Objects.equals(method, that.method)
                && headers.equals(that.headers)
                && Objects.equals(body, that.body)
                && Objects.equals(followRedirects, that.followRedirects)
                && abortSignal == that.abortSignal;
    }

    @Override
    public int hashCode() {
        return Objects.hash(method, headers, body, followRedirects);
    }

    @Override
    public String toString() {
        return "RequestInit{" +
                "method=" + method() +
                ", headers=" + headers.keySet() +
                ", hasBody=" + (body != null) +
                '}';
    }

    public static final class Builder {
        private String method;
        private final Map<String, String> headers = new LinkedHashMap<>();
        private Object body;
        private Boolean followRedirects;
        private CompletableFuture<?> abortSignal;

        private Builder() {
        }

        public Builder method(String method) {
            this.method = Objects.requireNonNull(method, "Method is required");
            return this;
        }

        /**
         * Sets a header, replacing any existing header with the same name in any casing.
         */
        public Builder header(String name, String value) {
            Objects.requireNonNull(name, "Header name is required");
            Objects.requireNonNull(value, "Header value is required");
            findKey(headers, name).ifPresent(headers::remove);
            headers.put(name, value);
            return this;
        }

        public Builder headers(Map<String, String> headers) {
            headers.forEach(this::header);
            return this;
        }

        public Builder body(Object body) {
            this.body = body;
            return this;
        }

        public Builder jsonBody(Object body) {
            header("Content-Type", "application/json");
            this.body = body;
            return this;
        }

        public Builder followRedirects(boolean followRedirects) {
            this.followRedirects = followRedirects;
            return this;
        }

        public Builder abortSignal(CompletableFuture<?> abortSignal) {
            this.abortSignal = abortSignal;
            return this;
        }

        public RequestInit build() {
            return new RequestInit(this);
        }
    }
}
