/**
 * Resilient Fetch - an HTTP request executor that wraps each call in a chain of
 * reliability policies and returns a typed, validated response or a classified error.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.resilientfetch.FetchBuilder} - immutable builder, the main entry point</li>
 *   <li>{@link fr.lapetina.resilientfetch.ResilientFetch} - the built client</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * ResilientFetch<JsonNode> client = FetchBuilder.create()
 *         .withTimeout(Duration.ofSeconds(5))
 *         .withCircuitBreaker(CircuitBreakerOptions.defaults())
 *         .build();
 *
 * client.fetch("https://api.example.com/items")
 *         .thenAccept(response -> System.out.println(response.data()));
 * }</pre>
 *
 * <h2>Features</h2>
 * <ul>
 *   <li>Retry with constant, linear, exponential or jittered backoff, honouring Retry-After</li>
 *   <li>Per-attempt timeout with an optional inner retry</li>
 *   <li>Client-wide fixed window rate limiting and sliding window circuit breaking</li>
 *   <li>JSON materialization with pluggable schema validation</li>
 *   <li>Pre-request, success and error hooks</li>
 *   <li>YAML configuration and Micrometer metrics</li>
 * </ul>
 *
 * @see fr.lapetina.resilientfetch.domain.error.FetchException
 */
package fr.lapetina.resilientfetch;
