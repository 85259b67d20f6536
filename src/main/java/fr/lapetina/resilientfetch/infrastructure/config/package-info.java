/**
 * YAML configuration of a fetch client.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.resilientfetch.infrastructure.config.FetchConfig} - Configuration model</li>
 *   <li>{@link fr.lapetina.resilientfetch.infrastructure.config.ConfigLoader} - YAML loading from file system or classpath</li>
 * </ul>
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code init} - base request (method, headers, redirects)</li>
 *   <li>{@code timeout} - per-attempt deadline and its optional inner retry</li>
 *   <li>{@code retry} - call scope retry and backoff shape</li>
 *   <li>{@code rateLimit} - client-wide fixed window quota and its admission retry</li>
 *   <li>{@code circuitBreaker} - client-wide breaker thresholds</li>
 *   <li>{@code metrics} - Micrometer settings</li>
 * </ul>
 *
 * <p>Configuration is read once when the client is built; there is no hot reload.
 * Rejection predicates, the breaker's error filter, schemas and hooks are set in code.
 *
 * @see fr.lapetina.resilientfetch.FetchBuilder#fromConfig(FetchConfig)
 */
package fr.lapetina.resilientfetch.infrastructure.config;
