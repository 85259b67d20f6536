/**
 * Policy execution pipeline.
 *
 * <p>A {@link fr.lapetina.resilientfetch.pipeline.PolicyChain} runs an ordered list of
 * {@link fr.lapetina.resilientfetch.pipeline.Policy} instances around the raw call.
 * The client assembles two scopes, outermost first:
 * <ol>
 *   <li>client scope: rate-limit retry, rate limiter, circuit breaker</li>
 *   <li>call scope: retry, timeout, timeout retry</li>
 * </ol>
 * Breaker and limiter state is owned by the built client and shared by its calls;
 * everything else lives in the futures of one call.
 */
package fr.lapetina.resilientfetch.pipeline;
