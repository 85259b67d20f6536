/**
 * Value objects of a fetch: the request as handed to the pipeline, the raw transport
 * response and its materialized envelope.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.resilientfetch.domain.model.RequestInit} - Method, headers, body, redirects, abort signal</li>
 *   <li>{@link fr.lapetina.resilientfetch.domain.model.FetchRequest} - URL plus effective init</li>
 *   <li>{@link fr.lapetina.resilientfetch.domain.model.RawResponse} - Buffered transport response</li>
 *   <li>{@link fr.lapetina.resilientfetch.domain.model.ResponseEnvelope} - Parsed and validated view of a response</li>
 *   <li>{@link fr.lapetina.resilientfetch.domain.model.Attempt} - One pass through a retry policy</li>
 * </ul>
 *
 * <p>All classes are immutable, except that {@code RawResponse} exposes its body array
 * without copying; callers must not modify it.
 */
package fr.lapetina.resilientfetch.domain.model;
