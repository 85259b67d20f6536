/**
 * Error taxonomy of the pipeline.
 *
 * <p>Every failure a caller sees is a {@link fr.lapetina.resilientfetch.domain.error.FetchException}
 * whose {@code kind()} tells which one it is. Dispatch on the kind with a switch:
 * <pre>{@code
 * switch (error.kind()) {
 *     case HTTP_RESPONSE, RETRY_EXHAUSTED -> ((HttpResponseException) error).getStatus();
 *     case TIMEOUT -> ...
 *     ...
 * }
 * }</pre>
 */
package fr.lapetina.resilientfetch.domain.error;
