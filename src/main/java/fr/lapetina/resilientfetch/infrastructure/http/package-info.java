/**
 * HTTP side of the pipeline: the raw transport, response materialization, and the
 * circuit breaker and rate limiter state shared by the calls of one client.
 */
package fr.lapetina.resilientfetch.infrastructure.http;
