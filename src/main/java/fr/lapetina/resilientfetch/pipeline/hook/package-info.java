/**
 * Lifecycle hooks: pre-request rewrite, post-response success rewrite and
 * post-response error replacement.
 */
package fr.lapetina.resilientfetch.pipeline.hook;
