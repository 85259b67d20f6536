package fr.lapetina.resilientfetch.pipeline;

import fr.lapetina.resilientfetch.domain.schema.ResponseSchema;
import fr.lapetina.resilientfetch.pipeline.hook.FetchHooks;

/**
 * Call scope settings. Any field left null falls back to the value of the layer below
 * (builder, then defaults); a set field replaces the whole sub-configuration.
 *
 * @param timeout deadline and inner retry
 * @param retry call scope retry
 * @param schema response schema
 * @param hooks lifecycle hooks, merged slot by slot
 */
public record RequestOptions<T>(
        TimeoutOptions timeout,
        RetryOptions retry,
        ResponseSchema<T> schema,
        FetchHooks<T> hooks
) {
    private static final RequestOptions<?> EMPTY = new RequestOptions<>(null, null, null, null);

    @SuppressWarnings("unchecked")
    public static <T> RequestOptions<T> empty() {
        return (RequestOptions<T>) EMPTY;
    }

    public RequestOptions<T> withTimeout(TimeoutOptions newTimeout) {
        return new RequestOptions<>(newTimeout, retry, schema, hooks);
    }

    public RequestOptions<T> withRetry(RetryOptions newRetry) {
        return new RequestOptions<>(timeout, newRetry, schema, hooks);
    }

    public RequestOptions<T> withSchema(ResponseSchema<T> newSchema) {
        return new RequestOptions<>(timeout, retry, newSchema, hooks);
    }

    public RequestOptions<T> withHooks(FetchHooks<T> newHooks) {
        return new RequestOptions<>(timeout, retry, schema, newHooks);
    }

    /**
     * Layers {@code override} on top of these options; the override wins per field.
     */
    public RequestOptions<T> mergedWith(RequestOptions<T> override) {
        if (override == null) {
            return this;
        }
        FetchHooks<T> mergedHooks = hooks == null ? override.hooks : hooks.overriddenBy(override.hooks);
        return new RequestOptions<>(
                override.timeout != null ? override.timeout : timeout,
                override.retry != null ? override.retry : retry,
                override.schema != null ? override.schema : schema,
                mergedHooks);
    }
}
