package fr.lapetina.resilientfetch.pipeline.hook;

import fr.lapetina.resilientfetch.domain.error.FetchException;
import fr.lapetina.resilientfetch.domain.model.FetchRequest;
import fr.lapetina.resilientfetch.domain.model.ResponseEnvelope;

import java.util.Optional;

/**
 * The three lifecycle extension points of a fetch. Every slot is optional; an empty
 * {@link Optional} return leaves the value untouched.
 *
 * @param <T> type of the validated response data
 */
public final class FetchHooks<T> {

    /**
     * Runs before the policy chain; may rewrite the url or the init.
     */
    @FunctionalInterface
    public interface PreRequestHook {
        Optional<FetchRequest> beforeRequest(FetchRequest request);
    }

    /**
     * Runs after a successful, materialized response; may rewrite it.
     */
    @FunctionalInterface
    public interface PostResponseSuccessHook<T> {
        Optional<ResponseEnvelope<T>> afterSuccess(FetchRequest request, ResponseEnvelope<T> response);
    }

    /**
     * Runs on any classified failure; may replace the error, never turn it into a success.
     * The response is present for HTTP and schema validation failures.
     */
    @FunctionalInterface
    public interface PostResponseErrorHook {
        Optional<RuntimeException> afterError(FetchRequest request, FetchException error,
                                              Optional<ResponseEnvelope<?>> response);
    }

    private static final FetchHooks<?> NONE = new FetchHooks<>(null, null, null);

    private final PreRequestHook preRequest;
    private final PostResponseSuccessHook<T> postResponseSuccess;
    private final PostResponseErrorHook postResponseError;

    private FetchHooks(
            PreRequestHook preRequest,
            PostResponseSuccessHook<T> postResponseSuccess,
            PostResponseErrorHook postResponseError
    ) {
        this.preRequest = preRequest;
        this.postResponseSuccess = postResponseSuccess;
        this.postResponseError = postResponseError;
    }

    @SuppressWarnings("unchecked")
    public static <T> FetchHooks<T> none() {
        return (FetchHooks<T>) NONE;
    }

    public FetchHooks<T> withPreRequest(PreRequestHook hook) {
        return new FetchHooks<>(hook, postResponseSuccess, postResponseError);
    }

    public FetchHooks<T> withPostResponseSuccess(PostResponseSuccessHook<T> hook) {
        return new FetchHooks<>(preRequest, hook, postResponseError);
    }

    public FetchHooks<T> withPostResponseError(PostResponseErrorHook hook) {
        return new FetchHooks<>(preRequest, postResponseSuccess, hook);
    }

    /**
     * Slot by slot merge: each slot set in {@code override} replaces this one's.
     */
    public FetchHooks<T> overriddenBy(FetchHooks<T> override) {
        if (override == null) {
            return this;
        }
        return new FetchHooks<>(
                override.preRequest != null ? override.preRequest : preRequest,
                override.postResponseSuccess != null ? override.postResponseSuccess : postResponseSuccess,
                override.postResponseError != null ? override.postResponseError : postResponseError);
    }

    /**
     * Carries the hooks over to another data type. The success hook is typed by the data,
     * so it is dropped.
     */
    public <U> FetchHooks<U> retyped() {
        return new FetchHooks<>(preRequest, null, postResponseError);
    }

    public Optional<PreRequestHook> preRequest() {
        return Optional.ofNullable(preRequest);
    }

    public Optional<PostResponseSuccessHook<T>> postResponseSuccess() {
        return Optional.ofNullable(postResponseSuccess);
    }

    public Optional<PostResponseErrorHook> postResponseError() {
        return Optional.ofNullable(postResponseError);
    }

    @Override
    public String toString() {
        return "FetchHooks{" +
                "preRequest=" + (preRequest != null) +
                ", postResponseSuccess=" + (postResponseSuccess != null) +
                ", postResponseError=" + (postResponseError != null) +
                '}';
    }
}
