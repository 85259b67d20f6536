package fr.lapetina.resilientfetch.pipeline.hook;

import fr.lapetina.resilientfetch.domain.error.FetchException;
import fr.lapetina.resilientfetch.domain.error.HttpResponseException;
import fr.lapetina.resilientfetch.domain.error.SchemaValidationException;
import fr.lapetina.resilientfetch.domain.model.FetchRequest;
import fr.lapetina.resilientfetch.domain.model.ResponseEnvelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Invokes the configured hooks at their fixed pipeline stages.
 * An exception thrown by a hook fails the call with that exception.
 */
public final class HookRunner<T> {

    private static final Logger log = LoggerFactory.getLogger(HookRunner.class);

    private final FetchHooks<T> hooks;

    public HookRunner(FetchHooks<T> hooks) {
        this.hooks = Objects.requireNonNull(hooks, "Hooks are required");
    }

    public FetchRequest beforeRequest(FetchRequest request) {
        return hooks.preRequest()
                .flatMap(hook -> hook.beforeRequest(request))
                .map(rewritten -> {
                    log.trace("Request rewritten by hook: from={}, to={}", request, rewritten);
                    return rewritten;
                })
                .orElse(request);
    }

    public ResponseEnvelope<T> afterSuccess(FetchRequest request, ResponseEnvelope<T> response) {
        return hooks.postResponseSuccess()
                .flatMap(hook -> hook.afterSuccess(request, response))
                .orElse(response);
    }

    /**
     * @return the error the caller should see: the hook's replacement, or {@code error} itself
     */
    public RuntimeException afterError(FetchRequest request, FetchException error) {
        return hooks.postResponseError()
                .flatMap(hook -> hook.afterError(request, error, responseOf(error)))
                .orElse(error);
    }

    public FetchHooks<T> getHooks() {
        return hooks;
    }

    static Optional<ResponseEnvelope<?>> responseOf(FetchException error) {
        return switch (error.kind()) {
            case HTTP_RESPONSE, RETRY_EXHAUSTED -> Optional.of(((HttpResponseException) error).getResponse());
            case SCHEMA_VALIDATION -> Optional.ofNullable(((SchemaValidationException) error).getResponse());
            case TIMEOUT, RATE_LIMITED, CIRCUIT_OPEN, TRANSPORT -> Optional.empty();
        };
    }
}
