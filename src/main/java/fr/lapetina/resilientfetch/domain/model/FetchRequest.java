package fr.lapetina.resilientfetch.domain.model;

import java.net.URI;
import java.util.Objects;

/**
 * The request as it is handed to the policy chain: a target URL plus its effective init.
 * Immutable; hooks produce new instances rather than mutating this one.
 */
public record FetchRequest(String url, RequestInit init) {

    public FetchRequest {
        Objects.requireNonNull(url, "URL is required");
        if (url.isBlank()) {
            throw new IllegalArgumentException("URL must not be blank");
        }
        init = init != null ? init : RequestInit.empty();
    }

    public static FetchRequest of(String url) {
        return new FetchRequest(url, RequestInit.empty());
    }

    public String method() {
        return init.method();
    }

    public URI uri() {
        return URI.create(url);
    }

    public FetchRequest withUrl(String newUrl) {
        return new FetchRequest(newUrl, init);
    }

    public FetchRequest withInit(RequestInit newInit) {
        return new FetchRequest(url, newInit);
    }

    @Override
    public String toString() {
        return method() + " " + url;
    }
}
