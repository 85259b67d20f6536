package fr.lapetina.resilientfetch.domain.model;

import java.net.URI;
import java.net.http.HttpHeaders;
import java.util.Objects;
import java.util.Optional;

/**
 * Materialized view of a transport response.
 *
 * <p>{@code isJson} is true only when the body was declared as JSON and parsed.
 * {@code data} is present only when the body is JSON and, if a schema was configured,
 * passed validation. Without a schema the data is the parsed Jackson tree.
 *
 * @param <T> type of the parsed (and possibly validated) body
 */
public final class ResponseEnvelope<T> {

    private final RawResponse rawResponse;
    private final T data;
    private final boolean json;
    private final String dataString;

    public ResponseEnvelope(RawResponse rawResponse, T data, boolean json, String dataString) {
        this.rawResponse = Objects.requireNonNull(rawResponse, "Raw response is required");
        if (data != null && !json) {
            throw new IllegalArgumentException("Data can only be present for JSON bodies");
        }
        this.data = data;
        this.json = json;
        this.dataString = dataString != null ? dataString : "";
    }

    public boolean ok() {
        return rawResponse.ok();
    }

    public int status() {
        return rawResponse.status();
    }

    public String statusText() {
        return rawResponse.statusText();
    }

    public HttpHeaders headers() {
        return rawResponse.headers();
    }

    public URI url() {
        return rawResponse.url();
    }

    public boolean redirected() {
        return rawResponse.redirected();
    }

    public Optional<T> data() {
        return Optional.ofNullable(data);
    }

    public boolean isJson() {
        return json;
    }

    public String dataString() {
        return dataString;
    }

    public RawResponse rawResponse() {
        return rawResponse;
    }

    /**
     * Returns a copy carrying different data, used by success hooks to rewrite the body.
     *
     * @throws IllegalArgumentException if data is given for a non-JSON response
     */
    public ResponseEnvelope<T> withData(T newData) {
        return new ResponseEnvelope<>(rawResponse, newData, json, dataString);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ResponseEnvelope<?> that)) return false;
        return json == that.json
                && rawResponse.equals(that.rawResponse)
                && Objects.equals(data, that.data)
                && dataString.equals(that.dataString);
    }

    @Override
    public int hashCode() {
        return Objects.hash(rawResponse, data, json, dataString);
    }

    @Override
    public String toString() {
        return "ResponseEnvelope{" +
                "status=" + status() +
                ", ok=" + ok() +
                ", isJson=" + json +
                ", hasData=" + (data != null) +
                '}';
    }
}
