package fr.lapetina.resilientfetch.domain.model;

import java.net.URI;
import java.net.http.HttpHeaders;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Response as returned by the transport, with its body fully buffered.
 * The body bytes are copied in and out, so the response can be materialized any number of times
 * and a caller changing the array it got back does not change the response.
 */
public record RawResponse(
        int status,
        String statusText,
        HttpHeaders headers,
        URI url,
        boolean redirected,
        byte[] body
) {
    private static final HttpHeaders NO_HEADERS = HttpHeaders.of(Map.of(), (name, value) -> true);

    public RawResponse {
        statusText = statusText != null ? statusText : ReasonPhrases.forStatus(status);
        headers = headers != null ? headers : NO_HEADERS;
        body = body != null ? body.clone() : new byte[0];
    }

    @Override
    public byte[] body() {
        return body.clone();
    }

    public boolean ok() {
        return status >= 200 && status < 300;
    }

    public Optional<String> contentType() {
        return headers.firstValue("Content-Type");
    }

    /**
     * Decodes the body using the charset of the Content-Type, UTF-8 when absent or unknown.
     */
    public String text() {
        return new String(body, charset());
    }

    private Charset charset() {
        return contentType()
                .flatMap(RawResponse::charsetParameter)
                .orElse(StandardCharsets.UTF_8);
    }

    private static Optional<Charset> charsetParameter(String contentType) {
        for (String part : contentType.split(";")) {
            String trimmed = part.trim();
            if (trimmed.toLowerCase(Locale.ROOT).startsWith("charset=")) {
                String name = trimmed.substring("charset=".length()).replace("\"", "");
                try {
                    return Optional.of(Charset.forName(name));
                } catch (IllegalArgumentException e) {
                    return Optional.empty();
                }
            }
        }
        return Optional.empty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RawResponse that)) return false;
        return status == that.status
                && redirected == that.redirected
                && Objects.equals(statusText, that.statusText)
                && Objects.equals(headers, that.headers)
                && Objects.equals(url, that.url)
                && Arrays.equals(body, that.body);
    }

    @Override
    public int hashCode() {
        return Objects.hash(status, statusText, headers, url, redirected, Arrays.hashCode(body));
    }

    @Override
    public String toString() {
        return "RawResponse{status=" + status + ", url=" + url + ", bodyBytes=" + body.length + '}';
    }

    /**
     * Standard reason phrases; java.net.http does not expose the server's own.
     */
    static final class ReasonPhrases {

        private ReasonPhrases() {
        }

        static String forStatus(int status) {
            return switch (status) {
                case 200 -> "OK";
                case 201 -> "Created";
                case 202 -> "Accepted";
                case 204 -> "No Content";
                case 301 -> "Moved Permanently";
                case 302 -> "Found";
                case 304 -> "Not Modified";
                case 307 -> "Temporary Redirect";
                case 308 -> "Permanent Redirect";
                case 400 -> "Bad Request";
                case 401 -> "Unauthorized";
                case 403 -> "Forbidden";
                case 404 -> "Not Found";
                case 405 -> "Method Not Allowed";
                case 408 -> "Request Timeout";
                case 409 -> "Conflict";
                case 410 -> "Gone";
                case 413 -> "Payload Too Large";
                case 415 -> "Unsupported Media Type";
                case 422 -> "Unprocessable Entity";
                case 429 -> "Too Many Requests";
                case 500 -> "Internal Server Error";
                case 501 -> "Not Implemented";
                case 502 -> "Bad Gateway";
                case 503 -> "Service Unavailable";
                case 504 -> "Gateway Timeout";
                default -> "";
            };
        }
    }
}
