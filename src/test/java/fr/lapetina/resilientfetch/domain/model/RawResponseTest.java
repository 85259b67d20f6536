package fr.lapetina.resilientfetch.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpHeaders;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RawResponseTest {

    private static RawResponse response(int status, String contentType, byte[] body) {
        return new RawResponse(status, null,
                HttpHeaders.of(Map.of("Content-Type", List.of(contentType)), (name, value) -> true),
                URI.create("https://api.example.com"), false, body);
    }

    @Test
    @DisplayName("should decode the body with the charset of the content type")
    void shouldDecodeWithCharset() {
        RawResponse raw = response(200, "text/plain; charset=ISO-8859-1",
                "café".getBytes(StandardCharsets.ISO_8859_1));

        assertThat(raw.text()).isEqualTo("café");
    }

    @Test
    @DisplayName("should fall back to UTF-8 for an unknown charset")
    void shouldFallBackToUtf8() {
        RawResponse raw = response(200, "text/plain; charset=not-a-charset",
                "café".getBytes(StandardCharsets.UTF_8));

        assertThat(raw.text()).isEqualTo("café");
    }

    @Test
    @DisplayName("should derive the reason phrase when none is given")
    void shouldDeriveStatusText() {
        assertThat(response(200, "text/plain", new byte[0]).statusText()).isEqualTo("OK");
        assertThat(response(429, "text/plain", new byte[0]).statusText()).isEqualTo("Too Many Requests");
        assertThat(response(299, "text/plain", new byte[0]).ok()).isTrue();
        assertThat(response(300, "text/plain", new byte[0]).ok()).isFalse();
    }

    @Test
    @DisplayName("should keep its body when the caller changes the bytes it passed in or got back")
    void shouldNotShareBodyArray() {
        byte[] bytes = "{\"id\":1}".getBytes(StandardCharsets.UTF_8);
        RawResponse raw = response(200, "application/json", bytes);

        bytes[0] = 'X';
        raw.body()[1] = 'Y';

        assertThat(raw.text()).isEqualTo("{\"id\":1}");
        assertThat(raw).isEqualTo(response(200, "application/json", "{\"id\":1}".getBytes(StandardCharsets.UTF_8)));
    }
}
