package fr.lapetina.resilientfetch.domain.error;

import com.fasterxml.jackson.databind.JsonNode;
import fr.lapetina.resilientfetch.domain.model.ResponseEnvelope;

import java.util.ArrayList;
import java.util.List;

/**
 * Thrown for a non-2xx, non-redirect response. The body has already been read into
 * the envelope so the message can quote the server's own error fields.
 */
public class HttpResponseException extends FetchException {

    private final ResponseEnvelope<JsonNode> response;

    public HttpResponseException(ResponseEnvelope<JsonNode> response) {
        this(response, null);
    }

    protected HttpResponseException(ResponseEnvelope<JsonNode> response, String context) {
        super(buildMessage(response, context));
        this.response = response;
    }

    public ResponseEnvelope<JsonNode> getResponse() {
        return response;
    }

    public int getStatus() {
        return response.status();
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.HTTP_RESPONSE;
    }

    /**
     * Best-effort extraction of the server error: {@code error.{type,code,message}},
     * then a string {@code error}, then {@code errorMessages}, then the raw body.
     */
    static String buildMessage(ResponseEnvelope<JsonNode> response, String context) {
        String detail = response.data()
                .filter(data -> response.isJson())
                .map(HttpResponseException::extractError)
                .filter(extracted -> !extracted.isEmpty())
                .orElse(response.dataString());

        StringBuilder message = new StringBuilder();
        if (context != null && !context.isEmpty()) {
            message.append(context).append("; ");
        }
        return message.append(detail)
                .append("; HTTP Error Response: ")
                .append(response.status())
                .append(' ')
                .append(response.statusText())
                .toString();
    }

    private static String extractError(JsonNode data) {
        StringBuilder extracted = new StringBuilder();
        JsonNode error = data.path("error");
        if (error.isObject()) {
            if (hasValue(error.get("type"))) {
                extracted.append('(').append(error.get("type").asText()).append("): ");
            }
            if (hasValue(error.get("code"))) {
                extracted.append('(').append(error.get("code").asText()).append("): ");
            }
            if (hasValue(error.get("message"))) {
                extracted.append(error.get("message").asText());
            }
        } else if (error.isTextual()) {
            extracted.append(error.asText());
        }

        JsonNode errorMessages = data.path("errorMessages");
        if (errorMessages.isArray()) {
            List<String> messages = new ArrayList<>();
            errorMessages.forEach(node -> messages.add(node.asText()));
            extracted.append(String.join("; ", messages));
        }
        return extracted.toString();
    }

    private static boolean hasValue(JsonNode node) {
        return node != null && !node.isNull() && !node.asText().isEmpty();
    }
}
