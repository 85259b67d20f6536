package fr.lapetina.resilientfetch.infrastructure.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.resilientfetch.domain.error.HttpResponseException;
import fr.lapetina.resilientfetch.domain.error.SchemaValidationException;
import fr.lapetina.resilientfetch.domain.model.RawResponse;
import fr.lapetina.resilientfetch.domain.model.ResponseEnvelope;
import fr.lapetina.resilientfetch.domain.schema.ResponseSchema;
import fr.lapetina.resilientfetch.domain.schema.SchemaResult;

import java.util.Locale;
import java.util.Objects;

/**
 * Turns a raw transport response into a {@link ResponseEnvelope}.
 *
 * The body is decoded once; the raw bytes stay untouched, so materializing the same
 * response twice gives equal envelopes.
 */
public final class ResponseMaterializer {

    private static final String JSON_MEDIA_TYPE = "application/json";

    private final ObjectMapper objectMapper;

    public ResponseMaterializer(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "ObjectMapper is required");
    }

    public ResponseMaterializer() {
        this(JsonMapper.shared());
    }

    /**
     * @throws HttpResponseException if the response is neither ok nor redirected
     * @throws SchemaValidationException if the JSON body does not satisfy {@code schema}
     */
    public <T> ResponseEnvelope<T> materialize(RawResponse raw, ResponseSchema<T> schema) {
        Objects.requireNonNull(schema, "Schema is required");
        String text = raw.text();
        JsonNode tree = isJsonContentType(raw) ? parse(text) : null;

        if (!raw.ok() && !raw.redirected()) {
            throw new HttpResponseException(new ResponseEnvelope<>(raw, tree, tree != null, text));
        }

        if (tree == null) {
            return new ResponseEnvelope<>(raw, null, false, text);
        }

        SchemaResult<T> result = schema.validate(tree);
        if (!result.isValid()) {
            throw new SchemaValidationException(result.issues(), new ResponseEnvelope<T>(raw, null, true, text));
        }
        return new ResponseEnvelope<>(raw, result.value(), true, text);
    }

    static boolean isJsonContentType(RawResponse raw) {
        return raw.contentType()
                .map(value -> value.toLowerCase(Locale.ROOT).contains(JSON_MEDIA_TYPE))
                .orElse(false);
    }

    /**
     * @return the parsed tree, or null when the text is not a JSON document
     */
    private JsonNode parse(String text) {
        if (text.isBlank()) {
            return null;
        }
        try {
            JsonNode tree = objectMapper.readTree(text);
            return tree == null || tree.isMissingNode() ? null : tree;
        } catch (JsonProcessingException e) {
            return null;
        }
    }
}
