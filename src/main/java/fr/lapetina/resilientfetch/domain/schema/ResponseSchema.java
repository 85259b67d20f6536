package fr.lapetina.resilientfetch.domain.schema;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Validates a parsed JSON response body and maps it to the type callers work with.
 *
 * <p>This is the only contract the pipeline has with a validation engine; plug any
 * engine in by implementing it.
 *
 * @param <T> type of the validated value
 */
@FunctionalInterface
public interface ResponseSchema<T> {

    SchemaResult<T> validate(JsonNode value);

    /**
     * Accepts any JSON document as-is. Used when no schema is configured.
     */
    static ResponseSchema<JsonNode> json() {
        return SchemaResult::valid;
    }

    /**
     * Binds the document to {@code type} with Jackson, rejecting type coercions.
     */
    static <T> ResponseSchema<T> of(Class<T> type) {
        return new JacksonSchema<>(type);
    }
}
