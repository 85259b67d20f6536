package fr.lapetina.resilientfetch.infrastructure.http;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * The Jackson configuration used for request bodies and response parsing.
 */
public final class JsonMapper {

    private static final ObjectMapper SHARED = create();

    private JsonMapper() {
    }

    public static ObjectMapper create() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Shared instance. ObjectMapper is thread-safe once configured; do not reconfigure it.
     */
    public static ObjectMapper shared() {
        return SHARED;
    }
}
