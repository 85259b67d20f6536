package fr.lapetina.resilientfetch.domain.schema;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.BeanDescription;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.cfg.CoercionAction;
import com.fasterxml.jackson.databind.cfg.CoercionInputShape;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import com.fasterxml.jackson.databind.introspect.BeanPropertyDefinition;
import com.fasterxml.jackson.databind.type.LogicalType;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Schema backed by Jackson data binding: a document is valid when it binds to the target type
 * without any scalar coercion (a number is not accepted for a String, a string not for a number).
 *
 * Jackson stops binding at the first problem, so on failure the document is walked property by
 * property against the target type to report every offending value, in document order.
 */
public final class JacksonSchema<T> implements ResponseSchema<T> {

    private static final ObjectMapper STRICT_MAPPER = createStrictMapper();

    private final Class<T> type;

    public JacksonSchema(Class<T> type) {
        this.type = Objects.requireNonNull(type, "Target type is required");
    }

    @Override
    public SchemaResult<T> validate(JsonNode value) {
        try {
            T bound = STRICT_MAPPER.treeToValue(value, type);
            if (bound == null) {
                return SchemaResult.invalid(SchemaIssue.at("", "Expected " + describe(type) + ", received null"));
            }
            return SchemaResult.valid(bound);
        } catch (JsonMappingException e) {
            return SchemaResult.invalid(collectIssues(value, STRICT_MAPPER.constructType(type), "", e));
        } catch (IOException e) {
            return SchemaResult.invalid(SchemaIssue.at("", e.getMessage()));
        }
    }

    public Class<T> getType() {
        return type;
    }

    /**
     * Issues for {@code node} bound as {@code target}, given the binding already failed with
     * {@code failure}. Objects and arrays are descended into; anything else yields the failure itself.
     */
    private static List<SchemaIssue> collectIssues(JsonNode node, JavaType target, String path,
                                                   JsonMappingException failure) {
        List<SchemaIssue> issues = new ArrayList<>();
        if (node.isObject() && isBean(target)) {
            BeanDescription description = STRICT_MAPPER.getDeserializationConfig().introspect(target);
            Map<String, BeanPropertyDefinition> properties = new LinkedHashMap<>();
            for (BeanPropertyDefinition property : description.findProperties()) {
                if (property.couldDeserialize()) {
                    properties.put(property.getName(), property);
                }
            }

            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                BeanPropertyDefinition property = properties.remove(field.getKey());
                if (property != null) {
                    issues.addAll(issuesFor(field.getValue(), property.getPrimaryType(), join(path, field.getKey())));
                }
            }
            for (BeanPropertyDefinition missing : properties.values()) {
                if (missing.hasConstructorParameter() || missing.getPrimaryType().isPrimitive()) {
                    issues.add(SchemaIssue.at(join(path, missing.getName()), "Required"));
                }
            }
        } else if (node.isArray() && (target.isCollectionLikeType() || target.isArrayType())) {
            for (int i = 0; i < node.size(); i++) {
                issues.addAll(issuesFor(node.get(i), target.getContentType(), join(path, String.valueOf(i))));
            }
        }

        if (issues.isEmpty()) {
            issues.add(toIssue(failure, path));
        }
        return issues;
    }

    private static List<SchemaIssue> issuesFor(JsonNode node, JavaType target, String path) {
        try {
            STRICT_MAPPER.treeToValue(node, target);
            return List.of();
        } catch (JsonMappingException e) {
            return collectIssues(node, target, path, e);
        } catch (IOException e) {
            return List.of(SchemaIssue.at(path, e.getMessage()));
        }
    }

    private static boolean isBean(JavaType target) {
        return !target.isContainerType()
                && !target.isEnumType()
                && !target.isPrimitive()
                && !target.getRawClass().getName().startsWith("java.");
    }

    private static String join(String parent, String child) {
        return parent.isEmpty() ? child : parent + "." + child;
    }

    private static SchemaIssue toIssue(JsonMappingException e, String parentPath) {
        String relative = e.getPath().stream()
                .map(ref -> ref.getFieldName() != null ? ref.getFieldName() : String.valueOf(ref.getIndex()))
                .collect(Collectors.joining("."));
        String path = relative.isEmpty() ? parentPath : join(parentPath, relative);

        if (e instanceof MismatchedInputException mismatch && mismatch.getTargetType() != null) {
            JsonToken received = e.getProcessor() instanceof JsonParser parser ? parser.currentToken() : null;
            if (received != null && received.isScalarValue()) {
                return SchemaIssue.at(path,
                        "Expected " + describe(mismatch.getTargetType()) + ", received " + describe(received));
            }
        }
        return SchemaIssue.at(path, e.getOriginalMessage());
    }

    private static String describe(Class<?> type) {
        if (type == String.class || CharSequence.class.isAssignableFrom(type)) {
            return "string";
        }
        if (type == Boolean.class || type == boolean.class) {
            return "boolean";
        }
        if (Number.class.isAssignableFrom(type) || (type.isPrimitive() && type != char.class)) {
            return "number";
        }
        return type.getSimpleName();
    }

    private static String describe(JsonToken token) {
        return switch (token) {
            case VALUE_STRING -> "string";
            case VALUE_NUMBER_INT, VALUE_NUMBER_FLOAT -> "number";
            case VALUE_TRUE, VALUE_FALSE -> "boolean";
            case VALUE_NULL -> "null";
            default -> token.name().toLowerCase(Locale.ROOT);
        };
    }

    private static ObjectMapper createStrictMapper() {
        ObjectMapper mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES, true)
                .configure(DeserializationFeature.FAIL_ON_MISSING_CREATOR_PROPERTIES, true);

        for (CoercionInputShape shape : new CoercionInputShape[]{
                CoercionInputShape.Integer, CoercionInputShape.Float, CoercionInputShape.Boolean}) {
            mapper.coercionConfigFor(LogicalType.Textual).setCoercion(shape, CoercionAction.Fail);
        }
        mapper.coercionConfigFor(LogicalType.Integer).setCoercion(CoercionInputShape.String, CoercionAction.Fail);
        mapper.coercionConfigFor(LogicalType.Float).setCoercion(CoercionInputShape.String, CoercionAction.Fail);
        mapper.coercionConfigFor(LogicalType.Boolean).setCoercion(CoercionInputShape.String, CoercionAction.Fail);
        mapper.coercionConfigFor(LogicalType.Boolean).setCoercion(CoercionInputShape.Integer, CoercionAction.Fail);
        return mapper;
    }
}
