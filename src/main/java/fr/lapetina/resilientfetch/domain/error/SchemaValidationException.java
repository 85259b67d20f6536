package fr.lapetina.resilientfetch.domain.error;

import fr.lapetina.resilientfetch.domain.model.ResponseEnvelope;
import fr.lapetina.resilientfetch.domain.schema.SchemaIssue;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Thrown when a JSON response body does not satisfy the configured schema.
 * The envelope it carries has no data, only the raw JSON text.
 */
public final class SchemaValidationException extends FetchException {

    private final List<SchemaIssue> issues;
    private final ResponseEnvelope<?> response;

    public SchemaValidationException(List<SchemaIssue> issues, ResponseEnvelope<?> response) {
        super(buildMessage(issues));
        this.issues = List.copyOf(issues);
        this.response = response;
    }

    public List<SchemaIssue> getIssues() {
        return issues;
    }

    public ResponseEnvelope<?> getResponse() {
        return response;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.SCHEMA_VALIDATION;
    }

    private static String buildMessage(List<SchemaIssue> issues) {
        String numbered = IntStream.range(0, issues.size())
                .mapToObj(i -> (i + 1) + ". " + issues.get(i))
                .collect(Collectors.joining("; "));
        return "Response failed schema validation: " + numbered;
    }
}
