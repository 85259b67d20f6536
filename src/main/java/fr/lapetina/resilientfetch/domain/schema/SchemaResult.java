package fr.lapetina.resilientfetch.domain.schema;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of validating a JSON value: either the validated value or a non-empty list of issues.
 */
public final class SchemaResult<T> {

    private final T value;
    private final List<SchemaIssue> issues;

    private SchemaResult(T value, List<SchemaIssue> issues) {
        this.value = value;
        this.issues = issues;
    }

    public static <T> SchemaResult<T> valid(T value) {
        return new SchemaResult<>(Objects.requireNonNull(value, "Validated value is required"), List.of());
    }

    public static <T> SchemaResult<T> invalid(List<SchemaIssue> issues) {
        if (issues == null || issues.isEmpty()) {
            throw new IllegalArgumentException("An invalid result needs at least one issue");
        }
        return new SchemaResult<>(null, List.copyOf(issues));
    }

    public static <T> SchemaResult<T> invalid(SchemaIssue issue) {
        return invalid(List.of(issue));
    }

    public boolean isValid() {
        return issues.isEmpty();
    }

    /**
     * @throws IllegalStateException if the result is invalid
     */
    public T value() {
        if (!isValid()) {
            throw new IllegalStateException("No value on an invalid result: " + issues);
        }
        return value;
    }

    public List<SchemaIssue> issues() {
        return issues;
    }
}
