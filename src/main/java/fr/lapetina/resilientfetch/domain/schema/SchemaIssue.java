package fr.lapetina.resilientfetch.domain.schema;

import java.util.Objects;

/**
 * One validation problem: what is wrong, and where in the document.
 *
 * @param message human readable description, e.g. "Expected string, received number"
 * @param path    dotted path to the offending value, empty for the document root
 */
public record SchemaIssue(String message, String path) {

    public SchemaIssue {
        Objects.requireNonNull(message, "Message is required");
        path = path != null ? path : "";
    }

    public static SchemaIssue at(String path, String message) {
        return new SchemaIssue(message, path);
    }

    @Override
    public String toString() {
        return path.isEmpty() ? message : message + " at \"" + path + "\"";
    }
}
