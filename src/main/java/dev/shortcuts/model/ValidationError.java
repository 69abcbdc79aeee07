package dev.shortcuts.model;

import java.util.List;

/**
 * A single validation finding.
 *
 * @param kind        category of the finding
 * @param message     human readable description
 * @param actionIndex index of the offending action within its own list, or null for root findings
 * @param path        breadcrumb through nested branches, e.g. {@code ["if:0", "then"]}; empty at top level
 * @param cause       the wrapped finding when {@code kind} is {@link ErrorKind#NESTED}
 */
public record ValidationError(
    ErrorKind kind,
    String message,
    Integer actionIndex,
    List<String> path,
    ValidationError cause
) {
    public ValidationError {
        path = path == null ? List.of() : List.copyOf(path);
    }

    public static ValidationError of(ErrorKind kind, String message) {
        return new ValidationError(kind, message, null, List.of(), null);
    }

    public static ValidationError at(ErrorKind kind, int actionIndex, String message) {
        return new ValidationError(kind, message, actionIndex, List.of(), null);
    }

    /** Wrap a finding raised inside a nested branch. */
    public static ValidationError nested(List<String> path, ValidationError cause) {
        String message = "%s: %s".formatted(String.join(" > ", path), cause.message());
        return new ValidationError(ErrorKind.NESTED, message, cause.actionIndex(), path, cause);
    }

    /** The underlying finding, unwrapping any {@link ErrorKind#NESTED} layers. */
    public ValidationError innermost() {
        ValidationError current = this;
        while (current.kind() == ErrorKind.NESTED && current.cause() != null) {
            current = current.cause();
        }
        return current;
    }
}
