package dev.shortcuts.engine;

import dev.shortcuts.model.ErrorKind;
import dev.shortcuts.model.Permission;
import dev.shortcuts.model.Shortcut;
import dev.shortcuts.model.ValidationError;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Outcome of validating a shortcut. Both variants carry the permissions the tree needs.
 */
public sealed interface ValidationResult {

    /** The tree passed every check; {@code shortcut} is the sanitized copy. */
    record Accepted(Shortcut shortcut, Set<Permission> permissions) implements ValidationResult {
        public Accepted {
            permissions = Set.copyOf(permissions);
        }
    }

    /** Every problem found in one pass, in document order. */
    record Rejected(List<ValidationError> errors, Set<Permission> permissions) implements ValidationResult {
        public Rejected {
            errors = List.copyOf(errors);
            permissions = Set.copyOf(permissions);
        }
    }

    Set<Permission> permissions();

    default boolean isAccepted() {
        return this instanceof Accepted;
    }

    default List<ValidationError> errors() {
        return this instanceof Rejected rejected ? rejected.errors() : List.of();
    }

    /**
     * Errors followed by one informational {@link ErrorKind#PERMISSIONS} entry listing the
     * required permissions, when there are any.
     */
    default List<ValidationError> issues() {
        var issues = new ArrayList<>(errors());
        if (!permissions().isEmpty()) {
            String names = permissions().stream()
                .sorted()
                .map(Permission::wireName)
                .collect(Collectors.joining(", "));
            issues.add(ValidationError.of(ErrorKind.PERMISSIONS, "Required permissions: " + names));
        }
        return issues;
    }
}
