package dev.shortcuts.engine;

import dev.shortcuts.model.Permission;
import dev.shortcuts.model.ValidationError;

import java.util.List;
import java.util.Set;

/**
 * Outcome of a pipeline stage that only runs on an accepted shortcut.
 */
public sealed interface PipelineResult<T> {

    record Completed<T>(T value, Set<Permission> permissions) implements PipelineResult<T> {
        public Completed {
            permissions = Set.copyOf(permissions);
        }
    }

    /** Validation failed, so the stage did not run. */
    record Rejected<T>(ValidationResult.Rejected validation) implements PipelineResult<T> {
        public List<ValidationError> errors() {
            return validation.errors();
        }
    }
}
