package dev.shortcuts.model;

/**
 * Size ceilings applied by the validator.
 */
public record ValidationLimits(
    int maxActions,
    int maxNameLength,
    int maxNestingDepth
) {
    public static final int DEFAULT_MAX_ACTIONS = 50;
    public static final int DEFAULT_MAX_NAME_LENGTH = 255;
    public static final int DEFAULT_MAX_NESTING_DEPTH = 10;

    public ValidationLimits {
        if (maxActions < 1 || maxNameLength < 1 || maxNestingDepth < 1) {
            throw new IllegalArgumentException("Validation limits must be positive");
        }
    }

    public static ValidationLimits defaults() {
        return new ValidationLimits(DEFAULT_MAX_ACTIONS, DEFAULT_MAX_NAME_LENGTH, DEFAULT_MAX_NESTING_DEPTH);
    }

    public ValidationLimits withMaxActions(int value) {
        return new ValidationLimits(value, maxNameLength, maxNestingDepth);
    }

    public ValidationLimits withMaxNestingDepth(int value) {
        return new ValidationLimits(maxActions, maxNameLength, value);
    }
}
