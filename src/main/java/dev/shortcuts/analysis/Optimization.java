package dev.shortcuts.analysis;

/**
 * A suggested improvement.
 */
public record Optimization(Category category, String description, String suggestion, Severity impact) {

    public enum Category {
        PERFORMANCE,
        STRUCTURE,
        SAFETY
    }
}
