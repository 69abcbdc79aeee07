package dev.shortcuts.model;

/**
 * Categories of validation findings.
 */
public enum ErrorKind {
    STRUCTURE,
    LIMIT,
    CIRCULAR,
    INVALID_ACTION,
    PARAMETER,
    /** Wraps a finding from inside a nested branch; see {@link ValidationError#cause()}. */
    NESTED,
    /** Informational: the aggregated permission set. Never counted as an error. */
    PERMISSIONS
}
