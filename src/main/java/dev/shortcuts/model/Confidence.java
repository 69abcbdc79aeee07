package dev.shortcuts.model;

/**
 * How much an inferred fact can be trusted. Direct registry mappings are {@link #HIGH};
 * identifier substring heuristics are never better than {@link #MEDIUM}.
 */
public enum Confidence {
    HIGH,
    MEDIUM,
    LOW
}
