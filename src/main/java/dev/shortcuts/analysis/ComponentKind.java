package dev.shortcuts.analysis;

public enum ComponentKind {
    SEQUENCE,
    CONDITIONAL,
    LOOP,
    INPUT,
    OUTPUT
}
