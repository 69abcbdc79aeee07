package dev.shortcuts.model;

/**
 * Kind of control flow an action introduces.
 */
public enum ControlFlow {
    CONDITIONAL,
    LOOP
}
