package dev.shortcuts.model;

import java.util.List;

/**
 * A nested action list of a control-flow action, with the label used in error paths
 * ({@code then}, {@code else}, or the parameter key of a loop body).
 */
public record NestedList(String label, List<Action> actions) {}
