package dev.shortcuts.model;

import java.util.Locale;

/**
 * Declared kind of a parameter in an action type's schema.
 */
public enum ParameterKind {
    STRING,
    NUMBER,
    BOOLEAN,
    /** Loop body. */
    ACTIONS,
    /** Then/else pair of a conditional. */
    BRANCHES,
    ANY;

    public static ParameterKind fromWire(String value) {
        if (value == null) {
            return ANY;
        }
        return switch (value.toLowerCase(Locale.ROOT)) {
            case "string", "text" -> STRING;
            case "number", "integer", "double" -> NUMBER;
            case "boolean", "bool" -> BOOLEAN;
            case "actions" -> ACTIONS;
            case "branches" -> BRANCHES;
            default -> ANY;
        };
    }

    /** Whether the given value satisfies this kind without coercion. */
    public boolean accepts(ParameterValue value) {
        return switch (this) {
            case STRING -> value instanceof ParameterValue.Text;
            case NUMBER -> value instanceof ParameterValue.Number;
            case BOOLEAN -> value instanceof ParameterValue.Bool;
            case ACTIONS -> value instanceof ParameterValue.ActionList;
            case BRANCHES -> value instanceof ParameterValue.Branches;
            case ANY -> !(value instanceof ParameterValue.ActionList)
                && !(value instanceof ParameterValue.Branches);
        };
    }
}
