package dev.shortcuts.model;

/**
 * One entry of an action type's parameter schema.
 *
 * @param defaultValue value substituted for a null parameter; may be null
 */
public record ParameterSpec(
    String key,
    ParameterKind kind,
    boolean required,
    ParameterValue defaultValue
) {
    public static ParameterSpec required(String key, ParameterKind kind) {
        return new ParameterSpec(key, kind, true, null);
    }

    public static ParameterSpec optional(String key, ParameterKind kind, ParameterValue defaultValue) {
        return new ParameterSpec(key, kind, false, defaultValue);
    }
}
