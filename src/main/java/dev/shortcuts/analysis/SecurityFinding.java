package dev.shortcuts.analysis;

/**
 * Risk attached to a single action.
 *
 * @param weakness CWE identifier of the weakness category, e.g. {@code CWE-319}
 */
public record SecurityFinding(
    int actionIndex,
    String actionType,
    String area,
    Severity risk,
    String description,
    String mitigation,
    String weakness
) {}
