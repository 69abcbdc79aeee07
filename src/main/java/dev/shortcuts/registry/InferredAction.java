package dev.shortcuts.registry;

import dev.shortcuts.model.Confidence;
import dev.shortcuts.model.Permission;

import java.util.Set;

/**
 * Result of resolving an identifier to an action type, with the confidence of the guess.
 *
 * @param type   internal action type
 * @param reason short explanation, kept for diagnostics
 */
public record InferredAction(
    String type,
    String category,
    Permission permission,
    Set<String> acceptedValueKinds,
    Set<String> producedValueKinds,
    Confidence confidence,
    String reason
) {}
