package dev.shortcuts.registry;

import java.util.Optional;

/**
 * Strategy that maps an external (or internal) identifier to an action type.
 * Strategies are chained from most to least trustworthy.
 */
@FunctionalInterface
public interface ActionInference {

    Optional<InferredAction> infer(String identifier);

    /** Try this strategy first and fall back to {@code next}. */
    default ActionInference orElse(ActionInference next) {
        return identifier -> {
            Optional<InferredAction> inferred = infer(identifier);
            return inferred.isPresent() ? inferred : next.infer(identifier);
        };
    }
}
