package dev.shortcuts.registry;

import dev.shortcuts.model.ActionTypeDescriptor;
import dev.shortcuts.model.Confidence;

import java.util.Optional;

/**
 * Direct registry mapping. Matches either an external identifier or an internal type.
 */
public final class RegistryInference implements ActionInference {

    private final ActionRegistry registry;

    public RegistryInference(ActionRegistry registry) {
        this.registry = registry;
    }

    @Override
    public Optional<InferredAction> infer(String identifier) {
        return registry.lookupByIdentifier(identifier)
            .or(() -> registry.lookup(identifier))
            .map(this::toInferred);
    }

    private InferredAction toInferred(ActionTypeDescriptor descriptor) {
        return new InferredAction(
            descriptor.type(),
            descriptor.category(),
            descriptor.requiredPermission(),
            descriptor.acceptedValueKinds(),
            descriptor.producedValueKinds(),
            Confidence.HIGH,
            "Direct mapping for " + descriptor.identifier()
        );
    }
}
