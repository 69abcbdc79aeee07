package dev.shortcuts.model;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Registry entry describing one action type.
 *
 * @param type               internal action type used in the IR, e.g. {@code notification}
 * @param identifier         stable external namespaced identifier, e.g. {@code is.workflow.actions.shownotification}
 * @param parameterSchema    ordered parameter schema
 * @param confidence         how the category and permission were obtained
 */
public record ActionTypeDescriptor(
    String type,
    String identifier,
    String displayName,
    String category,
    List<ParameterSpec> parameterSchema,
    Permission requiredPermission,
    Set<String> acceptedValueKinds,
    Set<String> producedValueKinds,
    Confidence confidence
) {
    public ActionTypeDescriptor {
        parameterSchema = List.copyOf(parameterSchema);
        acceptedValueKinds = Set.copyOf(acceptedValueKinds);
        producedValueKinds = Set.copyOf(producedValueKinds);
    }

    public Optional<ParameterSpec> parameter(String key) {
        return parameterSchema.stream().filter(p -> p.key().equals(key)).findFirst();
    }
}
