package dev.shortcuts.target;

import com.fasterxml.jackson.databind.JsonNode;
import dev.shortcuts.model.Action;
import dev.shortcuts.model.ActionTypeDescriptor;
import dev.shortcuts.model.Confidence;
import dev.shortcuts.model.JsonValues;
import dev.shortcuts.model.ParameterKind;
import dev.shortcuts.model.ParameterSpec;
import dev.shortcuts.model.ParameterValue;
import dev.shortcuts.model.Shortcut;
import dev.shortcuts.registry.ActionRegistry;
import dev.shortcuts.registry.IdentifierHeuristics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Lifts a target document back into the IR on a best-effort basis.
 *
 * <p>Records whose identifier is registered get the registered type and their parameters
 * translated back (HIGH confidence). Anything else takes the last identifier segment as its
 * type and keeps its parameters verbatim (LOW). Record UUIDs and grouping identifiers are
 * dropped, and the flat list stays flat: grouped bodies are not re-nested, so a loop comes
 * back with an empty body followed by what used to be inside it.
 */
public final class ShortcutDecompiler {

    private static final Logger logger = LoggerFactory.getLogger(ShortcutDecompiler.class);

    private final ActionRegistry registry;

    public ShortcutDecompiler(ActionRegistry registry) {
        this.registry = registry;
    }

    public Decompilation decompile(TargetDocument document) {
        var actions = new ArrayList<Action>();
        var resolutions = new ArrayList<TypeResolution>();
        List<TargetAction> records = document.actions();
        for (int i = 0; i < records.size(); i++) {
            TargetAction record = records.get(i);
            String identifier = record.identifier();
            var descriptor = identifier == null ? null : registry.lookupByIdentifier(identifier).orElse(null);
            var mapping = descriptor == null ? null : TargetMappings.forType(descriptor.type()).orElse(null);

            Action action;
            Confidence confidence;
            if (descriptor != null && mapping != null) {
                action = new Action(descriptor.type(), withEmptyBodies(reverse(record, mapping), descriptor));
                confidence = Confidence.HIGH;
            } else if (descriptor != null) {
                action = new Action(descriptor.type(), withEmptyBodies(passThrough(record, Set.of()), descriptor));
                confidence = Confidence.HIGH;
            } else {
                String type = identifier == null ? null : IdentifierHeuristics.lastSegment(identifier);
                action = new Action(type, passThrough(record, Set.of()));
                confidence = Confidence.LOW;
                logger.warn("Unregistered identifier '{}' at record {} decompiled as '{}'", identifier, i, type);
            }
            actions.add(action);
            resolutions.add(new TypeResolution(i, identifier, action.type(), confidence));
        }
        String name = document.name() == null || document.name().isBlank() ? Shortcut.UNTITLED : document.name();
        return new Decompilation(new Shortcut(name, actions), resolutions);
    }

    private static Map<String, ParameterValue> reverse(TargetAction record, TargetMappings.Mapping mapping) {
        Map<String, ParameterValue> parameters = new LinkedHashMap<>();
        Set<String> consumed = new HashSet<>(mapping.constants().keySet());
        for (TargetMappings.ParameterRule rule : mapping.rules()) {
            JsonNode external = record.parameters().get(rule.externalKey());
            consumed.add(rule.externalKey());
            if (external != null && !external.isNull()) {
                parameters.put(rule.internalKey(), rule.toInternal().apply(external));
            }
        }
        parameters.putAll(passThrough(record, consumed));
        return parameters;
    }

    /** Loop bodies are not carried by the record; an empty one keeps the action valid. */
    private static Map<String, ParameterValue> withEmptyBodies(
            Map<String, ParameterValue> parameters, ActionTypeDescriptor descriptor) {
        for (ParameterSpec spec : descriptor.parameterSchema()) {
            if (spec.kind() == ParameterKind.ACTIONS) {
                parameters.putIfAbsent(spec.key(), new ParameterValue.ActionList(List.of()));
            }
        }
        return parameters;
    }

    /** Remaining record parameters, minus bookkeeping keys and the ones already consumed. */
    private static Map<String, ParameterValue> passThrough(TargetAction record, Set<String> consumed) {
        Map<String, ParameterValue> parameters = new LinkedHashMap<>();
        if (record.parameters() == null) {
            return parameters;
        }
        record.parameters().fields().forEachRemaining(entry -> {
            String key = entry.getKey();
            if (TargetAction.UUID_KEY.equals(key) || TargetAction.GROUPING_KEY.equals(key) || consumed.contains(key)) {
                return;
            }
            parameters.put(key, JsonValues.toValue(entry.getValue()));
        });
        return parameters;
    }
}
