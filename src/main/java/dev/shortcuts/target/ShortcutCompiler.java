package dev.shortcuts.target;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.shortcuts.model.Action;
import dev.shortcuts.model.ActionTypeDescriptor;
import dev.shortcuts.model.NestedList;
import dev.shortcuts.model.ParameterSpec;
import dev.shortcuts.model.ParameterValue;
import dev.shortcuts.model.Shortcut;
import dev.shortcuts.registry.ActionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Lowers a validated shortcut tree into the flat target document.
 *
 * <p>Records are emitted in pre-order: a conditional or loop record comes first, followed by
 * the records of its then branch, its else branch, or its body. Parameters missing from an
 * action fall back to the registry default for that key; keys with neither are left out.
 */
public final class ShortcutCompiler {

    private static final Logger logger = LoggerFactory.getLogger(ShortcutCompiler.class);

    private final ActionRegistry registry;
    private final Supplier<String> idGenerator;

    public ShortcutCompiler(ActionRegistry registry) {
        this(registry, () -> UUID.randomUUID().toString().toUpperCase(Locale.ROOT));
    }

    /** @param idGenerator source of record UUIDs and grouping identifiers */
    public ShortcutCompiler(ActionRegistry registry, Supplier<String> idGenerator) {
        this.registry = registry;
        this.idGenerator = idGenerator;
    }

    /**
     * @throws CompilationException naming the first action type without a target mapping
     */
    public TargetDocument compile(Shortcut shortcut) {
        List<Action> roots = shortcut.actions() == null ? List.of() : shortcut.actions();
        var records = new ArrayList<TargetAction>();

        Deque<Pending> stack = new ArrayDeque<>();
        pushAll(stack, roots, "");
        while (!stack.isEmpty()) {
            Pending next = stack.pop();
            records.add(lower(next.action(), next.location()));
            List<NestedList> nested = next.action().nestedLists();
            for (int i = nested.size() - 1; i >= 0; i--) {
                NestedList list = nested.get(i);
                pushAll(stack, list.actions(), next.location() + " > " + list.label());
            }
        }

        String name = shortcut.name() == null ? Shortcut.UNTITLED : shortcut.name();
        logger.debug("Compiled '{}' into {} records", name, records.size());
        return TargetDocument.of(name, IconCatalog.forActions(roots, registry), records);
    }

    private static void pushAll(Deque<Pending> stack, List<Action> actions, String prefix) {
        for (int i = actions.size() - 1; i >= 0; i--) {
            Action action = actions.get(i);
            String here = (prefix.isEmpty() ? "" : prefix + " > ") + action.type() + ":" + i;
            stack.push(new Pending(action, here));
        }
    }

    private TargetAction lower(Action action, String location) {
        if (action.type() == null) {
            throw new CompilationException(null, "Action at " + location + " has no type");
        }
        TargetMappings.Mapping mapping = TargetMappings.forType(action.type())
            .orElseThrow(() -> new CompilationException(action.type(),
                "Action type '" + action.type() + "' at " + location + " has no target mapping"));
        Optional<ActionTypeDescriptor> descriptor = registry.lookup(action.type());

        ObjectNode parameters = JsonNodeFactory.instance.objectNode();
        parameters.put(TargetAction.UUID_KEY, idGenerator.get());
        if (mapping.grouped()) {
            parameters.put(TargetAction.GROUPING_KEY, idGenerator.get());
        }
        for (TargetMappings.ParameterRule rule : mapping.rules()) {
            ParameterValue value = action.parameter(rule.internalKey())
                .filter(v -> !v.isNullish())
                .orElseGet(() -> descriptor
                    .flatMap(d -> d.parameter(rule.internalKey()))
                    .map(ParameterSpec::defaultValue)
                    .orElse(null));
            if (value == null) {
                continue;
            }
            JsonNode external = rule.toExternal().apply(value);
            parameters.set(rule.externalKey(), external);
        }
        mapping.constants().forEach(parameters::set);
        return new TargetAction(mapping.identifier(), parameters);
    }

    private record Pending(Action action, String location) {}
}
