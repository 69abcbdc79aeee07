package dev.shortcuts.registry;

import dev.shortcuts.model.ActionTypeDescriptor;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Immutable lookup from action type to its descriptor. Safe to share between threads;
 * growing the registry produces a new instance, see {@link #extendedWith(Collection)}.
 */
public final class ActionRegistry {

    private static final ActionRegistry EMPTY = new ActionRegistry(Map.of(), Map.of());

    private final Map<String, ActionTypeDescriptor> byType;
    private final Map<String, ActionTypeDescriptor> byIdentifier;

    private ActionRegistry(Map<String, ActionTypeDescriptor> byType,
                           Map<String, ActionTypeDescriptor> byIdentifier) {
        this.byType = byType;
        this.byIdentifier = byIdentifier;
    }

    public static ActionRegistry empty() {
        return EMPTY;
    }

    /**
     * Build a registry from descriptors in iteration order.
     *
     * @throws IllegalArgumentException if two descriptors share a type
     */
    public static ActionRegistry of(Collection<ActionTypeDescriptor> descriptors) {
        return EMPTY.extendedWith(descriptors);
    }

    public Optional<ActionTypeDescriptor> lookup(String type) {
        return type == null ? Optional.empty() : Optional.ofNullable(byType.get(type));
    }

    /** Reverse lookup by external identifier. The first registered type wins on clashes. */
    public Optional<ActionTypeDescriptor> lookupByIdentifier(String identifier) {
        return identifier == null ? Optional.empty() : Optional.ofNullable(byIdentifier.get(identifier));
    }

    public List<ActionTypeDescriptor> allByCategory(String category) {
        var matches = new ArrayList<ActionTypeDescriptor>();
        for (ActionTypeDescriptor descriptor : byType.values()) {
            if (descriptor.category().equals(category)) {
                matches.add(descriptor);
            }
        }
        return matches;
    }

    public Collection<ActionTypeDescriptor> all() {
        return byType.values();
    }

    public Set<String> categories() {
        var categories = new TreeSet<String>();
        byType.values().forEach(d -> categories.add(d.category()));
        return categories;
    }

    public int size() {
        return byType.size();
    }

    /**
     * Append descriptors, returning a new registry. Existing entries are never replaced.
     *
     * @throws IllegalArgumentException if a type is already registered
     */
    public ActionRegistry extendedWith(Collection<ActionTypeDescriptor> descriptors) {
        var types = new LinkedHashMap<>(byType);
        var identifiers = new LinkedHashMap<>(byIdentifier);
        for (ActionTypeDescriptor descriptor : descriptors) {
            if (types.putIfAbsent(descriptor.type(), descriptor) != null) {
                throw new IllegalArgumentException("Action type already registered: " + descriptor.type());
            }
            identifiers.putIfAbsent(descriptor.identifier(), descriptor);
        }
        return new ActionRegistry(Collections.unmodifiableMap(types), Collections.unmodifiableMap(identifiers));
    }
}
