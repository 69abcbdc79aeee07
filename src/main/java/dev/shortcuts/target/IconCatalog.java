package dev.shortcuts.target;

import dev.shortcuts.model.Action;
import dev.shortcuts.registry.ActionRegistry;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Picks the workflow icon from the dominant registry category of the top-level actions.
 */
final class IconCatalog {

    private static final Map<String, WorkflowIcon> BY_CATEGORY = Map.ofEntries(
        Map.entry("text", WorkflowIcon.defaults()),
        Map.entry("notification", new WorkflowIcon(4282601983L, 59512L)),
        Map.entry("web", new WorkflowIcon(4282601983L, 59522L)),
        Map.entry("location", new WorkflowIcon(4292093695L, 59519L)),
        Map.entry("device", new WorkflowIcon(2071128575L, 59525L)),
        Map.entry("camera", new WorkflowIcon(4271458815L, 59529L)),
        Map.entry("media", new WorkflowIcon(4251333119L, 59515L)),
        Map.entry("scripting", new WorkflowIcon(431817727L, 59537L)),
        Map.entry("documents", new WorkflowIcon(4274264319L, 59541L)),
        Map.entry("calendar", new WorkflowIcon(4271458815L, 59535L)),
        Map.entry("contacts", new WorkflowIcon(3679049983L, 59535L)),
        Map.entry("health", new WorkflowIcon(4271458815L, 59549L)),
        Map.entry("home", new WorkflowIcon(4251333119L, 59553L))
    );

    private IconCatalog() {}

    static WorkflowIcon forActions(List<Action> actions, ActionRegistry registry) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (Action action : actions) {
            registry.lookup(action.type())
                .ifPresent(d -> counts.merge(d.category(), 1, Integer::sum));
        }
        String dominant = null;
        int best = 0;
        // first category wins a tie
        for (var entry : counts.entrySet()) {
            if (entry.getValue() > best) {
                dominant = entry.getKey();
                best = entry.getValue();
            }
        }
        return dominant == null ? WorkflowIcon.defaults() : BY_CATEGORY.getOrDefault(dominant, WorkflowIcon.defaults());
    }
}
