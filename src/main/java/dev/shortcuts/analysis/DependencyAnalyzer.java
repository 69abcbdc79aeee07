package dev.shortcuts.analysis;

import dev.shortcuts.model.Action;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Best-effort data flow: each placeholder is resolved to the nearest earlier action that
 * looks like it produces a value of that name. This is string matching, not type checking.
 * <ul>
 *   <li>{@code ask} whose prompt mentions the name</li>
 *   <li>{@code text} whose literal text (placeholders removed) mentions the name</li>
 *   <li>{@code get_location} when the name mentions "location"</li>
 * </ul>
 */
final class DependencyAnalyzer {

    private DependencyAnalyzer() {}

    static DependencyGraph analyze(List<LocatedAction> actions) {
        var edges = new ArrayList<DependencyEdge>();
        var unresolved = new LinkedHashSet<String>();

        for (LocatedAction consumer : actions) {
            for (String token : PlaceholderTokens.consumedBy(consumer.action())) {
                LocatedAction producer = findProducer(actions, consumer.flatIndex(), token);
                if (producer == null) {
                    unresolved.add(token);
                    continue;
                }
                edges.add(new DependencyEdge(producer.flatIndex(), producer.type(),
                    consumer.flatIndex(), consumer.type(), token));
            }
        }

        var nodes = new ArrayList<DependencyNode>(actions.size());
        for (LocatedAction located : actions) {
            int index = located.flatIndex();
            nodes.add(new DependencyNode(index, located.type(), located.path(),
                edges.stream().filter(e -> e.consumerIndex() == index).toList(),
                edges.stream().filter(e -> e.producerIndex() == index).toList()));
        }
        return new DependencyGraph(List.copyOf(nodes), List.copyOf(edges), Set.copyOf(unresolved));
    }

    private static LocatedAction findProducer(List<LocatedAction> actions, int before, String token) {
        String needle = token.toLowerCase(Locale.ROOT);
        for (int i = before - 1; i >= 0; i--) {
            LocatedAction candidate = actions.get(i);
            if (produces(candidate.action(), needle)) {
                return candidate;
            }
        }
        return null;
    }

    private static boolean produces(Action action, String needle) {
        if (action.type() == null) {
            return false;
        }
        return switch (action.type()) {
            case "ask" -> action.text("prompt")
                .map(p -> p.toLowerCase(Locale.ROOT).contains(needle))
                .orElse(false);
            case "text" -> action.text("text")
                .map(t -> PlaceholderTokens.stripPlaceholders(t).toLowerCase(Locale.ROOT).contains(needle))
                .orElse(false);
            case "get_location" -> needle.contains("location");
            default -> false;
        };
    }
}
