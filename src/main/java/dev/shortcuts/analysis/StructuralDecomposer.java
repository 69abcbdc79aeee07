package dev.shortcuts.analysis;

import dev.shortcuts.model.Action;
import dev.shortcuts.model.ActionTypeDescriptor;
import dev.shortcuts.model.ControlFlow;
import dev.shortcuts.registry.ActionRegistry;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Splits the top-level action list into components: maximal runs of plain actions, and one
 * component per conditional or loop. Data flows between components are found by matching
 * a component's output tokens against the input tokens of later components.
 */
final class StructuralDecomposer {

    static final Set<String> INPUT_TYPES = Set.of(
        "ask", "select_photos", "take_photo", "record_audio", "files", "contacts");
    static final Set<String> OUTPUT_TYPES = Set.of(
        "notification", "show_result", "play_sound");

    private final ActionRegistry registry;

    StructuralDecomposer(ActionRegistry registry) {
        this.registry = registry;
    }

    /** Top-level index range of a component before its data flow is known. */
    private record Span(ComponentKind kind, int start, int end) {}

    Decomposition decompose(List<Action> topLevel, List<LocatedAction> flat, DependencyGraph graph) {
        List<Span> spans = spans(topLevel);

        int[] componentOf = new int[topLevel.size()];
        for (int c = 0; c < spans.size(); c++) {
            for (int i = spans.get(c).start(); i <= spans.get(c).end(); i++) {
                componentOf[i] = c;
            }
        }

        var inputs = new ArrayList<Set<String>>();
        var outputs = new ArrayList<Set<String>>();
        var sizes = new int[spans.size()];
        for (int c = 0; c < spans.size(); c++) {
            inputs.add(new LinkedHashSet<>());
            outputs.add(new LinkedHashSet<>());
        }
        for (LocatedAction located : flat) {
            sizes[componentOf[located.topLevelIndex()]]++;
        }
        for (LocatedAction located : flat) {
            int c = componentOf[located.topLevelIndex()];
            for (String token : PlaceholderTokens.consumedBy(located.action())) {
                boolean producedInside = graph.node(located.flatIndex()).dependencies().stream()
                    .anyMatch(e -> e.token().equals(token)
                        && componentOf[flat.get(e.producerIndex()).topLevelIndex()] == c);
                if (!producedInside) {
                    inputs.get(c).add(token);
                }
            }
        }
        for (DependencyEdge edge : graph.edges()) {
            outputs.get(componentOf[flat.get(edge.producerIndex()).topLevelIndex()]).add(edge.token());
        }

        var components = new ArrayList<Component>();
        for (int c = 0; c < spans.size(); c++) {
            Span span = spans.get(c);
            List<Action> members = List.copyOf(topLevel.subList(span.start(), span.end() + 1));
            boolean reusable = inputs.get(c).isEmpty() && sizes[c] >= 2;
            components.add(new Component(c, span.kind(), members, span.start(), span.end(),
                purpose(span.kind(), members), reusable, Set.copyOf(inputs.get(c)), Set.copyOf(outputs.get(c))));
        }

        var flows = new ArrayList<ComponentFlow>();
        for (Component from : components) {
            for (Component to : components) {
                if (to.id() <= from.id()) {
                    continue;
                }
                for (String token : outputs.get(from.id())) {
                    if (inputs.get(to.id()).contains(token)) {
                        flows.add(new ComponentFlow(from.id(), to.id(), token));
                    }
                }
            }
        }

        List<LocatedAction> entryPoints = flat.stream().filter(a -> INPUT_TYPES.contains(a.type())).toList();
        List<LocatedAction> exitPoints = flat.stream().filter(a -> OUTPUT_TYPES.contains(a.type())).toList();
        return new Decomposition(List.copyOf(components), List.copyOf(flows), entryPoints, exitPoints);
    }

    private static List<Span> spans(List<Action> topLevel) {
        var spans = new ArrayList<Span>();
        int runStart = -1;
        for (int i = 0; i < topLevel.size(); i++) {
            Optional<ControlFlow> flow = topLevel.get(i).controlFlow();
            if (flow.isEmpty()) {
                if (runStart < 0) {
                    runStart = i;
                }
                continue;
            }
            if (runStart >= 0) {
                spans.add(new Span(runKind(topLevel.subList(runStart, i)), runStart, i - 1));
                runStart = -1;
            }
            spans.add(new Span(flow.get() == ControlFlow.CONDITIONAL ? ComponentKind.CONDITIONAL : ComponentKind.LOOP, i, i));
        }
        if (runStart >= 0) {
            spans.add(new Span(runKind(topLevel.subList(runStart, topLevel.size())), runStart, topLevel.size() - 1));
        }
        return spans;
    }

    private static ComponentKind runKind(List<Action> run) {
        if (run.stream().allMatch(a -> INPUT_TYPES.contains(a.type()))) {
            return ComponentKind.INPUT;
        }
        if (run.stream().allMatch(a -> OUTPUT_TYPES.contains(a.type()))) {
            return ComponentKind.OUTPUT;
        }
        return ComponentKind.SEQUENCE;
    }

    private String purpose(ComponentKind kind, List<Action> members) {
        Action head = members.get(0);
        return switch (kind) {
            case CONDITIONAL -> "Branches on condition '%s'".formatted(head.text("condition").orElse("?"));
            case LOOP -> head.number("count")
                .map(count -> "Repeats %s times".formatted(formatCount(count)))
                .orElse("Repeats a block of actions");
            case INPUT -> "Collects input from the user";
            case OUTPUT -> "Presents results to the user";
            case SEQUENCE -> "Performs %s operations".formatted(dominantCategory(members));
        };
    }

    private String dominantCategory(List<Action> members) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (Action action : members) {
            String category = registry.lookup(action.type()).map(ActionTypeDescriptor::category).orElse("general");
            counts.merge(category, 1, Integer::sum);
        }
        String best = "general";
        int bestCount = 0;
        for (Map.Entry<String, Integer> entry : counts.entrySet()) {
            if (entry.getValue() > bestCount) {
                best = entry.getKey();
                bestCount = entry.getValue();
            }
        }
        return best;
    }

    private static String formatCount(double count) {
        return count == Math.rint(count) ? Long.toString((long) count) : Double.toString(count);
    }
}
