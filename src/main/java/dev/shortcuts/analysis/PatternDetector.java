package dev.shortcuts.analysis;

import dev.shortcuts.model.Action;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Frequency patterns and the optimizations they suggest.
 */
final class PatternDetector {

    static final int REPEAT_THRESHOLD = 3;
    static final double LONG_WAIT_SECONDS = 5;
    static final int DEEP_NESTING = 3;

    private PatternDetector() {}

    static List<ActionPattern> patterns(List<LocatedAction> actions) {
        var counts = new LinkedHashMap<String, Integer>();
        var first = new LinkedHashMap<String, LocatedAction>();
        for (LocatedAction located : actions) {
            counts.merge(located.type(), 1, Integer::sum);
            first.putIfAbsent(located.type(), located);
        }
        var patterns = new ArrayList<ActionPattern>();
        for (Map.Entry<String, Integer> entry : counts.entrySet()) {
            patterns.add(new ActionPattern(entry.getKey(), entry.getValue(), context(first.get(entry.getKey()))));
        }
        return patterns;
    }

    static List<Optimization> optimizations(List<ActionPattern> patterns, List<LocatedAction> actions,
                                            ComplexityScore complexity) {
        var optimizations = new ArrayList<Optimization>();
        for (ActionPattern pattern : patterns) {
            if (pattern.frequency() > REPEAT_THRESHOLD) {
                optimizations.add(new Optimization(Optimization.Category.STRUCTURE,
                    "Repeated %s actions detected (%d occurrences)".formatted(pattern.type(), pattern.frequency()),
                    "Consider using a Repeat action or creating a sub-shortcut",
                    Severity.MEDIUM));
            }
        }
        for (LocatedAction located : actions) {
            Action action = located.action();
            if ("wait".equals(action.type()) && action.number("seconds").orElse(0.0) > LONG_WAIT_SECONDS) {
                optimizations.add(new Optimization(Optimization.Category.PERFORMANCE,
                    "Long wait time detected at action %d".formatted(located.flatIndex()),
                    "Consider using background tasks or notifications instead of wait actions",
                    Severity.HIGH));
            }
        }
        if (complexity.nestingDepth() > DEEP_NESTING) {
            optimizations.add(new Optimization(Optimization.Category.STRUCTURE,
                "Control flow is nested %d levels deep".formatted(complexity.nestingDepth()),
                "Consider moving inner branches into a separate shortcut",
                Severity.LOW));
        }
        return optimizations;
    }

    private static String context(LocatedAction located) {
        List<Action> siblings = located.siblings();
        int index = located.siblingIndex();
        String prev = index > 0 ? siblings.get(index - 1).type() : "start";
        String next = index < siblings.size() - 1 ? siblings.get(index + 1).type() : "end";
        return "%s -> %s -> %s".formatted(prev, located.type(), next);
    }
}
