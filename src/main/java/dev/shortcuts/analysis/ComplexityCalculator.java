package dev.shortcuts.analysis;

import dev.shortcuts.model.ControlFlow;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

final class ComplexityCalculator {

    private ComplexityCalculator() {}

    static ComplexityScore score(List<LocatedAction> actions, DependencyGraph graph) {
        int nestingDepth = 0;
        int conditionals = 0;
        for (LocatedAction located : actions) {
            nestingDepth = Math.max(nestingDepth, located.controlDepth());
            if (located.action().controlFlow().orElse(null) == ControlFlow.CONDITIONAL) {
                conditionals++;
            }
        }

        // (input token, producing action) pairs
        Set<String> flows = new HashSet<>();
        for (DependencyEdge edge : graph.edges()) {
            flows.add(edge.token() + "\u0000" + edge.producerIndex());
        }

        double raw = 0.2 * actions.size() + 0.3 * nestingDepth + 0.3 * conditionals + 0.2 * flows.size();
        double score = BigDecimal.valueOf(raw).setScale(2, RoundingMode.HALF_UP).doubleValue();
        return new ComplexityScore(actions.size(), nestingDepth, conditionals, flows.size(), score);
    }
}
