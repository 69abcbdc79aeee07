package dev.shortcuts.analysis;

import java.util.List;
import java.util.Set;

/**
 * Producer/consumer edges inferred from placeholders.
 *
 * @param unresolved tokens no earlier action could be matched to
 */
public record DependencyGraph(List<DependencyNode> nodes, List<DependencyEdge> edges, Set<String> unresolved) {

    public DependencyNode node(int index) {
        return nodes.get(index);
    }
}
