package dev.shortcuts.analysis;

import java.util.List;

/**
 * Dependency view of one action.
 *
 * @param dependencies edges from earlier actions whose output this action consumes
 * @param dependents   edges to later actions that consume this action's output
 */
public record DependencyNode(
    int index,
    String type,
    List<String> path,
    List<DependencyEdge> dependencies,
    List<DependencyEdge> dependents
) {
    public List<String> dependencyTypes() {
        return dependencies.stream().map(DependencyEdge::producerType).toList();
    }

    public List<String> dependentTypes() {
        return dependents.stream().map(DependencyEdge::consumerType).toList();
    }
}
