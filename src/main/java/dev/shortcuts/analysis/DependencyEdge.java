package dev.shortcuts.analysis;

/**
 * Data flow from a producing action to a consuming one through a placeholder token.
 * Indices are pre-order positions in the whole tree.
 */
public record DependencyEdge(
    int producerIndex,
    String producerType,
    int consumerIndex,
    String consumerType,
    String token
) {}
