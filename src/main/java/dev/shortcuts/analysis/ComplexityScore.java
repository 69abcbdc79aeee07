package dev.shortcuts.analysis;

/**
 * Weighted complexity: {@code 0.2 * actionCount + 0.3 * nestingDepth
 * + 0.3 * conditionalComplexity + 0.2 * dataFlowComplexity}, rounded to two decimals.
 */
public record ComplexityScore(
    int actionCount,
    int nestingDepth,
    int conditionalComplexity,
    int dataFlowComplexity,
    double score
) {}
