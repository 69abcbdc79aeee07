package dev.shortcuts.analysis;

import java.util.List;

/**
 * Everything the analyzer computes for one shortcut.
 */
public record AnalysisReport(
    List<ActionPattern> patterns,
    List<Optimization> optimizations,
    DependencyGraph dependencies,
    ComplexityScore complexity,
    List<SecurityFinding> security,
    List<PermissionCheck> permissions,
    Decomposition decomposition
) {}
