package dev.shortcuts.analysis;

import dev.shortcuts.model.Permission;
import dev.shortcuts.model.Shortcut;
import dev.shortcuts.registry.ActionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Static analysis of a validated shortcut. All passes share one pre-order walk of the tree.
 * The analyzer only reads its input and the registry snapshot, so one instance can serve
 * concurrent callers.
 */
public final class ShortcutAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(ShortcutAnalyzer.class);

    private final ActionRegistry registry;
    private final StructuralDecomposer decomposer;

    public ShortcutAnalyzer(ActionRegistry registry) {
        this.registry = registry;
        this.decomposer = new StructuralDecomposer(registry);
    }

    public AnalysisReport analyze(Shortcut shortcut) {
        List<LocatedAction> flat = ActionWalker.walk(shortcut.actions());

        List<ActionPattern> patterns = PatternDetector.patterns(flat);
        DependencyGraph graph = DependencyAnalyzer.analyze(flat);
        ComplexityScore complexity = ComplexityCalculator.score(flat, graph);
        List<Optimization> optimizations = PatternDetector.optimizations(patterns, flat, complexity);
        List<SecurityFinding> security = SecurityScanner.scan(flat);
        List<PermissionCheck> permissions = permissions(flat);
        Decomposition decomposition = decomposer.decompose(shortcut.actions(), flat, graph);

        logger.debug("Analyzed '{}': {} actions, {} edges, complexity {}, {} components",
            shortcut.name(), flat.size(), graph.edges().size(), complexity.score(),
            decomposition.components().size());
        return new AnalysisReport(patterns, optimizations, graph, complexity, security, permissions, decomposition);
    }

    private List<PermissionCheck> permissions(List<LocatedAction> flat) {
        Set<Permission> required = new LinkedHashSet<>();
        for (LocatedAction located : flat) {
            registry.lookup(located.type())
                .map(d -> d.requiredPermission())
                .filter(p -> p != Permission.NONE)
                .ifPresent(required::add);
        }
        var checks = new ArrayList<PermissionCheck>();
        for (Permission permission : required) {
            checks.add(new PermissionCheck(permission, true, permission.reason(), permission.alternative()));
        }
        return checks;
    }
}
