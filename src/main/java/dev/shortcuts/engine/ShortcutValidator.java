package dev.shortcuts.engine;

import dev.shortcuts.model.Action;
import dev.shortcuts.model.ActionTypeDescriptor;
import dev.shortcuts.model.ErrorKind;
import dev.shortcuts.model.ParameterKind;
import dev.shortcuts.model.ParameterSpec;
import dev.shortcuts.model.ParameterValue;
import dev.shortcuts.model.Permission;
import dev.shortcuts.model.Shortcut;
import dev.shortcuts.model.ValidationError;
import dev.shortcuts.model.ValidationLimits;
import dev.shortcuts.registry.ActionRegistry;
import dev.shortcuts.registry.IdentifierHeuristics;
import dev.shortcuts.registry.InferredAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Checks a shortcut tree against the action registry.
 * <p>
 * The whole tree is walked with an explicit stack, so the depth of nesting never touches
 * the call stack. Validation is not fail-fast: a rejected result lists every problem.
 * Rules:
 * <ol>
 *   <li>the name is present and not longer than the limit; actions form a list; every list
 *       is within {@link ValidationLimits#maxActions()} and the nesting limit, otherwise one
 *       {@link ErrorKind#LIMIT} is reported and that list is not descended</li>
 *   <li>an action whose {@code type:index} token already appears on its ancestor path is
 *       {@link ErrorKind#CIRCULAR} and is not descended</li>
 *   <li>every type resolves in the registry; parameters are sanitized, required keys must be
 *       present and unknown keys are rejected</li>
 *   <li>errors found inside a nested branch are wrapped as {@link ErrorKind#NESTED}</li>
 * </ol>
 */
public final class ShortcutValidator {

    private static final Logger logger = LoggerFactory.getLogger(ShortcutValidator.class);

    private static final int MAX_SUGGESTIONS = 3;
    /** Integer digits accepted for numeric parameters. */
    static final int MAX_INTEGER_DIGITS = 1000;

    private final ActionRegistry registry;
    private final ValidationLimits limits;
    private final IdentifierHeuristics heuristics = new IdentifierHeuristics();

    public ShortcutValidator(ActionRegistry registry) {
        this(registry, ValidationLimits.defaults());
    }

    public ShortcutValidator(ActionRegistry registry, ValidationLimits limits) {
        this.registry = registry;
        this.limits = limits;
    }

    /** A child list waiting to be rebuilt; {@code nodes} is null when it was not descended. */
    private record PendingList(List<Node> nodes, List<Action> original) {
        List<Action> build() {
            if (nodes == null) {
                return original;
            }
            return nodes.stream().map(n -> n.result).collect(Collectors.toList());
        }
    }

    private record PendingBranches(PendingList thenList, PendingList elseList) {}

    private static final class Node {
        final Action source;
        final int index;
        final List<String> path;
        final Set<String> ancestors;
        final int depth;
        final Map<String, Object> slots = new LinkedHashMap<>();
        boolean visited;
        Action result;

        Node(Action source, int index, List<String> path, Set<String> ancestors, int depth) {
            this.source = source;
            this.index = index;
            this.path = path;
            this.ancestors = ancestors;
            this.depth = depth;
        }
    }

    /** Sanitized value, or a problem description; both null means the value is absent. */
    private record Sanitized(ParameterValue value, String problem) {
        static Sanitized ok(ParameterValue value) {
            return new Sanitized(value, null);
        }

        static Sanitized problem(String problem) {
            return new Sanitized(null, problem);
        }
    }

    public ValidationResult validate(Shortcut shortcut) {
        var errors = new ArrayList<ValidationError>();
        var permissions = EnumSet.noneOf(Permission.class);

        if (shortcut == null) {
            errors.add(ValidationError.of(ErrorKind.STRUCTURE, "Shortcut is missing"));
            return new ValidationResult.Rejected(errors, permissions);
        }
        if (shortcut.name() == null || shortcut.name().isBlank()) {
            errors.add(ValidationError.of(ErrorKind.STRUCTURE, "Shortcut name is required"));
        } else if (shortcut.name().length() > limits.maxNameLength()) {
            errors.add(ValidationError.of(ErrorKind.STRUCTURE,
                "Shortcut name is too long (%d characters, maximum %d)"
                    .formatted(shortcut.name().length(), limits.maxNameLength())));
        }
        if (shortcut.actions() == null) {
            errors.add(ValidationError.of(ErrorKind.STRUCTURE, "Shortcut actions must be a list"));
            return new ValidationResult.Rejected(errors, permissions);
        }

        List<Node> roots = expand(shortcut.actions(), List.of(), Set.of(), 0, errors);
        int visitedCount = 0;
        if (roots != null) {
            Deque<Node> stack = new ArrayDeque<>();
            for (int i = roots.size() - 1; i >= 0; i--) {
                stack.push(roots.get(i));
            }
            while (!stack.isEmpty()) {
                Node node = stack.pop();
                if (node.visited) {
                    node.result = assemble(node);
                    continue;
                }
                node.visited = true;
                visitedCount++;
                stack.push(node);
                List<Node> children = visit(node, errors, permissions);
                for (int i = children.size() - 1; i >= 0; i--) {
                    stack.push(children.get(i));
                }
            }
        }

        logger.debug("Validated '{}': {} actions visited, {} errors, permissions {}",
            shortcut.name(), visitedCount, errors.size(), permissions);
        if (!errors.isEmpty()) {
            return new ValidationResult.Rejected(errors, permissions);
        }
        return new ValidationResult.Accepted(
            new Shortcut(shortcut.name(), new PendingList(roots, shortcut.actions()).build()),
            permissions);
    }

    /**
     * Turn a list into work nodes, or report a limit and return null so the list is kept
     * as is and not descended.
     */
    private List<Node> expand(List<Action> actions, List<String> path, Set<String> ancestors,
                              int depth, List<ValidationError> errors) {
        if (depth > limits.maxNestingDepth()) {
            report(errors, path, ValidationError.of(ErrorKind.LIMIT,
                "Nesting is deeper than %d levels".formatted(limits.maxNestingDepth())));
            return null;
        }
        if (actions.size() > limits.maxActions()) {
            report(errors, path, ValidationError.of(ErrorKind.LIMIT,
                "Too many actions: %d (maximum %d)".formatted(actions.size(), limits.maxActions())));
            return null;
        }
        var nodes = new ArrayList<Node>(actions.size());
        for (int i = 0; i < actions.size(); i++) {
            nodes.add(new Node(actions.get(i), i, path, ancestors, depth));
        }
        return nodes;
    }

    private List<Node> visit(Node node, List<ValidationError> errors, Set<Permission> permissions) {
        Action action = node.source;
        var children = new ArrayList<Node>();

        if (action.type() == null || action.type().isBlank()) {
            report(errors, node.path, ValidationError.at(ErrorKind.STRUCTURE, node.index,
                "Action at index %d has no type".formatted(node.index)));
            node.slots.putAll(action.parameters());
            return children;
        }

        String token = action.type() + ":" + node.index;
        boolean circular = node.ancestors.contains(token);
        if (circular) {
            report(errors, node.path, ValidationError.at(ErrorKind.CIRCULAR, node.index,
                "Action '%s' at index %d repeats an ancestor position (%s)"
                    .formatted(action.type(), node.index, token)));
        }

        ActionTypeDescriptor descriptor = registry.lookup(action.type()).orElse(null);
        if (descriptor == null) {
            report(errors, node.path, ValidationError.at(ErrorKind.INVALID_ACTION, node.index,
                unknownTypeMessage(action.type(), node.index)));
        } else if (descriptor.requiredPermission() != Permission.NONE) {
            permissions.add(descriptor.requiredPermission());
        }

        var present = new HashSet<String>();
        for (var entry : action.parameters().entrySet()) {
            String key = entry.getKey();
            ParameterValue value = entry.getValue();
            ParameterSpec spec = descriptor == null ? null : descriptor.parameter(key).orElse(null);

            if (descriptor != null && spec == null) {
                report(errors, node.path, ValidationError.at(ErrorKind.PARAMETER, node.index,
                    "Unknown parameter '%s' for action '%s'".formatted(displayKey(key), action.type())));
                node.slots.put(key, value);
                continue;
            }

            Sanitized sanitized = spec == null ? Sanitized.ok(value) : sanitize(value, spec);
            if (sanitized.problem() != null) {
                report(errors, node.path, ValidationError.at(ErrorKind.PARAMETER, node.index,
                    "Parameter '%s' of action '%s' has an invalid type: %s"
                        .formatted(displayKey(key), action.type(), sanitized.problem())));
                node.slots.put(key, value);
                present.add(key);
                continue;
            }
            if (sanitized.value() == null) {
                continue;
            }
            present.add(key);

            ParameterValue clean = sanitized.value();
            if (circular) {
                node.slots.put(key, clean);
            } else if (clean instanceof ParameterValue.ActionList list) {
                List<String> childPath = childPath(node.path, token, key);
                List<Node> nodes = expand(list.actions(), childPath, childAncestors(node, token), node.depth + 1, errors);
                node.slots.put(key, new PendingList(nodes, list.actions()));
                if (nodes != null) {
                    children.addAll(nodes);
                }
            } else if (clean instanceof ParameterValue.Branches branches) {
                PendingList thenList = branch(node, token, "then", branches.thenActions(), children, errors);
                PendingList elseList = branch(node, token, "else", branches.elseActions(), children, errors);
                node.slots.put(key, new PendingBranches(thenList, elseList));
            } else {
                node.slots.put(key, clean);
            }
        }

        if (descriptor != null) {
            for (ParameterSpec spec : descriptor.parameterSchema()) {
                if (spec.required() && !present.contains(spec.key())) {
                    report(errors, node.path, ValidationError.at(ErrorKind.PARAMETER, node.index,
                        "Missing required parameter '%s' for action '%s'"
                            .formatted(displayKey(spec.key()), action.type())));
                }
            }
        }
        return children;
    }

    private PendingList branch(Node node, String token, String label, List<Action> actions,
                               List<Node> children, List<ValidationError> errors) {
        if (actions == null) {
            return null;
        }
        List<Node> nodes = expand(actions, childPath(node.path, token, label),
            childAncestors(node, token), node.depth + 1, errors);
        if (nodes != null) {
            children.addAll(nodes);
        }
        return new PendingList(nodes, actions);
    }

    private static Action assemble(Node node) {
        var parameters = new LinkedHashMap<String, ParameterValue>();
        for (var entry : node.slots.entrySet()) {
            Object slot = entry.getValue();
            if (slot instanceof PendingList list) {
                parameters.put(entry.getKey(), new ParameterValue.ActionList(list.build()));
            } else if (slot instanceof PendingBranches branches) {
                parameters.put(entry.getKey(), new ParameterValue.Branches(
                    branches.thenList() == null ? null : branches.thenList().build(),
                    branches.elseList() == null ? null : branches.elseList().build()));
            } else {
                parameters.put(entry.getKey(), (ParameterValue) slot);
            }
        }
        return new Action(node.source.type(), parameters);
    }

    private static Sanitized sanitize(ParameterValue value, ParameterSpec spec) {
        if (value == null || value.isNullish()) {
            return spec.defaultValue() != null ? Sanitized.ok(spec.defaultValue()) : Sanitized.ok(null);
        }
        ParameterKind kind = spec.kind();
        if (value instanceof ParameterValue.Text text) {
            String trimmed = text.value().trim();
            switch (kind) {
                case STRING, ANY:
                    return Sanitized.ok(new ParameterValue.Text(trimmed));
                case NUMBER:
                    BigDecimal parsed;
                    try {
                        parsed = new BigDecimal(trimmed);
                    } catch (NumberFormatException e) {
                        return Sanitized.problem("expected number, got '%s'".formatted(trimmed));
                    }
                    return inRange(parsed)
                        ? Sanitized.ok(new ParameterValue.Number(round(parsed)))
                        : Sanitized.problem("number out of range: '%s'".formatted(trimmed));
                case BOOLEAN:
                    String lower = trimmed.toLowerCase(Locale.ROOT);
                    if (lower.equals("true") || lower.equals("false")) {
                        return Sanitized.ok(new ParameterValue.Bool(Boolean.parseBoolean(lower)));
                    }
                    return Sanitized.problem("expected boolean, got '%s'".formatted(trimmed));
                default:
                    return mismatch(kind, value);
            }
        }
        if (value instanceof ParameterValue.Number number) {
            if (!inRange(number.value())) {
                return Sanitized.problem("number out of range: %s".formatted(number.value()));
            }
            BigDecimal rounded = round(number.value());
            switch (kind) {
                case NUMBER, ANY:
                    return Sanitized.ok(new ParameterValue.Number(rounded));
                case STRING:
                    return Sanitized.ok(new ParameterValue.Text(rounded.toPlainString()));
                default:
                    return mismatch(kind, value);
            }
        }
        if (value instanceof ParameterValue.Bool bool) {
            switch (kind) {
                case BOOLEAN, ANY:
                    return Sanitized.ok(bool);
                case STRING:
                    return Sanitized.ok(new ParameterValue.Text(Boolean.toString(bool.value())));
                default:
                    return mismatch(kind, value);
            }
        }
        return kind.accepts(value) ? Sanitized.ok(value) : mismatch(kind, value);
    }

    private static Sanitized mismatch(ParameterKind kind, ParameterValue value) {
        return Sanitized.problem("expected %s, got %s"
            .formatted(kind.name().toLowerCase(Locale.ROOT), value.kindName()));
    }

    private static boolean inRange(BigDecimal value) {
        return value.precision() - value.scale() <= MAX_INTEGER_DIGITS;
    }

    /** Two decimal places, half up, without trailing zeros. */
    static BigDecimal round(BigDecimal value) {
        // below 0.001 in magnitude; skips rescaling tiny values with huge scales
        if (value.precision() - value.scale() <= -3) {
            return BigDecimal.ZERO;
        }
        BigDecimal rounded = value.setScale(2, RoundingMode.HALF_UP).stripTrailingZeros();
        return rounded.scale() < 0 ? rounded.setScale(0) : rounded;
    }

    private String unknownTypeMessage(String type, int index) {
        String message = "Unknown action type '%s' at index %d".formatted(type, index);
        InferredAction guess = heuristics.infer(type).orElse(null);
        if (guess == null) {
            return message;
        }
        List<String> similar = registry.allByCategory(guess.category()).stream()
            .map(ActionTypeDescriptor::type)
            .limit(MAX_SUGGESTIONS)
            .toList();
        return similar.isEmpty() ? message : message + ". Similar actions: " + String.join(", ", similar);
    }

    private static String displayKey(String key) {
        return Action.BRANCHES.equals(key) ? "then/else" : key;
    }

    private static List<String> childPath(List<String> path, String token, String label) {
        var child = new ArrayList<>(path);
        child.add(token);
        child.add(label);
        return child;
    }

    private static Set<String> childAncestors(Node node, String token) {
        var ancestors = new HashSet<>(node.ancestors);
        ancestors.add(token);
        return ancestors;
    }

    private static void report(List<ValidationError> errors, List<String> path, ValidationError error) {
        errors.add(path.isEmpty() ? error : ValidationError.nested(path, error));
    }
}
