package dev.shortcuts.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A single node of the shortcut tree. Parameters keep their insertion order.
 */
public record Action(String type, Map<String, ParameterValue> parameters) {

    /** Internal key under which a conditional keeps its then/else pair. */
    public static final String BRANCHES = "branches";

    public static final String CONDITIONAL_TYPE = "if";
    public static final String LOOP_TYPE = "repeat";

    public Action {
        parameters = parameters == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    public static Action of(String type) {
        return new Action(type, Map.of());
    }

    public Optional<ParameterValue> parameter(String key) {
        return Optional.ofNullable(parameters.get(key));
    }

    /** String value of a parameter, if it is a {@link ParameterValue.Text}. */
    public Optional<String> text(String key) {
        ParameterValue value = parameters.get(key);
        if (value instanceof ParameterValue.Text text) {
            return Optional.ofNullable(text.value());
        }
        return Optional.empty();
    }

    /** Numeric value of a parameter, if it is a {@link ParameterValue.Number}. */
    public Optional<Double> number(String key) {
        ParameterValue value = parameters.get(key);
        if (value instanceof ParameterValue.Number number) {
            return Optional.of(number.value().doubleValue());
        }
        return Optional.empty();
    }

    /**
     * The control flow this action introduces: conditionals carry branches, loops carry
     * an action list body.
     */
    public Optional<ControlFlow> controlFlow() {
        if (CONDITIONAL_TYPE.equals(type)) {
            return Optional.of(ControlFlow.CONDITIONAL);
        }
        if (LOOP_TYPE.equals(type)) {
            return Optional.of(ControlFlow.LOOP);
        }
        for (ParameterValue value : parameters.values()) {
            if (value instanceof ParameterValue.Branches) {
                return Optional.of(ControlFlow.CONDITIONAL);
            }
            if (value instanceof ParameterValue.ActionList) {
                return Optional.of(ControlFlow.LOOP);
            }
        }
        return Optional.empty();
    }

    /** Nested lists in parameter order; then before else. */
    public List<NestedList> nestedLists() {
        var lists = new ArrayList<NestedList>();
        for (var entry : parameters.entrySet()) {
            ParameterValue value = entry.getValue();
            if (value instanceof ParameterValue.ActionList list) {
                lists.add(new NestedList(entry.getKey(), list.actions()));
            } else if (value instanceof ParameterValue.Branches branches) {
                if (branches.thenActions() != null) {
                    lists.add(new NestedList("then", branches.thenActions()));
                }
                if (branches.elseActions() != null) {
                    lists.add(new NestedList("else", branches.elseActions()));
                }
            }
        }
        return lists;
    }
}
