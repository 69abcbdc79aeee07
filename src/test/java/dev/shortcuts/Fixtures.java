package dev.shortcuts;

import dev.shortcuts.model.Action;
import dev.shortcuts.model.ParameterValue;
import dev.shortcuts.model.Shortcut;
import dev.shortcuts.registry.ActionRegistry;
import dev.shortcuts.registry.JsonRegistrySource;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Shared test data: the bundled registry and a terse way to build actions.
 */
public final class Fixtures {

    private static ActionRegistry bundled;

    private Fixtures() {}

    public static synchronized ActionRegistry registry() {
        if (bundled == null) {
            try {
                bundled = ActionRegistry.of(JsonRegistrySource.classpath().loadRegistry().values());
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }
        return bundled;
    }

    /**
     * Builds an action from alternating keys and values. Strings, numbers, booleans and
     * action lists become the matching parameter variants; a ParameterValue is kept as is.
     */
    public static Action action(String type, Object... keyValues) {
        Map<String, ParameterValue> parameters = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            String key = (String) keyValues[i];
            Object value = keyValues[i + 1];
            ParameterValue parameter;
            if (value instanceof ParameterValue pv) {
                parameter = pv;
            } else if (value instanceof String s) {
                parameter = ParameterValue.text(s);
            } else if (value instanceof Boolean b) {
                parameter = ParameterValue.bool(b);
            } else if (value instanceof BigDecimal d) {
                parameter = new ParameterValue.Number(d);
            } else if (value instanceof Number n) {
                parameter = new ParameterValue.Number(new BigDecimal(n.toString()));
            } else if (value instanceof List<?> list) {
                parameter = ParameterValue.actions(actionList(list));
            } else {
                throw new IllegalArgumentException("Unsupported fixture value: " + value);
            }
            parameters.put(key, parameter);
        }
        return new Action(type, parameters);
    }

    private static List<Action> actionList(List<?> values) {
        var actions = new ArrayList<Action>();
        for (Object value : values) {
            actions.add(Action.class.cast(value));
        }
        return actions;
    }

    public static Action conditional(String condition, List<Action> thenActions, List<Action> elseActions) {
        return action("if", "condition", condition, Action.BRANCHES, ParameterValue.branches(thenActions, elseActions));
    }

    public static Shortcut shortcut(String name, Action... actions) {
        return new Shortcut(name, List.of(actions));
    }
}
