package dev.shortcuts.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

import java.math.BigDecimal;
import java.util.List;

/**
 * Tagged value of a single action parameter.
 * Nested action lists only ever appear as {@link ActionList} or {@link Branches}.
 */
public sealed interface ParameterValue {

    /** Literal string, possibly containing {@code {name}} placeholders. */
    record Text(String value) implements ParameterValue {}

    record Number(BigDecimal value) implements ParameterValue {}

    record Bool(boolean value) implements ParameterValue {}

    /** Loop body. */
    record ActionList(List<Action> actions) implements ParameterValue {
        public ActionList {
            actions = List.copyOf(actions);
        }
    }

    /**
     * The two branches of a conditional. A branch that was absent in the source is null,
     * an empty branch is an empty list.
     */
    record Branches(List<Action> thenActions, List<Action> elseActions) implements ParameterValue {
        public Branches {
            thenActions = thenActions == null ? null : List.copyOf(thenActions);
            elseActions = elseActions == null ? null : List.copyOf(elseActions);
        }
    }

    /** Any structured value the IR does not interpret (dictionaries, arrays, JSON null). */
    record Opaque(JsonNode value) implements ParameterValue {
        public Opaque {
            value = value == null ? NullNode.getInstance() : value;
        }
    }

    static ParameterValue text(String value) {
        return new Text(value);
    }

    static ParameterValue number(long value) {
        return new Number(BigDecimal.valueOf(value));
    }

    static ParameterValue number(double value) {
        return new Number(BigDecimal.valueOf(value));
    }

    static ParameterValue bool(boolean value) {
        return new Bool(value);
    }

    static ParameterValue actions(List<Action> actions) {
        return new ActionList(actions);
    }

    static ParameterValue branches(List<Action> thenActions, List<Action> elseActions) {
        return new Branches(thenActions, elseActions);
    }

    /** True for a JSON null carried through as an opaque value. */
    @JsonIgnore
    default boolean isNullish() {
        return this instanceof Opaque opaque && opaque.value().isNull();
    }

    /** Short name of the variant, used in error messages. */
    default String kindName() {
        if (this instanceof Text) {
            return "string";
        } else if (this instanceof Number) {
            return "number";
        } else if (this instanceof Bool) {
            return "boolean";
        } else if (this instanceof ActionList) {
            return "action list";
        } else if (this instanceof Branches) {
            return "branches";
        }
        return isNullish() ? "null" : "structured value";
    }
}
