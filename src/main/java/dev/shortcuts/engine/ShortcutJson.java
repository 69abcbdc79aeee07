package dev.shortcuts.engine;

import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.shortcuts.model.Action;
import dev.shortcuts.model.JsonValues;
import dev.shortcuts.model.ParameterValue;
import dev.shortcuts.model.Shortcut;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads and writes the JSON interchange form:
 * {@code { "name": ..., "actions": [ { "type": ..., "parameters": { ... } } ] }}.
 * <p>
 * Conditionals use {@code then}/{@code else} arrays, loops an {@code actions} array. Reading
 * is lenient about structure (a missing name or a non-list {@code actions} is left for the
 * validator to report) and only fails on input that is not a JSON object or that carries a
 * NaN or infinite parameter. Floating point literals are read as {@code BigDecimal}, so
 * parsed text never produces the latter; trees built elsewhere can.
 */
public final class ShortcutJson {

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);

    private static final String THEN = "then";
    private static final String ELSE = "else";
    private static final String LOOP_BODY = "actions";

    private ShortcutJson() {}

    public static ParseResult parse(String json) {
        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            JsonLocation location = e.getLocation();
            return new ParseResult.Failed(new ParseError(
                "Invalid JSON: " + e.getOriginalMessage(),
                location == null ? -1 : location.getLineNr(),
                location == null ? -1 : location.getColumnNr()));
        }
        return fromTree(root);
    }

    public static ParseResult parseFile(Path path) throws IOException {
        return parse(Files.readString(path));
    }

    public static ParseResult fromTree(JsonNode root) {
        if (root == null || !root.isObject()) {
            return new ParseResult.Failed(ParseError.of("Shortcut JSON must be an object"));
        }
        JsonNode name = root.get("name");
        JsonNode actions = root.get("actions");
        try {
            return new ParseResult.Parsed(new Shortcut(
                name != null && name.isTextual() ? name.asText() : null,
                actions != null && actions.isArray() ? parseActions(actions) : null));
        } catch (NonFiniteNumberException e) {
            return new ParseResult.Failed(ParseError.of(e.getMessage()));
        }
    }

    public static String write(Shortcut shortcut) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(toTree(shortcut));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize shortcut " + shortcut.name(), e);
        }
    }

    public static ObjectNode toTree(Shortcut shortcut) {
        ObjectNode root = MAPPER.createObjectNode();
        root.put("name", shortcut.name());
        if (shortcut.actions() != null) {
            root.set("actions", writeActions(shortcut.actions()));
        }
        return root;
    }

    private static List<Action> parseActions(JsonNode array) {
        var actions = new ArrayList<Action>();
        array.forEach(node -> actions.add(parseAction(node)));
        return actions;
    }

    private static Action parseAction(JsonNode node) {
        JsonNode type = node.get("type");
        JsonNode parameters = node.get("parameters");
        return new Action(
            type != null && type.isTextual() ? type.asText() : null,
            parameters != null && parameters.isObject() ? parseParameters(parameters) : Map.of());
    }

    private static Map<String, ParameterValue> parseParameters(JsonNode node) {
        var parameters = new LinkedHashMap<String, ParameterValue>();
        List<Action> thenActions = null;
        List<Action> elseActions = null;
        for (var entry : node.properties()) {
            String key = entry.getKey();
            JsonNode value = entry.getValue();
            if (value.isArray() && (THEN.equals(key) || ELSE.equals(key))) {
                if (THEN.equals(key)) {
                    thenActions = parseActions(value);
                } else {
                    elseActions = parseActions(value);
                }
                // reserve the position of the first branch key
                parameters.putIfAbsent(Action.BRANCHES, null);
            } else if (value.isArray() && LOOP_BODY.equals(key)) {
                parameters.put(key, new ParameterValue.ActionList(parseActions(value)));
            } else if ((value.isDouble() || value.isFloat()) && !Double.isFinite(value.doubleValue())) {
                throw new NonFiniteNumberException("Parameter '%s' is not a finite number".formatted(key));
            } else {
                parameters.put(key, JsonValues.toValue(value));
            }
        }
        if (parameters.containsKey(Action.BRANCHES)) {
            parameters.put(Action.BRANCHES, new ParameterValue.Branches(thenActions, elseActions));
        }
        return parameters;
    }

    private static ArrayNode writeActions(List<Action> actions) {
        ArrayNode array = MAPPER.createArrayNode();
        for (Action action : actions) {
            ObjectNode node = array.addObject();
            node.put("type", action.type());
            node.set("parameters", writeParameters(action.parameters()));
        }
        return array;
    }

    private static ObjectNode writeParameters(Map<String, ParameterValue> parameters) {
        ObjectNode node = MAPPER.createObjectNode();
        for (var entry : parameters.entrySet()) {
            ParameterValue value = entry.getValue();
            if (value instanceof ParameterValue.Branches branches) {
                if (branches.thenActions() != null) {
                    node.set(THEN, writeActions(branches.thenActions()));
                }
                if (branches.elseActions() != null) {
                    node.set(ELSE, writeActions(branches.elseActions()));
                }
            } else if (value instanceof ParameterValue.ActionList list) {
                node.set(entry.getKey(), writeActions(list.actions()));
            } else {
                node.set(entry.getKey(), JsonValues.toJson(value));
            }
        }
        return node;
    }

    private static final class NonFiniteNumberException extends RuntimeException {
        NonFiniteNumberException(String message) {
            super(message);
        }
    }
}
