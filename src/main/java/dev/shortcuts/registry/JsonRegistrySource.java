package dev.shortcuts.registry;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.shortcuts.model.ActionTypeDescriptor;
import dev.shortcuts.model.Confidence;
import dev.shortcuts.model.JsonValues;
import dev.shortcuts.model.ParameterKind;
import dev.shortcuts.model.ParameterSpec;
import dev.shortcuts.model.Permission;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Loads registry data from JSON. The bundled data lives at {@value #DEFAULT_RESOURCE}.
 *
 * <pre>
 * { "actions": [ { "type": "text", "identifier": "is.workflow.actions.gettext",
 *                  "name": "Text", "category": "text", "permission": "none",
 *                  "parameters": [ { "key": "text", "type": "string", "required": true } ],
 *                  "inputTypes": [], "outputTypes": ["text"] } ] }
 * </pre>
 *
 * Entries that omit {@code category} or {@code permission} are completed by
 * {@link IdentifierHeuristics} and keep its confidence.
 */
public final class JsonRegistrySource implements RegistrySource {

    public static final String DEFAULT_RESOURCE = "/action-registry.json";

    private static final Logger logger = LoggerFactory.getLogger(JsonRegistrySource.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private interface TreeReader {
        JsonNode read() throws IOException;
    }

    private final String description;
    private final TreeReader reader;
    private final IdentifierHeuristics heuristics = new IdentifierHeuristics();

    private JsonRegistrySource(String description, TreeReader reader) {
        this.description = description;
        this.reader = reader;
    }

    public static JsonRegistrySource classpath() {
        return classpath(DEFAULT_RESOURCE);
    }

    public static JsonRegistrySource classpath(String resource) {
        return new JsonRegistrySource("classpath:" + resource, () -> {
            try (InputStream in = JsonRegistrySource.class.getResourceAsStream(resource)) {
                if (in == null) {
                    throw new IOException("Registry resource not found: " + resource);
                }
                return MAPPER.readTree(in);
            }
        });
    }

    public static JsonRegistrySource fromFile(Path path) {
        return new JsonRegistrySource(path.toString(), () -> MAPPER.readTree(path.toFile()));
    }

    public static JsonRegistrySource fromString(String json) {
        return new JsonRegistrySource("inline", () -> MAPPER.readTree(json));
    }

    @Override
    public Map<String, ActionTypeDescriptor> loadRegistry() throws IOException {
        JsonNode root = reader.read();
        JsonNode actions = root == null ? null : root.get("actions");
        if (actions == null || !actions.isArray()) {
            throw new IllegalArgumentException("Registry data must contain an 'actions' array: " + description);
        }
        var descriptors = new LinkedHashMap<String, ActionTypeDescriptor>();
        for (JsonNode node : actions) {
            ActionTypeDescriptor descriptor = parseDescriptor(node);
            if (descriptors.putIfAbsent(descriptor.type(), descriptor) != null) {
                throw new IllegalArgumentException("Duplicate action type in registry data: " + descriptor.type());
            }
        }
        logger.debug("Read {} action types from {}", descriptors.size(), description);
        return descriptors;
    }

    private ActionTypeDescriptor parseDescriptor(JsonNode node) {
        String type = requiredText(node, "type");
        String identifier = requiredText(node, "identifier");
        String name = node.has("name") ? node.get("name").asText() : type;

        InferredAction inferred = null;
        if (!node.hasNonNull("category") || !node.hasNonNull("permission")) {
            inferred = heuristics.infer(identifier).orElseThrow();
            if (inferred.confidence() == Confidence.LOW) {
                logger.warn("Registry entry '{}' has no category/permission and no heuristic match", type);
            }
        }
        String category = node.hasNonNull("category") ? node.get("category").asText() : inferred.category();
        Permission permission = node.hasNonNull("permission")
            ? Permission.fromWire(node.get("permission").asText())
            : inferred.permission();
        Confidence confidence = inferred == null ? Confidence.HIGH : inferred.confidence();

        return new ActionTypeDescriptor(
            type,
            identifier,
            name,
            category,
            parseSchema(type, node.get("parameters")),
            permission,
            textSet(node.get("inputTypes")),
            textSet(node.get("outputTypes")),
            confidence
        );
    }

    private static List<ParameterSpec> parseSchema(String type, JsonNode parameters) {
        var schema = new ArrayList<ParameterSpec>();
        if (parameters == null) {
            return schema;
        }
        for (JsonNode param : parameters) {
            String key = requiredText(param, "key");
            if (schema.stream().anyMatch(p -> p.key().equals(key))) {
                throw new IllegalArgumentException("Duplicate parameter '%s' for action type '%s'".formatted(key, type));
            }
            schema.add(new ParameterSpec(
                key,
                ParameterKind.fromWire(param.path("type").asText(null)),
                param.path("required").asBoolean(false),
                param.has("default") ? JsonValues.toValue(param.get("default")) : null
            ));
        }
        return schema;
    }

    private static Set<String> textSet(JsonNode node) {
        var values = new LinkedHashSet<String>();
        if (node != null) {
            node.forEach(v -> values.add(v.asText()));
        }
        return values;
    }

    private static String requiredText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            throw new IllegalArgumentException("Registry entry is missing '%s': %s".formatted(field, node));
        }
        return value.asText();
    }
}
