package dev.shortcuts.target;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * One record of the flat action list, in the platform's vocabulary.
 */
public record TargetAction(String identifier, ObjectNode parameters) {

    public static final String UUID_KEY = "UUID";
    public static final String GROUPING_KEY = "GroupingIdentifier";

    public String uuid() {
        return parameters.path(UUID_KEY).asText(null);
    }

    public String groupingIdentifier() {
        return parameters.path(GROUPING_KEY).asText(null);
    }
}
