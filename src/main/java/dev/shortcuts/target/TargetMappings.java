package dev.shortcuts.target;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.TextNode;
import dev.shortcuts.model.JsonValues;
import dev.shortcuts.model.ParameterValue;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Type-by-type translation between internal actions and platform records. There is no
 * generic fallback: a type without an entry here cannot be compiled.
 */
final class TargetMappings {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    /** One parameter, translated in both directions. */
    record ParameterRule(
        String internalKey,
        String externalKey,
        Function<ParameterValue, JsonNode> toExternal,
        Function<JsonNode, ParameterValue> toInternal
    ) {}

    /**
     * @param constants fixed external parameters emitted for every record of this type
     * @param grouped   whether records need a grouping identifier
     */
    record Mapping(
        String type,
        String identifier,
        List<ParameterRule> rules,
        Map<String, JsonNode> constants,
        boolean grouped
    ) {}

    private static final Map<String, Mapping> BY_TYPE = new LinkedHashMap<>();
    private static final Map<String, Mapping> BY_IDENTIFIER = new LinkedHashMap<>();

    static {
        add("text", "is.workflow.actions.gettext", direct("text", "WFTextActionText"));
        add("number", "is.workflow.actions.number", direct("value", "WFNumberActionNumber"));
        add("ask", "is.workflow.actions.ask",
            direct("prompt", "WFAskActionPrompt"),
            direct("defaultValue", "WFAskActionDefaultAnswer"));
        addGrouped("if", "is.workflow.actions.conditional", direct("condition", "WFConditionalActionString"));
        addGrouped("repeat", "is.workflow.actions.repeat.count", direct("count", "WFRepeatCount"));
        add("wait", "is.workflow.actions.delay", direct("seconds", "WFDelayTime"));
        add("play_sound", "is.workflow.actions.playsound", direct("sound", "WFPlaySoundActionSound"));
        add("record_audio", "is.workflow.actions.recordaudio", direct("quality", "WFRecordingCompression"));
        register(new Mapping("take_photo", "is.workflow.actions.takephoto",
            List.of(camera("useFrontCamera", "WFCameraCaptureDevice"),
                direct("flash", "WFCameraCaptureFlashMode")),
            Map.of("WFCameraCaptureShowPreview", BooleanNode.TRUE), false));
        add("select_photos", "is.workflow.actions.selectphotos", direct("multiple", "WFSelectMultiplePhotos"));
        add("set_volume", "is.workflow.actions.setvolume", percent("level", "WFSetVolumeActionVolume"));
        add("set_brightness", "is.workflow.actions.setbrightness", percent("level", "WFSetBrightnessActionBrightness"));
        add("set_do_not_disturb", "is.workflow.actions.dnd.set", direct("enabled", "Enabled"));
        add("url", "is.workflow.actions.url", direct("url", "WFURLActionURL"));
        add("notification", "is.workflow.actions.shownotification",
            direct("title", "WFNotificationActionTitle"),
            direct("body", "WFNotificationActionBody"),
            direct("sound", "WFNotificationActionSound"));
        add("files", "is.workflow.actions.documentpicker.open", direct("path", "WFGetFilePath"));
        add("calendar", "is.workflow.actions.addnewevent",
            direct("title", "WFCalendarItemTitle"),
            direct("startDate", "WFCalendarItemStartDate"),
            direct("endDate", "WFCalendarItemEndDate"));
        add("contacts", "is.workflow.actions.contacts", direct("query", "WFContactSearchQuery"));
        add("get_location", "is.workflow.actions.location", direct("accuracy", "WFLocationAccuracy"));
        add("get_directions", "is.workflow.actions.getdirections",
            direct("destination", "WFDestination"),
            direct("mode", "WFGetDirectionsActionMode"));
        add("log_health", "is.workflow.actions.health.quantity.log",
            direct("sample", "WFQuantitySampleType"),
            direct("value", "WFQuantitySampleQuantity"));
        add("get_health", "is.workflow.actions.health.quantity.get", direct("sample", "WFQuantitySampleType"));
        add("control_devices", "is.workflow.actions.homekit.set",
            direct("device", "WFHomeAccessory"),
            direct("state", "WFHomeCharacteristicValue"));
        add("get_device_state", "is.workflow.actions.homekit.get", direct("device", "WFHomeAccessory"));
    }

    private TargetMappings() {}

    static Optional<Mapping> forType(String type) {
        return Optional.ofNullable(BY_TYPE.get(type));
    }

    static Optional<Mapping> forIdentifier(String identifier) {
        return Optional.ofNullable(BY_IDENTIFIER.get(identifier));
    }

    static Map<String, Mapping> all() {
        return Map.copyOf(BY_TYPE);
    }

    private static void add(String type, String identifier, ParameterRule... rules) {
        register(new Mapping(type, identifier, List.of(rules), Map.of(), false));
    }

    private static void addGrouped(String type, String identifier, ParameterRule... rules) {
        register(new Mapping(type, identifier, List.of(rules), Map.of(), true));
    }

    private static void register(Mapping mapping) {
        BY_TYPE.put(mapping.type(), mapping);
        BY_IDENTIFIER.put(mapping.identifier(), mapping);
    }

    private static ParameterRule direct(String internalKey, String externalKey) {
        return new ParameterRule(internalKey, externalKey, JsonValues::toJson, JsonValues::toValue);
    }

    /** 0-100 internally, 0-1 on the platform. */
    private static ParameterRule percent(String internalKey, String externalKey) {
        return new ParameterRule(internalKey, externalKey,
            value -> value instanceof ParameterValue.Number number
                ? JsonValues.numberNode(number.value().divide(HUNDRED))
                : JsonValues.toJson(value),
            node -> node.isNumber()
                ? new ParameterValue.Number(node.decimalValue().multiply(HUNDRED))
                : JsonValues.toValue(node));
    }

    /** Boolean "use front camera" internally, Front/Back device name on the platform. */
    private static ParameterRule camera(String internalKey, String externalKey) {
        return new ParameterRule(internalKey, externalKey,
            value -> TextNode.valueOf(value instanceof ParameterValue.Bool bool && bool.value() ? "Front" : "Back"),
            node -> new ParameterValue.Bool("Front".equalsIgnoreCase(node.asText())));
    }
}
