package dev.shortcuts.target;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.shortcuts.model.Action;
import dev.shortcuts.model.Confidence;
import dev.shortcuts.model.ParameterValue;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static dev.shortcuts.Fixtures.registry;
import static org.assertj.core.api.Assertions.assertThat;

class ShortcutDecompilerTest {

    private final ShortcutDecompiler decompiler = new ShortcutDecompiler(registry());

    private static ObjectNode parameters() {
        return JsonNodeFactory.instance.objectNode();
    }

    @Test
    void registeredIdentifiersAreReverseMapped() {
        ObjectNode volume = parameters().put("UUID", "A").put("WFSetVolumeActionVolume", 0.4);
        ObjectNode conditional = parameters().put("UUID", "B").put("GroupingIdentifier", "G")
            .put("WFConditionalActionString", "x");
        TargetDocument document = TargetDocument.of("Lifted", WorkflowIcon.defaults(), List.of(
            new TargetAction("is.workflow.actions.setvolume", volume),
            new TargetAction("is.workflow.actions.conditional", conditional)));

        Decompilation decompilation = decompiler.decompile(document);

        List<Action> actions = decompilation.shortcut().actions();
        assertThat(actions.get(0).type()).isEqualTo("set_volume");
        assertThat(((ParameterValue.Number) actions.get(0).parameters().get("level")).value())
            .isEqualByComparingTo(new BigDecimal("40"));
        assertThat(actions.get(1).parameters()).containsOnlyKeys("condition");
        assertThat(decompilation.resolutions()).extracting(TypeResolution::confidence)
            .containsOnly(Confidence.HIGH);
        assertThat(decompilation.lowConfidence()).isEmpty();
    }

    @Test
    void unknownIdentifiersUseTheLastSegment() {
        ObjectNode raw = parameters().put("UUID", "C").put("WFInput", "abc").put("WFCount", 3);
        raw.putObject("WFDictionary").put("k", "v");
        TargetDocument document = TargetDocument.of("Third party", WorkflowIcon.defaults(), List.of(
            new TargetAction("com.vendor.app.DoThingIntent", raw)));

        Decompilation decompilation = decompiler.decompile(document);

        Action action = decompilation.shortcut().actions().get(0);
        assertThat(action.type()).isEqualTo("DoThingIntent");
        assertThat(action.parameters()).containsOnlyKeys("WFInput", "WFCount", "WFDictionary");
        assertThat(action.parameter("WFInput")).contains(ParameterValue.text("abc"));
        assertThat(action.parameter("WFDictionary").orElseThrow()).isInstanceOf(ParameterValue.Opaque.class);
        assertThat(decompilation.lowConfidence()).singleElement()
            .satisfies(r -> {
                assertThat(r.index()).isZero();
                assertThat(r.externalIdentifier()).isEqualTo("com.vendor.app.DoThingIntent");
            });
    }

    @Test
    void unmappedKeysOfRegisteredTypesPassThrough() {
        ObjectNode text = parameters().put("WFTextActionText", "hi").put("Extra", true);
        TargetDocument document = TargetDocument.of("Extra", WorkflowIcon.defaults(), List.of(
            new TargetAction("is.workflow.actions.gettext", text)));

        Action action = decompiler.decompile(document).shortcut().actions().get(0);

        assertThat(action.parameters()).containsOnlyKeys("text", "Extra");
    }

    @Test
    void blankNameBecomesUntitled() {
        TargetDocument document = TargetDocument.of(" ", WorkflowIcon.defaults(), List.of());

        assertThat(decompiler.decompile(document).shortcut().name()).isEqualTo("Untitled Shortcut");
    }
}
