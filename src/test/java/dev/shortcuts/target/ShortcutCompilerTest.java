package dev.shortcuts.target;

import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.shortcuts.model.Shortcut;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static dev.shortcuts.Fixtures.action;
import static dev.shortcuts.Fixtures.conditional;
import static dev.shortcuts.Fixtures.registry;
import static dev.shortcuts.Fixtures.shortcut;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ShortcutCompilerTest {

    private final AtomicInteger ids = new AtomicInteger();
    private final ShortcutCompiler compiler = new ShortcutCompiler(registry(), () -> "ID-" + ids.incrementAndGet());

    @Test
    void compilesNotificationWithMappedKeys() {
        Shortcut morning = shortcut("Good Morning",
            action("notification", "title", "Hi", "body", "Morning", "sound", true));

        TargetDocument document = compiler.compile(morning);

        assertThat(document.name()).isEqualTo("Good Morning");
        assertThat(document.actions()).hasSize(1);
        TargetAction record = document.actions().get(0);
        assertThat(record.identifier()).isEqualTo("is.workflow.actions.shownotification");
        ObjectNode parameters = record.parameters();
        assertThat(parameters.get("WFNotificationActionTitle").asText()).isEqualTo("Hi");
        assertThat(parameters.get("WFNotificationActionBody").asText()).isEqualTo("Morning");
        assertThat(parameters.get("WFNotificationActionSound").booleanValue()).isTrue();
        assertThat(record.uuid()).isEqualTo("ID-1");
        assertThat(record.groupingIdentifier()).isNull();
    }

    @Test
    void usesFixedClientConstants() {
        TargetDocument document = compiler.compile(shortcut("Constants", action("text", "text", "x")));

        assertThat(document.clientVersion()).isEqualTo(TargetDocument.CLIENT_VERSION);
        assertThat(document.minimumClientVersion()).isEqualTo(900);
        assertThat(document.workflowTypes()).containsExactly("NCWidget", "WatchKit");
        assertThat(document.inputContentItemClasses()).contains("WFStringContentItem", "WFURLContentItem");
    }

    @Test
    void flattensNestedBodiesAfterTheirControlRecord() {
        Shortcut shortcut = shortcut("Flat",
            conditional("c", List.of(action("text", "text", "yes")), List.of(action("text", "text", "no"))),
            action("repeat", "count", 2, "actions", List.of(action("wait", "seconds", 1))));

        List<TargetAction> records = compiler.compile(shortcut).actions();

        assertThat(records).extracting(TargetAction::identifier).containsExactly(
            "is.workflow.actions.conditional",
            "is.workflow.actions.gettext",
            "is.workflow.actions.gettext",
            "is.workflow.actions.repeat.count",
            "is.workflow.actions.delay");
        assertThat(records.get(1).parameters().get("WFTextActionText").asText()).isEqualTo("yes");
        assertThat(records.get(2).parameters().get("WFTextActionText").asText()).isEqualTo("no");
        assertThat(records.get(0).groupingIdentifier()).isNotNull();
        assertThat(records.get(3).groupingIdentifier()).isNotNull().isNotEqualTo(records.get(0).groupingIdentifier());
        assertThat(records.get(4).groupingIdentifier()).isNull();
        assertThat(records).extracting(TargetAction::uuid).doesNotHaveDuplicates();
        assertThat(records.get(3).parameters().get("WFRepeatCount").intValue()).isEqualTo(2);
    }

    @Test
    void missingParametersFallBackToRegistryDefaults() {
        TargetAction record = compiler.compile(shortcut("Defaults", action("notification", "body", "b"))).actions().get(0);

        assertThat(record.parameters().get("WFNotificationActionTitle").asText()).isEmpty();
        assertThat(record.parameters().get("WFNotificationActionSound").booleanValue()).isTrue();
    }

    @Test
    void transformsPercentagesAndCameraSelection() {
        Shortcut shortcut = shortcut("Transforms",
            action("set_brightness", "level", 75),
            action("take_photo", "useFrontCamera", false));

        List<TargetAction> records = compiler.compile(shortcut).actions();

        assertThat(records.get(0).parameters().get("WFSetBrightnessActionBrightness").decimalValue())
            .isEqualByComparingTo("0.75");
        ObjectNode camera = records.get(1).parameters();
        assertThat(camera.get("WFCameraCaptureDevice").asText()).isEqualTo("Back");
        assertThat(camera.get("WFCameraCaptureFlashMode").asText()).isEqualTo("Auto");
        assertThat(camera.get("WFCameraCaptureShowPreview").booleanValue()).isTrue();
    }

    @Test
    void unmappedTypeFailsFast() {
        Shortcut shortcut = shortcut("Comments",
            action("text", "text", "x"),
            action("comment", "text", "note"));

        assertThatThrownBy(() -> compiler.compile(shortcut))
            .isInstanceOf(CompilationException.class)
            .hasMessageContaining("'comment'")
            .hasMessageContaining("comment:1")
            .extracting(e -> ((CompilationException) e).actionType())
            .isEqualTo("comment");
    }

    @Test
    void unmappedNestedTypeNamesItsLocation() {
        Shortcut shortcut = shortcut("Nested comment",
            conditional("c", List.of(action("show_result", "text", "x")), null));

        assertThatThrownBy(() -> compiler.compile(shortcut))
            .isInstanceOf(CompilationException.class)
            .hasMessageContaining("if:0 > then > show_result:0");
    }

    @Test
    void iconFollowsDominantCategory() {
        TargetDocument camera = compiler.compile(shortcut("Camera",
            action("take_photo"), action("select_photos"), action("text", "text", "x")));
        TargetDocument empty = compiler.compile(new Shortcut("Empty", List.of()));

        assertThat(camera.icon().glyphNumber()).isEqualTo(59529L);
        assertThat(empty.icon()).isEqualTo(WorkflowIcon.defaults());
        assertThat(empty.actions()).isEmpty();
    }

    @Test
    void everyMappedTypeIsRegistered() {
        assertThat(TargetMappings.all().values()).allSatisfy(mapping ->
            assertThat(registry().lookup(mapping.type()))
                .hasValueSatisfying(d -> assertThat(d.identifier()).isEqualTo(mapping.identifier())));
    }
}
