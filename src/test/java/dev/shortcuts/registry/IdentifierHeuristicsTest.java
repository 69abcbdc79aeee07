package dev.shortcuts.registry;

import dev.shortcuts.model.Confidence;
import dev.shortcuts.model.Permission;
import org.junit.jupiter.api.Test;

import static dev.shortcuts.Fixtures.registry;
import static org.assertj.core.api.Assertions.assertThat;

class IdentifierHeuristicsTest {

    private final IdentifierHeuristics heuristics = new IdentifierHeuristics();

    @Test
    void keywordMatchIsMediumConfidence() {
        InferredAction inferred = heuristics.infer("is.workflow.actions.getcurrentlocation").orElseThrow();

        assertThat(inferred.type()).isEqualTo("getcurrentlocation");
        assertThat(inferred.category()).isEqualTo("location");
        assertThat(inferred.permission()).isEqualTo(Permission.LOCATION);
        assertThat(inferred.confidence()).isEqualTo(Confidence.MEDIUM);
    }

    @Test
    void earlierRulesWin() {
        // mentions both "text" and "file"
        assertThat(heuristics.infer("com.example.textfile").orElseThrow().category()).isEqualTo("text");
    }

    @Test
    void unmatchedIdentifierFallsBackToLowConfidence() {
        InferredAction inferred = heuristics.infer("com.vendor.frobnicate").orElseThrow();

        assertThat(inferred.category()).isEqualTo("general");
        assertThat(inferred.permission()).isEqualTo(Permission.NONE);
        assertThat(inferred.confidence()).isEqualTo(Confidence.LOW);
    }

    @Test
    void blankIdentifierHasNoInference() {
        assertThat(heuristics.infer(" ")).isEmpty();
        assertThat(heuristics.infer(null)).isEmpty();
    }

    @Test
    void registryInferenceTakesPriority() {
        ActionInference chain = new RegistryInference(registry()).orElse(heuristics);

        InferredAction direct = chain.infer("is.workflow.actions.takephoto").orElseThrow();
        InferredAction guessed = chain.infer("com.example.camera.burst").orElseThrow();

        assertThat(direct.type()).isEqualTo("take_photo");
        assertThat(direct.confidence()).isEqualTo(Confidence.HIGH);
        assertThat(guessed.type()).isEqualTo("burst");
        assertThat(guessed.confidence()).isEqualTo(Confidence.MEDIUM);
    }

    @Test
    void lastSegment() {
        assertThat(IdentifierHeuristics.lastSegment("a.b.c")).isEqualTo("c");
        assertThat(IdentifierHeuristics.lastSegment("plain")).isEqualTo("plain");
        assertThat(IdentifierHeuristics.lastSegment("trailing.")).isEqualTo("trailing.");
    }
}
