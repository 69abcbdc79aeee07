package dev.shortcuts.target;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExternalToolsTest {

    private static final String MISSING_TOOL = "/nonexistent/shortcut-ir-test-tool";

    @Test
    void missingConverterIsUnavailable() {
        Conversion conversion = new PlutilConverter(MISSING_TOOL)
            .toBinary("<plist/>".getBytes(StandardCharsets.UTF_8));

        assertThat(conversion).isInstanceOf(Conversion.Unavailable.class);
        assertThat(((Conversion.Unavailable) conversion).reason()).contains(MISSING_TOOL);
    }

    @Test
    void missingSignerFails() {
        SigningResult result = new ShortcutsCommandSigner(MISSING_TOOL)
            .sign(new byte[] {1, 2, 3}, SigningMode.ANYONE);

        assertThat(result).isInstanceOf(SigningResult.Failed.class);
        assertThat(((SigningResult.Failed) result).reason()).contains(MISSING_TOOL);
    }

    @Test
    void signingModesAcceptCliNames() {
        assertThat(SigningMode.fromWire("anyone")).isEqualTo(SigningMode.ANYONE);
        assertThat(SigningMode.fromWire("contacts-only")).isEqualTo(SigningMode.CONTACTS_ONLY);
        assertThat(SigningMode.fromWire("people-who-know-me")).isEqualTo(SigningMode.CONTACTS_ONLY);
        assertThatThrownBy(() -> SigningMode.fromWire("everyone"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("everyone");
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void toolOutputLargerThanAPipeBufferIsCaptured() throws Exception {
        var outcome = ExternalProcess.run(
            List.of("sh", "-c", "i=0; while [ $i -lt 4000 ]; do echo 0123456789012345678901234567890123456789; i=$((i+1)); done"),
            Duration.ofSeconds(20));

        assertThat(outcome.succeeded()).isTrue();
        assertThat(outcome.output().lines().count()).isEqualTo(4000);
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void failingToolReportsExitCodeAndOutput() throws Exception {
        var outcome = ExternalProcess.run(List.of("sh", "-c", "echo broken >&2; exit 3"), Duration.ofSeconds(20));

        assertThat(outcome.exitCode()).isEqualTo(3);
        assertThat(outcome.output()).isEqualTo("broken");
    }
}
