package dev.shortcuts.target;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Signs through the platform's {@code shortcuts sign} command.
 */
public final class ShortcutsCommandSigner implements ShortcutSigner {

    private static final Logger logger = LoggerFactory.getLogger(ShortcutsCommandSigner.class);
    private static final Duration TIMEOUT = Duration.ofSeconds(60);

    private final String executable;

    public ShortcutsCommandSigner() {
        this("shortcuts");
    }

    public ShortcutsCommandSigner(String executable) {
        this.executable = executable;
    }

    @Override
    public SigningResult sign(byte[] shortcut, SigningMode mode) {
        Path input = null;
        Path output = null;
        try {
            input = Files.createTempFile("shortcut-ir-unsigned-", ".shortcut");
            output = Files.createTempFile("shortcut-ir-signed-", ".shortcut");
            Files.write(input, shortcut);
            var outcome = ExternalProcess.run(List.of(executable, "sign",
                "--mode", mode.wireName(),
                "--input", input.toString(),
                "--output", output.toString()), TIMEOUT);
            if (!outcome.succeeded()) {
                return new SigningResult.Failed(executable + " sign exited with " + outcome.exitCode() + ": " + outcome.output());
            }
            byte[] signed = Files.readAllBytes(output);
            if (signed.length == 0) {
                return new SigningResult.Failed(executable + " sign produced no output");
            }
            logger.info("Signed shortcut ({} bytes, mode {})", signed.length, mode.wireName());
            return new SigningResult.Signed(signed, mode);
        } catch (IOException e) {
            logger.debug("{} could not run", executable, e);
            return new SigningResult.Failed(executable + " is not available: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new SigningResult.Failed("Interrupted while signing");
        } finally {
            if (input != null) {
                ExternalProcess.deleteQuietly(input, logger);
            }
            if (output != null) {
                ExternalProcess.deleteQuietly(output, logger);
            }
        }
    }
}
