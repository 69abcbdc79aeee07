package dev.shortcuts.target;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Converts property lists with the {@code plutil} command line tool.
 */
public final class PlutilConverter implements NativeFormatConverter {

    private static final Logger logger = LoggerFactory.getLogger(PlutilConverter.class);
    private static final Duration TIMEOUT = Duration.ofSeconds(30);

    private final String executable;

    public PlutilConverter() {
        this("plutil");
    }

    public PlutilConverter(String executable) {
        this.executable = executable;
    }

    @Override
    public Conversion toBinary(byte[] xmlPlist) {
        return convert(xmlPlist, "binary1");
    }

    @Override
    public Conversion toXml(byte[] binaryPlist) {
        return convert(binaryPlist, "xml1");
    }

    private Conversion convert(byte[] data, String format) {
        Path input = null;
        Path output = null;
        try {
            input = Files.createTempFile("shortcut-ir-", ".plist");
            output = Files.createTempFile("shortcut-ir-", "." + format);
            Files.write(input, data);
            var outcome = ExternalProcess.run(
                List.of(executable, "-convert", format, "-o", output.toString(), input.toString()), TIMEOUT);
            if (!outcome.succeeded()) {
                return new Conversion.Unavailable(executable + " exited with " + outcome.exitCode() + ": " + outcome.output());
            }
            return new Conversion.Converted(Files.readAllBytes(output));
        } catch (IOException e) {
            logger.debug("{} could not run", executable, e);
            return new Conversion.Unavailable(executable + " is not available: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new Conversion.Unavailable("Interrupted while running " + executable);
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
