package dev.shortcuts.target;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs a platform tool to completion with a timeout, capturing its combined output.
 * Output goes to a temporary file so a chatty tool never blocks on a full pipe.
 */
final class ExternalProcess {

    record Outcome(int exitCode, String output) {
        boolean succeeded() {
            return exitCode == 0;
        }
    }

    private static final Logger logger = LoggerFactory.getLogger(ExternalProcess.class);

    private ExternalProcess() {}

    static Outcome run(List<String> command, Duration timeout) throws IOException, InterruptedException {
        Path transcript = Files.createTempFile("shortcut-ir-process", ".log");
        try {
            Process process = new ProcessBuilder(command)
                .redirectErrorStream(true)
                .redirectOutput(transcript.toFile())
                .start();
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                return new Outcome(-1, command.get(0) + " timed out after " + timeout.toSeconds() + "s");
            }
            return new Outcome(process.exitValue(), new String(Files.readAllBytes(transcript), StandardCharsets.UTF_8).trim());
        } finally {
            deleteQuietly(transcript, logger);
        }
    }

    static void deleteQuietly(Path path, Logger log) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.debug("Could not delete temporary file {}: {}", path, e.getMessage());
        }
    }
}
