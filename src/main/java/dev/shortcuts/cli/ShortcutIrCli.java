package dev.shortcuts.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import dev.shortcuts.engine.ShortcutPipeline;
import dev.shortcuts.engine.ValidationResult;
import dev.shortcuts.model.ValidationError;
import dev.shortcuts.model.ValidationLimits;
import dev.shortcuts.registry.JsonRegistrySource;
import dev.shortcuts.registry.RegistryHolder;
import dev.shortcuts.registry.RegistrySource;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI entry point for shortcut-ir. Global options go before the subcommand.
 */
@Command(
    name = "shortcut-ir",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    description = "Validate, analyze, compile and decompile shortcut trees.",
    subcommands = {
        ValidateCommand.class,
        AnalyzeCommand.class,
        CompileCommand.class,
        DecompileCommand.class,
        ActionsCommand.class
    }
)
public class ShortcutIrCli implements Callable<Integer> {

    static final ObjectMapper JSON = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    @Spec
    private CommandSpec spec;

    @Option(names = "--registry", description = "Action registry JSON file (default: bundled registry)")
    private Path registryFile;

    @Option(names = "--max-actions", description = "Override the per-list action limit (default: 50)")
    private Integer maxActions;

    @Option(names = "--max-depth", description = "Override the nesting depth limit (default: 10)")
    private Integer maxDepth;

    @Option(names = "--verbose", description = "Print permissions, paths and type resolutions")
    private boolean verbose;

    /** The configured command line, shared by {@code Main} and tests. */
    public static CommandLine commandLine() {
        return new CommandLine(new ShortcutIrCli())
            .setExecutionExceptionHandler(new ShortErrorHandler())
            .setCaseInsensitiveEnumValuesAllowed(true);
    }

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    boolean verbose() {
        return verbose;
    }

    ShortcutPipeline pipeline() throws IOException {
        RegistrySource source = registryFile == null
            ? JsonRegistrySource.classpath()
            : JsonRegistrySource.fromFile(registryFile);
        return new ShortcutPipeline(RegistryHolder.load(source), limits());
    }

    ValidationLimits limits() {
        ValidationLimits limits = ValidationLimits.defaults();
        if (maxActions != null) {
            limits = limits.withMaxActions(maxActions);
        }
        if (maxDepth != null) {
            limits = limits.withMaxNestingDepth(maxDepth);
        }
        return limits;
    }

    /** Reads a file, or standard input for {@code -}. */
    static byte[] readInput(Path input) throws IOException {
        if ("-".equals(input.toString())) {
            return System.in.readAllBytes();
        }
        return Files.readAllBytes(input);
    }

    void printIssues(PrintWriter err, ValidationResult result) {
        for (ValidationError issue : verbose ? result.issues() : result.errors()) {
            ValidationError root = issue.innermost();
            String at = root.actionIndex() == null ? "" : " #" + root.actionIndex();
            err.println("  " + root.kind() + at + ": " + issue.message());
        }
    }
}
