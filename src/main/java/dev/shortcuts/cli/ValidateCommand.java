package dev.shortcuts.cli;

import dev.shortcuts.engine.ValidationResult;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(name = "validate", mixinStandardHelpOptions = true,
    description = "Validate a shortcut JSON file against the action registry.")
class ValidateCommand implements Callable<Integer> {

    @ParentCommand
    private ShortcutIrCli root;

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Shortcut JSON file, or - for standard input")
    private Path input;

    @Override
    public Integer call() throws Exception {
        String json = new String(ShortcutIrCli.readInput(input), StandardCharsets.UTF_8);
        ValidationResult result = root.pipeline().validateJson(json);
        if (result instanceof ValidationResult.Accepted accepted) {
            spec.commandLine().getOut().println("Valid: " + accepted.shortcut().name()
                + " (" + accepted.shortcut().actions().size() + " top-level actions)");
            if (root.verbose()) {
                root.printIssues(spec.commandLine().getOut(), result);
            }
            return 0;
        }
        spec.commandLine().getErr().println("Invalid shortcut, " + result.errors().size() + " error(s):");
        root.printIssues(spec.commandLine().getErr(), result);
        return 1;
    }
}
