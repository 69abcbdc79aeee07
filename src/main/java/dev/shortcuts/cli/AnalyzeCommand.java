package dev.shortcuts.cli;

import dev.shortcuts.analysis.AnalysisReport;
import dev.shortcuts.engine.ParseResult;
import dev.shortcuts.engine.PipelineResult;
import dev.shortcuts.engine.ShortcutJson;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(name = "analyze", mixinStandardHelpOptions = true,
    description = "Validate a shortcut, then print its analysis report as JSON.")
class AnalyzeCommand implements Callable<Integer> {

    @ParentCommand
    private ShortcutIrCli root;

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Shortcut JSON file, or - for standard input")
    private Path input;

    @Override
    public Integer call() throws Exception {
        ParseResult parsed = ShortcutJson.parse(new String(ShortcutIrCli.readInput(input), StandardCharsets.UTF_8));
        if (parsed instanceof ParseResult.Failed failed) {
            spec.commandLine().getErr().println("Invalid JSON: " + failed.error().message());
            return 1;
        }
        PipelineResult<AnalysisReport> result = root.pipeline().analyze(((ParseResult.Parsed) parsed).shortcut());
        if (result instanceof PipelineResult.Rejected<AnalysisReport> rejected) {
            spec.commandLine().getErr().println("Invalid shortcut, nothing to analyze:");
            root.printIssues(spec.commandLine().getErr(), rejected.validation());
            return 1;
        }
        AnalysisReport report = ((PipelineResult.Completed<AnalysisReport>) result).value();
        spec.commandLine().getOut().println(ShortcutIrCli.JSON.writeValueAsString(report));
        return 0;
    }
}
