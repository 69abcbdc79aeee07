package dev.shortcuts.cli;

import dev.shortcuts.engine.ShortcutJson;
import dev.shortcuts.engine.ShortcutPipeline;
import dev.shortcuts.model.Confidence;
import dev.shortcuts.target.PlutilConverter;
import dev.shortcuts.target.TargetDocument;
import dev.shortcuts.target.TargetDocumentCodec;
import dev.shortcuts.target.TypeResolution;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(name = "decompile", mixinStandardHelpOptions = true,
    description = "Lift a target document (json, xml or binary) back into shortcut JSON.")
class DecompileCommand implements Callable<Integer> {

    @ParentCommand
    private ShortcutIrCli root;

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Target document file, or - for standard input")
    private Path input;

    @Option(names = {"-o", "--output"}, description = "Output file (default: standard output)")
    private Path output;

    @Option(names = "--plutil", defaultValue = "plutil", description = "Property list converter executable")
    private String plutil;

    @Override
    public Integer call() throws Exception {
        PrintWriter err = spec.commandLine().getErr();
        TargetDocument document = TargetDocumentCodec.read(ShortcutIrCli.readInput(input), new PlutilConverter(plutil));
        ShortcutPipeline.Lifted lifted = root.pipeline().decompile(document);

        String json = ShortcutJson.write(lifted.decompilation().shortcut());
        if (output != null) {
            Files.writeString(output, json);
        } else {
            spec.commandLine().getOut().println(json);
        }

        for (TypeResolution resolution : lifted.decompilation().resolutions()) {
            if (root.verbose() || resolution.confidence() != Confidence.HIGH) {
                err.println("  #" + resolution.index() + " " + resolution.externalIdentifier()
                    + " -> " + resolution.type() + " (" + resolution.confidence() + ")");
            }
        }
        if (!lifted.validation().isAccepted()) {
            err.println("Decompiled shortcut does not validate:");
            root.printIssues(err, lifted.validation());
            return 1;
        }
        return 0;
    }
}
