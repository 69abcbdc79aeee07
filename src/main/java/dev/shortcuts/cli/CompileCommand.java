package dev.shortcuts.cli;

import dev.shortcuts.engine.ParseResult;
import dev.shortcuts.engine.PipelineResult;
import dev.shortcuts.engine.ShortcutJson;
import dev.shortcuts.target.CompilationException;
import dev.shortcuts.target.PlutilConverter;
import dev.shortcuts.target.ShortcutsCommandSigner;
import dev.shortcuts.target.SigningMode;
import dev.shortcuts.target.SigningResult;
import dev.shortcuts.target.TargetDocument;
import dev.shortcuts.target.TargetDocumentCodec;
import dev.shortcuts.target.TargetDocumentCodec.Framing;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.concurrent.Callable;

@Command(name = "compile", mixinStandardHelpOptions = true,
    description = "Compile a shortcut into the flat target document.")
class CompileCommand implements Callable<Integer> {

    @ParentCommand
    private ShortcutIrCli root;

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Shortcut JSON file, or - for standard input")
    private Path input;

    @Option(names = "--format", defaultValue = "XML",
        description = "Output framing: json, xml, binary (binary falls back to xml without plutil)")
    private Framing format;

    @Option(names = "--sign", description = "Sign the result: anyone, contacts-only")
    private String signMode;

    @Option(names = {"-o", "--output"}, description = "Output file (default: standard output)")
    private Path output;

    @Option(names = "--plutil", defaultValue = "plutil", description = "Property list converter executable")
    private String plutil;

    @Option(names = "--shortcuts-tool", defaultValue = "shortcuts", description = "Signing tool executable")
    private String shortcutsTool;

    @Override
    public Integer call() throws Exception {
        PrintWriter err = spec.commandLine().getErr();
        SigningMode mode = signMode == null ? null : SigningMode.fromWire(signMode);
        ParseResult parsed = ShortcutJson.parse(new String(ShortcutIrCli.readInput(input), StandardCharsets.UTF_8));
        if (parsed instanceof ParseResult.Failed failed) {
            err.println("Invalid JSON: " + failed.error().message());
            return 1;
        }

        PipelineResult<TargetDocument> result;
        try {
            result = root.pipeline().compile(((ParseResult.Parsed) parsed).shortcut());
        } catch (CompilationException e) {
            err.println("Cannot compile: " + e.getMessage());
            return 1;
        }
        if (result instanceof PipelineResult.Rejected<TargetDocument> rejected) {
            err.println("Invalid shortcut, nothing to compile:");
            root.printIssues(err, rejected.validation());
            return 1;
        }

        TargetDocument document = ((PipelineResult.Completed<TargetDocument>) result).value();
        var encoded = TargetDocumentCodec.encode(document, format, new PlutilConverter(plutil));
        byte[] data = encoded.data();
        if (mode != null) {
            SigningResult signing = new ShortcutsCommandSigner(shortcutsTool).sign(data, mode);
            if (signing instanceof SigningResult.Failed failed) {
                err.println("Signing failed: " + failed.reason());
                return 1;
            }
            data = ((SigningResult.Signed) signing).data();
        }

        if (output != null) {
            Files.write(output, data);
            if (root.verbose()) {
                err.println("Wrote " + data.length + " bytes (" + encoded.framing().name().toLowerCase(Locale.ROOT) + ") to " + output);
            }
        } else if (encoded.framing() == Framing.BINARY || mode != null) {
            err.println("Binary output needs --output");
            return 1;
        } else {
            spec.commandLine().getOut().println(new String(data, StandardCharsets.UTF_8));
        }
        return 0;
    }
}
