package dev.shortcuts.engine;

import dev.shortcuts.analysis.AnalysisReport;
import dev.shortcuts.analysis.ShortcutAnalyzer;
import dev.shortcuts.model.ErrorKind;
import dev.shortcuts.model.Shortcut;
import dev.shortcuts.model.ValidationError;
import dev.shortcuts.model.ValidationLimits;
import dev.shortcuts.registry.ActionRegistry;
import dev.shortcuts.registry.RegistryHolder;
import dev.shortcuts.target.Decompilation;
import dev.shortcuts.target.ShortcutCompiler;
import dev.shortcuts.target.ShortcutDecompiler;
import dev.shortcuts.target.TargetDocument;

import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * Wires parsing, validation, analysis, compilation and decompilation together.
 *
 * <p>Each operation takes one snapshot of the registry and uses it throughout, so a reload
 * that happens mid-operation is only seen by the next call.
 */
public final class ShortcutPipeline {

    private final RegistryHolder registries;
    private final ValidationLimits limits;

    public ShortcutPipeline(RegistryHolder registries) {
        this(registries, ValidationLimits.defaults());
    }

    public ShortcutPipeline(RegistryHolder registries, ValidationLimits limits) {
        this.registries = registries;
        this.limits = limits;
    }

    public ActionRegistry registry() {
        return registries.current();
    }

    public ValidationResult validate(Shortcut shortcut) {
        return new ShortcutValidator(registries.current(), limits).validate(shortcut);
    }

    /** Parses and validates; a parse failure is reported as a single STRUCTURE error. */
    public ValidationResult validateJson(String json) {
        ParseResult parsed = ShortcutJson.parse(json);
        if (parsed instanceof ParseResult.Failed failed) {
            return new ValidationResult.Rejected(List.of(structureError(failed.error())), Set.of());
        }
        return validate(((ParseResult.Parsed) parsed).shortcut());
    }

    public PipelineResult<AnalysisReport> analyze(Shortcut shortcut) {
        ActionRegistry registry = registries.current();
        return runAccepted(registry, shortcut, new ShortcutAnalyzer(registry)::analyze);
    }

    /**
     * @throws dev.shortcuts.target.CompilationException when an accepted shortcut uses a type
     *     the target format cannot express
     */
    public PipelineResult<TargetDocument> compile(Shortcut shortcut) {
        ActionRegistry registry = registries.current();
        return runAccepted(registry, shortcut, new ShortcutCompiler(registry)::compile);
    }

    /** Lifts a document and validates the result against the same registry snapshot. */
    public Lifted decompile(TargetDocument document) {
        ActionRegistry registry = registries.current();
        Decompilation decompilation = new ShortcutDecompiler(registry).decompile(document);
        ValidationResult validation = new ShortcutValidator(registry, limits).validate(decompilation.shortcut());
        return new Lifted(decompilation, validation);
    }

    private <T> PipelineResult<T> runAccepted(ActionRegistry registry, Shortcut shortcut, Function<Shortcut, T> stage) {
        ValidationResult validation = new ShortcutValidator(registry, limits).validate(shortcut);
        if (validation instanceof ValidationResult.Rejected rejected) {
            return new PipelineResult.Rejected<>(rejected);
        }
        var accepted = (ValidationResult.Accepted) validation;
        return new PipelineResult.Completed<>(stage.apply(accepted.shortcut()), accepted.permissions());
    }

    private static ValidationError structureError(ParseError error) {
        String where = error.line() < 0 ? "" : " (line " + error.line() + ", column " + error.column() + ")";
        return ValidationError.of(ErrorKind.STRUCTURE, error.message() + where);
    }

    /** A decompiled shortcut together with its re-validation. */
    public record Lifted(Decompilation decompilation, ValidationResult validation) {}
}
