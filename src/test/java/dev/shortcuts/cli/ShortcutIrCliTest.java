package dev.shortcuts.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class ShortcutIrCliTest {

    private static final String MORNING = """
        {"name": "Good Morning", "actions": [
          {"type": "notification", "parameters": {"title": "Hi", "body": "Morning", "sound": true}}
        ]}
        """;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int run(String... args) {
        CommandLine cli = ShortcutIrCli.commandLine();
        cli.setOut(new PrintWriter(out));
        cli.setErr(new PrintWriter(err));
        return cli.execute(args);
    }

    @Test
    void validateAcceptsAGoodShortcut(@TempDir Path dir) throws Exception {
        Path file = Files.writeString(dir.resolve("morning.json"), MORNING);

        int exit = run("validate", file.toString());

        assertThat(exit).isZero();
        assertThat(out.toString()).contains("Valid: Good Morning");
    }

    @Test
    void validateListsErrors(@TempDir Path dir) throws Exception {
        Path file = Files.writeString(dir.resolve("bad.json"),
            "{\"name\": \"Bad\", \"actions\": [{\"type\": \"nope\", \"parameters\": {}}]}");

        int exit = run("validate", file.toString());

        assertThat(exit).isEqualTo(1);
        assertThat(err.toString()).contains("INVALID_ACTION #0").contains("Unknown action type 'nope'");
    }

    @Test
    void limitsComeFromOptions(@TempDir Path dir) throws Exception {
        Path file = Files.writeString(dir.resolve("two.json"), """
            {"name": "Two", "actions": [
              {"type": "wait", "parameters": {"seconds": 1}},
              {"type": "wait", "parameters": {"seconds": 1}}
            ]}
            """);

        int exit = run("--max-actions", "1", "validate", file.toString());

        assertThat(exit).isEqualTo(1);
        assertThat(err.toString()).contains("LIMIT");
    }

    @Test
    void compileWritesJsonDocument(@TempDir Path dir) throws Exception {
        Path file = Files.writeString(dir.resolve("morning.json"), MORNING);
        Path target = dir.resolve("morning.shortcut.json");

        int exit = run("compile", "--format", "json", "-o", target.toString(), file.toString());

        assertThat(exit).isZero();
        JsonNode document = new ObjectMapper().readTree(target.toFile());
        assertThat(document.path("WFWorkflowName").asText()).isEqualTo("Good Morning");
        assertThat(document.at("/WFWorkflowActions/0/WFWorkflowActionIdentifier").asText())
            .isEqualTo("is.workflow.actions.shownotification");
    }

    @Test
    void compileReportsUnmappedTypes(@TempDir Path dir) throws Exception {
        Path file = Files.writeString(dir.resolve("comment.json"),
            "{\"name\": \"Note\", \"actions\": [{\"type\": \"comment\", \"parameters\": {\"text\": \"hi\"}}]}");

        int exit = run("compile", file.toString());

        assertThat(exit).isEqualTo(1);
        assertThat(err.toString()).contains("Cannot compile").contains("'comment'");
    }

    @Test
    void decompileLiftsACompiledDocument(@TempDir Path dir) throws Exception {
        Path file = Files.writeString(dir.resolve("morning.json"), MORNING);
        Path plist = dir.resolve("morning.plist");
        run("compile", "--format", "xml", "-o", plist.toString(), file.toString());

        int exit = run("decompile", plist.toString());

        assertThat(exit).isZero();
        JsonNode lifted = new ObjectMapper().readTree(out.toString());
        assertThat(lifted.at("/actions/0/type").asText()).isEqualTo("notification");
        assertThat(lifted.at("/actions/0/parameters/body").asText()).isEqualTo("Morning");
    }

    @Test
    void analyzePrintsReport(@TempDir Path dir) throws Exception {
        Path file = Files.writeString(dir.resolve("greet.json"), """
            {"name": "Greet", "actions": [
              {"type": "ask", "parameters": {"prompt": "Enter your name"}},
              {"type": "text", "parameters": {"text": "Hello {name}!"}}
            ]}
            """);

        int exit = run("analyze", file.toString());

        assertThat(exit).isZero();
        JsonNode report = new ObjectMapper().readTree(out.toString());
        assertThat(report.at("/dependencies/edges/0/token").asText()).isEqualTo("name");
        assertThat(report.at("/complexity/dataFlowComplexity").asInt()).isEqualTo(1);
    }

    @Test
    void actionsListsCategories() {
        int exit = run("actions", "--category", "home");

        assertThat(exit).isZero();
        assertThat(out.toString()).contains("home:").contains("control_devices").contains("[home]");
    }

    @Test
    void missingInputIsAShortError() {
        int exit = run("validate", "/nonexistent/input.json");

        assertThat(exit).isEqualTo(1);
        assertThat(err.toString()).startsWith("Error:").doesNotContain("\tat ");
    }
}
