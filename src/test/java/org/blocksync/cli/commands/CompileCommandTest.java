package org.blocksync.cli.commands;

import org.blocksync.cli.CommandLineInterface;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Smoke tests for the compile command.
 */
@Tag("unit")
public class CompileCommandTest {

    private static final String WORKSPACE = """
            {"blocks": {"languageVersion": 0, "blocks": [
              {"type": "on_button_pressed", "id": "1", "fields": {"BUTTON": "B"},
               "inputs": {"DO": {"block": {"type": "show_string", "id": "2",
                 "inputs": {"TEXT": {"block": {"type": "text", "id": "3", "fields": {"TEXT": "Hi"}}}}}}}},
              {"type": "loops_for_of", "id": "4"}
            ]}}
            """;

    @TempDir
    Path tempDir;

    private StringWriter out;
    private StringWriter err;
    private CommandLine cmdLine;

    @BeforeEach
    void setUp() {
        cmdLine = CommandLineInterface.createCommandLine();
        out = new StringWriter();
        err = new StringWriter();
        cmdLine.setOut(new PrintWriter(out));
        cmdLine.setErr(new PrintWriter(err));
    }

    @Test
    void testCommandParses() {
        assertThat(cmdLine.getSubcommands()).containsKeys("compile", "extract", "roundtrip", "catalog");
    }

    @Test
    void testHelpOutput() {
        cmdLine.execute("compile", "--help");

        String output = out.toString() + err.toString();
        assertThat(output).contains("compile");
        assertThat(output).contains("--file");
        assertThat(output).contains("--lint");
    }

    @Test
    void testCompileWorkspace() throws Exception {
        Path workspace = tempDir.resolve("program.json");
        Files.writeString(workspace, WORKSPACE);

        int exitCode = cmdLine.execute("compile", "-f", workspace.toString());

        assertThat(exitCode)
            .describedAs("Exit code should be 0. stderr: %s, stdout: %s", err.toString(), out.toString())
            .isEqualTo(0);
        assertThat(out.toString()).startsWith("""
                def on_button_pressed_b():
                    basic.show_string("Hi")
                input.on_button_pressed(Button.B, on_button_pressed_b)
                """);
    }

    @Test
    void testCompileToFileWithLint() throws Exception {
        Path workspace = tempDir.resolve("program.json");
        Path program = tempDir.resolve("main.py");
        Files.writeString(workspace, WORKSPACE);

        int exitCode = cmdLine.execute("compile", "-f", workspace.toString(), "-o", program.toString(), "--lint");

        assertThat(exitCode).isEqualTo(0);
        assertThat(out.toString()).isEmpty();
        assertThat(Files.readString(program)).contains("def on_button_pressed_b():");
        assertThat(err.toString()).contains("[WARNING]").contains("iterates over no list");
    }

    @Test
    void testLintErrorExitsWithTwo() throws Exception {
        Path workspace = tempDir.resolve("loop.json");
        Files.writeString(workspace, """
                {"blocks": {"languageVersion": 0, "blocks": [
                  {"type": "loops_for_of", "id": "1", "inputs": {
                    "VAR": {"block": {"type": "variables_get", "id": "2", "fields": {"VAR": "items"}}},
                    "LIST": {"block": {"type": "variables_get", "id": "3", "fields": {"VAR": "items"}}}}}
                ]}}
                """);

        int exitCode = cmdLine.execute("compile", "-f", workspace.toString(), "--lint");

        assertThat(exitCode).isEqualTo(2);
        assertThat(out.toString()).isEqualTo("for items in items:\n    pass\n");
        assertThat(err.toString()).contains("[ERROR]").contains("'items' both as element variable and as list");
    }

    @Test
    void testConfigFileChangesIndentation() throws Exception {
        Path workspace = tempDir.resolve("program.json");
        Path config = tempDir.resolve("blocksync.conf");
        Files.writeString(workspace, WORKSPACE);
        Files.writeString(config, "blocksync.compiler.indent = 2\n");

        int exitCode = cmdLine.execute("-c", config.toString(), "compile", "-f", workspace.toString());

        assertThat(exitCode).isEqualTo(0);
        assertThat(out.toString()).contains("\n  basic.show_string(\"Hi\")\n");
    }

    @Test
    void testMissingFileFails() {
        int exitCode = cmdLine.execute("compile", "-f", tempDir.resolve("missing.json").toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("Error: cannot read or write file");
    }

    @Test
    void testUnknownBlockTypeFails() throws Exception {
        Path workspace = tempDir.resolve("program.json");
        Files.writeString(workspace, "{\"blocks\": {\"blocks\": [{\"type\": \"radio_send\"}]}}");

        int exitCode = cmdLine.execute("compile", "-f", workspace.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("Error:").contains("radio_send");
    }
}
