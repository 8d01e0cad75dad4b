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
 * Smoke tests for the extract command.
 */
@Tag("unit")
public class ExtractCommandTest {

    @TempDir
    Path tempDir;

    private StringWriter out;
    private StringWriter err;
    private CommandLine cmdLine;
    private Path source;

    @BeforeEach
    void setUp() throws Exception {
        cmdLine = CommandLineInterface.createCommandLine();
        out = new StringWriter();
        err = new StringWriter();
        cmdLine.setOut(new PrintWriter(out));
        cmdLine.setErr(new PrintWriter(err));
        source = tempDir.resolve("main.py");
        Files.writeString(source, """
                def on_forever():
                    basic.show_number(3)
                    radio.send_number(1)
                basic.forever(on_forever)
                """);
    }

    @Test
    void testExtractPrintsWorkspaceAndReportsFragments() {
        int exitCode = cmdLine.execute("extract", "-f", source.toString());

        assertThat(exitCode)
            .describedAs("stderr: %s", err.toString())
            .isEqualTo(0);
        assertThat(out.toString())
            .contains("\"type\": \"forever\"")
            .contains("\"type\": \"show_number\"")
            .contains("\"type\": \"opaque_statement\"")
            .contains("radio.send_number(1)");
        assertThat(err.toString()).contains("Unrecognized main.py:3: no statement pattern matches");
    }

    @Test
    void testStrictExitsWithTwoWhenIncomplete() {
        int exitCode = cmdLine.execute("extract", "-f", source.toString(), "--strict");

        assertThat(exitCode).isEqualTo(ExtractCommand.EXIT_UNRECOGNIZED);
    }

    @Test
    void testSkipPolicyDropsFragment() {
        int exitCode = cmdLine.execute("extract", "-f", source.toString(), "--policy", "skip");

        assertThat(exitCode).isEqualTo(0);
        assertThat(out.toString()).doesNotContain("opaque_statement");
    }

    @Test
    void testFailPolicyReportsError() {
        int exitCode = cmdLine.execute("extract", "-f", source.toString(), "-p", "fail");

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("Error: Unrecognized source at");
        assertThat(out.toString()).isEmpty();
    }

    @Test
    void testUnknownPolicyIsRejected() {
        int exitCode = cmdLine.execute("extract", "-f", source.toString(), "-p", "ignore");

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("Unknown extraction policy 'ignore'");
    }

    @Test
    void testOutputFileRoundTripsThroughCompile() throws Exception {
        Path json = tempDir.resolve("main.json");
        assertThat(cmdLine.execute("extract", "-f", source.toString(), "-o", json.toString())).isEqualTo(0);

        CommandLine compile = CommandLineInterface.createCommandLine();
        StringWriter compiled = new StringWriter();
        compile.setOut(new PrintWriter(compiled));
        compile.setErr(new PrintWriter(new StringWriter()));
        int exitCode = compile.execute("compile", "-f", json.toString());

        assertThat(exitCode).isEqualTo(0);
        assertThat(compiled.toString()).isEqualTo(Files.readString(source));
    }
}
