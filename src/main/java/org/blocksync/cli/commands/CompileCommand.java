package org.blocksync.cli.commands;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.concurrent.Callable;

import org.blocksync.BlockSyncException;
import org.blocksync.cli.CommandLineInterface;
import org.blocksync.compiler.backend.CompilerOptions;
import org.blocksync.compiler.backend.ForwardCompiler;
import org.blocksync.compiler.diagnostics.DiagnosticsEngine;
import org.blocksync.graph.Graph;
import org.blocksync.graph.io.GraphJsonCodec;
import org.blocksync.registry.BlockKindRegistry;
import org.blocksync.workspace.WorkspaceLint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Compiles a block workspace stored as JSON to Python.
 */
@Command(
    name = "compile",
    description = "Compile a block workspace (JSON) to MicroPython"
)
public class CompileCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CompileCommand.class);

    @Option(names = {"-f", "--file"}, required = true, description = "Workspace JSON file")
    private File file;

    @Option(names = {"-o", "--output"}, description = "Write the program to this file instead of stdout")
    private File output;

    @Option(names = {"--lint"}, description = "Report suspicious constructs on stderr; exit with 2 if any is an error")
    private boolean lint;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        var out = spec.commandLine().getOut();
        var err = spec.commandLine().getErr();

        try {
            Config config = parent.getConfig();
            String json = Files.readString(file.toPath(), StandardCharsets.UTF_8);
            Graph graph = new GraphJsonCodec(BlockKindRegistry.defaults()).decode(json);
            ForwardCompiler compiler = new ForwardCompiler(
                    CompilerOptions.fromConfig(config.getConfig("blocksync.compiler")));
            String program = compiler.compile(graph);

            boolean lintErrors = false;
            if (lint) {
                DiagnosticsEngine diagnostics = new DiagnosticsEngine();
                WorkspaceLint.check(graph, diagnostics);
                err.print(diagnostics.summary());
                lintErrors = diagnostics.hasErrors();
            }

            if (output != null) {
                Files.writeString(output.toPath(), program, StandardCharsets.UTF_8);
                log.info("Wrote {} to {}", file.getName(), output.getAbsolutePath());
            } else {
                out.print(program);
            }
            out.flush();
            err.flush();
            return lintErrors ? 2 : 0;
        } catch (IOException e) {
            err.println("Error: cannot read or write file: " + e.getMessage());
            err.flush();
            return 1;
        } catch (BlockSyncException | IllegalArgumentException | ConfigException e) {
            log.debug("Compilation of {} failed", file, e);
            err.println("Error: " + e.getMessage());
            err.flush();
            return 1;
        }
    }
}
