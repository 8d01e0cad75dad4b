package org.blocksync.cli.commands;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;
import java.util.concurrent.Callable;

import org.blocksync.BlockSyncException;
import org.blocksync.cli.CommandLineInterface;
import org.blocksync.workspace.Workspace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.ConfigException;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Loads a Python program into a workspace and compiles it back, showing the program as the
 * block editor would regenerate it.
 */
@Command(
    name = "roundtrip",
    description = "Extract a MicroPython program into blocks and compile it back"
)
public class RoundtripCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RoundtripCommand.class);

    @Option(names = {"-f", "--file"}, required = true, description = "Python source file")
    private File file;

    @Option(names = {"--check"},
            description = "Do not print the program; exit with code 1 if it differs from the input")
    private boolean check;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        var out = spec.commandLine().getOut();
        var err = spec.commandLine().getErr();

        try {
            Workspace workspace = Workspace.fromConfig(parent.getConfig());
            String source = Files.readString(file.toPath(), StandardCharsets.UTF_8);
            workspace.load(source);
            String regenerated = workspace.source();

            if (!check) {
                out.print(regenerated);
                out.flush();
                return 0;
            }
            int line = firstDifference(normalize(source), normalize(regenerated));
            if (line == 0) {
                out.println(file.getName() + ": unchanged");
                out.flush();
                return 0;
            }
            log.debug("{} changes at line {} when regenerated", file.getName(), line);
            err.println(file.getName() + ": regenerated program differs at line " + line);
            err.flush();
            return 1;
        } catch (IOException e) {
            err.println("Error: cannot read file: " + e.getMessage());
            err.flush();
            return 1;
        } catch (BlockSyncException | IllegalArgumentException | ConfigException e) {
            err.println("Error: " + e.getMessage());
            err.flush();
            return 1;
        }
    }

    private static List<String> normalize(String text) {
        return text.replace("\r\n", "\n").stripTrailing().lines().map(String::stripTrailing).toList();
    }

    /** 1-based number of the first differing line, or 0 if both are equal. */
    private static int firstDifference(List<String> a, List<String> b) {
        int common = Math.min(a.size(), b.size());
        for (int i = 0; i < common; i++) {
            if (!a.get(i).equals(b.get(i))) {
                return i + 1;
            }
        }
        return a.size() == b.size() ? 0 : common + 1;
    }
}
