package org.blocksync.cli.commands;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.concurrent.Callable;

import org.blocksync.BlockSyncException;
import org.blocksync.cli.CommandLineInterface;
import org.blocksync.compiler.frontend.ExtractionPolicy;
import org.blocksync.compiler.frontend.ExtractionResult;
import org.blocksync.compiler.frontend.ReverseExtractor;
import org.blocksync.compiler.frontend.UnrecognizedFragment;
import org.blocksync.graph.io.GraphJsonCodec;
import org.blocksync.registry.BlockKindRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.ConfigException;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Rebuilds a block workspace from a Python program and prints it as JSON.
 */
@Command(
    name = "extract",
    description = "Extract a block workspace (JSON) from a MicroPython program"
)
public class ExtractCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ExtractCommand.class);

    /** Exit code when {@code --strict} is set and parts of the program were not recognized. */
    static final int EXIT_UNRECOGNIZED = 2;

    @Option(names = {"-f", "--file"}, required = true, description = "Python source file")
    private File file;

    @Option(names = {"-p", "--policy"},
            description = "What to do with unrecognized code: preserve, skip or fail (default: from configuration)")
    private String policy;

    @Option(names = {"--strict"}, description = "Exit with code 2 if any code was not recognized")
    private boolean strict;

    @Option(names = {"-o", "--output"}, description = "Write the JSON to this file instead of stdout")
    private File output;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        var out = spec.commandLine().getOut();
        var err = spec.commandLine().getErr();

        try {
            String policyName = policy != null ? policy : parent.getConfig().getString("blocksync.extractor.unrecognized");
            ReverseExtractor extractor = new ReverseExtractor(BlockKindRegistry.defaults(),
                    ExtractionPolicy.parse(policyName));
            String source = Files.readString(file.toPath(), StandardCharsets.UTF_8);
            ExtractionResult result = extractor.extract(source, file.getName());
            String json = new GraphJsonCodec(BlockKindRegistry.defaults()).encode(result.graph());

            if (output != null) {
                Files.writeString(output.toPath(), json, StandardCharsets.UTF_8);
                log.info("Wrote workspace of {} to {}", file.getName(), output.getAbsolutePath());
            } else {
                out.println(json);
            }
            for (UnrecognizedFragment fragment : result.unrecognized()) {
                err.println("Unrecognized " + file.getName() + ":" + fragment.line() + ": " + fragment.reason());
            }
            out.flush();
            err.flush();
            return strict && !result.isComplete() ? EXIT_UNRECOGNIZED : 0;
        } catch (IOException e) {
            err.println("Error: cannot read or write file: " + e.getMessage());
            err.flush();
            return 1;
        } catch (BlockSyncException | IllegalArgumentException | ConfigException e) {
            log.debug("Extraction of {} failed", file, e);
            err.println("Error: " + e.getMessage());
            err.flush();
            return 1;
        }
    }
}
