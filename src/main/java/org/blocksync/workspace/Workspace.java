package org.blocksync.workspace;

import com.typesafe.config.Config;
import org.blocksync.compiler.backend.CompilerOptions;
import org.blocksync.compiler.backend.ForwardCompiler;
import org.blocksync.compiler.diagnostics.DiagnosticsEngine;
import org.blocksync.compiler.frontend.ExtractionPolicy;
import org.blocksync.compiler.frontend.ExtractionResult;
import org.blocksync.compiler.frontend.ReverseExtractor;
import org.blocksync.graph.Graph;
import org.blocksync.graph.Node;
import org.blocksync.registry.BlockKindRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Consumer;

/**
 * One editable program: a graph with its invariant maintainers, kept in sync with its text.
 * <p>
 * Edits go through {@link #edit(Consumer)}; {@link #settle()} applies the maintainers' fixes.
 * {@link #source()} settles and compiles; {@link #load(String)} replaces the graph's content
 * with the extraction of a text, leaving it untouched if the extraction fails.
 * <p>
 * Not thread-safe.
 */
public final class Workspace {

    private static final Logger log = LoggerFactory.getLogger(Workspace.class);

    private final BlockKindRegistry registry;
    private final Graph graph = new Graph();
    private final MutationPipeline pipeline = new MutationPipeline(graph);
    private final LoopVariableMaintainer loopVariables;
    private final HandlerUniquenessEnforcer handlers = new HandlerUniquenessEnforcer();
    private final ForwardCompiler compiler;
    private final ReverseExtractor extractor;

    public Workspace(BlockKindRegistry registry, CompilerOptions options, ExtractionPolicy policy) {
        this.registry = registry;
        this.loopVariables = new LoopVariableMaintainer(registry);
        this.compiler = new ForwardCompiler(options);
        this.extractor = new ReverseExtractor(registry, policy);
        pipeline.addReaction(loopVariables);
        pipeline.addReaction(handlers);
    }

    /** A workspace over the built-in kinds with default options. */
    public static Workspace create() {
        return new Workspace(BlockKindRegistry.defaults(), CompilerOptions.defaults(), ExtractionPolicy.PRESERVE);
    }

    /**
     * Creates a workspace configured from the {@code blocksync} block of the application config.
     * @param config The resolved application configuration.
     * @return The workspace.
     */
    public static Workspace fromConfig(Config config) {
        Config blocksync = config.getConfig("blocksync");
        return new Workspace(BlockKindRegistry.defaults(),
                CompilerOptions.fromConfig(blocksync.getConfig("compiler")),
                ExtractionPolicy.parse(blocksync.getString("extractor.unrecognized")));
    }

    public BlockKindRegistry registry() {
        return registry;
    }

    public Graph graph() {
        return graph;
    }

    public MutationPipeline pipeline() {
        return pipeline;
    }

    public LoopVariableMaintainer loopVariables() {
        return loopVariables;
    }

    public HandlerUniquenessEnforcer handlers() {
        return handlers;
    }

    public void edit(Consumer<Graph> edit) {
        pipeline.edit(edit);
    }

    public int settle() {
        return pipeline.settle();
    }

    /** Settles pending fixes and compiles the graph. */
    public String source() {
        settle();
        return compiler.compile(graph);
    }

    /**
     * Replaces the graph's content with the program extracted from {@code text}.
     * @param text The program text.
     * @return The extraction result; its graph is the scratch graph the content was copied from.
     * @throws org.blocksync.compiler.frontend.UnrecognizedFragmentException under the fail policy;
     *         the workspace is unchanged in that case.
     */
    public ExtractionResult load(String text) {
        ExtractionResult result = extractor.extract(text);
        edit(g -> {
            for (Node root : g.roots()) {
                if (g.contains(root.id())) {
                    g.dispose(root.id());
                }
            }
            g.adopt(result.graph());
        });
        settle();
        log.debug("Loaded {} node(s), {} unrecognized fragment(s)", graph.size(), result.unrecognized().size());
        return result;
    }

    /** Runs the workspace lint over the current graph. */
    public DiagnosticsEngine lint() {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        WorkspaceLint.check(graph, diagnostics);
        return diagnostics;
    }
}
