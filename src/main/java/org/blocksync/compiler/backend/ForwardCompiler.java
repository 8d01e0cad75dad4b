package org.blocksync.compiler.backend;

import org.blocksync.graph.Graph;
import org.blocksync.graph.Node;
import org.blocksync.registry.BlockShape;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Compiles a block graph to program text.
 * <p>
 * Top-level nodes are compiled in insertion order: an event handler to its procedure definition
 * and registration, any other statement to the text of its chain. Disabled nodes, detached
 * values and stacks that produce no text are left out. The remaining sections are separated by
 * one blank line. The same graph always produces the same text, and the graph is never
 * modified.
 */
public final class ForwardCompiler {

    private static final Logger log = LoggerFactory.getLogger(ForwardCompiler.class);

    private final CompilerOptions options;

    public ForwardCompiler() {
        this(CompilerOptions.defaults());
    }

    public ForwardCompiler(CompilerOptions options) {
        this.options = options;
    }

    public CompilerOptions options() {
        return options;
    }

    /**
     * Compiles the graph.
     * @param graph The graph to compile; it may be incomplete.
     * @return The program text, ending with a newline, or an empty string for an empty program.
     * @throws IllegalStateException if called while the graph is dispatching a mutation event.
     */
    public String compile(Graph graph) {
        if (graph.isDispatching()) {
            throw new IllegalStateException("Cannot compile while the graph is dispatching a mutation event");
        }
        List<String> sections = new ArrayList<>();
        int skipped = 0;
        for (Node root : graph.roots()) {
            if (root.isDisabled() || root.kind().shape() == BlockShape.VALUE) {
                skipped++;
                continue;
            }
            String code;
            if (root.kind().isEventHandler()) {
                code = root.kind().render(root, new RenderContext(graph, options, true)).code();
            } else {
                code = new RenderContext(graph, options, false).renderChain(root);
            }
            code = stripTrailingNewlines(code);
            if (code.isBlank()) {
                skipped++;
                continue;
            }
            sections.add(code);
        }
        log.debug("Compiled {} section(s), skipped {} root(s)", sections.size(), skipped);
        return sections.isEmpty() ? "" : String.join("\n\n", sections) + "\n";
    }

    private static String stripTrailingNewlines(String code) {
        int end = code.length();
        while (end > 0 && code.charAt(end - 1) == '\n') {
            end--;
        }
        return code.substring(0, end);
    }
}
