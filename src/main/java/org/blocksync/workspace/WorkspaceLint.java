package org.blocksync.workspace;

import org.blocksync.compiler.diagnostics.DiagnosticsEngine;
import org.blocksync.graph.Graph;
import org.blocksync.graph.Node;
import org.blocksync.registry.features.loops.LoopBlocks;
import org.blocksync.registry.features.variables.VariableBlocks;

import java.util.Optional;

/**
 * Findings about graphs that compile but are unlikely to do what the user meant. A for-each
 * loop without a list is a warning; one whose element variable is also its list reads the
 * variable before the loop binds it, which is an error.
 */
public final class WorkspaceLint {

    private static final String SOURCE = "workspace";

    private WorkspaceLint() {
    }

    /**
     * Checks the graph.
     * @param graph       The graph to check.
     * @param diagnostics Receives the findings.
     */
    public static void check(Graph graph, DiagnosticsEngine diagnostics) {
        for (Node node : graph.nodes()) {
            if (!node.kind().tag().equals(LoopBlocks.FOR_OF)) {
                continue;
            }
            Optional<Node> list = graph.child(node.id(), "LIST");
            if (list.isEmpty()) {
                diagnostics.reportWarning(node + " iterates over no list", SOURCE, 0);
                continue;
            }
            Optional<String> element = variableName(graph, node, LoopBlocks.VAR);
            Optional<String> listName = variableName(list.get());
            if (element.isPresent() && element.equals(listName)) {
                diagnostics.reportError(node + " uses '" + element.get()
                        + "' both as element variable and as list", SOURCE, 0);
            }
        }
    }

    private static Optional<String> variableName(Graph graph, Node owner, String slot) {
        return graph.child(owner.id(), slot).flatMap(WorkspaceLint::variableName);
    }

    private static Optional<String> variableName(Node node) {
        return node.kind().tag().equals(VariableBlocks.GET)
                ? Optional.ofNullable(node.field(VariableBlocks.VAR))
                : Optional.empty();
    }
}
