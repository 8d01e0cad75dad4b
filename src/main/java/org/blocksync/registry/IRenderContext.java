package org.blocksync.registry;

import org.blocksync.graph.Graph;
import org.blocksync.graph.Node;

import java.util.List;

/**
 * Services the forward compiler offers to block renderers.
 */
public interface IRenderContext {

    /**
     * Renders the value child of a slot, parenthesized if its precedence requires it. An empty
     * slot renders the slot's default literal.
     *
     * @param node     The owning node.
     * @param slot     The value slot.
     * @param required The precedence the surrounding code requires.
     * @return The expression text.
     */
    String valueToCode(Node node, String slot, Order required);

    /**
     * Renders the statement chain in a statement slot one indentation level deeper. An empty
     * body renders as an indented {@code pass}.
     *
     * @param node The owning node.
     * @param slot The statement slot.
     * @return Indented lines, each ending in a newline.
     */
    String statementToCode(Node node, String slot);

    /** The indentation unit. */
    String indent();

    Graph graph();

    /**
     * Lists variables assigned by the statements nested below the node that are rendered, in
     * order of first appearance. Nothing below a disabled node counts.
     */
    List<String> assignedVariables(Node node);

    /** Whether any rendered statement nested below the node is an {@code await}. */
    boolean awaits(Node node);
}
