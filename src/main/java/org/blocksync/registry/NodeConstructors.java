package org.blocksync.registry;

import org.blocksync.graph.Node;

/**
 * Common {@link INodeConstructor}s.
 */
public final class NodeConstructors {

    private static final INodeConstructor STANDARD = (kind, parameters, graph) -> {
        Node node = graph.create(kind);
        parameters.mutation().ifPresent(m -> graph.setMutation(node.id(), m));
        parameters.fields().forEach((name, value) -> graph.setField(node.id(), name, value));
        return node;
    };

    private NodeConstructors() {
    }

    /** Creates a node of the kind, applies the mutation and sets every extracted field. */
    public static INodeConstructor standard() {
        return STANDARD;
    }
}
