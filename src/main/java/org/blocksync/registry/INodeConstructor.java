package org.blocksync.registry;

import org.blocksync.graph.Graph;
import org.blocksync.graph.Node;

/**
 * Creates a detached node of a kind from extracted parameters. Value inputs and bodies are
 * attached afterwards by the caller.
 */
@FunctionalInterface
public interface INodeConstructor {

    Node construct(BlockKind kind, ParameterSet parameters, Graph graph);
}
