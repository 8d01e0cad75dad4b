package org.blocksync.registry;

import org.blocksync.graph.Node;

/**
 * Renders one node to source text.
 */
@FunctionalInterface
public interface IBlockRenderer {

    Fragment render(Node node, IRenderContext context);
}
