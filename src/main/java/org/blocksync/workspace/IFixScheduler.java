package org.blocksync.workspace;

import org.blocksync.graph.Graph;

import java.util.function.Consumer;

/**
 * Accepts graph changes that must wait until the current mutation has been dispatched.
 */
@FunctionalInterface
public interface IFixScheduler {

    /**
     * Queues a fix for the next settle phase.
     * @param description What the fix does, for logging.
     * @param fix         The change to apply; it receives the graph.
     */
    void defer(String description, Consumer<Graph> fix);
}
