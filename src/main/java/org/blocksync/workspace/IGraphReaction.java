package org.blocksync.workspace;

import org.blocksync.graph.Graph;
import org.blocksync.graph.GraphEvent;

/**
 * A component that keeps the graph well-formed by reacting to user edits.
 * <p>
 * Reactions see only events of user origin. They may read the graph while an event is
 * dispatched, but every change they want to make must be handed to the scheduler.
 */
public interface IGraphReaction {

    void onEvent(GraphEvent event, Graph graph, IFixScheduler scheduler);

    /**
     * Called once all deferred fixes of a settle phase have been applied.
     */
    default void afterSettle(Graph graph) {
    }
}
