package org.blocksync.graph;

/**
 * Receives graph mutation events synchronously, after each mutation has completed.
 * <p>
 * Listeners must not mutate the graph from within {@link #onGraphEvent}; the graph rejects such
 * calls with an {@link IllegalStateException}.
 */
@FunctionalInterface
public interface IGraphListener {

    void onGraphEvent(GraphEvent event);
}
