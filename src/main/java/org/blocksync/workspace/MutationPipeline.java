package org.blocksync.workspace;

import org.blocksync.graph.Graph;
import org.blocksync.graph.GraphEvent;
import org.blocksync.graph.IGraphListener;
import org.blocksync.graph.Node;
import org.blocksync.graph.NodeId;
import org.blocksync.graph.StructuralViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Two-phase mutation processing for one graph.
 * <p>
 * In the first phase user edits are applied and each resulting event is handed to the
 * registered {@link IGraphReaction}s, which may only queue fixes. In the second phase
 * ({@link #settle()}) the queued fixes run in the order they were queued, with synthetic origin
 * so that reactions do not see them. A fix that violates the graph structure is dropped; nodes
 * it created are removed again.
 * <p>
 * Not thread-safe; the pipeline belongs to the same thread as its graph.
 */
public final class MutationPipeline implements IGraphListener, IFixScheduler {

    private static final Logger log = LoggerFactory.getLogger(MutationPipeline.class);

    private record DeferredFix(String description, Consumer<Graph> fix) {
    }

    private final Graph graph;
    private final List<IGraphReaction> reactions = new CopyOnWriteArrayList<>();
    private final List<Consumer<Graph>> settleListeners = new CopyOnWriteArrayList<>();
    private final Deque<DeferredFix> queue = new ArrayDeque<>();
    private final List<NodeId> createdByFix = new ArrayList<>();
    private boolean settling;

    public MutationPipeline(Graph graph) {
        this.graph = graph;
        graph.addListener(this);
    }

    public Graph graph() {
        return graph;
    }

    public void addReaction(IGraphReaction reaction) {
        reactions.add(reaction);
    }

    public void removeReaction(IGraphReaction reaction) {
        reactions.remove(reaction);
    }

    /** Registers a callback run at the end of every settle phase. */
    public void addSettleListener(Consumer<Graph> listener) {
        settleListeners.add(listener);
    }

    /**
     * Applies a user edit. Reactions observe the resulting events; their fixes wait for
     * {@link #settle()}.
     */
    public void edit(Consumer<Graph> edit) {
        edit.accept(graph);
    }

    @Override
    public void defer(String description, Consumer<Graph> fix) {
        log.trace("Deferred fix: {}", description);
        queue.addLast(new DeferredFix(description, fix));
    }

    public boolean hasPending() {
        return !queue.isEmpty();
    }

    public int pendingCount() {
        return queue.size();
    }

    /**
     * Drains the fix queue, then runs each reaction's settle hook and notifies settle listeners.
     * @return The number of fixes applied successfully.
     * @throws IllegalStateException if called from within a settle phase.
     */
    public int settle() {
        if (settling) {
            throw new IllegalStateException("settle() is not reentrant");
        }
        settling = true;
        int applied = 0;
        int dropped = 0;
        try {
            while (!queue.isEmpty()) {
                DeferredFix fix = queue.pollFirst();
                if (apply(fix)) {
                    applied++;
                } else {
                    dropped++;
                }
            }
            for (IGraphReaction reaction : reactions) {
                reaction.afterSettle(graph);
            }
        } finally {
            settling = false;
        }
        if (applied > 0 || dropped > 0) {
            log.debug("Settled: {} fix(es) applied, {} dropped", applied, dropped);
        }
        for (Consumer<Graph> listener : settleListeners) {
            listener.accept(graph);
        }
        return applied;
    }

    private boolean apply(DeferredFix fix) {
        createdByFix.clear();
        try {
            graph.runSynthetic(() -> fix.fix().accept(graph));
            return true;
        } catch (StructuralViolationException e) {
            log.warn("Dropped fix '{}': {}", fix.description(), e.getMessage());
            graph.runSynthetic(this::removeCreatedByFix);
            return false;
        } finally {
            createdByFix.clear();
        }
    }

    private void removeCreatedByFix() {
        List<NodeId> created = new ArrayList<>(createdByFix);
        for (int i = created.size() - 1; i >= 0; i--) {
            NodeId id = created.get(i);
            graph.find(id).filter(Node::isRoot).ifPresent(n -> graph.dispose(n.id()));
        }
    }

    @Override
    public void onGraphEvent(GraphEvent event) {
        if (event.isSynthetic()) {
            if (settling && event.type() == GraphEvent.Type.CREATED) {
                createdByFix.add(event.nodeId());
            }
            return;
        }
        for (IGraphReaction reaction : reactions) {
            reaction.onEvent(event, graph, this);
        }
    }
}
