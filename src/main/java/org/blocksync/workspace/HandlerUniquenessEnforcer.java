package org.blocksync.workspace;

import org.blocksync.graph.Graph;
import org.blocksync.graph.GraphEvent;
import org.blocksync.graph.Node;
import org.blocksync.graph.NodeId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Ensures that at most one event handler per procedure name is enabled.
 * <p>
 * Handlers are grouped by the procedure name they compile to. The first handler of a group in
 * graph order stays enabled, every later one is disabled. A handler this enforcer disabled is
 * enabled again once it is the first of its group. Handlers the user disabled are left alone
 * and do not count as the first of their group.
 */
public final class HandlerUniquenessEnforcer implements IGraphReaction {

    private static final Logger log = LoggerFactory.getLogger(HandlerUniquenessEnforcer.class);

    private final Set<NodeId> disabledHere = new HashSet<>();
    private boolean scheduled;

    @Override
    public void onEvent(GraphEvent event, Graph graph, IFixScheduler scheduler) {
        if (event.type() == GraphEvent.Type.CHANGED && GraphEvent.ELEMENT_DISABLED.equals(event.element())) {
            // the user took over this handler's enablement
            disabledHere.remove(event.nodeId());
        }
        if (!scheduled) {
            scheduled = true;
            scheduler.defer("recompute handler uniqueness", this::recompute);
        }
    }

    /** Handlers currently disabled because an earlier handler has the same procedure name. */
    public Set<NodeId> disabledDuplicates() {
        return Set.copyOf(disabledHere);
    }

    private void recompute(Graph graph) {
        scheduled = false;
        disabledHere.removeIf(id -> !graph.contains(id));
        Map<String, Node> first = new LinkedHashMap<>();
        for (Node root : graph.roots()) {
            if (!root.kind().isEventHandler()) {
                continue;
            }
            if (root.isDisabled() && !disabledHere.contains(root.id())) {
                continue;
            }
            String name = root.kind().procedureName(root).orElseThrow();
            Node owner = first.putIfAbsent(name, root);
            if (owner == null) {
                if (disabledHere.remove(root.id())) {
                    log.debug("Re-enabling {} as the only handler {}", root, name);
                    graph.setDisabled(root.id(), false);
                }
            } else if (!root.isDisabled()) {
                log.debug("Disabling {}: {} already handles {}", root, owner, name);
                disabledHere.add(root.id());
                graph.setDisabled(root.id(), true);
            }
        }
    }
}
