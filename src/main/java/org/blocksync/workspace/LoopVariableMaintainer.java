package org.blocksync.workspace;

import org.blocksync.graph.Graph;
import org.blocksync.graph.GraphEvent;
import org.blocksync.graph.Node;
import org.blocksync.graph.NodeId;
import org.blocksync.graph.SlotRef;
import org.blocksync.registry.BlockKind;
import org.blocksync.registry.BlockKindRegistry;
import org.blocksync.registry.Slot;
import org.blocksync.registry.features.variables.VariableBlocks;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Keeps the variable-binding slots of loops occupied.
 * <p>
 * Every variable reference sitting in a binding slot is tracked together with its loop, slot
 * and variable name. When the user drags such a reference out or deletes it, a fix is queued
 * that puts a fresh reference to the same variable back, provided the loop still exists and
 * the slot is still empty when the fix runs.
 */
public final class LoopVariableMaintainer implements IGraphReaction {

    private static final Logger log = LoggerFactory.getLogger(LoopVariableMaintainer.class);

    /**
     * Where a tracked reference sits.
     *
     * @param loop     the loop node.
     * @param slot     the binding slot.
     * @param variable the name the reference was bound to.
     */
    public record Binding(NodeId loop, String slot, String variable) {
    }

    private final BlockKind reference;
    private final Map<NodeId, Binding> tracked = new LinkedHashMap<>();

    public LoopVariableMaintainer(BlockKindRegistry registry) {
        this.reference = registry.lookup(VariableBlocks.GET);
    }

    /** The currently tracked references, keyed by reference node id. */
    public Map<NodeId, Binding> tracked() {
        return Collections.unmodifiableMap(tracked);
    }

    @Override
    public void onEvent(GraphEvent event, Graph graph, IFixScheduler scheduler) {
        if (event.isDetachment()) {
            Binding binding = tracked.remove(event.nodeId());
            if (binding != null) {
                log.debug("Variable reference {} left {}.{}, scheduling replacement",
                        event.nodeId(), binding.loop(), binding.slot());
                scheduler.defer("restore " + binding.variable() + " in " + binding.loop() + "." + binding.slot(),
                        g -> restore(g, binding));
            }
        }
        rebuild(graph);
    }

    @Override
    public void afterSettle(Graph graph) {
        rebuild(graph);
    }

    private void restore(Graph graph, Binding binding) {
        Node loop = graph.find(binding.loop()).orElse(null);
        if (loop == null) {
            log.trace("Loop {} is gone, nothing to restore", binding.loop());
            return;
        }
        if (loop.child(binding.slot()).isPresent()) {
            log.trace("{}.{} was refilled in the meantime", binding.loop(), binding.slot());
            return;
        }
        Node fresh = graph.create(reference);
        graph.setField(fresh.id(), VariableBlocks.VAR, binding.variable());
        graph.attach(fresh.id(), SlotRef.of(binding.loop(), binding.slot()));
    }

    private void rebuild(Graph graph) {
        tracked.clear();
        for (Node node : graph.nodes()) {
            for (Slot slot : node.kind().slots(node.mutation())) {
                if (!slot.bindsVariable()) {
                    continue;
                }
                node.child(slot.name())
                        .map(graph::node)
                        .filter(child -> child.kind().tag().equals(VariableBlocks.GET))
                        .ifPresent(child -> tracked.put(child.id(),
                                new Binding(node.id(), slot.name(), child.field(VariableBlocks.VAR))));
            }
        }
    }
}
