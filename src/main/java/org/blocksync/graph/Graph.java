package org.blocksync.graph;

import org.blocksync.registry.BlockKind;
import org.blocksync.registry.BlockShape;
import org.blocksync.registry.Slot;
import org.blocksync.registry.SlotKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Arena of {@link Node}s forming one visual program.
 * <p>
 * Nodes are kept in insertion order; top-level nodes ({@link #roots()}) are the program's
 * stacks and event handlers. Every mutation validates completely before it changes anything,
 * so a {@link StructuralViolationException} leaves the graph untouched. After a mutation has
 * completed, one {@link GraphEvent} per affected node is dispatched to the registered
 * listeners. Listeners must not mutate the graph while an event is being dispatched.
 * <p>
 * A graph is confined to a single thread.
 */
public final class Graph {

    private static final Logger log = LoggerFactory.getLogger(Graph.class);

    private final Map<NodeId, Node> nodes = new LinkedHashMap<>();
    private final List<IGraphListener> listeners = new CopyOnWriteArrayList<>();
    private long nextId = 1;
    private EventOrigin origin = EventOrigin.USER;
    private boolean dispatching;

    public void addListener(IGraphListener listener) {
        listeners.add(listener);
    }

    // ---- queries ----

    /**
     * @param id The node id.
     * @return The node.
     * @throws NoSuchElementException if the graph holds no such node.
     */
    public Node node(NodeId id) {
        Node node = nodes.get(id);
        if (node == null) {
            throw new NoSuchElementException("No node " + id + " in graph");
        }
        return node;
    }

    public Optional<Node> find(NodeId id) {
        return Optional.ofNullable(nodes.get(id));
    }

    public boolean contains(NodeId id) {
        return nodes.containsKey(id);
    }

    public int size() {
        return nodes.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    /** All nodes in insertion order. */
    public List<Node> nodes() {
        return List.copyOf(nodes.values());
    }

    /** Top-level nodes in insertion order. */
    public List<Node> roots() {
        return nodes.values().stream().filter(Node::isRoot).toList();
    }

    public Optional<Node> child(NodeId owner, String slot) {
        return node(owner).child(slot).map(this::node);
    }

    /**
     * Follows the statement chain starting at {@code head}.
     * @param head The first statement.
     * @return The chain, including {@code head}.
     */
    public List<Node> chain(NodeId head) {
        List<Node> chain = new ArrayList<>();
        Node current = node(head);
        while (current != null) {
            chain.add(current);
            current = current.next().map(this::node).orElse(null);
        }
        return chain;
    }

    /**
     * Collects a node and everything attached below it, including its chain successors, in
     * pre-order: the node, its slots in declaration order, then its successor.
     */
    public List<Node> subtree(NodeId id) {
        List<Node> result = new ArrayList<>();
        collect(node(id), result);
        return result;
    }

    private void collect(Node node, List<Node> into) {
        into.add(node);
        for (Slot slot : node.kind().slots(node.mutation())) {
            node.child(slot.name()).ifPresent(c -> collect(node(c), into));
        }
        node.next().ifPresent(n -> collect(node(n), into));
    }

    public boolean isDispatching() {
        return dispatching;
    }

    // ---- mutations ----

    /**
     * Creates a detached node with every field set to its default.
     * @param kind The block kind.
     * @return The new node.
     */
    public Node create(BlockKind kind) {
        checkMutable();
        Node node = new Node(new NodeId(nextId++), kind);
        for (Slot slot : kind.slots(Mutation.NONE)) {
            if (slot.kind() == SlotKind.FIELD && slot.defaultValue() != null) {
                node.putField(slot.name(), slot.defaultValue());
            }
        }
        nodes.put(node.id(), node);
        emit(List.of(GraphEvent.created(node, origin)));
        return node;
    }

    public void setField(NodeId id, String name, String value) {
        checkMutable();
        Node node = node(id);
        Slot slot = node.kind().slot(name, node.mutation())
                .orElseThrow(() -> new StructuralViolationException(node + " has no field " + name));
        if (slot.kind() != SlotKind.FIELD) {
            throw new StructuralViolationException(node + "." + name + " is not a field");
        }
        String old = node.field(name);
        if (value.equals(old)) {
            return;
        }
        node.putField(name, value);
        emit(List.of(GraphEvent.changed(node, name, old, value, origin)));
    }

    /**
     * Changes the arm structure of a mutable node. Slots that the new shape drops must be empty.
     */
    public void setMutation(NodeId id, Mutation mutation) {
        checkMutable();
        Node node = node(id);
        if (!node.kind().isMutable()) {
            throw new StructuralViolationException(node + " does not support mutations");
        }
        Set<String> kept = new HashSet<>();
        node.kind().slots(mutation).forEach(s -> kept.add(s.name()));
        for (String occupied : node.children().keySet()) {
            if (!SlotRef.NEXT.equals(occupied) && !kept.contains(occupied)) {
                throw new StructuralViolationException(
                        "Cannot drop occupied slot " + occupied + " of " + node);
            }
        }
        Mutation old = node.mutation();
        if (old.equals(mutation)) {
            return;
        }
        node.setMutation(mutation);
        emit(List.of(GraphEvent.changed(node, GraphEvent.ELEMENT_MUTATION, old.toString(), mutation.toString(),
                origin)));
    }

    public void setDisabled(NodeId id, boolean disabled) {
        checkMutable();
        Node node = node(id);
        if (node.isDisabled() == disabled) {
            return;
        }
        node.setDisabled(disabled);
        emit(List.of(GraphEvent.changed(node, GraphEvent.ELEMENT_DISABLED, String.valueOf(!disabled),
                String.valueOf(disabled), origin)));
    }

    /**
     * Places a detached node (with any chain successors) into an empty slot.
     * @throws StructuralViolationException if the node is attached elsewhere, the slot is unknown,
     *                                      occupied or incompatible, or a cycle would form.
     */
    public void attach(NodeId childId, SlotRef target) {
        checkMutable();
        Node child = node(childId);
        if (!child.isRoot()) {
            throw new StructuralViolationException(child + " is already attached to " + child.parent().get());
        }
        validatePlacement(child, target);
        link(child, target);
        emit(List.of(GraphEvent.moved(child, null, target, origin)));
    }

    /**
     * Removes a node from its slot, making it top-level. Its chain successors stay attached to
     * it. Detaching a top-level node does nothing.
     */
    public void detach(NodeId childId) {
        checkMutable();
        Node child = node(childId);
        if (child.isRoot()) {
            return;
        }
        SlotRef from = unlink(child);
        emit(List.of(GraphEvent.moved(child, from, null, origin)));
    }

    /**
     * Moves a node (with its chain successors) from wherever it is into an empty slot, as one
     * mutation with one event.
     */
    public void move(NodeId childId, SlotRef target) {
        checkMutable();
        Node child = node(childId);
        if (child.parent().filter(target::equals).isPresent()) {
            return;
        }
        validatePlacement(child, target);
        SlotRef from = child.isRoot() ? null : unlink(child);
        link(child, target);
        emit(List.of(GraphEvent.moved(child, from, target, origin)));
    }

    /**
     * Deletes a node, everything nested in it and its chain successors.
     */
    public void dispose(NodeId id) {
        checkMutable();
        Node node = node(id);
        List<Node> doomed = subtree(id);
        List<GraphEvent> events = new ArrayList<>(doomed.size());
        SlotRef from = node.isRoot() ? null : unlink(node);
        for (Node n : doomed) {
            SlotRef oldParent = n == node ? from : n.parent().orElse(null);
            nodes.remove(n.id());
            events.add(GraphEvent.deleted(n, oldParent, origin));
        }
        log.trace("Disposed {} node(s) starting at {}", doomed.size(), node);
        emit(events);
    }

    /**
     * Copies every node of another graph into this one, preserving structure, root order,
     * fields, mutations and disabled flags. The other graph is not modified.
     *
     * @param other The graph to copy from.
     * @return Mapping from the other graph's ids to the new ids.
     */
    public Map<NodeId, NodeId> adopt(Graph other) {
        Map<NodeId, NodeId> mapping = new HashMap<>();
        for (Node root : other.roots()) {
            copyTree(other, root, mapping);
        }
        return mapping;
    }

    private Node copyTree(Graph source, Node original, Map<NodeId, NodeId> mapping) {
        Node copy = create(original.kind());
        mapping.put(original.id(), copy.id());
        if (!original.mutation().equals(Mutation.NONE)) {
            setMutation(copy.id(), original.mutation());
        }
        original.fields().forEach((name, value) -> setField(copy.id(), name, value));
        if (original.isDisabled()) {
            setDisabled(copy.id(), true);
        }
        for (Map.Entry<String, NodeId> entry : original.children().entrySet()) {
            Node childCopy = copyTree(source, source.node(entry.getValue()), mapping);
            attach(childCopy.id(), SlotRef.of(copy.id(), entry.getKey()));
        }
        return copy;
    }

    /**
     * Runs mutations that the graph reports with {@link EventOrigin#SYNTHETIC} origin.
     */
    public void runSynthetic(Runnable mutations) {
        EventOrigin previous = origin;
        origin = EventOrigin.SYNTHETIC;
        try {
            mutations.run();
        } finally {
            origin = previous;
        }
    }

    // ---- internals ----

    private void validatePlacement(Node child, SlotRef target) {
        Node owner = find(target.owner())
                .orElseThrow(() -> new StructuralViolationException("No node " + target.owner() + " to attach to"));
        BlockShape childShape = child.kind().shape();
        if (target.isNext()) {
            if (owner.kind().shape() != BlockShape.STATEMENT) {
                throw new StructuralViolationException(owner + " cannot be followed by another statement");
            }
            if (childShape != BlockShape.STATEMENT) {
                throw new StructuralViolationException(child + " is not a statement and cannot follow " + owner);
            }
        } else {
            Slot slot = owner.kind().slot(target.slot(), owner.mutation())
                    .orElseThrow(() -> new StructuralViolationException(owner + " has no slot " + target.slot()));
            switch (slot.kind()) {
                case FIELD -> throw new StructuralViolationException(target + " is a field, not an input");
                case VALUE -> {
                    if (childShape != BlockShape.VALUE) {
                        throw new StructuralViolationException(child + " does not produce a value for " + target);
                    }
                    if (!slot.accepts(child.kind().outputCheck())) {
                        throw new StructuralViolationException(child + " produces " + child.kind().outputCheck()
                                + " but " + target + " requires " + slot.check());
                    }
                }
                case STATEMENT -> {
                    if (childShape != BlockShape.STATEMENT) {
                        throw new StructuralViolationException(child + " is not a statement and cannot nest in "
                                + target);
                    }
                }
            }
        }
        if (owner.child(target.slot()).isPresent()) {
            throw new StructuralViolationException(target + " is already occupied");
        }
        for (Node current = owner; current != null;
             current = current.parent().map(p -> node(p.owner())).orElse(null)) {
            if (current.id().equals(child.id())) {
                throw new StructuralViolationException("Attaching " + child + " to " + target + " would form a cycle");
            }
        }
    }

    private void link(Node child, SlotRef target) {
        node(target.owner()).putChild(target.slot(), child.id());
        child.setParent(target);
    }

    private SlotRef unlink(Node child) {
        SlotRef from = child.parent().orElseThrow();
        node(from.owner()).removeChild(from.slot());
        child.setParent(null);
        return from;
    }

    private void checkMutable() {
        if (dispatching) {
            throw new IllegalStateException(
                    "Graph mutated while an event is being dispatched; defer the change to the settle phase");
        }
    }

    private void emit(List<GraphEvent> events) {
        if (listeners.isEmpty()) {
            return;
        }
        dispatching = true;
        try {
            for (GraphEvent event : events) {
                for (IGraphListener listener : listeners) {
                    listener.onGraphEvent(event);
                }
            }
        } finally {
            dispatching = false;
        }
    }
}
