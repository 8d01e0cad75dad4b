package org.blocksync.graph;

import org.blocksync.registry.BlockKind;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * One instance of a block kind inside a {@link Graph}. Nodes are read-only to callers; every
 * change goes through the owning graph so that it can be validated and announced.
 */
public final class Node {

    private final NodeId id;
    private final BlockKind kind;
    private final Map<String, String> fields = new LinkedHashMap<>();
    private final Map<String, NodeId> children = new LinkedHashMap<>();
    private SlotRef parent;
    private Mutation mutation = Mutation.NONE;
    private boolean disabled;

    Node(NodeId id, BlockKind kind) {
        this.id = id;
        this.kind = kind;
    }

    public NodeId id() {
        return id;
    }

    public BlockKind kind() {
        return kind;
    }

    /**
     * @param name The field name.
     * @return The field value, or {@code null} if the field is not set.
     */
    public String field(String name) {
        return fields.get(name);
    }

    public Map<String, String> fields() {
        return Collections.unmodifiableMap(fields);
    }

    /**
     * @param slot A value or statement slot name, or {@link SlotRef#NEXT}.
     * @return The child occupying the slot.
     */
    public Optional<NodeId> child(String slot) {
        return Optional.ofNullable(children.get(slot));
    }

    /** Occupied slots in the order they were filled, including {@link SlotRef#NEXT}. */
    public Map<String, NodeId> children() {
        return Collections.unmodifiableMap(children);
    }

    public Optional<NodeId> next() {
        return child(SlotRef.NEXT);
    }

    public Optional<SlotRef> parent() {
        return Optional.ofNullable(parent);
    }

    public boolean isRoot() {
        return parent == null;
    }

    public Mutation mutation() {
        return mutation;
    }

    public boolean isDisabled() {
        return disabled;
    }

    void putField(String name, String value) {
        fields.put(name, value);
    }

    void putChild(String slot, NodeId child) {
        children.put(slot, child);
    }

    void removeChild(String slot) {
        children.remove(slot);
    }

    void setParent(SlotRef parent) {
        this.parent = parent;
    }

    void setMutation(Mutation mutation) {
        this.mutation = mutation;
    }

    void setDisabled(boolean disabled) {
        this.disabled = disabled;
    }

    @Override
    public String toString() {
        return kind.tag() + id;
    }
}
