package org.blocksync.graph;

/**
 * Notification about one completed graph mutation.
 *
 * @param type      what happened.
 * @param nodeId    the node concerned.
 * @param kindTag   the type tag of the node concerned.
 * @param oldParent the slot the node occupied before, or {@code null}.
 * @param newParent the slot the node occupies afterwards, or {@code null}.
 * @param element   for {@link Type#CHANGED}: the field name, {@code mutation} or {@code disabled}.
 * @param oldValue  for {@link Type#CHANGED}: the previous value.
 * @param newValue  for {@link Type#CHANGED}: the new value.
 * @param origin    who caused the mutation.
 */
public record GraphEvent(Type type, NodeId nodeId, String kindTag, SlotRef oldParent, SlotRef newParent,
                         String element, String oldValue, String newValue, EventOrigin origin) {

    public static final String ELEMENT_MUTATION = "mutation";
    public static final String ELEMENT_DISABLED = "disabled";

    public enum Type {
        CREATED,
        MOVED,
        CHANGED,
        DELETED
    }

    static GraphEvent created(Node node, EventOrigin origin) {
        return new GraphEvent(Type.CREATED, node.id(), node.kind().tag(), null, null, null, null, null, origin);
    }

    static GraphEvent moved(Node node, SlotRef from, SlotRef to, EventOrigin origin) {
        return new GraphEvent(Type.MOVED, node.id(), node.kind().tag(), from, to, null, null, null, origin);
    }

    static GraphEvent changed(Node node, String element, String oldValue, String newValue, EventOrigin origin) {
        return new GraphEvent(Type.CHANGED, node.id(), node.kind().tag(), null, null, element, oldValue, newValue,
                origin);
    }

    static GraphEvent deleted(Node node, SlotRef from, EventOrigin origin) {
        return new GraphEvent(Type.DELETED, node.id(), node.kind().tag(), from, null, null, null, null, origin);
    }

    /** Whether the node left a slot (a move with no destination, or a deletion out of a slot). */
    public boolean isDetachment() {
        return oldParent != null && newParent == null && (type == Type.MOVED || type == Type.DELETED);
    }

    public boolean isSynthetic() {
        return origin == EventOrigin.SYNTHETIC;
    }
}
