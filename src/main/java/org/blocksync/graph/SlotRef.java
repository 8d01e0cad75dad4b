package org.blocksync.graph;

/**
 * Addresses one slot of one node. The pseudo-slot {@link #NEXT} is the statement that follows
 * the owner in its chain.
 *
 * @param owner the node owning the slot.
 * @param slot  the slot name.
 */
public record SlotRef(NodeId owner, String slot) {

    public static final String NEXT = "@next";

    public static SlotRef of(NodeId owner, String slot) {
        return new SlotRef(owner, slot);
    }

    public static SlotRef next(NodeId owner) {
        return new SlotRef(owner, NEXT);
    }

    public boolean isNext() {
        return NEXT.equals(slot);
    }

    @Override
    public String toString() {
        return owner + "." + slot;
    }
}
