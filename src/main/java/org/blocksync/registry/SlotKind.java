package org.blocksync.registry;

/**
 * What a {@link Slot} holds.
 */
public enum SlotKind {
    /** A scalar value edited in place (dropdown, number, text). */
    FIELD,
    /** A single value-producing child node. */
    VALUE,
    /** The head of a nested chain of statement nodes. */
    STATEMENT
}
