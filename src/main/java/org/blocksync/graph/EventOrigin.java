package org.blocksync.graph;

/**
 * Who caused a graph mutation.
 */
public enum EventOrigin {
    /** A user edit or an extractor load. */
    USER,
    /** A deferred fix applied while the mutation pipeline settles. */
    SYNTHETIC
}
