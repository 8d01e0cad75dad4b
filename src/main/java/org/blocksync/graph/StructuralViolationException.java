package org.blocksync.graph;

import org.blocksync.BlockSyncException;

/**
 * Thrown when a graph mutation would break a structural rule: an occupied or unknown slot, a
 * type mismatch, a cycle, or a misplaced event handler. The graph is left unchanged.
 */
public class StructuralViolationException extends BlockSyncException {

    public StructuralViolationException(String message) {
        super(message);
    }
}
