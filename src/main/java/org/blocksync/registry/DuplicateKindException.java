package org.blocksync.registry;

import org.blocksync.BlockSyncException;

/**
 * Thrown when a block kind is registered under a type tag that is already taken.
 */
public class DuplicateKindException extends BlockSyncException {

    private final String tag;

    public DuplicateKindException(String tag) {
        super("Block kind already registered: " + tag);
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }
}
