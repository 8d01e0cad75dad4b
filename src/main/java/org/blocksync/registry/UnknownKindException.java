package org.blocksync.registry;

import org.blocksync.BlockSyncException;

/**
 * Thrown when a type tag is looked up that no registered block kind carries.
 */
public class UnknownKindException extends BlockSyncException {

    private final String tag;

    public UnknownKindException(String tag) {
        super("Unknown block kind: " + tag);
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }
}
