package org.blocksync.graph.io;

import org.blocksync.BlockSyncException;

/**
 * Thrown when a serialized graph cannot be read.
 */
public class GraphFormatException extends BlockSyncException {

    public GraphFormatException(String message) {
        super(message);
    }

    public GraphFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
