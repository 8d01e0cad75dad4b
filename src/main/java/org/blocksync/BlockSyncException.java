package org.blocksync;

/**
 * Base class of all unchecked exceptions raised by the synchronization engine.
 */
public class BlockSyncException extends RuntimeException {

    /**
     * Constructs a new exception with the specified detail message.
     * @param message the detail message.
     */
    public BlockSyncException(String message) {
        super(message);
    }

    /**
     * Constructs a new exception with the specified detail message and cause.
     * @param message the detail message.
     * @param cause the cause.
     */
    public BlockSyncException(String message, Throwable cause) {
        super(message, cause);
    }
}
