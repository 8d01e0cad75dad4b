package org.blocksync.compiler.frontend;

import org.blocksync.BlockSyncException;

/**
 * Thrown by the {@link ReverseExtractor} under {@link ExtractionPolicy#FAIL} when it meets a
 * fragment no pattern recognizes.
 */
public class UnrecognizedFragmentException extends BlockSyncException {

    private final transient UnrecognizedFragment fragment;

    public UnrecognizedFragmentException(UnrecognizedFragment fragment) {
        super("Unrecognized source at " + fragment);
        this.fragment = fragment;
    }

    public UnrecognizedFragment getFragment() {
        return fragment;
    }
}
