package org.blocksync.compiler.frontend;

import org.blocksync.compiler.diagnostics.Diagnostic;
import org.blocksync.graph.Graph;

import java.util.List;

/**
 * Outcome of a reverse extraction.
 *
 * @param graph        the reconstructed graph.
 * @param unrecognized the fragments no pattern recognized, in source order.
 * @param diagnostics  everything reported while extracting.
 */
public record ExtractionResult(Graph graph, List<UnrecognizedFragment> unrecognized, List<Diagnostic> diagnostics) {

    public ExtractionResult {
        unrecognized = List.copyOf(unrecognized);
        diagnostics = List.copyOf(diagnostics);
    }

    /** Whether every fragment of the source was recognized. */
    public boolean isComplete() {
        return unrecognized.isEmpty();
    }
}
