package org.blocksync.registry;

import java.util.Optional;

/**
 * Turns a pattern match into the parameters of a node.
 */
@FunctionalInterface
public interface IParameterExtractor {

    /**
     * @param kind  The kind whose pattern matched.
     * @param match The captures, body and clauses of the match.
     * @return The parameters, or empty if the match is not consistent with this kind after all.
     */
    Optional<ParameterSet> extract(BlockKind kind, PatternMatch match);
}
