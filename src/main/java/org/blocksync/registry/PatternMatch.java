package org.blocksync.registry;

import org.blocksync.registry.pattern.Captures;
import org.blocksync.registry.pattern.SourceBlock;

import java.util.List;

/**
 * Everything a statement pattern recognized: the header captures, the indented body below the
 * header and the clauses that followed it.
 *
 * @param header  captures of the header line.
 * @param body    the lines indented below the header.
 * @param clauses the recognized clauses, in source order.
 * @param line    the source line of the header.
 */
public record PatternMatch(Captures header, List<SourceBlock> body, List<ClauseMatch> clauses, int line) {

    /** Creates the match of an expression or a single line without body or clauses. */
    public static PatternMatch of(Captures captures) {
        return new PatternMatch(captures, List.of(), List.of(), 0);
    }

    public List<ClauseMatch> clauses(String name) {
        return clauses.stream().filter(c -> c.clause().equals(name)).toList();
    }
}
