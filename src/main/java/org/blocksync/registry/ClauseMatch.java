package org.blocksync.registry;

import org.blocksync.registry.pattern.Captures;
import org.blocksync.registry.pattern.SourceBlock;

import java.util.List;

/**
 * One recognized clause line.
 *
 * @param clause   the clause name.
 * @param captures the named captures of the clause line.
 * @param body     the indented lines owned by the clause.
 * @param line     the source line of the clause.
 */
public record ClauseMatch(String clause, Captures captures, List<SourceBlock> body, int line) {
}
