package org.blocksync.registry;

import org.blocksync.registry.pattern.IFragmentMatcher;

/**
 * A follow-up line that belongs to a statement although it is written as the statement's
 * sibling, such as an {@code elif} arm or an event registration call.
 *
 * @param name       the clause name used to look up its matches.
 * @param matcher    recognizes the clause line.
 * @param repeatable whether the clause may occur several times in a row.
 * @param required   whether the statement is only recognized if the clause is present.
 * @param hasBody    whether the clause owns the indented lines below it.
 */
public record ClauseSpec(String name, IFragmentMatcher matcher, boolean repeatable, boolean required,
                         boolean hasBody) {
}
