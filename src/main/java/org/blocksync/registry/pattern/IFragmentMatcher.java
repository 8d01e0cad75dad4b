package org.blocksync.registry.pattern;

import java.util.Optional;

/**
 * Recognizes one logical line or expression and captures its parameters by name.
 */
@FunctionalInterface
public interface IFragmentMatcher {

    /**
     * Attempts to match the whole fragment.
     * @param fragment The trimmed text of a logical line or expression.
     * @return The named captures, or empty if the fragment does not have this shape.
     */
    Optional<Captures> match(String fragment);
}
