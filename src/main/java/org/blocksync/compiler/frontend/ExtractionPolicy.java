package org.blocksync.compiler.frontend;

import java.util.Locale;

/**
 * What the {@link ReverseExtractor} does with source fragments no pattern recognizes. Each such
 * fragment is reported as an {@link UnrecognizedFragment} regardless of the policy.
 */
public enum ExtractionPolicy {
    /** Keep the fragment verbatim in an opaque node, so that it compiles back unchanged. */
    PRESERVE,
    /** Drop the fragment. */
    SKIP,
    /** Abort the extraction with an {@link UnrecognizedFragmentException}. */
    FAIL;

    /**
     * Parses a policy name case-insensitively.
     * @param name The policy name, e.g. {@code preserve}.
     * @return The policy.
     * @throws IllegalArgumentException if the name is unknown.
     */
    public static ExtractionPolicy parse(String name) {
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    "Unknown extraction policy '" + name + "', expected one of preserve, skip, fail", e);
        }
    }
}
