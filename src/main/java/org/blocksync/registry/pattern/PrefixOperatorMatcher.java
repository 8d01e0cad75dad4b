package org.blocksync.registry.pattern;

import java.util.Map;
import java.util.Optional;

/**
 * Matches a keyword prefix operator such as {@code not x}, capturing the operand.
 */
public final class PrefixOperatorMatcher implements IFragmentMatcher {

    private final String keyword;
    private final String operandGroup;

    public PrefixOperatorMatcher(String keyword, String operandGroup) {
        this.keyword = keyword + " ";
        this.operandGroup = operandGroup;
    }

    @Override
    public Optional<Captures> match(String fragment) {
        if (!fragment.startsWith(keyword)) {
            return Optional.empty();
        }
        String operand = fragment.substring(keyword.length()).trim();
        if (operand.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(Captures.of(Map.of(operandGroup, operand)));
    }
}
