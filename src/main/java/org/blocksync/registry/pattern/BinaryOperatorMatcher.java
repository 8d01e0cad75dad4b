package org.blocksync.registry.pattern;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Splits an infix expression at its loosest top-level operator.
 * <p>
 * Operators are grouped into tiers from loosest to tightest binding. The first tier with a
 * top-level occurrence decides the split; within a left-associative tier the rightmost
 * occurrence wins, within a right-associative tier the leftmost. Operators must be written with
 * a single space on both sides, as the compiler renders them. Captures the operands as
 * {@code A} and {@code B} and the operator's field value as {@code OP}.
 */
public final class BinaryOperatorMatcher implements IFragmentMatcher {

    /**
     * @param symbol The operator as written, e.g. {@code +}.
     * @param code   The field value identifying it, e.g. {@code ADD}.
     */
    public record Operator(String symbol, String code) {
    }

    /**
     * One precedence level of operators.
     */
    public record Tier(List<Operator> operators, boolean rightAssociative) {

        public static Tier left(Operator... operators) {
            return new Tier(List.of(operators), false);
        }

        public static Tier right(Operator... operators) {
            return new Tier(List.of(operators), true);
        }
    }

    private final List<Tier> tiers;

    public BinaryOperatorMatcher(Tier... tiers) {
        this.tiers = List.of(tiers);
    }

    @Override
    public Optional<Captures> match(String fragment) {
        for (Tier tier : tiers) {
            int bestIndex = -1;
            Operator best = null;
            for (Operator op : tier.operators()) {
                List<Integer> hits = TextScanner.topLevelOccurrences(fragment, " " + op.symbol() + " ");
                if (hits.isEmpty()) {
                    continue;
                }
                int candidate = tier.rightAssociative() ? hits.get(0) : hits.get(hits.size() - 1);
                if (best == null
                        || (tier.rightAssociative() ? candidate < bestIndex : candidate > bestIndex)) {
                    bestIndex = candidate;
                    best = op;
                }
            }
            if (best != null) {
                String left = fragment.substring(0, bestIndex).trim();
                String right = fragment.substring(bestIndex + best.symbol().length() + 2).trim();
                if (left.isEmpty() || right.isEmpty()) {
                    return Optional.empty();
                }
                Map<String, String> groups = new LinkedHashMap<>();
                groups.put("A", left);
                groups.put("OP", best.code());
                groups.put("B", right);
                return Optional.of(Captures.of(groups));
            }
        }
        return Optional.empty();
    }
}
