package org.blocksync.graph;

/**
 * Shape state of a conditional node: how many {@code elif} arms it has and whether it ends
 * with an {@code else} arm.
 *
 * @param elseIfCount number of {@code elif} arms, never negative.
 * @param hasElse     whether an {@code else} arm is present.
 */
public record Mutation(int elseIfCount, boolean hasElse) {

    public static final Mutation NONE = new Mutation(0, false);

    public Mutation {
        if (elseIfCount < 0) {
            throw new IllegalArgumentException("elseIfCount must not be negative: " + elseIfCount);
        }
    }

    @Override
    public String toString() {
        return "elif=" + elseIfCount + ",else=" + hasElse;
    }
}
