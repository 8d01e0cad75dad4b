package org.blocksync.registry;

/**
 * Operator precedence of a rendered expression, from tightest ({@link #ATOMIC}) to loosest
 * ({@link #NONE}). Values follow the Python operator table.
 */
public enum Order {
    ATOMIC(0),
    MEMBER(2.1),
    FUNCTION_CALL(2.2),
    EXPONENTIATION(3),
    UNARY_SIGN(4),
    MULTIPLICATIVE(5),
    ADDITIVE(6),
    RELATIONAL(11),
    LOGICAL_NOT(12),
    LOGICAL_AND(13),
    LOGICAL_OR(14),
    NONE(99);

    private final double precedence;

    Order(double precedence) {
        this.precedence = precedence;
    }

    public double precedence() {
        return precedence;
    }

    /**
     * Decides whether an expression of this order must be wrapped in parentheses when it is
     * placed where the surrounding code requires {@code required}.
     * <p>
     * An expression binding less tightly than required is always wrapped. At equal precedence it
     * is wrapped too, except for atoms, unconstrained contexts and the associative pairs
     * (chained calls and member accesses, {@code not not}, {@code and and}, {@code or or}).
     *
     * @param required the order demanded by the enclosing expression.
     * @return {@code true} if parentheses are needed.
     */
    public boolean needsParenthesesWithin(Order required) {
        if (this.precedence < required.precedence) {
            return false;
        }
        if (this == required && (this == ATOMIC || this == NONE)) {
            return false;
        }
        return !isAssociativePair(required, this);
    }

    private static boolean isAssociativePair(Order outer, Order inner) {
        return switch (outer) {
            case FUNCTION_CALL, MEMBER -> inner == FUNCTION_CALL || inner == MEMBER;
            case LOGICAL_NOT -> inner == LOGICAL_NOT;
            case LOGICAL_AND -> inner == LOGICAL_AND;
            case LOGICAL_OR -> inner == LOGICAL_OR;
            default -> false;
        };
    }
}
