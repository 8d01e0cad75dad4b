package org.blocksync.registry;

/**
 * A piece of rendered source text together with the precedence of its outermost operator.
 * Statement renderers produce complete lines ending in a newline and use {@link Order#NONE}.
 *
 * @param code  the rendered text.
 * @param order the precedence of the outermost construct.
 */
public record Fragment(String code, Order order) {

    public static Fragment of(String code, Order order) {
        return new Fragment(code, order);
    }

    public static Fragment atomic(String code) {
        return new Fragment(code, Order.ATOMIC);
    }

    public static Fragment call(String code) {
        return new Fragment(code, Order.FUNCTION_CALL);
    }

    public static Fragment statement(String code) {
        return new Fragment(code, Order.NONE);
    }

    /** Returns a statement fragment for a single line, appending the newline. */
    public static Fragment line(String code) {
        return new Fragment(code + "\n", Order.NONE);
    }

    public static Fragment empty() {
        return new Fragment("", Order.NONE);
    }

    public boolean isEmpty() {
        return code.isEmpty();
    }
}
