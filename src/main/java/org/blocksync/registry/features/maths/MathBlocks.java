package org.blocksync.registry.features.maths;

import org.blocksync.registry.BlockCategory;
import org.blocksync.registry.BlockKind;
import org.blocksync.registry.BlockKindRegistry;
import org.blocksync.registry.Fragment;
import org.blocksync.registry.Order;
import org.blocksync.registry.ShadowSpec;
import org.blocksync.registry.pattern.BinaryOperatorMatcher;
import org.blocksync.registry.pattern.BinaryOperatorMatcher.Operator;
import org.blocksync.registry.pattern.BinaryOperatorMatcher.Tier;
import org.blocksync.registry.pattern.CallMatcher;
import org.blocksync.registry.pattern.RegexMatcher;

import java.util.Map;

/**
 * Number literals, arithmetic and random integers.
 */
public final class MathBlocks {

    public static final String NUMBER = "math_number";

    private record ArithmeticOp(String symbol, Order order) {
    }

    private static final Map<String, ArithmeticOp> ARITHMETIC = Map.of(
            "ADD", new ArithmeticOp("+", Order.ADDITIVE),
            "MINUS", new ArithmeticOp("-", Order.ADDITIVE),
            "MULTIPLY", new ArithmeticOp("*", Order.MULTIPLICATIVE),
            "DIVIDE", new ArithmeticOp("/", Order.MULTIPLICATIVE),
            "POWER", new ArithmeticOp("**", Order.EXPONENTIATION));

    private MathBlocks() {
    }

    public static void register(BlockKindRegistry registry) {
        registry.register(BlockKind.value(NUMBER, BlockCategory.MATHS, "Number")
                .field("NUM", "0")
                .render((node, ctx) -> {
                    String num = node.field("NUM");
                    return Fragment.of(num, num.startsWith("-") ? Order.UNARY_SIGN : Order.ATOMIC);
                })
                .pattern(new RegexMatcher("(?<NUM>-?\\d+(?:\\.\\d+)?)"))
                .tooltip("A number")
                .build());

        registry.register(BlockKind.value("math_arithmetic", BlockCategory.MATHS, "Number")
                .field("OP", "ADD")
                .value("A", "Number", "0", ShadowSpec.number("1"))
                .value("B", "Number", "0", ShadowSpec.number("1"))
                .priority(40)
                .render((node, ctx) -> {
                    ArithmeticOp op = ARITHMETIC.get(node.field("OP"));
                    return Fragment.of(ctx.valueToCode(node, "A", op.order()) + " " + op.symbol() + " "
                            + ctx.valueToCode(node, "B", op.order()), op.order());
                })
                .pattern(new BinaryOperatorMatcher(
                        Tier.left(new Operator("+", "ADD"), new Operator("-", "MINUS")),
                        Tier.left(new Operator("*", "MULTIPLY"), new Operator("/", "DIVIDE")),
                        Tier.right(new Operator("**", "POWER"))))
                .tooltip("Add, subtract, multiply, divide or raise to a power")
                .build());

        registry.register(BlockKind.value("math_random_int", BlockCategory.MATHS, "Number")
                .value("FROM", "Number", "0", ShadowSpec.number("0"))
                .value("TO", "Number", "10", ShadowSpec.number("10"))
                .render((node, ctx) -> Fragment.call("random.randint(" + ctx.valueToCode(node, "FROM", Order.NONE)
                        + ", " + ctx.valueToCode(node, "TO", Order.NONE) + ")"))
                .pattern(new CallMatcher("random.randint", "(?<FROM>.+)", "(?<TO>.+)"))
                .gated()
                .tooltip("A random whole number between two limits, inclusive")
                .build());
    }
}
