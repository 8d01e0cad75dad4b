package org.blocksync.registry.features.loops;

import org.blocksync.registry.BlockCategory;
import org.blocksync.registry.BlockKind;
import org.blocksync.registry.BlockKindRegistry;
import org.blocksync.registry.Fragment;
import org.blocksync.registry.Order;
import org.blocksync.registry.ShadowSpec;
import org.blocksync.registry.features.EventHandlers;
import org.blocksync.registry.pattern.CallMatcher;
import org.blocksync.registry.pattern.RegexMatcher;

/**
 * Counted, conditional and collection loops, the interval handler and loop jumps.
 * <p>
 * {@code for ... in range(0, TO + 1)} is tried before the plain repeat loop so that a counted
 * loop is never mistaken for one; the collection loop matches any {@code for} and goes last.
 */
public final class LoopBlocks {

    public static final String REPEAT = "loops_repeat";
    public static final String WHILE = "loops_while";
    public static final String FOR_RANGE = "loops_for_range";
    public static final String FOR_OF = "loops_for_of";
    public static final String EVERY_INTERVAL = "loops_every_interval";

    /** The variable-binding slot of the counted and collection loops. */
    public static final String VAR = "VAR";
    public static final String BODY = "DO";

    private LoopBlocks() {
    }

    public static void register(BlockKindRegistry registry) {
        registry.register(BlockKind.statement(FOR_RANGE, BlockCategory.LOOPS)
                .variableBinding(VAR, "index")
                .value("TO", "Number", "4", ShadowSpec.number("4"))
                .statementInput(BODY)
                .priority(90)
                .render((node, ctx) -> Fragment.statement(
                        "for " + ctx.valueToCode(node, VAR, Order.NONE)
                                + " in range(0, " + ctx.valueToCode(node, "TO", Order.ADDITIVE) + " + 1):\n"
                                + ctx.statementToCode(node, BODY)))
                .pattern(new RegexMatcher("for (?<VAR>[A-Za-z_]\\w*) in range\\(0, (?<TO>.+) \\+ 1\\):"))
                .tooltip("Count from 0 up to a number, including it")
                .build());

        registry.register(BlockKind.statement(REPEAT, BlockCategory.LOOPS)
                .value("TIMES", "Number", "4", ShadowSpec.number("4"))
                .statementInput(BODY)
                .render((node, ctx) -> Fragment.statement(
                        "for _ in range(" + ctx.valueToCode(node, "TIMES", Order.NONE) + "):\n"
                                + ctx.statementToCode(node, BODY)))
                .pattern(new RegexMatcher("for _ in range\\((?<TIMES>.+)\\):"))
                .tooltip("Run the body a number of times")
                .build());

        registry.register(BlockKind.statement(WHILE, BlockCategory.LOOPS)
                .value("COND", "Boolean", "True", ShadowSpec.bool(true))
                .statementInput(BODY)
                .render((node, ctx) -> Fragment.statement(
                        "while " + ctx.valueToCode(node, "COND", Order.NONE) + ":\n"
                                + ctx.statementToCode(node, BODY)))
                .pattern(new RegexMatcher("while (?<COND>.+):"))
                .tooltip("Run the body while a condition holds")
                .build());

        registry.register(BlockKind.statement(FOR_OF, BlockCategory.LOOPS)
                .variableBinding(VAR, "value")
                .value("LIST", null, "list", ShadowSpec.variable("list"))
                .statementInput(BODY)
                .priority(500)
                .render((node, ctx) -> Fragment.statement(
                        "for " + ctx.valueToCode(node, VAR, Order.NONE)
                                + " in " + ctx.valueToCode(node, "LIST", Order.RELATIONAL) + ":\n"
                                + ctx.statementToCode(node, BODY)))
                .pattern(new RegexMatcher("for (?<VAR>[A-Za-z_]\\w*) in (?<LIST>.+):"))
                .tooltip("Run the body for each element of a list")
                .build());

        registry.register(EventHandlers.build(
                BlockKind.eventHandler(EVERY_INTERVAL, BlockCategory.LOOPS)
                        .value("MS", "Number", "500", ShadowSpec.number("500"))
                        .tooltip("Run the body repeatedly, pausing between runs"),
                fields -> "on_every_interval",
                (node, name, ctx) -> "basic.forever(" + name + ")",
                new RegexMatcher("basic\\.forever\\((?<HANDLER>[A-Za-z_]\\w*)\\)"),
                new EventHandlers.Epilogue(
                        (node, name, ctx) -> "basic.pause(" + ctx.valueToCode(node, "MS", Order.NONE) + ")",
                        new CallMatcher("basic.pause", "(?<MS>.+)"))));

        registry.register(BlockKind.statement("loops_break", BlockCategory.LOOPS)
                .render((node, ctx) -> Fragment.line("break"))
                .pattern(new RegexMatcher("break"))
                .tooltip("Leave the enclosing loop")
                .build());

        registry.register(BlockKind.statement("loops_continue", BlockCategory.LOOPS)
                .render((node, ctx) -> Fragment.line("continue"))
                .pattern(new RegexMatcher("continue"))
                .tooltip("Skip to the next loop iteration")
                .build());
    }
}
