package org.blocksync.registry.features.logic;

import org.blocksync.graph.Mutation;
import org.blocksync.graph.Node;
import org.blocksync.registry.BlockCategory;
import org.blocksync.registry.BlockKind;
import org.blocksync.registry.BlockKindRegistry;
import org.blocksync.registry.ClauseMatch;
import org.blocksync.registry.ClauseSpec;
import org.blocksync.registry.Fragment;
import org.blocksync.registry.IRenderContext;
import org.blocksync.registry.Order;
import org.blocksync.registry.ParameterSet;
import org.blocksync.registry.ShadowSpec;
import org.blocksync.registry.Slot;
import org.blocksync.registry.pattern.BinaryOperatorMatcher;
import org.blocksync.registry.pattern.BinaryOperatorMatcher.Operator;
import org.blocksync.registry.pattern.BinaryOperatorMatcher.Tier;
import org.blocksync.registry.pattern.PrefixOperatorMatcher;
import org.blocksync.registry.pattern.RegexMatcher;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Conditionals, comparisons, boolean operators and boolean literals.
 */
public final class LogicBlocks {

    public static final String IF = "controls_if";
    public static final String BOOLEAN = "logic_boolean";

    private static final String ELIF = "elif";
    private static final String ELSE = "else";

    private static final Map<String, String> COMPARISONS = Map.of(
            "EQ", "==", "NEQ", "!=", "LT", "<", "LTE", "<=", "GT", ">", "GTE", ">=");

    private LogicBlocks() {
    }

    public static void register(BlockKindRegistry registry) {
        registry.register(BlockKind.statement(IF, BlockCategory.LOGIC)
                .slot(condition(0))
                .statementInput("DO0")
                .mutator(LogicBlocks::conditionalSlots)
                .gated()
                .render(LogicBlocks::renderConditional)
                .pattern(new RegexMatcher("if (?<IF0>.+):"))
                .clause(new ClauseSpec(ELIF, new RegexMatcher("elif (?<IF>.+):"), true, false, true))
                .clause(new ClauseSpec(ELSE, new RegexMatcher("else:"), false, false, true))
                .extractor((kind, match) -> {
                    ParameterSet.Builder params = ParameterSet.builder()
                            .value("IF0", match.header().get("IF0"))
                            .body("DO0", match.body());
                    List<ClauseMatch> elifs = match.clauses(ELIF);
                    for (int i = 0; i < elifs.size(); i++) {
                        params.value("IF" + (i + 1), elifs.get(i).captures().get("IF"))
                                .body("DO" + (i + 1), elifs.get(i).body());
                    }
                    List<ClauseMatch> otherwise = match.clauses(ELSE);
                    otherwise.forEach(e -> params.body("ELSE", e.body()));
                    return Optional.of(params.mutation(new Mutation(elifs.size(), !otherwise.isEmpty())).build());
                })
                .tooltip("Run the first branch whose condition holds")
                .build());

        List<Operator> comparisonOperators = new ArrayList<>();
        for (String code : List.of("EQ", "NEQ", "LT", "LTE", "GT", "GTE")) {
            comparisonOperators.add(new Operator(COMPARISONS.get(code), code));
        }
        registry.register(BlockKind.value("logic_compare", BlockCategory.LOGIC, "Boolean")
                .field("OP", "EQ")
                .value("A", null, "0", ShadowSpec.number("0"))
                .value("B", null, "0", ShadowSpec.number("0"))
                .priority(30)
                .render((node, ctx) -> Fragment.of(
                        ctx.valueToCode(node, "A", Order.RELATIONAL) + " " + COMPARISONS.get(node.field("OP")) + " "
                                + ctx.valueToCode(node, "B", Order.RELATIONAL), Order.RELATIONAL))
                .pattern(new BinaryOperatorMatcher(new Tier(comparisonOperators, false)))
                .tooltip("Compare two values")
                .build());

        registry.register(BlockKind.value("logic_operation", BlockCategory.LOGIC, "Boolean")
                .field("OP", "AND")
                .value("A", "Boolean", "False", ShadowSpec.bool(true))
                .value("B", "Boolean", "False", ShadowSpec.bool(false))
                .priority(10)
                .render((node, ctx) -> {
                    boolean and = "AND".equals(node.field("OP"));
                    Order order = and ? Order.LOGICAL_AND : Order.LOGICAL_OR;
                    return Fragment.of(ctx.valueToCode(node, "A", order) + (and ? " and " : " or ")
                            + ctx.valueToCode(node, "B", order), order);
                })
                .pattern(new BinaryOperatorMatcher(
                        Tier.left(new Operator("or", "OR")),
                        Tier.left(new Operator("and", "AND"))))
                .tooltip("Combine two conditions")
                .build());

        registry.register(BlockKind.value("logic_negate", BlockCategory.LOGIC, "Boolean")
                .value("BOOL", "Boolean", "True", ShadowSpec.bool(true))
                .priority(20)
                .render((node, ctx) -> Fragment.of(
                        "not " + ctx.valueToCode(node, "BOOL", Order.LOGICAL_NOT), Order.LOGICAL_NOT))
                .pattern(new PrefixOperatorMatcher("not", "BOOL"))
                .tooltip("Invert a condition")
                .build());

        registry.register(BlockKind.value(BOOLEAN, BlockCategory.LOGIC, "Boolean")
                .field("BOOL", "TRUE")
                .render((node, ctx) -> Fragment.atomic("TRUE".equals(node.field("BOOL")) ? "True" : "False"))
                .pattern(new RegexMatcher("(?<BOOL>True|False)"))
                .extractor((kind, match) -> Optional.of(ParameterSet.builder()
                        .field("BOOL", match.header().get("BOOL").toUpperCase(Locale.ROOT))
                        .build()))
                .tooltip("True or False")
                .build());
    }

    private static Slot condition(int index) {
        return Slot.value("IF" + index, "Boolean", "True", ShadowSpec.bool(true));
    }

    private static List<Slot> conditionalSlots(Mutation mutation) {
        List<Slot> slots = new ArrayList<>();
        slots.add(condition(0));
        slots.add(Slot.statement("DO0"));
        for (int i = 1; i <= mutation.elseIfCount(); i++) {
            slots.add(condition(i));
            slots.add(Slot.statement("DO" + i));
        }
        if (mutation.hasElse()) {
            slots.add(Slot.statement("ELSE"));
        }
        return slots;
    }

    private static Fragment renderConditional(Node node, IRenderContext ctx) {
        StringBuilder sb = new StringBuilder();
        Mutation mutation = node.mutation();
        for (int i = 0; i <= mutation.elseIfCount(); i++) {
            sb.append(i == 0 ? "if " : "elif ")
                    .append(ctx.valueToCode(node, "IF" + i, Order.NONE))
                    .append(":\n")
                    .append(ctx.statementToCode(node, "DO" + i));
        }
        if (mutation.hasElse()) {
            sb.append("else:\n").append(ctx.statementToCode(node, "ELSE"));
        }
        return Fragment.statement(sb.toString());
    }
}
