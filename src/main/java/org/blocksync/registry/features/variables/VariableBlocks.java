package org.blocksync.registry.features.variables;

import org.blocksync.registry.BlockCategory;
import org.blocksync.registry.BlockKind;
import org.blocksync.registry.BlockKindRegistry;
import org.blocksync.registry.Fragment;
import org.blocksync.registry.Order;
import org.blocksync.registry.ShadowSpec;
import org.blocksync.registry.pattern.RegexMatcher;

import java.util.Set;

/**
 * Variable references, assignments and increments. Variables are identified by name.
 * <p>
 * The reference and assignment patterns match almost any identifier or assignment and are
 * therefore tried after every other kind.
 */
public final class VariableBlocks {

    public static final String GET = "variables_get";
    public static final String SET = "variables_set";
    public static final String CHANGE = "math_change";
    public static final String VAR = "VAR";

    /** Kinds whose {@code VAR} field names a variable they assign. */
    public static final Set<String> ASSIGNING = Set.of(SET, CHANGE);

    private static final String NAME =
            "(?!(?:True|False|None|and|or|not|in|is|if|elif|else|for|while|def|return|pass|break|continue"
                    + "|global|lambda|import|from|class|with|try|except)\\b)(?<VAR>[A-Za-z_]\\w*)";

    private VariableBlocks() {
    }

    public static void register(BlockKindRegistry registry) {
        registry.register(BlockKind.value(GET, BlockCategory.VARIABLES, null)
                .field(VAR, "x")
                .priority(900)
                .render((node, ctx) -> Fragment.atomic(node.field(VAR)))
                .pattern(new RegexMatcher(NAME))
                .tooltip("The current value of a variable")
                .build());

        registry.register(BlockKind.statement(SET, BlockCategory.VARIABLES)
                .field(VAR, "x")
                .value("VALUE", null, "0", ShadowSpec.number("0"))
                .priority(800)
                .render((node, ctx) -> Fragment.line(
                        node.field(VAR) + " = " + ctx.valueToCode(node, "VALUE", Order.NONE)))
                .pattern(new RegexMatcher(NAME + " = (?<VALUE>.+)"))
                .tooltip("Assign a value to a variable")
                .build());

        registry.register(BlockKind.statement(CHANGE, BlockCategory.VARIABLES)
                .field(VAR, "x")
                .value("DELTA", "Number", "1", ShadowSpec.number("1"))
                .priority(800)
                .render((node, ctx) -> Fragment.line(
                        node.field(VAR) + " += " + ctx.valueToCode(node, "DELTA", Order.NONE)))
                .pattern(new RegexMatcher(NAME + " \\+= (?<DELTA>.+)"))
                .tooltip("Add to a variable")
                .build());
    }
}
