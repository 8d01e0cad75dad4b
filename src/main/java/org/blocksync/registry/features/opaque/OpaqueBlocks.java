package org.blocksync.registry.features.opaque;

import org.blocksync.registry.BlockCategory;
import org.blocksync.registry.BlockKind;
import org.blocksync.registry.BlockKindRegistry;
import org.blocksync.registry.Fragment;
import org.blocksync.registry.Order;
import org.blocksync.registry.pattern.TextScanner;

/**
 * Carriers for source text no other kind recognizes. They have no pattern and are created only
 * by the extractor, which stores the foreign text verbatim in {@link #SOURCE}.
 */
public final class OpaqueBlocks {

    public static final String STATEMENT = "opaque_statement";
    public static final String EXPRESSION = "opaque_expression";
    public static final String SOURCE = "SOURCE";

    private OpaqueBlocks() {
    }

    public static void register(BlockKindRegistry registry) {
        registry.register(BlockKind.statement(STATEMENT, BlockCategory.INTERNAL)
                .field(SOURCE, "pass")
                .render((node, ctx) -> Fragment.line(node.field(SOURCE)))
                .tooltip("Source code kept as written")
                .build());

        registry.register(BlockKind.value(EXPRESSION, BlockCategory.INTERNAL, null)
                .field(SOURCE, "None")
                .render((node, ctx) -> Fragment.of(node.field(SOURCE), orderOf(node.field(SOURCE))))
                .tooltip("Expression kept as written")
                .build());
    }

    /** Text without top-level spaces binds like a call; anything else is parenthesized when nested. */
    private static Order orderOf(String source) {
        return TextScanner.topLevelOccurrences(source, " ").isEmpty() ? Order.FUNCTION_CALL : Order.NONE;
    }
}
