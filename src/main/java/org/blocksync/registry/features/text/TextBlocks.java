package org.blocksync.registry.features.text;

import org.blocksync.registry.BlockCategory;
import org.blocksync.registry.BlockKind;
import org.blocksync.registry.BlockKindRegistry;
import org.blocksync.registry.Fragment;
import org.blocksync.registry.ParameterSet;
import org.blocksync.registry.features.Literals;
import org.blocksync.registry.pattern.RegexMatcher;

import java.util.Optional;

/**
 * String literals. Both quote styles are recognized; literals are always rendered with double
 * quotes.
 */
public final class TextBlocks {

    public static final String TEXT = "text";

    private TextBlocks() {
    }

    public static void register(BlockKindRegistry registry) {
        registry.register(BlockKind.value(TEXT, BlockCategory.TEXT, "String")
                .field("TEXT", "")
                .render((node, ctx) -> Fragment.atomic(Literals.quote(node.field("TEXT"))))
                .pattern(new RegexMatcher("\"(?<DQ>(?:[^\"\\\\]|\\\\.)*)\"|'(?<SQ>(?:[^'\\\\]|\\\\.)*)'"))
                .extractor((kind, match) -> {
                    String content = match.header().find("DQ").orElseGet(() -> match.header().get("SQ"));
                    return Optional.of(ParameterSet.builder().field("TEXT", Literals.unescape(content)).build());
                })
                .tooltip("A piece of text")
                .build());
    }
}
