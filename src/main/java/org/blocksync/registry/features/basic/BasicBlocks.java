package org.blocksync.registry.features.basic;

import org.blocksync.registry.BlockCategory;
import org.blocksync.registry.BlockKind;
import org.blocksync.registry.BlockKindRegistry;
import org.blocksync.registry.Fragment;
import org.blocksync.registry.Order;
import org.blocksync.registry.ParameterExtractors;
import org.blocksync.registry.ShadowSpec;
import org.blocksync.registry.features.EventHandlers;
import org.blocksync.registry.pattern.CallMatcher;
import org.blocksync.registry.pattern.RegexMatcher;

import java.util.Optional;
import java.util.Set;

/**
 * Display and timing blocks, plus the {@code forever} and {@code on start} handlers.
 */
public final class BasicBlocks {

    public static final String FOREVER = "forever";
    public static final String ON_START = "on_start";

    static final Set<String> ICONS = Set.of(
            "HEART", "SMALL_HEART", "YES", "NO", "HAPPY", "SAD", "CONFUSED", "ANGRY", "ASLEEP", "SURPRISED",
            "SILLY", "FABULOUS", "MEH", "TSHIRT", "ROLLERSKATE", "DUCK", "HOUSE", "TORTOISE", "BUTTERFLY",
            "STICK_FIGURE", "GHOST", "SWORD", "GIRAFFE", "SKULL", "UMBRELLA", "SNAKE", "RABBIT", "COW",
            "QUARTER_NOTE", "EIGHTH_NOTE", "PITCHFORK", "TARGET", "TRIANGLE", "LEFT_TRIANGLE",
            "CHESSBOARD", "DIAMOND", "SMALL_DIAMOND", "SQUARE", "SMALL_SQUARE", "SCISSORS");

    private BasicBlocks() {
    }

    public static void register(BlockKindRegistry registry) {
        registry.register(BlockKind.statement("clear_screen", BlockCategory.BASIC)
                .gated()
                .render((node, ctx) -> Fragment.line("display.clear()"))
                .pattern(new RegexMatcher("(?:display\\.clear|basic\\.clear_screen)\\(\\)"))
                .tooltip("Turn off all LEDs")
                .build());

        registry.register(BlockKind.statement("show_string", BlockCategory.BASIC)
                .value("TEXT", "String", "\"\"", ShadowSpec.text("Hello!"))
                .gated()
                .render((node, ctx) -> Fragment.line(
                        "basic.show_string(" + ctx.valueToCode(node, "TEXT", Order.NONE) + ")"))
                .pattern(new CallMatcher("basic.show_string", "(?<TEXT>.+)"))
                .tooltip("Scroll text across the display")
                .build());

        registry.register(BlockKind.statement("show_number", BlockCategory.BASIC)
                .value("NUM", "Number", "0", ShadowSpec.number("0"))
                .gated()
                .render((node, ctx) -> Fragment.line(
                        "basic.show_number(" + ctx.valueToCode(node, "NUM", Order.NONE) + ")"))
                .pattern(new CallMatcher("basic.show_number", "(?<NUM>.+)"))
                .tooltip("Scroll a number across the display")
                .build());

        registry.register(BlockKind.statement("basic_show_leds", BlockCategory.BASIC)
                .field(LedMatrix.FIELD, LedMatrix.blank())
                .gated()
                .render((node, ctx) -> Fragment.statement(
                        "basic.show_leds(\"\"\"\n" + node.field(LedMatrix.FIELD) + "\n\"\"\")\n"))
                .pattern(new RegexMatcher("(?s)basic\\.show_leds\\(\\s*\"\"\"(?<LEDS>.*)\"\"\"\\s*\\)"))
                .extractor((kind, match) -> LedMatrix.normalize(match.header().get(LedMatrix.FIELD))
                        .map(leds -> ParameterExtractors.bySlotName(kind, match).field(LedMatrix.FIELD, leds).build()))
                .tooltip("Draw an image on the 5x5 LED grid")
                .build());

        registry.register(BlockKind.statement("pause", BlockCategory.BASIC)
                .value("TIME", "Number", "100", ShadowSpec.number("100"))
                .gated()
                .render((node, ctx) -> Fragment.line("basic.pause(" + ctx.valueToCode(node, "TIME", Order.NONE) + ")"))
                .pattern(new CallMatcher("basic.pause", "(?<TIME>.+)"))
                .tooltip("Pause for the given number of milliseconds")
                .build());

        registry.register(BlockKind.statement("show_icon", BlockCategory.BASIC)
                .field("ICON", "HEART")
                .gated()
                .render((node, ctx) -> Fragment.line("display.show(Image." + node.field("ICON") + ")"))
                .pattern(new RegexMatcher("display\\.show\\(Image\\.(?<ICON>[A-Z_]+)\\)"))
                .extractor((kind, match) -> ICONS.contains(match.header().get("ICON"))
                        ? Optional.of(ParameterExtractors.bySlotName(kind, match).build())
                        : Optional.empty())
                .tooltip("Show a built-in image")
                .build());

        registry.register(EventHandlers.build(
                BlockKind.eventHandler(FOREVER, BlockCategory.BASIC).tooltip("Run the body over and over"),
                fields -> "on_forever",
                (node, name, ctx) -> "basic.forever(" + name + ")",
                new RegexMatcher("basic\\.forever\\((?<HANDLER>[A-Za-z_]\\w*)\\)"),
                null));

        registry.register(EventHandlers.build(
                BlockKind.eventHandler(ON_START, BlockCategory.BASIC).tooltip("Run the body once at start-up"),
                fields -> "on_start",
                (node, name, ctx) -> (ctx.awaits(node) ? "await " : "") + name + "()",
                new RegexMatcher("(?:await )?(?<HANDLER>[A-Za-z_]\\w*)\\(\\)"),
                null));
    }
}
