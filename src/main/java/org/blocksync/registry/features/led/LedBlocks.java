package org.blocksync.registry.features.led;

import org.blocksync.graph.Node;
import org.blocksync.registry.BlockCategory;
import org.blocksync.registry.BlockKind;
import org.blocksync.registry.BlockKindRegistry;
import org.blocksync.registry.Fragment;
import org.blocksync.registry.IRenderContext;
import org.blocksync.registry.Order;
import org.blocksync.registry.ShadowSpec;
import org.blocksync.registry.pattern.CallMatcher;

/**
 * Single-LED plotting blocks addressed by column and row.
 */
public final class LedBlocks {

    private static final String ANY_X = "(?<X>.+)";
    private static final String ANY_Y = "(?<Y>.+)";

    private LedBlocks() {
    }

    public static void register(BlockKindRegistry registry) {
        registry.register(coordinateStatement("plot_led", "led.plot", "Turn on the LED at (x, y)"));
        registry.register(coordinateStatement("unplot_led", "led.unplot", "Turn off the LED at (x, y)"));
        registry.register(coordinateStatement("toggle_led", "led.toggle", "Toggle the LED at (x, y)"));

        registry.register(coordinates(BlockKind.statement("plot_led_brightness", BlockCategory.LED))
                .field("BRIGHTNESS", "255")
                .gated()
                .render((node, ctx) -> Fragment.line(
                        "led.plot_brightness(" + xy(node, ctx) + ", " + node.field("BRIGHTNESS") + ")"))
                .pattern(new CallMatcher("led.plot_brightness", ANY_X, ANY_Y, "(?<BRIGHTNESS>\\d{1,3})"))
                .tooltip("Plot the LED at (x, y) with a brightness from 0 to 255")
                .build());

        registry.register(coordinates(BlockKind.value("point_led", BlockCategory.LED, "Boolean"))
                .render((node, ctx) -> Fragment.call("led.point(" + xy(node, ctx) + ")"))
                .pattern(new CallMatcher("led.point", ANY_X, ANY_Y))
                .tooltip("Whether the LED at (x, y) is on")
                .build());
    }

    private static BlockKind coordinateStatement(String tag, String function, String tooltip) {
        return coordinates(BlockKind.statement(tag, BlockCategory.LED))
                .gated()
                .render((node, ctx) -> Fragment.line(function + "(" + xy(node, ctx) + ")"))
                .pattern(new CallMatcher(function, ANY_X, ANY_Y))
                .tooltip(tooltip)
                .build();
    }

    private static BlockKind.Builder coordinates(BlockKind.Builder builder) {
        return builder
                .value("X", "Number", "0", ShadowSpec.number("2"))
                .value("Y", "Number", "0", ShadowSpec.number("2"));
    }

    private static String xy(Node node, IRenderContext ctx) {
        return ctx.valueToCode(node, "X", Order.NONE) + ", " + ctx.valueToCode(node, "Y", Order.NONE);
    }
}
