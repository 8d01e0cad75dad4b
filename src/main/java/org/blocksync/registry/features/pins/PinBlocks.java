package org.blocksync.registry.features.pins;

import org.blocksync.registry.BlockCategory;
import org.blocksync.registry.BlockKind;
import org.blocksync.registry.BlockKindRegistry;
import org.blocksync.registry.Fragment;
import org.blocksync.registry.Order;
import org.blocksync.registry.ShadowSpec;
import org.blocksync.registry.pattern.CallMatcher;
import org.blocksync.registry.pattern.RegexMatcher;

/**
 * Digital and analog pin reads and writes on the edge connector pins P0 to P2.
 */
public final class PinBlocks {

    private static final String PIN = "(?<PIN>P[0-2])";

    private PinBlocks() {
    }

    public static void register(BlockKindRegistry registry) {
        registry.register(BlockKind.value("pins_digital_read_pin", BlockCategory.PINS, "Number")
                .field("PIN", "P0")
                .render((node, ctx) -> Fragment.call("pins.digital_read_pin(DigitalPin." + node.field("PIN") + ")"))
                .pattern(new RegexMatcher("pins\\.digital_read_pin\\(DigitalPin\\." + PIN + "\\)"))
                .tooltip("Read 0 or 1 from a pin")
                .build());

        registry.register(BlockKind.value("pins_read_analog_pin", BlockCategory.PINS, "Number")
                .field("PIN", "P0")
                .render((node, ctx) -> Fragment.call("pins.read_analog_pin(AnalogPin." + node.field("PIN") + ")"))
                .pattern(new RegexMatcher("pins\\.read_analog_pin\\(AnalogPin\\." + PIN + "\\)"))
                .tooltip("Read a value from 0 to 1023 from a pin")
                .build());

        registry.register(BlockKind.statement("pins_digital_write_pin", BlockCategory.PINS)
                .field("PIN", "P0")
                .value("VALUE", "Number", "0", ShadowSpec.number("0"))
                .render((node, ctx) -> Fragment.line("pins.digital_write_pin(DigitalPin." + node.field("PIN") + ", "
                        + ctx.valueToCode(node, "VALUE", Order.NONE) + ")"))
                .pattern(new CallMatcher("pins.digital_write_pin", "DigitalPin\\." + PIN, "(?<VALUE>.+)"))
                .tooltip("Write 0 or 1 to a pin")
                .build());

        registry.register(BlockKind.statement("pins_analog_write_pin", BlockCategory.PINS)
                .field("PIN", "P0")
                .value("VALUE", "Number", "1023", ShadowSpec.number("1023"))
                .render((node, ctx) -> Fragment.line("pins.analog_write_pin(AnalogPin." + node.field("PIN") + ", "
                        + ctx.valueToCode(node, "VALUE", Order.NONE) + ")"))
                .pattern(new CallMatcher("pins.analog_write_pin", "AnalogPin\\." + PIN, "(?<VALUE>.+)"))
                .tooltip("Write a value from 0 to 1023 to a pin")
                .build());
    }
}
