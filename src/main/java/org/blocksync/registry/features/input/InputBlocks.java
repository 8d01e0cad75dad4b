package org.blocksync.registry.features.input;

import org.blocksync.registry.BlockCategory;
import org.blocksync.registry.BlockKind;
import org.blocksync.registry.BlockKindRegistry;
import org.blocksync.registry.Fragment;
import org.blocksync.registry.features.EventHandlers;
import org.blocksync.registry.pattern.RegexMatcher;

import java.util.List;
import java.util.Locale;

/**
 * Button, gesture and logo events and the sensor reporters.
 */
public final class InputBlocks {

    public static final String ON_BUTTON_PRESSED = "on_button_pressed";
    public static final String ON_GESTURE = "on_gesture";

    static final List<String> BUTTONS = List.of("A", "B", "AB");
    static final List<String> GESTURES = List.of(
            "SHAKE", "LOGO_UP", "LOGO_DOWN", "SCREEN_UP", "SCREEN_DOWN", "TILT_LEFT", "TILT_RIGHT",
            "FREE_FALL", "THREE_G", "SIX_G", "EIGHT_G");

    private static final String BUTTON_GROUP = "(?<BUTTON>" + String.join("|", BUTTONS) + ")";
    private static final String GESTURE_GROUP = "(?<GESTURE>" + String.join("|", GESTURES) + ")";
    private static final String HANDLER_GROUP = "(?<HANDLER>[A-Za-z_]\\w*)";

    private InputBlocks() {
    }

    public static void register(BlockKindRegistry registry) {
        registry.register(EventHandlers.build(
                BlockKind.eventHandler(ON_BUTTON_PRESSED, BlockCategory.INPUT)
                        .field("BUTTON", "A")
                        .tooltip("Run the body when a button is pressed"),
                fields -> "on_button_pressed_" + fields.getOrDefault("BUTTON", "A").toLowerCase(Locale.ROOT),
                (node, name, ctx) -> "input.on_button_pressed(Button." + node.field("BUTTON") + ", " + name + ")",
                new RegexMatcher("input\\.on_button_pressed\\(Button\\." + BUTTON_GROUP + ", " + HANDLER_GROUP + "\\)"),
                null));

        registry.register(EventHandlers.build(
                BlockKind.eventHandler(ON_GESTURE, BlockCategory.INPUT)
                        .field("GESTURE", "SHAKE")
                        .tooltip("Run the body when a gesture is detected"),
                fields -> "on_gesture_" + fields.getOrDefault("GESTURE", "SHAKE").toLowerCase(Locale.ROOT),
                (node, name, ctx) -> "input.on_gesture(Gesture." + node.field("GESTURE") + ", " + name + ")",
                new RegexMatcher("input\\.on_gesture\\(Gesture\\." + GESTURE_GROUP + ", " + HANDLER_GROUP + "\\)"),
                null));

        registry.register(EventHandlers.build(
                BlockKind.eventHandler("on_logo_pressed", BlockCategory.INPUT)
                        .tooltip("Run the body when the touch logo is pressed"),
                fields -> "on_logo_pressed",
                (node, name, ctx) -> "input.on_logo_pressed(" + name + ")",
                new RegexMatcher("input\\.on_logo_pressed\\(" + HANDLER_GROUP + "\\)"),
                null));

        registry.register(EventHandlers.build(
                BlockKind.eventHandler("on_logo_released", BlockCategory.INPUT)
                        .tooltip("Run the body when the touch logo is released"),
                fields -> "on_logo_released",
                (node, name, ctx) -> "input.on_logo_released(" + name + ")",
                new RegexMatcher("input\\.on_logo_released\\(" + HANDLER_GROUP + "\\)"),
                null));

        registry.register(BlockKind.value("button_is_pressed", BlockCategory.INPUT, "Boolean")
                .field("BUTTON", "A")
                .render((node, ctx) -> Fragment.call("input.button_is_pressed(Button." + node.field("BUTTON") + ")"))
                .pattern(new RegexMatcher("input\\.button_is_pressed\\(Button\\." + BUTTON_GROUP + "\\)"))
                .tooltip("Whether a button is held down")
                .build());

        registry.register(BlockKind.value("is_gesture", BlockCategory.INPUT, "Boolean")
                .field("GESTURE", "SHAKE")
                .render((node, ctx) -> Fragment.call("input.is_gesture(Gesture." + node.field("GESTURE") + ")"))
                .pattern(new RegexMatcher("input\\.is_gesture\\(Gesture\\." + GESTURE_GROUP + "\\)"))
                .gated()
                .tooltip("Whether the given gesture is currently happening")
                .build());

        registry.register(BlockKind.value("logo_is_pressed", BlockCategory.INPUT, "Boolean")
                .render((node, ctx) -> Fragment.call("input.logo_is_pressed()"))
                .pattern(new RegexMatcher("input\\.logo_is_pressed\\(\\)"))
                .tooltip("Whether the touch logo is pressed")
                .build());

        registry.register(BlockKind.value("light_level", BlockCategory.INPUT, "Number")
                .render((node, ctx) -> Fragment.call("input.light_level()"))
                .pattern(new RegexMatcher("input\\.light_level\\(\\)"))
                .gated()
                .tooltip("Light level from 0 (dark) to 255 (bright)")
                .build());

        registry.register(BlockKind.value("temperature", BlockCategory.INPUT, "Number")
                .render((node, ctx) -> Fragment.call("input.temperature()"))
                .pattern(new RegexMatcher("(?:input|basic)\\.temperature\\(\\)"))
                .gated()
                .tooltip("Temperature in degrees Celsius")
                .build());
    }
}
