package org.blocksync.compiler;

import org.blocksync.compiler.backend.ForwardCompiler;
import org.blocksync.compiler.frontend.ExtractionResult;
import org.blocksync.compiler.frontend.ReverseExtractor;
import org.blocksync.graph.Graph;
import org.blocksync.graph.Node;
import org.blocksync.graph.SlotRef;
import org.blocksync.registry.BlockCategory;
import org.blocksync.registry.BlockKind;
import org.blocksync.registry.BlockKindRegistry;
import org.blocksync.registry.BlockShape;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Compiling a graph, extracting the text and compiling again must reproduce the text.
 */
@Tag("unit")
class RoundTripTest {

    private static final BlockKindRegistry REGISTRY = BlockKindRegistry.defaults();

    private final ForwardCompiler compiler = new ForwardCompiler();
    private final ReverseExtractor extractor = new ReverseExtractor(REGISTRY);

    static Stream<String> programs() {
        return Stream.of(
                """
                def on_button_pressed_a():
                    basic.show_string("A")
                input.on_button_pressed(Button.A, on_button_pressed_a)
                """,
                """
                def on_forever():
                    if input.light_level() < 10:
                        basic.show_number(1)
                    elif input.button_is_pressed(Button.B):
                        basic.show_number(2)
                    else:
                        basic.show_number(3)
                basic.forever(on_forever)
                """,
                """
                def on_forever():
                    global count
                    count += 1
                    basic.show_number(count)
                basic.forever(on_forever)
                """,
                """
                x = (1 + 2) * 3

                def on_start():
                    basic.show_number(x - 1)
                on_start()
                """,
                """
                def on_forever():
                    if input.button_is_pressed(Button.A) and not input.is_gesture(Gesture.SHAKE):
                        display.show(Image.HEART)
                    else:
                        display.clear()
                basic.forever(on_forever)
                """,
                """
                def on_every_interval():
                    led.toggle(2, 2)
                    basic.pause(250)
                basic.forever(on_every_interval)
                """,
                """
                def on_forever():
                    basic.show_leds(\"""
                    # . . . #
                    . # . # .
                    . . # . .
                    . # . # .
                    # . . . #
                    \""")
                basic.forever(on_forever)
                """,
                """
                import radio

                name = "micro:bit"
                level = radio.receive_number()
                """,
                """
                def on_forever():
                    for _ in range(3):
                        for index in range(0, 4 + 1):
                            if index == 2:
                                break
                basic.forever(on_forever)
                """,
                """
                async def on_start():
                    await music.record_and_play([262, 294, 330])
                await on_start()
                """,
                """
                async def on_button_pressed_a():
                    basic.show_string("go")
                    await music.record_and_play([])
                input.on_button_pressed(Button.A, on_button_pressed_a)
                """);
    }

    @ParameterizedTest
    @MethodSource("programs")
    void programSurvivesExtractAndCompile(String program) {
        ExtractionResult result = extractor.extract(program);

        assertThat(compiler.compile(result.graph())).isEqualTo(program);
    }

    @Test
    void assignmentInsideDisabledLoopSurvives() {
        Graph graph = new Graph();
        Node forever = graph.create(REGISTRY.lookup("forever"));
        Node repeat = graph.create(REGISTRY.lookup("loops_repeat"));
        Node set = graph.create(REGISTRY.lookup("variables_set"));
        graph.attach(set.id(), SlotRef.of(repeat.id(), "DO"));
        graph.attach(repeat.id(), SlotRef.of(forever.id(), "DO"));
        graph.setDisabled(repeat.id(), true);
        String compiled = compiler.compile(graph);

        String recompiled = compiler.compile(extractor.extract(compiled).graph());

        assertThat(recompiled).isEqualTo(compiled).doesNotContain("global");
    }

    static Stream<BlockKind> kinds() {
        return REGISTRY.kinds().stream().filter(kind -> kind.category() != BlockCategory.INTERNAL);
    }

    /**
     * Places a default node of the kind where it can compile: handlers stand alone, statements
     * go into a forever loop and values are assigned to a variable there.
     */
    @ParameterizedTest
    @MethodSource("kinds")
    void defaultNodeOfEveryKindSurvives(BlockKind kind) {
        Graph graph = new Graph();
        Node node = graph.create(kind);
        if (kind.shape() != BlockShape.EVENT_HANDLER) {
            Node forever = graph.create(REGISTRY.lookup("forever"));
            Node statement = node;
            if (kind.shape() == BlockShape.VALUE) {
                statement = graph.create(REGISTRY.lookup("variables_set"));
                graph.attach(node.id(), SlotRef.of(statement.id(), "VALUE"));
            }
            graph.attach(statement.id(), SlotRef.of(forever.id(), "DO"));
        }
        String compiled = compiler.compile(graph);

        ExtractionResult result = extractor.extract(compiled);

        assertThat(result.unrecognized()).as("unrecognized in\n%s", compiled).isEmpty();
        assertThat(compiler.compile(result.graph())).isEqualTo(compiled);
    }
}
