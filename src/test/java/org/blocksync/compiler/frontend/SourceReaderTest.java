package org.blocksync.compiler.frontend;

import org.blocksync.registry.pattern.SourceBlock;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class SourceReaderTest {

    private final SourceReader reader = new SourceReader();

    @Test
    void nestsLinesByIndentation() {
        List<SourceBlock> blocks = reader.read("""
                def on_forever():
                    if True:
                        pass
                    basic.pause(10)
                basic.forever(on_forever)
                """);

        assertThat(blocks).extracting(SourceBlock::text)
                .containsExactly("def on_forever():", "basic.forever(on_forever)");
        SourceBlock definition = blocks.get(0);
        assertThat(definition.children()).extracting(SourceBlock::text).containsExactly("if True:", "basic.pause(10)");
        assertThat(definition.children().get(0).children()).extracting(SourceBlock::text).containsExactly("pass");
        assertThat(blocks.get(1).line()).isEqualTo(5);
    }

    @Test
    void dropsCommentsAndRemembersBlankLines() {
        List<SourceBlock> blocks = reader.read("""
                # a program
                x = 1  # first

                y = 2
                """);

        assertThat(blocks).extracting(SourceBlock::text).containsExactly("x = 1", "y = 2");
        assertThat(blocks).extracting(SourceBlock::precededByBlank).containsExactly(false, true);
        assertThat(blocks).extracting(SourceBlock::line).containsExactly(2, 4);
    }

    @Test
    void joinsBracketContinuationsAndTripleQuotedStrings() {
        List<SourceBlock> blocks = reader.read("""
                led.plot(1,
                         2)
                basic.show_leds(\"""
                    # . . . .
                    . # . . .
                    \""")
                """);

        assertThat(blocks).hasSize(2);
        assertThat(blocks.get(0).text()).isEqualTo("led.plot(1, 2)");
        assertThat(blocks.get(1).text()).startsWith("basic.show_leds(\"\"\"\n").contains("# . . . .").endsWith("\"\"\")");
        assertThat(blocks.get(1).line()).isEqualTo(3);
    }

    @Test
    void toSourceTextReindentsNestedLines() {
        SourceBlock block = reader.read("""
                while True:
                  x = 1
                  if x:
                    y = 2
                """).get(0);

        assertThat(block.toSourceText()).isEqualTo("while True:\n    x = 1\n    if x:\n        y = 2");
    }
}
