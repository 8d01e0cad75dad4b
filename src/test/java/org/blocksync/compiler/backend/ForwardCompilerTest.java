package org.blocksync.compiler.backend;

import org.blocksync.graph.Graph;
import org.blocksync.graph.Mutation;
import org.blocksync.graph.Node;
import org.blocksync.graph.SlotRef;
import org.blocksync.registry.BlockKindRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class ForwardCompilerTest {

    private final BlockKindRegistry registry = BlockKindRegistry.defaults();
    private final ForwardCompiler compiler = new ForwardCompiler();
    private Graph graph;

    @BeforeEach
    void setUp() {
        graph = new Graph();
    }

    private Node create(String tag) {
        return graph.create(registry.lookup(tag));
    }

    private Node number(String value) {
        Node n = create("math_number");
        graph.setField(n.id(), "NUM", value);
        return n;
    }

    private Node text(String value) {
        Node n = create("text");
        graph.setField(n.id(), "TEXT", value);
        return n;
    }

    private void put(Node owner, String slot, Node child) {
        graph.attach(child.id(), SlotRef.of(owner.id(), slot));
    }

    private void chain(Node... statements) {
        for (int i = 1; i < statements.length; i++) {
            graph.attach(statements[i].id(), SlotRef.next(statements[i - 1].id()));
        }
    }

    private Node forever(Node body) {
        Node handler = create("forever");
        if (body != null) {
            put(handler, "DO", body);
        }
        return handler;
    }

    @Test
    void emptyGraphCompilesToEmptyText() {
        assertThat(compiler.compile(graph)).isEmpty();
    }

    @Test
    @DisplayName("Button handler showing a letter compiles to definition, body and registration")
    void buttonHandlerScenario() {
        Node handler = create("on_button_pressed");
        Node show = create("show_string");
        put(show, "TEXT", text("A"));
        put(handler, "DO", show);

        assertThat(compiler.compile(graph)).isEqualTo("""
                def on_button_pressed_a():
                    basic.show_string("A")
                input.on_button_pressed(Button.A, on_button_pressed_a)
                """);
    }

    @Test
    @DisplayName("Empty value and statement slots fall back to defaults")
    void defaultsFillEmptySlots() {
        Node conditional = create("controls_if");
        forever(conditional);
        create("loops_for_range");
        create("loops_every_interval");

        assertThat(compiler.compile(graph)).isEqualTo("""
                def on_forever():
                    if True:
                        pass
                basic.forever(on_forever)

                for index in range(0, 4 + 1):
                    pass

                def on_every_interval():
                    basic.pause(500)
                basic.forever(on_every_interval)
                """);
    }

    @Test
    @DisplayName("if, elif and else arms compile in order, bodies one level deeper")
    void branchesInOrder() {
        Node conditional = create("controls_if");
        graph.setMutation(conditional.id(), new Mutation(1, true));
        Node first = create("show_number");
        put(first, "NUM", number("1"));
        Node second = create("show_number");
        put(second, "NUM", number("2"));
        Node third = create("show_number");
        put(third, "NUM", number("3"));
        Node a = create("button_is_pressed");
        Node b = create("button_is_pressed");
        graph.setField(b.id(), "BUTTON", "B");
        put(conditional, "IF0", a);
        put(conditional, "DO0", first);
        put(conditional, "IF1", b);
        put(conditional, "DO1", second);
        put(conditional, "ELSE", third);
        forever(conditional);

        assertThat(compiler.compile(graph)).isEqualTo("""
                def on_forever():
                    if input.button_is_pressed(Button.A):
                        basic.show_number(1)
                    elif input.button_is_pressed(Button.B):
                        basic.show_number(2)
                    else:
                        basic.show_number(3)
                basic.forever(on_forever)
                """);
    }

    @Test
    @DisplayName("Parentheses follow operator precedence")
    void precedence() {
        Node sum = create("math_arithmetic");
        put(sum, "A", number("1"));
        put(sum, "B", number("2"));
        Node product = create("math_arithmetic");
        graph.setField(product.id(), "OP", "MULTIPLY");
        put(product, "A", sum);
        put(product, "B", number("3"));
        Node show = create("show_number");
        put(show, "NUM", product);

        Node and = create("logic_operation");
        Node not = create("logic_negate");
        put(not, "BOOL", and);
        Node loop = create("loops_while");
        put(loop, "COND", not);
        chain(show, loop);
        forever(show);

        assertThat(compiler.compile(graph)).isEqualTo("""
                def on_forever():
                    basic.show_number((1 + 2) * 3)
                    while not (False and False):
                        pass
                basic.forever(on_forever)
                """);
    }

    @Test
    @DisplayName("Handlers declare the variables they assign as global")
    void globalsForAssignedVariables() {
        Node set = create("variables_set");
        graph.setField(set.id(), "VAR", "count");
        Node change = create("math_change");
        graph.setField(change.id(), "VAR", "count");
        Node other = create("variables_set");
        graph.setField(other.id(), "VAR", "total");
        chain(set, change, other);
        forever(set);

        assertThat(compiler.compile(graph)).isEqualTo("""
                def on_forever():
                    global count, total
                    count = 0
                    count += 1
                    total = 0
                basic.forever(on_forever)
                """);
    }

    @Test
    @DisplayName("Gated statements outside handlers are left out unless gating is off")
    void gatedStatementsNeedAHandler() {
        Node set = create("variables_set");
        Node show = create("show_string");
        Node pause = create("pause");
        chain(set, show, pause);

        assertThat(compiler.compile(graph)).isEqualTo("x = 0\n");
        assertThat(new ForwardCompiler(new CompilerOptions(4, false)).compile(graph)).isEqualTo("""
                x = 0
                basic.show_string("")
                basic.pause(100)
                """);
    }

    @Test
    @DisplayName("Gated values outside handlers fall back to the slot default")
    void gatedValuesNeedAHandler() {
        Node detached = create("variables_set");
        put(detached, "VALUE", create("light_level"));
        Node inside = create("variables_set");
        put(inside, "VALUE", create("temperature"));
        forever(inside);

        assertThat(compiler.compile(graph)).isEqualTo("""
                x = 0

                def on_forever():
                    global x
                    x = input.temperature()
                basic.forever(on_forever)
                """);
        assertThat(new ForwardCompiler(new CompilerOptions(4, false)).compile(graph))
                .startsWith("x = input.light_level()\n");
    }

    @Test
    @DisplayName("Assignments inside a disabled container add no global")
    void disabledContainerContributesNoGlobals() {
        Node repeat = create("loops_repeat");
        put(repeat, "DO", create("variables_set"));
        Node change = create("math_change");
        graph.setField(change.id(), "VAR", "count");
        chain(repeat, change);
        forever(repeat);
        graph.setDisabled(repeat.id(), true);

        assertThat(compiler.compile(graph)).isEqualTo("""
                def on_forever():
                    global count
                    count += 1
                basic.forever(on_forever)
                """);
    }

    @Test
    @DisplayName("Handlers that play a recording are async and on_start is awaited")
    void recordingMakesHandlerAsync() {
        Node record = create("music_record_and_play");
        graph.setField(record.id(), "RECORDER", "[262, 294]");
        Node start = create("on_start");
        put(start, "DO", record);
        Node disabledRecord = create("music_record_and_play");
        forever(disabledRecord);
        graph.setDisabled(disabledRecord.id(), true);

        assertThat(compiler.compile(graph)).isEqualTo("""
                async def on_start():
                    await music.record_and_play([262, 294])
                await on_start()

                def on_forever():
                    pass
                basic.forever(on_forever)
                """);
    }

    @Test
    void emptyRecordingPlaysAnEmptyList() {
        Node record = create("music_record_and_play");
        graph.setField(record.id(), "RECORDER", " ");
        forever(record);

        assertThat(compiler.compile(graph)).contains("    await music.record_and_play([])\n");
    }

    @Test
    @DisplayName("Stacks with nothing left to compile produce no section")
    void fullyGatedStackIsOmitted() {
        create("clear_screen");
        create("math_number");
        forever(null);

        assertThat(compiler.compile(graph)).isEqualTo("""
                def on_forever():
                    pass
                basic.forever(on_forever)
                """);
    }

    @Test
    @DisplayName("Disabled roots, statements and values are skipped")
    void disabledNodesAreSkipped() {
        Node first = create("show_number");
        Node dropped = create("clear_screen");
        Node last = create("show_number");
        Node value = number("7");
        put(last, "NUM", value);
        chain(first, dropped, last);
        forever(first);
        Node disabledHandler = create("on_start");
        graph.setDisabled(dropped.id(), true);
        graph.setDisabled(value.id(), true);
        graph.setDisabled(disabledHandler.id(), true);

        assertThat(compiler.compile(graph)).isEqualTo("""
                def on_forever():
                    basic.show_number(0)
                    basic.show_number(0)
                basic.forever(on_forever)
                """);
    }

    @Test
    void indentWidthIsConfigurable() {
        Node repeat = create("loops_repeat");
        Node inner = create("loops_repeat");
        put(repeat, "DO", inner);
        put(inner, "DO", create("loops_break"));

        assertThat(new ForwardCompiler(new CompilerOptions(2, true)).compile(graph)).isEqualTo("""
                for _ in range(4):
                  for _ in range(4):
                    break
                """);
    }

    @Test
    @DisplayName("Identical graphs compile to identical text")
    void compilationIsDeterministic() {
        Graph other = new Graph();
        for (Graph g : List.of(graph, other)) {
            Node handler = g.create(registry.lookup("on_gesture"));
            g.setField(handler.id(), "GESTURE", "LOGO_UP");
            Node show = g.create(registry.lookup("show_icon"));
            g.attach(show.id(), SlotRef.of(handler.id(), "DO"));
        }

        String first = compiler.compile(graph);
        assertThat(compiler.compile(other)).isEqualTo(first);
        assertThat(compiler.compile(graph)).isEqualTo(first);
        assertThat(first).containsOnlyOnce("input.on_gesture(Gesture.LOGO_UP, on_gesture_logo_up)");
    }

    @Test
    @DisplayName("Every handler instance gets its own registration line naming its procedure")
    void oneRegistrationPerHandlerInstance() {
        for (String button : List.of("A", "A", "B")) {
            Node handler = create("on_button_pressed");
            graph.setField(handler.id(), "BUTTON", button);
        }

        List<String> lines = compiler.compile(graph).lines().toList();

        assertThat(lines).filteredOn(line -> line.startsWith("def "))
                .containsExactly("def on_button_pressed_a():", "def on_button_pressed_a():", "def on_button_pressed_b():");
        assertThat(lines).filteredOn(line -> line.startsWith("input.on_button_pressed("))
                .containsExactly(
                        "input.on_button_pressed(Button.A, on_button_pressed_a)",
                        "input.on_button_pressed(Button.A, on_button_pressed_a)",
                        "input.on_button_pressed(Button.B, on_button_pressed_b)");
    }

    @Test
    void compilingDuringDispatchIsRejected() {
        List<Throwable> failures = new ArrayList<>();
        graph.addListener(event -> {
            try {
                compiler.compile(graph);
            } catch (IllegalStateException e) {
                failures.add(e);
            }
        });

        create("clear_screen");

        assertThat(failures).hasSize(1);
    }

    @Test
    void ledImageCompilesToTripleQuotedRows() {
        Node leds = create("basic_show_leds");
        forever(leds);

        assertThat(compiler.compile(graph)).isEqualTo("""
                def on_forever():
                    basic.show_leds(\"""
                    . . . . .
                    . . . . .
                    . . . . .
                    . . . . .
                    . . . . .
                    \""")
                basic.forever(on_forever)
                """);
    }
}
