package org.blocksync.graph.io;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.blocksync.compiler.backend.ForwardCompiler;
import org.blocksync.compiler.frontend.ReverseExtractor;
import org.blocksync.graph.Graph;
import org.blocksync.graph.Mutation;
import org.blocksync.graph.Node;
import org.blocksync.graph.SlotRef;
import org.blocksync.registry.BlockKindRegistry;
import org.blocksync.registry.UnknownKindException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class GraphJsonCodecTest {

    private static final String PROGRAM = """
            def on_forever():
                if input.button_is_pressed(Button.A):
                    basic.show_string("<&>")
                elif input.logo_is_pressed():
                    pass
                else:
                    basic.show_number(2 * 3)
                basic.pause(100)
            basic.forever(on_forever)
            """;

    private final BlockKindRegistry registry = BlockKindRegistry.defaults();
    private final GraphJsonCodec codec = new GraphJsonCodec(registry);
    private final ForwardCompiler compiler = new ForwardCompiler();

    @Test
    @DisplayName("A decoded graph compiles to the same program as the encoded one")
    void encodedGraphDecodesToEquivalentGraph() {
        Graph graph = new ReverseExtractor(registry).extract(PROGRAM).graph();

        Graph decoded = codec.decode(codec.encode(graph));

        assertThat(decoded.size()).isEqualTo(graph.size());
        assertThat(compiler.compile(decoded)).isEqualTo(PROGRAM);
    }

    @Test
    void writesBlocklyLayout() {
        Graph graph = new Graph();
        Node handler = graph.create(registry.lookup("forever"));
        Node conditional = graph.create(registry.lookup("controls_if"));
        graph.setMutation(conditional.id(), new Mutation(1, false));
        graph.attach(conditional.id(), SlotRef.of(handler.id(), "DO"));
        Node pause = graph.create(registry.lookup("pause"));
        graph.attach(pause.id(), SlotRef.next(conditional.id()));
        graph.setDisabled(pause.id(), true);

        JsonObject document = JsonParser.parseString(codec.encode(graph)).getAsJsonObject();

        JsonObject workspace = document.getAsJsonObject("blocks");
        assertThat(workspace.get("languageVersion").getAsInt()).isZero();
        JsonObject root = workspace.getAsJsonArray("blocks").get(0).getAsJsonObject();
        assertThat(root.get("type").getAsString()).isEqualTo("forever");
        JsonObject ifBlock = root.getAsJsonObject("inputs").getAsJsonObject("DO").getAsJsonObject("block");
        assertThat(ifBlock.getAsJsonObject("extraState").get("elseIfCount").getAsInt()).isEqualTo(1);
        assertThat(ifBlock.getAsJsonObject("extraState").get("hasElse").getAsBoolean()).isFalse();
        JsonObject next = ifBlock.getAsJsonObject("next").getAsJsonObject("block");
        assertThat(next.get("type").getAsString()).isEqualTo("pause");
        assertThat(next.get("enabled").getAsBoolean()).isFalse();
        assertThat(root.has("enabled")).isFalse();
    }

    @Test
    void readsDisabledFlagAndFields() {
        Graph graph = codec.decode("""
                {"blocks": {"languageVersion": 0, "blocks": [
                  {"type": "on_button_pressed", "id": "a", "enabled": false, "fields": {"BUTTON": "AB"}}
                ]}}
                """);

        assertThat(graph.roots()).singleElement().satisfies(node -> {
            assertThat(node.isDisabled()).isTrue();
            assertThat(node.field("BUTTON")).isEqualTo("AB");
        });
    }

    @Test
    void emptyWorkspaceDecodesToEmptyGraph() {
        assertThat(codec.decode("{\"blocks\": {\"languageVersion\": 0}}").isEmpty()).isTrue();
    }

    @Test
    void rejectsMalformedDocuments() {
        assertThatThrownBy(() -> codec.decode("{\"blocks\": "))
                .isInstanceOf(GraphFormatException.class);
        assertThatThrownBy(() -> codec.decode("[]"))
                .isInstanceOf(GraphFormatException.class);
        assertThatThrownBy(() -> codec.decode("{\"workspace\": {}}"))
                .isInstanceOf(GraphFormatException.class)
                .hasMessageContaining("'blocks'");
        assertThatThrownBy(() -> codec.decode("{\"blocks\": {\"blocks\": [{\"id\": \"1\"}]}}"))
                .isInstanceOf(GraphFormatException.class)
                .hasMessageContaining("type");
    }

    @Test
    void rejectsUnknownBlockTypes() {
        assertThatThrownBy(() -> codec.decode("{\"blocks\": {\"blocks\": [{\"type\": \"radio_send\"}]}}"))
                .isInstanceOf(UnknownKindException.class);
    }
}
