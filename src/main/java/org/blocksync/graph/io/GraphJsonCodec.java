package org.blocksync.graph.io;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import org.blocksync.graph.Graph;
import org.blocksync.graph.Mutation;
import org.blocksync.graph.Node;
import org.blocksync.graph.NodeId;
import org.blocksync.graph.SlotRef;
import org.blocksync.registry.BlockKind;
import org.blocksync.registry.BlockKindRegistry;
import org.blocksync.registry.Slot;
import org.blocksync.registry.SlotKind;

import java.util.Map;

/**
 * Reads and writes graphs in the JSON layout of Blockly workspace serialization:
 * <pre>
 * {"blocks": {"languageVersion": 0, "blocks": [
 *   {"type": "forever", "id": "1", "inputs": {"DO": {"block": {...}}}},
 *   ...
 * ]}}
 * </pre>
 * Each block carries its {@code fields}, its occupied {@code inputs}, the statement following
 * it under {@code next}, {@code "enabled": false} if disabled and the conditional's arm counts
 * under {@code extraState}. Node ids are written for reference only; decoding assigns new ones.
 */
public final class GraphJsonCodec {

    private final BlockKindRegistry registry;
    private final Gson gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

    public GraphJsonCodec(BlockKindRegistry registry) {
        this.registry = registry;
    }

    public String encode(Graph graph) {
        JsonArray blocks = new JsonArray();
        for (Node root : graph.roots()) {
            blocks.add(encodeNode(graph, root));
        }
        JsonObject workspace = new JsonObject();
        workspace.addProperty("languageVersion", 0);
        workspace.add("blocks", blocks);
        JsonObject document = new JsonObject();
        document.add("blocks", workspace);
        return gson.toJson(document);
    }

    private JsonObject encodeNode(Graph graph, Node node) {
        JsonObject block = new JsonObject();
        block.addProperty("type", node.kind().tag());
        block.addProperty("id", String.valueOf(node.id().value()));
        if (node.isDisabled()) {
            block.addProperty("enabled", false);
        }
        if (!node.mutation().equals(Mutation.NONE)) {
            JsonObject extra = new JsonObject();
            extra.addProperty("elseIfCount", node.mutation().elseIfCount());
            extra.addProperty("hasElse", node.mutation().hasElse());
            block.add("extraState", extra);
        }
        if (!node.fields().isEmpty()) {
            JsonObject fields = new JsonObject();
            node.fields().forEach(fields::addProperty);
            block.add("fields", fields);
        }
        JsonObject inputs = new JsonObject();
        for (Slot slot : node.kind().slots(node.mutation())) {
            if (slot.kind() == SlotKind.FIELD) {
                continue;
            }
            node.child(slot.name()).ifPresent(child -> inputs.add(slot.name(), wrap(encodeNode(graph, graph.node(child)))));
        }
        if (inputs.size() > 0) {
            block.add("inputs", inputs);
        }
        node.next().ifPresent(next -> block.add("next", wrap(encodeNode(graph, graph.node(next)))));
        return block;
    }

    private static JsonObject wrap(JsonObject block) {
        JsonObject connection = new JsonObject();
        connection.add("block", block);
        return connection;
    }

    /**
     * Reads a graph.
     * @param json The serialized workspace.
     * @return A new graph holding the decoded nodes.
     * @throws GraphFormatException if the text is not a valid workspace document.
     * @throws org.blocksync.registry.UnknownKindException if a block type is not registered.
     * @throws org.blocksync.graph.StructuralViolationException if the blocks do not fit together.
     */
    public Graph decode(String json) {
        Graph graph = new Graph();
        try {
            JsonObject document = JsonParser.parseString(json).getAsJsonObject();
            JsonObject workspace = object(document, "blocks");
            if (workspace == null) {
                throw new GraphFormatException("Missing top-level 'blocks' object");
            }
            JsonElement blocks = workspace.get("blocks");
            if (blocks != null) {
                for (JsonElement block : blocks.getAsJsonArray()) {
                    decodeNode(graph, block.getAsJsonObject());
                }
            }
        } catch (JsonParseException | IllegalStateException | UnsupportedOperationException e) {
            throw new GraphFormatException("Malformed workspace JSON: " + e.getMessage(), e);
        }
        return graph;
    }

    private NodeId decodeNode(Graph graph, JsonObject block) {
        JsonElement type = block.get("type");
        if (type == null) {
            throw new GraphFormatException("Block without 'type': " + block);
        }
        BlockKind kind = registry.lookup(type.getAsString());
        Node node = graph.create(kind);
        JsonObject extra = object(block, "extraState");
        if (extra != null) {
            int elseIfCount = extra.has("elseIfCount") ? extra.get("elseIfCount").getAsInt() : 0;
            boolean hasElse = extra.has("hasElse") && extra.get("hasElse").getAsBoolean();
            graph.setMutation(node.id(), new Mutation(elseIfCount, hasElse));
        }
        JsonObject fields = object(block, "fields");
        if (fields != null) {
            for (Map.Entry<String, JsonElement> field : fields.entrySet()) {
                graph.setField(node.id(), field.getKey(), field.getValue().getAsString());
            }
        }
        if (block.has("enabled") && !block.get("enabled").getAsBoolean()) {
            graph.setDisabled(node.id(), true);
        }
        JsonObject inputs = object(block, "inputs");
        if (inputs != null) {
            for (Map.Entry<String, JsonElement> input : inputs.entrySet()) {
                JsonObject child = object(input.getValue().getAsJsonObject(), "block");
                if (child != null) {
                    graph.attach(decodeNode(graph, child), SlotRef.of(node.id(), input.getKey()));
                }
            }
        }
        JsonObject next = object(block, "next");
        if (next != null && object(next, "block") != null) {
            graph.attach(decodeNode(graph, object(next, "block")), SlotRef.next(node.id()));
        }
        return node.id();
    }

    private static JsonObject object(JsonObject parent, String member) {
        JsonElement element = parent.get(member);
        return element == null || element.isJsonNull() ? null : element.getAsJsonObject();
    }
}
