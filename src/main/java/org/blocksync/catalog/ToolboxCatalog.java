package org.blocksync.catalog;

import org.blocksync.graph.Graph;
import org.blocksync.graph.Node;
import org.blocksync.graph.SlotRef;
import org.blocksync.registry.BlockCategory;
import org.blocksync.registry.BlockKind;
import org.blocksync.registry.BlockKindRegistry;
import org.blocksync.registry.ShadowSpec;
import org.blocksync.registry.Slot;
import org.blocksync.registry.SlotKind;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What a block editor offers in its toolbox: the visible categories with their kinds, and
 * ready-made example nodes with placeholder children in their value inputs.
 */
public final class ToolboxCatalog {

    /**
     * One toolbox category.
     *
     * @param category    the category.
     * @param displayName the label shown to the user.
     * @param colour      the category colour as a hex string.
     * @param kinds       the kinds offered, in registration order.
     */
    public record Entry(BlockCategory category, String displayName, String colour, List<KindEntry> kinds) {
    }

    /**
     * One kind offered in a category.
     *
     * @param tag           the type tag.
     * @param tooltip       a short description.
     * @param defaultFields the initial field values.
     */
    public record KindEntry(String tag, String tooltip, Map<String, String> defaultFields) {
    }

    private final BlockKindRegistry registry;

    public ToolboxCatalog(BlockKindRegistry registry) {
        this.registry = registry;
    }

    /** All visible categories in display order, empty ones included. */
    public List<Entry> categories() {
        List<Entry> entries = new ArrayList<>();
        Arrays.stream(BlockCategory.values())
                .filter(BlockCategory::isVisible)
                .forEach(c -> entries.add(new Entry(c, c.displayName(), c.colour(), kinds(c))));
        return entries;
    }

    public List<KindEntry> kinds(BlockCategory category) {
        List<KindEntry> result = new ArrayList<>();
        for (BlockKind kind : registry.kinds()) {
            if (kind.category() == category) {
                result.add(new KindEntry(kind.tag(), kind.tooltip(), defaultFields(kind)));
            }
        }
        return result;
    }

    /**
     * Parses a category by display name or constant name, ignoring case.
     * @throws IllegalArgumentException if no visible category matches.
     */
    public static BlockCategory category(String name) {
        for (BlockCategory c : BlockCategory.values()) {
            if (c.isVisible() && (c.name().equalsIgnoreCase(name) || c.displayName().equalsIgnoreCase(name))) {
                return c;
            }
        }
        throw new IllegalArgumentException("Unknown category '" + name + "'");
    }

    /**
     * Creates a detached example node of a kind, with a placeholder child in every value input
     * that suggests one.
     * @param tag   The kind to instantiate.
     * @param graph The graph to create the nodes in.
     * @return The example node.
     * @throws org.blocksync.registry.UnknownKindException if the tag is not registered.
     */
    public Node example(String tag, Graph graph) {
        BlockKind kind = registry.lookup(tag);
        Node node = graph.create(kind);
        for (Slot slot : kind.slots()) {
            if (slot.kind() != SlotKind.VALUE || slot.shadow() == null) {
                continue;
            }
            ShadowSpec shadow = slot.shadow();
            Node placeholder = graph.create(registry.lookup(shadow.kindTag()));
            graph.setField(placeholder.id(), shadow.field(), shadow.value());
            graph.attach(placeholder.id(), SlotRef.of(node.id(), slot.name()));
        }
        return node;
    }

    private static Map<String, String> defaultFields(BlockKind kind) {
        Map<String, String> fields = new LinkedHashMap<>();
        for (Slot slot : kind.slots()) {
            if (slot.kind() == SlotKind.FIELD && slot.defaultValue() != null) {
                fields.put(slot.name(), slot.defaultValue());
            }
        }
        return fields;
    }
}
