package org.blocksync.registry;

import org.blocksync.registry.features.basic.BasicBlocks;
import org.blocksync.registry.features.input.InputBlocks;
import org.blocksync.registry.features.led.LedBlocks;
import org.blocksync.registry.features.logic.LogicBlocks;
import org.blocksync.registry.features.loops.LoopBlocks;
import org.blocksync.registry.features.maths.MathBlocks;
import org.blocksync.registry.features.music.MusicBlocks;
import org.blocksync.registry.features.opaque.OpaqueBlocks;
import org.blocksync.registry.features.pins.PinBlocks;
import org.blocksync.registry.features.text.TextBlocks;
import org.blocksync.registry.features.variables.VariableBlocks;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registry of block kinds, keyed by type tag.
 * <p>
 * A registry is filled once and then {@linkplain #freeze() frozen}; a frozen registry is
 * read-only and may be shared between threads. {@link #defaults()} holds every built-in kind.
 */
public class BlockKindRegistry {

    private static final Logger log = LoggerFactory.getLogger(BlockKindRegistry.class);

    private final Map<String, BlockKind> kinds = new LinkedHashMap<>();
    private volatile boolean frozen;

    /**
     * Registers a block kind.
     * @param kind The kind to add.
     * @throws DuplicateKindException if a kind with the same tag is already registered.
     * @throws IllegalStateException  if the registry is frozen.
     */
    public void register(BlockKind kind) {
        if (frozen) {
            throw new IllegalStateException("Registry is frozen; cannot register " + kind.tag());
        }
        if (kinds.containsKey(kind.tag())) {
            throw new DuplicateKindException(kind.tag());
        }
        kinds.put(kind.tag(), kind);
    }

    /**
     * Looks up a kind by tag.
     * @param tag The type tag.
     * @return The kind.
     * @throws UnknownKindException if no kind carries the tag.
     */
    public BlockKind lookup(String tag) {
        BlockKind kind = kinds.get(tag);
        if (kind == null) {
            throw new UnknownKindException(tag);
        }
        return kind;
    }

    /**
     * @param tag The type tag.
     * @return The kind, or empty if none is registered under the tag.
     */
    public Optional<BlockKind> find(String tag) {
        return Optional.ofNullable(kinds.get(tag));
    }

    public boolean contains(String tag) {
        return kinds.containsKey(tag);
    }

    /** All kinds in registration order. */
    public List<BlockKind> kinds() {
        return List.copyOf(kinds.values());
    }

    /**
     * Lists the recognizable kinds of a shape in the order extraction tries them: by priority,
     * then by registration order.
     */
    public List<BlockKind> recognitionOrder(BlockShape shape) {
        List<BlockKind> result = new ArrayList<>();
        for (BlockKind kind : kinds.values()) {
            if (kind.shape() == shape && kind.pattern().isPresent()) {
                result.add(kind);
            }
        }
        result.sort(Comparator.comparingInt(BlockKind::priority));
        return result;
    }

    public void freeze() {
        frozen = true;
    }

    public boolean isFrozen() {
        return frozen;
    }

    /**
     * Creates a frozen registry with all built-in block kinds.
     * @return A new registry instance.
     */
    public static BlockKindRegistry initialize() {
        BlockKindRegistry registry = new BlockKindRegistry();
        registerBuiltIns(registry);
        registry.freeze();
        log.debug("Initialized block kind registry with {} kinds", registry.kinds.size());
        return registry;
    }

    /**
     * Adds every built-in block kind to a registry that is still open, e.g. before a caller
     * registers additional kinds of its own.
     */
    public static void registerBuiltIns(BlockKindRegistry registry) {
        BasicBlocks.register(registry);
        InputBlocks.register(registry);
        LoopBlocks.register(registry);
        LedBlocks.register(registry);
        LogicBlocks.register(registry);
        VariableBlocks.register(registry);
        TextBlocks.register(registry);
        MathBlocks.register(registry);
        MusicBlocks.register(registry);
        PinBlocks.register(registry);
        OpaqueBlocks.register(registry);
    }

    /** The process-wide registry of built-in kinds, built on first use. */
    public static BlockKindRegistry defaults() {
        return Holder.INSTANCE;
    }

    private static final class Holder {
        private static final BlockKindRegistry INSTANCE = initialize();
    }
}
