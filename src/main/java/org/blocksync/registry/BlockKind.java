package org.blocksync.registry;

import org.blocksync.graph.Graph;
import org.blocksync.graph.Mutation;
import org.blocksync.graph.Node;
import org.blocksync.registry.pattern.IFragmentMatcher;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Immutable descriptor of one block kind: its slots and shape, how it renders to text, how it is
 * recognized in text and how a node is rebuilt from what was recognized.
 * <p>
 * Kinds without a pattern are never produced by extraction. Kinds with a lower
 * {@linkplain #priority() priority} are tried first; general fallbacks use a high value.
 */
public final class BlockKind {

    public static final int DEFAULT_PRIORITY = 100;

    private final String tag;
    private final BlockCategory category;
    private final BlockShape shape;
    private final String outputCheck;
    private final List<Slot> slots;
    private final Function<Mutation, List<Slot>> mutator;
    private final IBlockRenderer renderer;
    private final IFragmentMatcher pattern;
    private final List<ClauseSpec> clauses;
    private final IParameterExtractor extractor;
    private final INodeConstructor constructor;
    private final int priority;
    private final boolean gated;
    private final boolean awaited;
    private final Function<Map<String, String>, String> procedureNaming;
    private final String tooltip;

    private BlockKind(Builder b) {
        this.tag = b.tag;
        this.category = b.category;
        this.shape = b.shape;
        this.outputCheck = b.outputCheck;
        this.slots = List.copyOf(b.slots);
        this.mutator = b.mutator;
        this.renderer = b.renderer;
        this.pattern = b.pattern;
        this.clauses = List.copyOf(b.clauses);
        this.extractor = b.extractor;
        this.constructor = b.constructor;
        this.priority = b.priority;
        this.gated = b.gated;
        this.awaited = b.awaited;
        this.procedureNaming = b.procedureNaming;
        this.tooltip = b.tooltip;
    }

    public static Builder statement(String tag, BlockCategory category) {
        return new Builder(tag, category, BlockShape.STATEMENT, null);
    }

    public static Builder value(String tag, BlockCategory category, String outputCheck) {
        return new Builder(tag, category, BlockShape.VALUE, outputCheck);
    }

    public static Builder eventHandler(String tag, BlockCategory category) {
        return new Builder(tag, category, BlockShape.EVENT_HANDLER, null);
    }

    public String tag() {
        return tag;
    }

    public BlockCategory category() {
        return category;
    }

    public BlockShape shape() {
        return shape;
    }

    public boolean isEventHandler() {
        return shape == BlockShape.EVENT_HANDLER;
    }

    /** The type a value kind produces, or {@code null} if it fits any value input. */
    public String outputCheck() {
        return outputCheck;
    }

    /** Slots of a node in its default shape. */
    public List<Slot> slots() {
        return slots;
    }

    /** Slots of a node carrying the given mutation. */
    public List<Slot> slots(Mutation mutation) {
        return mutator == null ? slots : mutator.apply(mutation);
    }

    public Optional<Slot> slot(String name, Mutation mutation) {
        return slots(mutation).stream().filter(s -> s.name().equals(name)).findFirst();
    }

    public boolean isMutable() {
        return mutator != null;
    }

    public Fragment render(Node node, IRenderContext context) {
        return renderer.render(node, context);
    }

    public Optional<IFragmentMatcher> pattern() {
        return Optional.ofNullable(pattern);
    }

    public List<ClauseSpec> clauses() {
        return clauses;
    }

    public Optional<ParameterSet> extract(PatternMatch match) {
        return extractor.extract(this, match);
    }

    public Node construct(ParameterSet parameters, Graph graph) {
        return constructor.construct(this, parameters, graph);
    }

    public int priority() {
        return priority;
    }

    /**
     * Whether nodes of this kind only compile when their stack hangs off an event handler.
     * Outside a handler a gated statement renders nothing and a gated value renders the default
     * of its slot.
     */
    public boolean isGated() {
        return gated;
    }

    /** Whether this kind renders an {@code await}, which makes the enclosing handler async. */
    public boolean isAwaited() {
        return awaited;
    }

    /**
     * Derives the procedure name an event handler node compiles to. The name depends only on
     * the node's fields.
     */
    public Optional<String> procedureName(Node node) {
        return procedureName(node.fields());
    }

    /** Derives the procedure name from field values alone. */
    public Optional<String> procedureName(Map<String, String> fields) {
        return procedureNaming == null ? Optional.empty() : Optional.of(procedureNaming.apply(fields));
    }

    public String tooltip() {
        return tooltip;
    }

    @Override
    public String toString() {
        return tag;
    }

    /**
     * Fluent construction of a {@link BlockKind}. Unless set otherwise, kinds are extracted
     * slot by slot from equally named captures and constructed by filling fields.
     */
    public static final class Builder {

        private final String tag;
        private final BlockCategory category;
        private final BlockShape shape;
        private final String outputCheck;
        private final List<Slot> slots = new ArrayList<>();
        private final List<ClauseSpec> clauses = new ArrayList<>();
        private Function<Mutation, List<Slot>> mutator;
        private IBlockRenderer renderer;
        private IFragmentMatcher pattern;
        private IParameterExtractor extractor = ParameterExtractors.standard();
        private INodeConstructor constructor = NodeConstructors.standard();
        private int priority = DEFAULT_PRIORITY;
        private boolean gated;
        private boolean awaited;
        private Function<Map<String, String>, String> procedureNaming;
        private String tooltip = "";

        private Builder(String tag, BlockCategory category, BlockShape shape, String outputCheck) {
            if (tag == null || tag.isBlank()) {
                throw new IllegalArgumentException("Block kind tag must not be blank");
            }
            this.tag = tag;
            this.category = Objects.requireNonNull(category, "category");
            this.shape = shape;
            this.outputCheck = outputCheck;
        }

        public Builder slot(Slot slot) {
            slots.add(slot);
            return this;
        }

        public Builder field(String name, String defaultValue) {
            return slot(Slot.field(name, defaultValue));
        }

        public Builder value(String name, String check, String defaultValue, ShadowSpec shadow) {
            return slot(Slot.value(name, check, defaultValue, shadow));
        }

        public Builder variableBinding(String name, String defaultName) {
            return slot(Slot.variableBinding(name, defaultName));
        }

        public Builder statementInput(String name) {
            return slot(Slot.statement(name));
        }

        /**
         * Makes the slot list depend on the node's mutation. The static slots stay the slots of
         * the default shape.
         */
        public Builder mutator(Function<Mutation, List<Slot>> mutator) {
            this.mutator = mutator;
            return this;
        }

        public Builder render(IBlockRenderer renderer) {
            this.renderer = renderer;
            return this;
        }

        public Builder pattern(IFragmentMatcher pattern) {
            this.pattern = pattern;
            return this;
        }

        public Builder clause(ClauseSpec clause) {
            clauses.add(clause);
            return this;
        }

        public Builder extractor(IParameterExtractor extractor) {
            this.extractor = extractor;
            return this;
        }

        public Builder constructor(INodeConstructor constructor) {
            this.constructor = constructor;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder gated() {
            this.gated = true;
            return this;
        }

        public Builder awaited() {
            this.awaited = true;
            return this;
        }

        public Builder procedureName(Function<Map<String, String>, String> naming) {
            this.procedureNaming = naming;
            return this;
        }

        public Builder tooltip(String tooltip) {
            this.tooltip = tooltip;
            return this;
        }

        public BlockKind build() {
            if (renderer == null) {
                throw new IllegalStateException("Block kind " + tag + " has no renderer");
            }
            if (shape == BlockShape.EVENT_HANDLER && procedureNaming == null) {
                throw new IllegalStateException("Event handler kind " + tag + " has no procedure naming");
            }
            return new BlockKind(this);
        }
    }
}
