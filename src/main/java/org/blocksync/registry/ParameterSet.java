package org.blocksync.registry;

import org.blocksync.graph.Mutation;
import org.blocksync.registry.pattern.SourceBlock;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The parameters extracted from a recognized fragment: field values, the source text of value
 * inputs and the source lines of statement bodies. Value and body text is extracted recursively
 * by the caller.
 */
public final class ParameterSet {

    private final Map<String, String> fields;
    private final Map<String, String> values;
    private final Map<String, List<SourceBlock>> bodies;
    private final Mutation mutation;

    private ParameterSet(Builder builder) {
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(builder.fields));
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(builder.values));
        this.bodies = Collections.unmodifiableMap(new LinkedHashMap<>(builder.bodies));
        this.mutation = builder.mutation;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Map<String, String> fields() {
        return fields;
    }

    public Map<String, String> values() {
        return values;
    }

    public Map<String, List<SourceBlock>> bodies() {
        return bodies;
    }

    public Optional<Mutation> mutation() {
        return Optional.ofNullable(mutation);
    }

    @Override
    public String toString() {
        return "ParameterSet{fields=" + fields + ", values=" + values + ", bodies=" + bodies.keySet()
                + (mutation != null ? ", mutation=" + mutation : "") + "}";
    }

    public static final class Builder {

        private final Map<String, String> fields = new LinkedHashMap<>();
        private final Map<String, String> values = new LinkedHashMap<>();
        private final Map<String, List<SourceBlock>> bodies = new LinkedHashMap<>();
        private Mutation mutation;

        private Builder() {
        }

        public Builder field(String name, String value) {
            fields.put(name, value);
            return this;
        }

        public Builder value(String slot, String expression) {
            values.put(slot, expression);
            return this;
        }

        public Builder body(String slot, List<SourceBlock> lines) {
            if (!lines.isEmpty()) {
                bodies.put(slot, List.copyOf(lines));
            }
            return this;
        }

        public Builder mutation(Mutation mutation) {
            this.mutation = mutation;
            return this;
        }

        public ParameterSet build() {
            return new ParameterSet(this);
        }
    }
}
