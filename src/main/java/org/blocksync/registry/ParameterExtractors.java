package org.blocksync.registry;

import org.blocksync.graph.Mutation;
import org.blocksync.registry.pattern.Captures;

import java.util.Optional;

/**
 * Common {@link IParameterExtractor}s.
 */
public final class ParameterExtractors {

    private static final IParameterExtractor STANDARD = (kind, match) -> Optional.of(bySlotName(kind, match).build());

    private ParameterExtractors() {
    }

    /**
     * Maps captures onto slots of the same name: field captures become field values, value
     * captures become value expressions, and the body below the header fills the kind's first
     * statement slot.
     */
    public static IParameterExtractor standard() {
        return STANDARD;
    }

    /**
     * Starts a parameter set the way {@link #standard()} fills it, for extractors that adjust
     * a few parameters afterwards.
     */
    public static ParameterSet.Builder bySlotName(BlockKind kind, PatternMatch match) {
        ParameterSet.Builder builder = ParameterSet.builder();
        Captures captures = match.header();
        boolean bodyAssigned = false;
        for (Slot slot : kind.slots(Mutation.NONE)) {
            switch (slot.kind()) {
                case FIELD -> captures.find(slot.name()).ifPresent(v -> builder.field(slot.name(), v));
                case VALUE -> captures.find(slot.name()).ifPresent(v -> builder.value(slot.name(), v));
                case STATEMENT -> {
                    if (!bodyAssigned) {
                        builder.body(slot.name(), match.body());
                        bodyAssigned = true;
                    }
                }
            }
        }
        return builder;
    }
}
