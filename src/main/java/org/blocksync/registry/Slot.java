package org.blocksync.registry;

import java.util.Objects;

/**
 * A named attachment point of a block kind.
 * <p>
 * For {@link SlotKind#FIELD} slots {@code defaultValue} is the initial field value. For
 * {@link SlotKind#VALUE} slots it is the literal rendered when the slot is left empty.
 * Statement slots have no default; an empty body renders {@code pass}.
 *
 * @param name          the slot name, unique within its kind.
 * @param kind          what the slot holds.
 * @param check         the type a value child must produce, or {@code null} for any.
 * @param defaultValue  the default field value or fallback literal, may be {@code null}.
 * @param shadow        the toolbox placeholder for value inputs, may be {@code null}.
 * @param bindsVariable whether the slot binds a loop variable that must never stay empty.
 */
public record Slot(String name, SlotKind kind, String check, String defaultValue, ShadowSpec shadow,
                   boolean bindsVariable) {

    public Slot {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
    }

    public static Slot field(String name, String defaultValue) {
        return new Slot(name, SlotKind.FIELD, null, defaultValue, null, false);
    }

    public static Slot value(String name, String check, String defaultValue, ShadowSpec shadow) {
        return new Slot(name, SlotKind.VALUE, check, defaultValue, shadow, false);
    }

    public static Slot variableBinding(String name, String defaultName) {
        return new Slot(name, SlotKind.VALUE, "Variable", defaultName, ShadowSpec.variable(defaultName), true);
    }

    public static Slot statement(String name) {
        return new Slot(name, SlotKind.STATEMENT, null, null, null, false);
    }

    /**
     * Checks whether a node producing {@code outputCheck} may occupy this slot.
     * A missing check on either side accepts anything.
     *
     * @param outputCheck the output type of the candidate, may be {@code null}.
     * @return {@code true} if the connection is type compatible.
     */
    public boolean accepts(String outputCheck) {
        return check == null || outputCheck == null || check.equals(outputCheck);
    }
}
