package org.blocksync.registry;

/**
 * Suggests the placeholder child a toolbox places into a value input.
 *
 * @param kindTag the kind of the placeholder node.
 * @param field   the field of the placeholder that receives {@code value}.
 * @param value   the placeholder's field value.
 */
public record ShadowSpec(String kindTag, String field, String value) {

    public static ShadowSpec number(String value) {
        return new ShadowSpec("math_number", "NUM", value);
    }

    public static ShadowSpec text(String value) {
        return new ShadowSpec("text", "TEXT", value);
    }

    public static ShadowSpec bool(boolean value) {
        return new ShadowSpec("logic_boolean", "BOOL", value ? "TRUE" : "FALSE");
    }

    public static ShadowSpec variable(String name) {
        return new ShadowSpec("variables_get", "VAR", name);
    }
}
