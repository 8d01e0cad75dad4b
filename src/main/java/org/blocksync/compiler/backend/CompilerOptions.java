package org.blocksync.compiler.backend;

import com.typesafe.config.Config;

/**
 * Settings of the {@link ForwardCompiler}.
 *
 * @param indentWidth            number of spaces per nesting level.
 * @param gateDetachedStatements whether gated statements outside event handlers are left out.
 */
public record CompilerOptions(int indentWidth, boolean gateDetachedStatements) {

    public CompilerOptions {
        if (indentWidth < 1 || indentWidth > 16) {
            throw new IllegalArgumentException("indent must be between 1 and 16 spaces, was " + indentWidth);
        }
    }

    public static CompilerOptions defaults() {
        return new CompilerOptions(4, true);
    }

    /**
     * Reads the options from a {@code blocksync.compiler} configuration block.
     * @param compilerConfig The block, e.g. {@code config.getConfig("blocksync.compiler")}.
     * @return The options.
     */
    public static CompilerOptions fromConfig(Config compilerConfig) {
        return new CompilerOptions(
                compilerConfig.getInt("indent"),
                compilerConfig.getBoolean("gate-detached-statements"));
    }

    public String indent() {
        return " ".repeat(indentWidth);
    }
}
