package org.blocksync.registry.pattern;

import java.util.List;

/**
 * One logical source line and the lines indented beneath it.
 *
 * @param line             the 1-based physical line the logical line starts on.
 * @param indent           the indentation width in columns.
 * @param text             the line content without indentation and trailing whitespace.
 * @param children         the nested lines, in source order.
 * @param precededByBlank  whether at least one blank line separates it from the previous sibling.
 */
public record SourceBlock(int line, int indent, String text, List<SourceBlock> children, boolean precededByBlank) {

    public SourceBlock {
        children = List.copyOf(children);
    }

    public boolean hasChildren() {
        return !children.isEmpty();
    }

    /**
     * Renders the block and its children back to text, re-indenting relative to this block.
     * @return The fragment as it appeared in the source, normalized to four-space steps.
     */
    public String toSourceText() {
        StringBuilder sb = new StringBuilder();
        append(sb, 0);
        return sb.toString().stripTrailing();
    }

    private void append(StringBuilder sb, int depth) {
        sb.append("    ".repeat(depth)).append(text).append('\n');
        for (SourceBlock child : children) {
            child.append(sb, depth + 1);
        }
    }
}
