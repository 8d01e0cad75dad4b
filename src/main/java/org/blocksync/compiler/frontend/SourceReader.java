package org.blocksync.compiler.frontend;

import org.blocksync.registry.pattern.SourceBlock;
import org.blocksync.registry.pattern.TextScanner;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Splits program text into logical lines and arranges them by indentation.
 * <p>
 * A logical line continues over physical lines while a triple-quoted string or a bracket is
 * open. Blank lines and comment lines are dropped, but a blank line is remembered on the line
 * that follows it. Trailing comments are removed. A tab counts as four columns.
 */
public final class SourceReader {

    private static final int TAB_WIDTH = 4;

    /** One logical line before the tree is built. */
    record LogicalLine(int line, int indent, String text, boolean blankBefore) {
    }

    private static final class Draft {
        final LogicalLine line;
        final List<Draft> children = new ArrayList<>();

        Draft(LogicalLine line) {
            this.line = line;
        }

        SourceBlock toBlock() {
            return new SourceBlock(line.line(), line.indent(), line.text(),
                    children.stream().map(Draft::toBlock).toList(), line.blankBefore());
        }
    }

    /**
     * Reads program text.
     * @param source The program text.
     * @return The top-level blocks in source order.
     */
    public List<SourceBlock> read(String source) {
        Draft root = new Draft(new LogicalLine(0, -1, "", false));
        Deque<Draft> open = new ArrayDeque<>();
        open.push(root);
        for (LogicalLine line : logicalLines(source)) {
            while (open.peek().line.indent() >= line.indent()) {
                open.pop();
            }
            Draft draft = new Draft(line);
            open.peek().children.add(draft);
            open.push(draft);
        }
        return root.children.stream().map(Draft::toBlock).toList();
    }

    List<LogicalLine> logicalLines(String source) {
        String[] physical = source.split("\r?\n", -1);
        List<LogicalLine> result = new ArrayList<>();
        boolean blank = false;
        int i = 0;
        while (i < physical.length) {
            String raw = physical[i];
            int lineNumber = ++i;
            String trimmed = raw.trim();
            if (trimmed.isEmpty()) {
                blank = true;
                continue;
            }
            if (trimmed.startsWith("#")) {
                continue;
            }
            StringBuilder joined = new StringBuilder(raw.strip());
            while (i < physical.length) {
                String current = TextScanner.stripComment(joined.toString());
                if (TextScanner.hasOpenTripleQuote(current)) {
                    joined.append('\n').append(physical[i]);
                } else if (TextScanner.bracketDepth(current) > 0) {
                    joined.append(' ').append(physical[i].trim());
                } else {
                    break;
                }
                i++;
            }
            String text = TextScanner.stripComment(joined.toString()).strip();
            if (text.isEmpty()) {
                continue;
            }
            result.add(new LogicalLine(lineNumber, indentOf(raw), text, blank));
            blank = false;
        }
        return result;
    }

    private static int indentOf(String raw) {
        int columns = 0;
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (c == ' ') {
                columns++;
            } else if (c == '\t') {
                columns += TAB_WIDTH;
            } else {
                break;
            }
        }
        return columns;
    }
}
