package org.blocksync.registry.pattern;

import java.util.ArrayList;
import java.util.List;

/**
 * Bracket- and string-aware scanning helpers for expression text.
 * <p>
 * A position is <em>top level</em> if it lies outside every string literal and every pair of
 * round, square or curly brackets.
 */
public final class TextScanner {

    private TextScanner() {
    }

    /**
     * Marks every position of {@code text} that lies at top level.
     * @param text The text to scan.
     * @return One flag per character.
     */
    public static boolean[] topLevelMask(String text) {
        boolean[] mask = new boolean[text.length()];
        int depth = 0;
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '"' || c == '\'') {
                i = skipString(text, i);
                continue;
            }
            if (c == '(' || c == '[' || c == '{') {
                mask[i] = depth == 0;
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                depth = Math.max(0, depth - 1);
                mask[i] = depth == 0;
            } else {
                mask[i] = depth == 0;
            }
            i++;
        }
        return mask;
    }

    /**
     * Finds every top-level start index of {@code token}.
     * @param text  The text to search.
     * @param token The token, which must not contain quotes or brackets.
     * @return The start indexes in ascending order.
     */
    public static List<Integer> topLevelOccurrences(String text, String token) {
        boolean[] mask = topLevelMask(text);
        List<Integer> result = new ArrayList<>();
        for (int i = 0; i + token.length() <= text.length(); i++) {
            if (mask[i] && text.startsWith(token, i)) {
                result.add(i);
            }
        }
        return result;
    }

    /**
     * Splits text at top-level occurrences of a separator character and trims the parts.
     * @param text      The text to split.
     * @param separator The separator.
     * @return The parts; an empty list for blank input.
     */
    public static List<String> splitTopLevel(String text, char separator) {
        List<String> parts = new ArrayList<>();
        if (text.isBlank()) {
            return parts;
        }
        boolean[] mask = topLevelMask(text);
        int start = 0;
        for (int i = 0; i < text.length(); i++) {
            if (mask[i] && text.charAt(i) == separator) {
                parts.add(text.substring(start, i).trim());
                start = i + 1;
            }
        }
        parts.add(text.substring(start).trim());
        return parts;
    }

    /**
     * Finds the bracket closing the one at {@code openIndex}.
     * @param text      The text.
     * @param openIndex Index of an opening bracket.
     * @return Index of the matching closing bracket, or -1 if it is unbalanced.
     */
    public static int matchingClose(String text, int openIndex) {
        int depth = 0;
        int i = openIndex;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '"' || c == '\'') {
                i = skipString(text, i);
                continue;
            }
            if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                depth--;
                if (depth == 0) {
                    return i;
                }
                if (depth < 0) {
                    return -1;
                }
            }
            i++;
        }
        return -1;
    }

    /**
     * Removes parentheses that enclose the whole expression, repeatedly.
     * {@code (a + b) * (c)} is returned unchanged because its first bracket closes early.
     * @param text The expression.
     * @return The trimmed expression without enclosing parentheses.
     */
    public static String stripEnclosingParens(String text) {
        String current = text.trim();
        while (current.length() >= 2 && current.charAt(0) == '('
                && matchingClose(current, 0) == current.length() - 1) {
            current = current.substring(1, current.length() - 1).trim();
        }
        return current;
    }

    /**
     * Checks that brackets pair up and every string literal is closed.
     * @param text The text.
     * @return {@code true} if the text is balanced.
     */
    public static boolean isBalanced(String text) {
        int depth = 0;
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '"' || c == '\'') {
                int end = stringEnd(text, i);
                if (end < 0) {
                    return false;
                }
                i = end;
                continue;
            }
            if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                depth--;
                if (depth < 0) {
                    return false;
                }
            }
            i++;
        }
        return depth == 0;
    }

    /**
     * Cuts a trailing {@code #} comment, ignoring {@code #} inside string literals.
     * @param line The line.
     * @return The line without its comment.
     */
    public static String stripComment(String line) {
        int i = 0;
        while (i < line.length()) {
            char c = line.charAt(i);
            if (c == '"' || c == '\'') {
                i = skipString(line, i);
                continue;
            }
            if (c == '#') {
                return line.substring(0, i);
            }
            i++;
        }
        return line;
    }

    /**
     * Counts brackets opened but not closed, outside string literals.
     * @param text The text.
     * @return The nesting depth at the end of the text.
     */
    public static int bracketDepth(String text) {
        int depth = 0;
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '"' || c == '\'') {
                i = skipString(text, i);
                continue;
            }
            if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                depth--;
            }
            i++;
        }
        return depth;
    }

    /**
     * Checks whether the text ends inside a triple-quoted string literal, i.e. the literal
     * continues on the next line.
     */
    public static boolean hasOpenTripleQuote(String text) {
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '"' || c == '\'') {
                boolean triple = text.startsWith(String.valueOf(c).repeat(3), i);
                int end = stringEnd(text, i);
                if (end < 0) {
                    return triple;
                }
                i = end;
                continue;
            }
            i++;
        }
        return false;
    }

    /**
     * Returns the index just past the string literal starting at {@code start}. An unterminated
     * literal runs to the end of the text.
     */
    private static int skipString(String text, int start) {
        int end = stringEnd(text, start);
        return end < 0 ? text.length() : end;
    }

    /** Like {@link #skipString} but returns -1 for an unterminated literal. Handles triple quotes. */
    private static int stringEnd(String text, int start) {
        char quote = text.charAt(start);
        String triple = String.valueOf(quote).repeat(3);
        if (text.startsWith(triple, start)) {
            int end = text.indexOf(triple, start + 3);
            return end < 0 ? -1 : end + 3;
        }
        int i = start + 1;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '\\') {
                i += 2;
                continue;
            }
            if (c == quote) {
                return i + 1;
            }
            i++;
        }
        return -1;
    }
}
