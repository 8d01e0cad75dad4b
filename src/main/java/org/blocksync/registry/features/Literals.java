package org.blocksync.registry.features;

/**
 * Python string literal quoting.
 */
public final class Literals {

    private Literals() {
    }

    /** Renders text as a double-quoted Python string literal. */
    public static String quote(String text) {
        StringBuilder sb = new StringBuilder(text.length() + 2).append('"');
        for (char c : text.toCharArray()) {
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '"' -> sb.append("\\\"");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> sb.append(c);
            }
        }
        return sb.append('"').toString();
    }

    /**
     * Resolves the escape sequences of a string literal's content (without its quotes).
     * Unknown escapes are kept as written.
     */
    public static String unescape(String content) {
        StringBuilder sb = new StringBuilder(content.length());
        for (int i = 0; i < content.length(); i++) {
            char c = content.charAt(i);
            if (c != '\\' || i + 1 >= content.length()) {
                sb.append(c);
                continue;
            }
            char escaped = content.charAt(++i);
            switch (escaped) {
                case 'n' -> sb.append('\n');
                case 'r' -> sb.append('\r');
                case 't' -> sb.append('\t');
                case '\\', '"', '\'' -> sb.append(escaped);
                default -> sb.append('\\').append(escaped);
            }
        }
        return sb.toString();
    }
}
