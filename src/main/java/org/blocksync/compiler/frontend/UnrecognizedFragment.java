package org.blocksync.compiler.frontend;

/**
 * A piece of source text that no registered pattern recognized.
 *
 * @param line   the 1-based line the fragment starts on.
 * @param text   the fragment, including any lines nested below it.
 * @param reason why it was not recognized.
 */
public record UnrecognizedFragment(int line, String text, String reason) {

    @Override
    public String toString() {
        return "line " + line + ": " + reason + ": " + text;
    }
}
