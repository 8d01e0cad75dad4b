package org.blocksync.compiler.diagnostics;

/**
 * One finding reported while processing source text or a graph.
 *
 * @param severity   how serious the finding is.
 * @param message    human readable description.
 * @param sourceName the name of the processed input.
 * @param line       the 1-based source line, or 0 if not tied to a line.
 */
public record Diagnostic(Severity severity, String message, String sourceName, int line) {

    public enum Severity {
        ERROR,
        WARNING
    }

    @Override
    public String toString() {
        String location = line > 0 ? sourceName + ":" + line : sourceName;
        return "[" + severity + "] " + location + ": " + message;
    }
}
