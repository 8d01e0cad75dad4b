package org.blocksync.compiler.diagnostics;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects errors and warnings so that processing can continue past a problem and report all
 * of them at once.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    public void reportError(String message, String sourceName, int line) {
        diagnostics.add(new Diagnostic(Diagnostic.Severity.ERROR, message, sourceName, line));
    }

    public void reportWarning(String message, String sourceName, int line) {
        diagnostics.add(new Diagnostic(Diagnostic.Severity.WARNING, message, sourceName, line));
    }

    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.severity() == Diagnostic.Severity.ERROR);
    }

    public List<Diagnostic> getDiagnostics() {
        return List.copyOf(diagnostics);
    }

    /**
     * Formats all collected diagnostics, one per line.
     * @return The summary, or an empty string if nothing was reported.
     */
    public String summary() {
        StringBuilder sb = new StringBuilder();
        for (Diagnostic d : diagnostics) {
            sb.append(d).append('\n');
        }
        return sb.toString();
    }
}
