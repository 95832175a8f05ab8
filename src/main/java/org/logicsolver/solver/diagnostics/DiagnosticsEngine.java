package org.logicsolver.solver.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An engine for collecting diagnostic messages that do not abort solving.
 * <p>
 * Errors are thrown as {@link org.logicsolver.solver.api.SolverException}s; this engine keeps
 * the warnings that the lexer and the parser report along the way.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports a warning.
     *
     * @param message    The warning message.
     * @param sourceName The source in which the warning occurred.
     * @param line       The line of the warning.
     * @param column     The column of the warning.
     */
    public void reportWarning(String message, String sourceName, int line, int column) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.WARNING, message, sourceName, line, column));
    }

    /**
     * Checks if warnings have been reported.
     *
     * @return {@code true} if at least one warning exists, otherwise {@code false}.
     */
    public boolean hasWarnings() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.WARNING);
    }

    /**
     * Returns an unmodifiable list of all collected diagnostics.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Discards all collected diagnostics.
     */
    public void clear() {
        diagnostics.clear();
    }
}
