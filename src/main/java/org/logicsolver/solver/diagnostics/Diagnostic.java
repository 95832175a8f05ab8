package org.logicsolver.solver.diagnostics;

/**
 * Represents a single diagnostic message (error or warning)
 * produced while lexing, parsing or evaluating a statement.
 *
 * @param type The type of the diagnostic (e.g., ERROR, WARNING).
 * @param message The diagnostic message.
 * @param sourceName The name of the source the statement was read from.
 * @param line The line of the issue, or 0 if the issue has no source position.
 * @param column The column of the issue, or 0 if the issue has no source position.
 */
public record Diagnostic(
        Type type,
        String message,
        String sourceName,
        int line,
        int column
) {
    /**
     * The type of a diagnostic message.
     */
    public enum Type {
        /** An error that aborts solving. */
        ERROR,
        /** A warning that does not abort solving. */
        WARNING
    }

    /**
     * Checks whether this diagnostic points at a location in the source.
     * @return true if line and column are known.
     */
    public boolean hasPosition() {
        return line > 0;
    }

    @Override
    public String toString() {
        if (!hasPosition()) {
            return String.format("[%s] %s: %s", type, sourceName, message);
        }
        return String.format("[%s] %s:%d:%d: %s", type, sourceName, line, column, message);
    }
}
