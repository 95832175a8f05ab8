package org.logicsolver.solver.api;

import org.logicsolver.solver.diagnostics.Diagnostic;

/**
 * An exception that is thrown when a statement cannot be lexed, parsed or evaluated.
 * <p>
 * It is part of the public API; the phase specific subclasses are
 * {@link org.logicsolver.solver.frontend.lexer.LexException},
 * {@link org.logicsolver.solver.frontend.parser.ParseException} and
 * {@link org.logicsolver.solver.interpreter.EvaluationException}.
 */
public class SolverException extends Exception {

    private final SolverErrorCode errorCode;
    private final Diagnostic diagnostic;

    /**
     * Constructs a new solver exception for an error with a source position.
     * @param errorCode The error code.
     * @param message The detail message.
     * @param sourceName The name of the source the statement was read from.
     * @param line The line of the error.
     * @param column The column of the error.
     */
    public SolverException(SolverErrorCode errorCode, String message, String sourceName, int line, int column) {
        this(errorCode, new Diagnostic(Diagnostic.Type.ERROR, message, sourceName, line, column));
    }

    /**
     * Constructs a new solver exception from a diagnostic.
     * @param errorCode The error code.
     * @param diagnostic The diagnostic describing the error.
     */
    public SolverException(SolverErrorCode errorCode, Diagnostic diagnostic) {
        super(diagnostic.message(), null);
        this.errorCode = errorCode;
        this.diagnostic = diagnostic;
    }

    /**
     * Gets the error code.
     * @return The error code.
     */
    public SolverErrorCode getErrorCode() {
        return errorCode;
    }

    /**
     * Gets the diagnostic describing the error, including its source position if known.
     * @return The diagnostic.
     */
    public Diagnostic getDiagnostic() {
        return diagnostic;
    }
}
