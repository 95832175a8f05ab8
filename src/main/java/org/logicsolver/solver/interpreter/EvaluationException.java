package org.logicsolver.solver.interpreter;

import org.logicsolver.solver.api.SolverErrorCode;
import org.logicsolver.solver.api.SolverException;
import org.logicsolver.solver.diagnostics.Diagnostic;

/**
 * Thrown by the {@link Evaluator} when a tree cannot be evaluated.
 * Trees carry no source positions, so the diagnostic of an evaluation error has none either.
 */
public class EvaluationException extends SolverException {

    /**
     * Constructs a new evaluation exception.
     * @param errorCode The error code.
     * @param message The detail message.
     * @param sourceName The name of the source the tree was parsed from.
     */
    public EvaluationException(SolverErrorCode errorCode, String message, String sourceName) {
        super(errorCode, new Diagnostic(Diagnostic.Type.ERROR, message, sourceName, 0, 0));
    }
}
