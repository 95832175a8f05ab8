package org.logicsolver.solver.frontend.parser;

import org.logicsolver.solver.api.SolverErrorCode;
import org.logicsolver.solver.api.SolverException;

/**
 * Thrown by the {@link Parser} when the token sequence is not a valid statement.
 */
public class ParseException extends SolverException {

    /**
     * Constructs a new parse exception.
     * @param errorCode The error code.
     * @param message The detail message.
     * @param sourceName The name of the source being parsed.
     * @param line The line of the offending token.
     * @param column The column of the offending token.
     */
    public ParseException(SolverErrorCode errorCode, String message, String sourceName, int line, int column) {
        super(errorCode, message, sourceName, line, column);
    }
}
