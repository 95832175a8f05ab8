package org.logicsolver.solver.frontend.lexer;

import org.logicsolver.solver.api.SolverErrorCode;
import org.logicsolver.solver.api.SolverException;

/**
 * Thrown by the {@link Lexer} when a character sequence does not form a valid token.
 */
public class LexException extends SolverException {

    /**
     * Constructs a new lex exception.
     * @param errorCode The error code.
     * @param message The detail message.
     * @param sourceName The name of the source being lexed.
     * @param line The line of the offending character.
     * @param column The column of the offending character.
     */
    public LexException(SolverErrorCode errorCode, String message, String sourceName, int line, int column) {
        super(errorCode, message, sourceName, line, column);
    }
}
