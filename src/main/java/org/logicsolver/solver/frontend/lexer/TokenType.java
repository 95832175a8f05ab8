package org.logicsolver.solver.frontend.lexer;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize.
 */
public enum TokenType {
    /** A boolean literal, written as 0 or 1. */
    LITERAL,
    /** A variable name. */
    VARIABLE,
    /** One of the {@link Operator}s. */
    OPERATOR,
    /** Represents the end of the input. */
    END_OF_INPUT
}
