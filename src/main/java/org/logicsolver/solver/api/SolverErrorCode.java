package org.logicsolver.solver.api;

/**
 * Defines unique, testable error codes for all errors that can occur while solving a statement.
 * This decouples the test logic from the wording of the error messages.
 */
public enum SolverErrorCode {
    // region Lexer Errors
    /** A character that is not part of the language was found. */
    UNEXPECTED_CHARACTER,
    /** A multi-character operator such as '<=>' or '=>' was started but not completed. */
    INCOMPLETE_OPERATOR,
    /** A digit other than 0 or 1 was used as a literal. */
    INVALID_LITERAL,
    // endregion

    // region Parser Errors
    /** A value (literal, variable or group) was found where an operator was expected. */
    VALUE_WHERE_OPERATOR_EXPECTED,
    /** An operator, a closing parenthesis or the end of input was found where a value was required. */
    VALUE_EXPECTED,
    /** A negation was placed directly after a value. */
    UNEXPECTED_NEGATION,
    /** A closing parenthesis has no matching opening parenthesis. */
    UNMATCHED_CLOSING_PARENTHESIS,
    /** An opening parenthesis was never closed. */
    UNMATCHED_OPENING_PARENTHESIS,
    /** The statement contains no expression. */
    EMPTY_EXPRESSION,
    /** The right-hand side of an assignment references a variable that has not been assigned yet. */
    UNDEFINED_VARIABLE_IN_ASSIGNMENT,
    /** The left-hand side of an assignment is not a variable. */
    INVALID_ASSIGNMENT_TARGET,
    /** The right-hand side of an assignment is not a single literal or variable. */
    INVALID_ASSIGNMENT_VALUE,
    /** An assignment was found after the final expression had begun. */
    ASSIGNMENT_AFTER_EXPRESSION,
    // endregion

    // region Evaluation Errors
    /** A variable is referenced by the expression but was never assigned. */
    UNDEFINED_VARIABLE,
    /** A binary operator node has no left child. */
    MISSING_LEFT_OPERAND,
    /** A binary operator node has no right child. */
    MISSING_RIGHT_OPERAND,
    /** An operator node has no children at all. */
    MISSING_OPERANDS,
    /** An operator that cannot be evaluated (e.g. a parenthesis) ended up in the tree. */
    UNEXPECTED_OPERATOR
    // endregion
}
