package org.logicsolver.solver.frontend.lexer;

/**
 * Represents a single token extracted from a statement by the {@link Lexer}.
 *
 * @param type The type of the token.
 * @param text The exact text of the token from the source.
 * @param value The processed value of the token: a {@link Boolean} for literals,
 *              the name for variables, the {@link Operator} for operators.
 */
public record Token(
        TokenType type,
        String text,
        Object value
) {

    static Token literal(String text, boolean value) {
        return new Token(TokenType.LITERAL, text, value);
    }

    static Token variable(String name) {
        return new Token(TokenType.VARIABLE, name, name);
    }

    static Token operator(Operator operator) {
        return new Token(TokenType.OPERATOR, operator.symbol(), operator);
    }

    static Token endOfInput() {
        return new Token(TokenType.END_OF_INPUT, "", null);
    }

    /**
     * Checks whether this token is the given operator.
     * @param operator The operator to compare with.
     * @return true if this is an operator token of that kind.
     */
    public boolean isOperator(Operator operator) {
        return type == TokenType.OPERATOR && value == operator;
    }

    /**
     * Gets the operator of an operator token.
     * @return The operator.
     */
    public Operator operator() {
        return (Operator) value;
    }

    /**
     * Gets the value of a literal token.
     * @return The boolean value.
     */
    public boolean booleanValue() {
        return (Boolean) value;
    }
}
