package org.logicsolver.solver.frontend.lexer;

/**
 * The operators of the propositional-logic language.
 * <p>
 * The declaration order carries no meaning; binding strength is defined by
 * {@link org.logicsolver.solver.frontend.parser.Precedence}.
 */
public enum Operator {
    /** Logical equivalence, {@code <=>}. */
    EQUIVALENCE("<=>", "Equivalence"),
    /** Material implication, {@code =>}. */
    IMPLICATION("=>", "Implication"),
    /** Disjunction, {@code v}. */
    OR("v", "Or"),
    /** Conjunction, {@code ^}. */
    AND("^", "And"),
    /** Negation, {@code ~}. The only unary operator. */
    NOT("~", "Not"),
    /** Opens a parenthesised group. */
    PAREN_OPEN("(", "ParenOpen"),
    /** Closes a parenthesised group. */
    PAREN_CLOSE(")", "ParenClose"),
    /** Separates the target of an assignment statement from its value, {@code :=}. */
    ASSIGN(":=", "Assign");

    private final String symbol;
    private final String displayName;

    Operator(String symbol, String displayName) {
        this.symbol = symbol;
        this.displayName = displayName;
    }

    /**
     * Gets the source representation of this operator.
     * @return The symbol as written in a statement.
     */
    public String symbol() {
        return symbol;
    }

    /**
     * Gets the human readable name of this operator, e.g. "And".
     * @return The display name.
     */
    public String displayName() {
        return displayName;
    }

    /**
     * Checks whether this operator takes a single operand.
     * @return true for {@link #NOT}.
     */
    public boolean isUnary() {
        return this == NOT;
    }
}
