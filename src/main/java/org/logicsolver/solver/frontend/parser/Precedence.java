package org.logicsolver.solver.frontend.parser;

import org.logicsolver.solver.frontend.lexer.Operator;

import java.util.EnumMap;
import java.util.Map;

/**
 * The binding strength of the expression operators, from loosest to tightest:
 * {@code <=>}, {@code =>}, {@code v}, {@code ^}, {@code ~}, parenthesis group.
 * <p>
 * {@link Operator#PAREN_CLOSE} and {@link Operator#ASSIGN} are not expression operators and have no rank.
 */
public final class Precedence {

    private static final Map<Operator, Integer> RANKS = new EnumMap<>(Operator.class);

    static {
        RANKS.put(Operator.EQUIVALENCE, 1);
        RANKS.put(Operator.IMPLICATION, 2);
        RANKS.put(Operator.OR, 3);
        RANKS.put(Operator.AND, 4);
        RANKS.put(Operator.NOT, 5);
        RANKS.put(Operator.PAREN_OPEN, 6);
    }

    private Precedence() {}

    /**
     * Gets the rank of an operator. Higher ranks bind tighter.
     * @param operator The operator.
     * @return The rank.
     * @throws IllegalArgumentException if the operator has no rank.
     */
    public static int of(Operator operator) {
        Integer rank = RANKS.get(operator);
        if (rank == null) {
            throw new IllegalArgumentException("Operator " + operator + " has no precedence");
        }
        return rank;
    }

    /**
     * Checks whether an operator on the stack must be reduced before {@code incoming} is pushed.
     * All binary operators are left associative, so equal ranks reduce.
     * @param stacked The operator on top of the operator stack.
     * @param incoming The operator being pushed.
     * @return true if {@code stacked} binds at least as tight as {@code incoming}.
     */
    public static boolean reducesBefore(Operator stacked, Operator incoming) {
        return of(stacked) >= of(incoming);
    }
}
