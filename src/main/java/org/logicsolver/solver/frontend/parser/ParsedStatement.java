package org.logicsolver.solver.frontend.parser;

import org.logicsolver.solver.frontend.parser.ast.ExpressionNode;

/**
 * The result of parsing a statement: the tree of its final expression and the
 * bindings produced by its assignment statements.
 *
 * @param expression The root of the expression tree.
 * @param bindings The variable bindings.
 */
public record ParsedStatement(
        ExpressionNode expression,
        Bindings bindings
) {
}
