package org.logicsolver.solver.frontend.parser.ast;

/**
 * A leaf that holds a boolean literal.
 *
 * @param value The literal value.
 */
public record LiteralNode(
        boolean value
) implements ExpressionNode {
    // This node has no children and inherits the empty list from getChildren().

    @Override
    public String toString() {
        return value ? "1" : "0";
    }
}
