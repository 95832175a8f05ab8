package org.logicsolver.solver.frontend.parser.ast;

/**
 * A leaf that references a variable by name.
 *
 * @param name The variable name.
 */
public record VariableNode(
        String name
) implements ExpressionNode {
    // This node has no children and inherits the empty list from getChildren().

    @Override
    public String toString() {
        return name;
    }
}
