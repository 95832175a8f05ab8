package org.logicsolver.solver.frontend.parser.ast;

import org.logicsolver.solver.frontend.lexer.Operator;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * An operator applied to its operands.
 * <p>
 * Binary operators use both children. {@link Operator#NOT} stores its single operand as
 * {@code left} and leaves {@code right} empty. Either child may be {@code null} in a malformed
 * tree; the evaluator reports such trees instead of failing on them.
 *
 * @param operator The operator.
 * @param left The left child, or the operand of a unary operator.
 * @param right The right child, {@code null} for unary operators.
 */
public record OperatorNode(
        Operator operator,
        ExpressionNode left,
        ExpressionNode right
) implements ExpressionNode {

    /**
     * Creates a unary node.
     * @param operator The unary operator.
     * @param operand The operand.
     * @return The node.
     */
    public static OperatorNode unary(Operator operator, ExpressionNode operand) {
        return new OperatorNode(operator, operand, null);
    }

    /**
     * Creates a binary node.
     * @param operator The binary operator.
     * @param left The left operand.
     * @param right The right operand.
     * @return The node.
     */
    public static OperatorNode binary(Operator operator, ExpressionNode left, ExpressionNode right) {
        return new OperatorNode(operator, left, right);
    }

    @Override
    public List<ExpressionNode> getChildren() {
        List<ExpressionNode> children = new ArrayList<>(2);
        if (left != null) children.add(left);
        if (right != null) children.add(right);
        return Collections.unmodifiableList(children);
    }

    @Override
    public String toString() {
        // iterative, trees may be thousands of levels deep
        StringBuilder out = new StringBuilder();
        Deque<Object> pending = new ArrayDeque<>();
        pending.push(this);
        while (!pending.isEmpty()) {
            Object item = pending.pop();
            if (item instanceof OperatorNode node) {
                pending.push(")");
                if (node.right != null) {
                    pending.push(node.right);
                    pending.push(", ");
                }
                pending.push(node.left != null ? node.left : "null");
                pending.push(node.operator.displayName() + "(");
            } else {
                out.append(item);
            }
        }
        return out.toString();
    }
}
