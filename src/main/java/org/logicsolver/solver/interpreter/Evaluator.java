package org.logicsolver.solver.interpreter;

import org.logicsolver.solver.api.SolverErrorCode;
import org.logicsolver.solver.frontend.lexer.Operator;
import org.logicsolver.solver.frontend.parser.Bindings;
import org.logicsolver.solver.frontend.parser.ast.ExpressionNode;
import org.logicsolver.solver.frontend.parser.ast.LiteralNode;
import org.logicsolver.solver.frontend.parser.ast.OperatorNode;
import org.logicsolver.solver.frontend.parser.ast.VariableNode;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.BinaryOperator;

/**
 * Computes the truth value of an expression tree by walking it in post-order.
 * <p>
 * Evaluation is side-effect free; the same tree and bindings always produce the same result.
 */
public class Evaluator {

    private static final Map<Operator, BinaryOperator<Boolean>> TRUTH_TABLES = new EnumMap<>(Operator.class);

    static {
        TRUTH_TABLES.put(Operator.AND, (a, b) -> a && b);
        TRUTH_TABLES.put(Operator.OR, (a, b) -> a || b);
        TRUTH_TABLES.put(Operator.EQUIVALENCE, (a, b) -> a.booleanValue() == b.booleanValue());
        // false only if the premise holds and the conclusion does not
        TRUTH_TABLES.put(Operator.IMPLICATION, (a, b) -> !(a && !b));
    }

    private final String sourceName;

    /**
     * Creates an evaluator for trees parsed from memory.
     */
    public Evaluator() {
        this("<memory>");
    }

    /**
     * Creates an evaluator.
     * @param sourceName The name of the source the trees were parsed from, for error reporting.
     */
    public Evaluator(String sourceName) {
        this.sourceName = sourceName;
    }

    /**
     * Evaluates a tree.
     * <p>
     * The tree is walked in post-order with an explicit stack, so arbitrarily deep trees
     * evaluate without exhausting the call stack. The left operand is always evaluated
     * before the right one, so the first error in that order is the one reported.
     *
     * @param root The root of the tree.
     * @param bindings The variable values.
     * @return The truth value.
     * @throws EvaluationException if a variable is undefined or the tree is malformed.
     */
    public boolean evaluate(ExpressionNode root, Bindings bindings) throws EvaluationException {
        Objects.requireNonNull(root, "root");
        Deque<Frame> pending = new ArrayDeque<>();
        Deque<Boolean> values = new ArrayDeque<>();
        pending.push(new Frame(root, false));

        while (!pending.isEmpty()) {
            Frame frame = pending.pop();
            ExpressionNode node = frame.node();
            if (node instanceof LiteralNode literal) {
                values.push(literal.value());
            } else if (node instanceof VariableNode variable) {
                values.push(resolve(variable, bindings));
            } else if (node instanceof OperatorNode operatorNode) {
                if (frame.operandsDone()) {
                    values.push(apply(operatorNode.operator(), values));
                } else {
                    checkOperands(operatorNode);
                    pending.push(new Frame(operatorNode, true));
                    if (operatorNode.right() != null) {
                        pending.push(new Frame(operatorNode.right(), false));
                    }
                    pending.push(new Frame(operatorNode.left(), false));
                }
            } else {
                throw new IllegalArgumentException("Unsupported node type " + node.getClass().getName());
            }
        }
        return values.pop();
    }

    /**
     * A node waiting on the stack; {@code operandsDone} is set once its children have been pushed.
     */
    private record Frame(ExpressionNode node, boolean operandsDone) {}

    private boolean resolve(VariableNode variable, Bindings bindings) throws EvaluationException {
        return bindings.resolve(variable.name()).orElseThrow(() -> new EvaluationException(
                SolverErrorCode.UNDEFINED_VARIABLE, "Undefined variable " + variable.name(), sourceName));
    }

    private static boolean apply(Operator operator, Deque<Boolean> values) {
        if (operator == Operator.NOT) {
            return !values.pop();
        }
        boolean right = values.pop();
        boolean left = values.pop();
        return TRUTH_TABLES.get(operator).apply(left, right);
    }

    private void checkOperands(OperatorNode node) throws EvaluationException {
        Operator operator = node.operator();
        if (operator == Operator.NOT) {
            if (node.left() == null) {
                throw new EvaluationException(SolverErrorCode.MISSING_OPERANDS,
                        "Cannot evaluate negation without value", sourceName);
            }
            return;
        }
        if (!TRUTH_TABLES.containsKey(operator)) {
            throw new EvaluationException(SolverErrorCode.UNEXPECTED_OPERATOR,
                    "Unexpected operator " + operator.displayName(), sourceName);
        }
        ExpressionNode left = node.left();
        ExpressionNode right = node.right();
        if (left != null && right != null) {
            return;
        }
        String operatorName = operator.displayName();
        if (left != null) {
            throw new EvaluationException(SolverErrorCode.MISSING_RIGHT_OPERAND,
                    "Expected two values for infix operator " + operatorName + ", got only left: " + left, sourceName);
        }
        if (right != null) {
            throw new EvaluationException(SolverErrorCode.MISSING_LEFT_OPERAND,
                    "Expected two values for infix operator " + operatorName + ", got only right: " + right, sourceName);
        }
        throw new EvaluationException(SolverErrorCode.MISSING_OPERANDS,
                "Expected two values for infix operator " + operatorName + ", got none", sourceName);
    }
}
