package org.logicsolver.solver.interpreter;

import org.logicsolver.solver.api.SolverErrorCode;
import org.logicsolver.solver.frontend.lexer.Operator;
import org.logicsolver.solver.frontend.parser.Bindings;
import org.logicsolver.solver.frontend.parser.ast.ExpressionNode;
import org.logicsolver.solver.frontend.parser.ast.LiteralNode;
import org.logicsolver.solver.frontend.parser.ast.OperatorNode;
import org.logicsolver.solver.frontend.parser.ast.VariableNode;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

/**
 * Contains unit tests for the {@link Evaluator}.
 * Trees are built by hand so that malformed shapes the parser never produces can be checked too.
 */
public class EvaluatorTest {

    private final Evaluator evaluator = new Evaluator();

    private static LiteralNode lit(boolean value) {
        return new LiteralNode(value);
    }

    /**
     * Verifies the truth table of every binary operator.
     */
    @ParameterizedTest
    @Tag("unit")
    @CsvSource({
            "AND,         true,  true,  true",
            "AND,         true,  false, false",
            "AND,         false, true,  false",
            "AND,         false, false, false",
            "OR,          true,  true,  true",
            "OR,          true,  false, true",
            "OR,          false, true,  true",
            "OR,          false, false, false",
            "IMPLICATION, true,  true,  true",
            "IMPLICATION, true,  false, false",
            "IMPLICATION, false, true,  true",
            "IMPLICATION, false, false, true",
            "EQUIVALENCE, true,  true,  true",
            "EQUIVALENCE, true,  false, false",
            "EQUIVALENCE, false, true,  false",
            "EQUIVALENCE, false, false, true"
    })
    void evaluatesBinaryOperators(Operator operator, boolean left, boolean right, boolean expected) throws Exception {
        ExpressionNode tree = OperatorNode.binary(operator, lit(left), lit(right));

        assertThat(evaluator.evaluate(tree, Bindings.empty())).isEqualTo(expected);
    }

    @Test
    @Tag("unit")
    void negatesItsOperand() throws Exception {
        assertThat(evaluator.evaluate(OperatorNode.unary(Operator.NOT, lit(true)), Bindings.empty())).isFalse();
        assertThat(evaluator.evaluate(
                OperatorNode.unary(Operator.NOT, OperatorNode.unary(Operator.NOT, lit(true))), Bindings.empty())).isTrue();
    }

    @Test
    @Tag("unit")
    void resolvesVariablesFromBindings() throws Exception {
        ExpressionNode tree = OperatorNode.binary(Operator.AND, new VariableNode("p"), new VariableNode("q"));

        assertThat(evaluator.evaluate(tree, Bindings.of(Map.of("p", true, "q", true)))).isTrue();
        assertThat(evaluator.evaluate(tree, Bindings.of(Map.of("p", true, "q", false)))).isFalse();
    }

    @Test
    @Tag("unit")
    void rejectsUndefinedVariable() {
        EvaluationException e = catchThrowableOfType(
                () -> evaluator.evaluate(new VariableNode("x"), Bindings.empty()), EvaluationException.class);

        assertThat(e.getErrorCode()).isEqualTo(SolverErrorCode.UNDEFINED_VARIABLE);
        assertThat(e.getMessage()).isEqualTo("Undefined variable x");
        assertThat(e.getDiagnostic().hasPosition()).isFalse();
    }

    /**
     * Verifies that binary operators missing one or both children are reported, naming the child that is present.
     */
    @Test
    @Tag("unit")
    void rejectsBinaryOperatorsWithMissingOperands() {
        EvaluationException onlyLeft = catchThrowableOfType(() -> evaluator.evaluate(
                new OperatorNode(Operator.OR, lit(true), null), Bindings.empty()), EvaluationException.class);
        EvaluationException onlyRight = catchThrowableOfType(() -> evaluator.evaluate(
                new OperatorNode(Operator.OR, null, lit(false)), Bindings.empty()), EvaluationException.class);
        EvaluationException none = catchThrowableOfType(() -> evaluator.evaluate(
                new OperatorNode(Operator.AND, null, null), Bindings.empty()), EvaluationException.class);

        assertThat(onlyLeft.getErrorCode()).isEqualTo(SolverErrorCode.MISSING_RIGHT_OPERAND);
        assertThat(onlyLeft.getMessage()).isEqualTo("Expected two values for infix operator Or, got only left: 1");
        assertThat(onlyRight.getErrorCode()).isEqualTo(SolverErrorCode.MISSING_LEFT_OPERAND);
        assertThat(onlyRight.getMessage()).endsWith("got only right: 0");
        assertThat(none.getErrorCode()).isEqualTo(SolverErrorCode.MISSING_OPERANDS);
    }

    @Test
    @Tag("unit")
    void rejectsNegationWithoutOperandAndNonEvaluableOperators() {
        EvaluationException negation = catchThrowableOfType(() -> evaluator.evaluate(
                new OperatorNode(Operator.NOT, null, null), Bindings.empty()), EvaluationException.class);
        EvaluationException paren = catchThrowableOfType(() -> evaluator.evaluate(
                new OperatorNode(Operator.PAREN_OPEN, lit(true), lit(true)), Bindings.empty()), EvaluationException.class);

        assertThat(negation.getErrorCode()).isEqualTo(SolverErrorCode.MISSING_OPERANDS);
        assertThat(paren.getErrorCode()).isEqualTo(SolverErrorCode.UNEXPECTED_OPERATOR);
    }

    @Test
    @Tag("unit")
    void isRepeatable() throws Exception {
        ExpressionNode tree = OperatorNode.binary(Operator.IMPLICATION, new VariableNode("p"), lit(false));
        Bindings bindings = Bindings.of(Map.of("p", true));

        assertThat(evaluator.evaluate(tree, bindings)).isFalse();
        assertThat(evaluator.evaluate(tree, bindings)).isFalse();
    }
}
