package org.logicsolver.solver.frontend.parser;

import org.logicsolver.solver.SolverOptions;
import org.logicsolver.solver.api.SolverErrorCode;
import org.logicsolver.solver.diagnostics.DiagnosticsEngine;
import org.logicsolver.solver.frontend.TreeWalker;
import org.logicsolver.solver.frontend.lexer.LexException;
import org.logicsolver.solver.frontend.lexer.Lexer;
import org.logicsolver.solver.frontend.lexer.Operator;
import org.logicsolver.solver.frontend.lexer.Token;
import org.logicsolver.solver.frontend.lexer.TokenType;
import org.logicsolver.solver.frontend.parser.ast.ExpressionNode;
import org.logicsolver.solver.frontend.parser.ast.LiteralNode;
import org.logicsolver.solver.frontend.parser.ast.OperatorNode;
import org.logicsolver.solver.frontend.parser.ast.VariableNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Builds the expression tree of a statement with a shunting-yard algorithm that
 * combines operands into subtrees instead of emitting postfix output.
 * <p>
 * Tokens are pulled from the {@link Lexer} one at a time. Leading assignment statements
 * ({@code name := value}) are consumed into the {@link Bindings} table and leave no node behind.
 * A parser instance parses exactly one statement.
 */
public class Parser {

    private static final Logger LOG = LoggerFactory.getLogger(Parser.class);

    private final Lexer lexer;
    private final DiagnosticsEngine diagnostics;
    private final SolverOptions options;

    private final Deque<Operator> operators = new ArrayDeque<>();
    private final Deque<ExpressionNode> nodes = new ArrayDeque<>();
    private final Bindings.Builder bindings = Bindings.builder();
    private final Set<String> readByAssignments = new HashSet<>();
    /** Line and column of every '(' still on the operator stack, innermost first. */
    private final Deque<int[]> openParenPositions = new ArrayDeque<>();

    private boolean expectingValue = true;
    private boolean assignmentsOpen = true;
    private Token previous;
    private boolean previousStartsStatement = false;
    private int targetLine;
    private int targetColumn;

    /**
     * Constructs a new Parser.
     * @param lexer The lexer supplying the tokens.
     * @param diagnostics The engine for reporting warnings.
     * @param options The parsing options.
     */
    public Parser(Lexer lexer, DiagnosticsEngine diagnostics, SolverOptions options) {
        this.lexer = lexer;
        this.diagnostics = diagnostics;
        this.options = options;
    }

    /**
     * Parses the whole statement.
     * @return The expression tree and the bindings.
     * @throws LexException if the lexer rejects the input.
     * @throws ParseException if the tokens do not form a valid statement.
     */
    public ParsedStatement parse() throws LexException, ParseException {
        Token token;
        while ((token = lexer.nextToken()).type() != TokenType.END_OF_INPUT) {
            if (LOG.isTraceEnabled()) {
                LOG.trace("token {} operators {} node count {}", token, operators, nodes.size());
            }
            boolean assignmentTarget = previousStartsStatement;
            previousStartsStatement = false;

            if (token.isOperator(Operator.ASSIGN)) {
                if (!assignmentTarget) {
                    throw misplacedAssignment();
                }
                assignment();
                continue;
            }
            if (assignmentTarget) {
                // the variable just read begins the final expression
                assignmentsOpen = false;
            }

            switch (token.type()) {
                case LITERAL -> {
                    assignmentsOpen = false;
                    value(new LiteralNode(token.booleanValue()), token);
                }
                case VARIABLE -> variable(token);
                case OPERATOR -> {
                    assignmentsOpen = false;
                    operator(token.operator(), token);
                }
                default -> throw new IllegalStateException("Unexpected token type " + token.type());
            }
            previous = token;
        }
        return finish();
    }

    private void variable(Token token) throws ParseException {
        boolean startsStatement = assignmentsOpen && nodes.isEmpty() && operators.isEmpty();
        value(new VariableNode(token.text()), token);
        if (startsStatement) {
            previousStartsStatement = true;
            targetLine = lexer.tokenLine();
            targetColumn = lexer.tokenColumn();
        }
    }

    private void value(ExpressionNode node, Token token) throws ParseException {
        if (!expectingValue) {
            throw error(SolverErrorCode.VALUE_WHERE_OPERATOR_EXPECTED,
                    "Expected an operator before '" + token.text() + "'");
        }
        nodes.push(node);
        expectingValue = false;
    }

    private void operator(Operator operator, Token token) throws ParseException {
        switch (operator) {
            case PAREN_OPEN -> {
                if (!expectingValue) {
                    throw error(SolverErrorCode.VALUE_WHERE_OPERATOR_EXPECTED, "Expected an operator before '('");
                }
                operators.push(operator);
                openParenPositions.push(new int[] {lexer.tokenLine(), lexer.tokenColumn()});
            }
            case PAREN_CLOSE -> closeGroup();
            case NOT -> {
                if (!expectingValue) {
                    throw error(SolverErrorCode.UNEXPECTED_NEGATION,
                            "Negation '~' is a prefix operator and cannot follow a value");
                }
                operators.push(operator);
            }
            default -> binary(operator, token);
        }
    }

    private void binary(Operator operator, Token token) throws ParseException {
        if (expectingValue && !options.lenientReduction()) {
            throw error(SolverErrorCode.VALUE_EXPECTED, "Expected a value before '" + token.text() + "'");
        }
        while (!operators.isEmpty()
                && operators.peek() != Operator.PAREN_OPEN
                && Precedence.reducesBefore(operators.peek(), operator)) {
            reduce(operators.pop());
        }
        operators.push(operator);
        expectingValue = true;
    }

    private void closeGroup() throws ParseException {
        if (!operators.contains(Operator.PAREN_OPEN)) {
            throw error(SolverErrorCode.UNMATCHED_CLOSING_PARENTHESIS, "Unmatched ')'");
        }
        if (expectingValue && !options.lenientReduction()) {
            throw error(SolverErrorCode.VALUE_EXPECTED, "Expected a value before ')'");
        }
        Operator top;
        while ((top = operators.pop()) != Operator.PAREN_OPEN) {
            reduce(top);
        }
        openParenPositions.pop();
        expectingValue = false;
    }

    private void assignment() throws LexException, ParseException {
        String name = ((VariableNode) nodes.pop()).name();
        Token valueToken = lexer.nextToken();
        boolean value = switch (valueToken.type()) {
            case LITERAL -> valueToken.booleanValue();
            case VARIABLE -> {
                readByAssignments.add(valueToken.text());
                yield bindings.resolve(valueToken.text()).orElseThrow(() -> error(
                        SolverErrorCode.UNDEFINED_VARIABLE_IN_ASSIGNMENT,
                        "Undefined variable " + valueToken.text() + " in assignment to " + name));
            }
            case END_OF_INPUT -> throw error(SolverErrorCode.INVALID_ASSIGNMENT_VALUE,
                    "Expected a literal or a variable after ':=' but reached the end of input");
            default -> throw error(SolverErrorCode.INVALID_ASSIGNMENT_VALUE,
                    "Expected a literal or a variable after ':=' but found '" + valueToken.text() + "'");
        };
        if (bindings.bind(name, value)) {
            diagnostics.reportWarning("Variable '" + name + "' is reassigned", lexer.sourceName(), targetLine, targetColumn);
        }
        LOG.debug("bound {} := {}", name, value);
        expectingValue = true;
        previous = valueToken;
    }

    private ParseException misplacedAssignment() {
        if (previous != null && previous.type() == TokenType.VARIABLE && !assignmentsOpen) {
            return error(SolverErrorCode.ASSIGNMENT_AFTER_EXPRESSION,
                    "Assignments must precede the expression, found ':=' after '" + previous.text() + "'");
        }
        return error(SolverErrorCode.INVALID_ASSIGNMENT_TARGET, "':=' must follow a variable name");
    }

    private ParsedStatement finish() throws ParseException {
        if (!openParenPositions.isEmpty()) {
            int[] position = openParenPositions.peekLast();
            throw new ParseException(SolverErrorCode.UNMATCHED_OPENING_PARENTHESIS, "Unmatched '('",
                    lexer.sourceName(), position[0], position[1]);
        }
        if (nodes.isEmpty() && operators.isEmpty()) {
            throw error(SolverErrorCode.EMPTY_EXPRESSION, "Statement contains no expression");
        }
        if (expectingValue && !options.lenientReduction()) {
            throw error(SolverErrorCode.VALUE_EXPECTED, "Unexpected end of input, expected a value");
        }
        while (!operators.isEmpty()) {
            reduce(operators.pop());
        }
        if (nodes.size() != 1) {
            throw new IllegalStateException("Expected exactly one expression tree, found " + nodes.size());
        }
        ExpressionNode root = nodes.pop();
        Bindings result = bindings.build();
        reportUnusedBindings(root, result);
        return new ParsedStatement(root, result);
    }

    /**
     * Combines the top of the node stack under {@code operator} and pushes the result back.
     */
    private void reduce(Operator operator) throws ParseException {
        if (nodes.isEmpty()) {
            throw error(SolverErrorCode.VALUE_EXPECTED, "Operator '" + operator.symbol() + "' has no operand");
        }
        ExpressionNode right = nodes.pop();
        if (operator.isUnary()) {
            nodes.push(OperatorNode.unary(operator, right));
            return;
        }
        if (nodes.isEmpty()) {
            if (!options.lenientReduction()) {
                throw error(SolverErrorCode.VALUE_EXPECTED, "Operator '" + operator.symbol() + "' has no left operand");
            }
            // lenient mode: the lone operand becomes the left child
            nodes.push(new OperatorNode(operator, right, null));
            return;
        }
        ExpressionNode left = nodes.pop();
        nodes.push(OperatorNode.binary(operator, left, right));
    }

    private void reportUnusedBindings(ExpressionNode root, Bindings result) {
        Set<String> referenced = new HashSet<>(readByAssignments);
        Map<Class<? extends ExpressionNode>, Consumer<ExpressionNode>> handlers =
                Map.of(VariableNode.class, n -> referenced.add(((VariableNode) n).name()));
        new TreeWalker(handlers).walk(root);
        for (String name : result.names()) {
            if (!referenced.contains(name)) {
                diagnostics.reportWarning("Variable '" + name + "' is assigned but never used", lexer.sourceName(), 0, 0);
            }
        }
    }

    private ParseException error(SolverErrorCode code, String message) {
        return new ParseException(code, message, lexer.sourceName(), lexer.tokenLine(), lexer.tokenColumn());
    }
}
