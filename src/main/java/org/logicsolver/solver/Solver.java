package org.logicsolver.solver;

import org.logicsolver.solver.api.ISolver;
import org.logicsolver.solver.api.SolverException;
import org.logicsolver.solver.diagnostics.DiagnosticsEngine;
import org.logicsolver.solver.frontend.lexer.LexException;
import org.logicsolver.solver.frontend.lexer.Lexer;
import org.logicsolver.solver.frontend.parser.ParseException;
import org.logicsolver.solver.frontend.parser.ParsedStatement;
import org.logicsolver.solver.frontend.parser.Parser;
import org.logicsolver.solver.interpreter.EvaluationException;
import org.logicsolver.solver.interpreter.Evaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The main solver implementation. This class runs the pipeline from statement text to
 * truth value: lexing, parsing into a tree plus bindings, and evaluation.
 * <p>
 * Every call starts from fresh phase objects; only the warnings of the most recent call are
 * kept in {@link #getDiagnostics()}. It is not thread-safe.
 */
public class Solver implements ISolver {

    private static final Logger LOG = LoggerFactory.getLogger(Solver.class);

    private final SolverOptions options;
    private final DiagnosticsEngine diagnostics = new DiagnosticsEngine();

    /**
     * Creates a solver with the default options.
     */
    public Solver() {
        this(SolverOptions.defaults());
    }

    /**
     * Creates a solver.
     * @param options The lexer and parser options.
     */
    public Solver(SolverOptions options) {
        this.options = options;
    }

    @Override
    public ParsedStatement parse(String statement, String sourceName) throws LexException, ParseException {
        diagnostics.clear();

        Lexer lexer = new Lexer(statement, diagnostics, options, sourceName);
        Parser parser = new Parser(lexer, diagnostics, options);
        ParsedStatement parsed = parser.parse();

        LOG.debug("Parsed {}: expression {} with bindings {}", sourceName, parsed.expression(), parsed.bindings());
        return parsed;
    }

    @Override
    public boolean solve(String statement, String sourceName) throws SolverException {
        ParsedStatement parsed = parse(statement, sourceName);
        return evaluate(parsed, sourceName);
    }

    @Override
    public boolean evaluate(ParsedStatement parsed, String sourceName) throws EvaluationException {
        boolean result = new Evaluator(sourceName).evaluate(parsed.expression(), parsed.bindings());
        LOG.debug("Evaluated {} to {}", sourceName, result);
        return result;
    }

    /**
     * Gets the warnings reported by the most recent call.
     * @return The diagnostics engine.
     */
    public DiagnosticsEngine getDiagnostics() {
        return diagnostics;
    }
}
