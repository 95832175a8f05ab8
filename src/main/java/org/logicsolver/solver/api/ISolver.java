package org.logicsolver.solver.api;

import org.logicsolver.solver.frontend.parser.ParsedStatement;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Defines the public interface for solving propositional-logic statements.
 */
public interface ISolver {

    /**
     * Lexes and parses a statement without evaluating it.
     *
     * @param statement The statement text.
     * @param sourceName A name for the statement, used in diagnostics.
     * @return The expression tree and the bindings of the statement.
     * @throws SolverException if the statement cannot be lexed or parsed.
     */
    ParsedStatement parse(String statement, String sourceName) throws SolverException;

    /**
     * Lexes, parses and evaluates a statement.
     *
     * @param statement The statement text.
     * @param sourceName A name for the statement, used in diagnostics.
     * @return The truth value of the statement's expression.
     * @throws SolverException on the first lex, parse or evaluation error.
     */
    boolean solve(String statement, String sourceName) throws SolverException;

    /**
     * Evaluates an already parsed statement.
     *
     * @param parsed The expression tree and bindings returned by {@link #parse(String, String)}.
     * @param sourceName The name of the source it was parsed from, used in diagnostics.
     * @return The truth value.
     * @throws SolverException if a variable is undefined or the tree is malformed.
     */
    boolean evaluate(ParsedStatement parsed, String sourceName) throws SolverException;

    /**
     * Evaluates an already parsed in-memory statement.
     * @param parsed The parsed statement.
     * @return The truth value.
     * @throws SolverException if a variable is undefined or the tree is malformed.
     */
    default boolean evaluate(ParsedStatement parsed) throws SolverException {
        return evaluate(parsed, "<memory>");
    }

    /**
     * Lexes and parses an in-memory statement.
     * @param statement The statement text.
     * @return The expression tree and the bindings of the statement.
     * @throws SolverException if the statement cannot be lexed or parsed.
     */
    default ParsedStatement parse(String statement) throws SolverException {
        return parse(statement, "<memory>");
    }

    /**
     * Solves an in-memory statement.
     * @param statement The statement text.
     * @return The truth value.
     * @throws SolverException on the first lex, parse or evaluation error.
     */
    default boolean solve(String statement) throws SolverException {
        return solve(statement, "<memory>");
    }

    /**
     * Lexes and parses the statement stored in a file.
     * @param statementPath The path of the statement file.
     * @return The expression tree and the bindings of the statement.
     * @throws SolverException if the statement cannot be lexed or parsed.
     * @throws IOException if the file cannot be read.
     */
    default ParsedStatement parse(Path statementPath) throws SolverException, IOException {
        return parse(Files.readString(statementPath), statementPath.toString());
    }

    /**
     * Solves the statement stored in a file.
     * @param statementPath The path of the statement file.
     * @return The truth value.
     * @throws SolverException on the first lex, parse or evaluation error.
     * @throws IOException if the file cannot be read.
     */
    default boolean solve(Path statementPath) throws SolverException, IOException {
        return solve(Files.readString(statementPath), statementPath.toString());
    }
}
