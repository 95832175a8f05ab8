package org.logicsolver.solver.frontend.lexer;

import org.logicsolver.solver.SolverOptions;
import org.logicsolver.solver.api.SolverErrorCode;
import org.logicsolver.solver.diagnostics.DiagnosticsEngine;

import java.util.ArrayList;
import java.util.List;

/**
 * The Lexer converts a statement into a sequence of tokens.
 * <p>
 * Tokens are produced lazily, one per call to {@link #nextToken()}, in a single left-to-right
 * pass. A lexer instance cannot be rewound; lexing the same statement again takes a new instance.
 */
public class Lexer {

    private final String source;
    private final DiagnosticsEngine diagnostics;
    private final SolverOptions options;
    private final String sourceName;
    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int column = 1;
    private int tokenLine = 1;
    private int tokenColumn = 1;

    /**
     * Creates a new Lexer with default options.
     * @param source The statement to lex.
     * @param diagnostics The engine for reporting warnings.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics) {
        this(source, diagnostics, SolverOptions.defaults(), "<memory>");
    }

    /**
     * Creates a new Lexer.
     * @param source The statement to lex.
     * @param diagnostics The engine for reporting warnings.
     * @param options The lexing options.
     * @param sourceName The name of the source, for error reporting.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics, SolverOptions options, String sourceName) {
        this.source = source;
        this.diagnostics = diagnostics;
        this.options = options;
        this.sourceName = sourceName;
    }

    /**
     * Scans the next token. Once the input is exhausted every call returns an
     * {@link TokenType#END_OF_INPUT} token.
     * @return The next token.
     * @throws LexException if the next character sequence is not a valid token.
     */
    public Token nextToken() throws LexException {
        while (!isAtEnd()) {
            start = current;
            tokenLine = line;
            tokenColumn = column;
            char c = advance();
            switch (c) {
                case '^': return Token.operator(Operator.AND);
                case '~': return Token.operator(Operator.NOT);
                case '(': return Token.operator(Operator.PAREN_OPEN);
                case ')': return Token.operator(Operator.PAREN_CLOSE);
                case '<':
                    if (match('=') && match('>')) {
                        return Token.operator(Operator.EQUIVALENCE);
                    }
                    throw error(SolverErrorCode.INCOMPLETE_OPERATOR,
                            "Expected '<=>' but found '" + source.substring(start, current) + "'");
                case '=':
                    if (match('>')) {
                        return Token.operator(Operator.IMPLICATION);
                    }
                    if (options.bareEquals() == SolverOptions.BareEqualsPolicy.ERROR) {
                        throw error(SolverErrorCode.INCOMPLETE_OPERATOR, "Expected '=>' but found '='");
                    }
                    diagnostics.reportWarning("Skipping '=' that is not part of '=>'", sourceName, tokenLine, tokenColumn);
                    break;
                case ':':
                    if (match('=')) {
                        return Token.operator(Operator.ASSIGN);
                    }
                    diagnostics.reportWarning("Skipping ':' that is not part of ':='", sourceName, tokenLine, tokenColumn);
                    break;
                case '\n':
                    line++;
                    column = 1;
                    break;
                default:
                    if (Character.isWhitespace(c)) {
                        break;
                    }
                    if (isDigit(c)) {
                        return literal(c);
                    }
                    if (isAlpha(c)) {
                        return identifier();
                    }
                    throw error(SolverErrorCode.UNEXPECTED_CHARACTER,
                            "Unexpected character: " + new String(Character.toChars(source.codePointAt(start))));
            }
        }
        tokenLine = line;
        tokenColumn = column;
        return Token.endOfInput();
    }

    /**
     * Drains the lexer into a list. The last element is always the end-of-input token.
     * @return All remaining tokens.
     * @throws LexException on the first invalid token.
     */
    public List<Token> scanTokens() throws LexException {
        List<Token> tokens = new ArrayList<>();
        Token token;
        do {
            token = nextToken();
            tokens.add(token);
        } while (token.type() != TokenType.END_OF_INPUT);
        return tokens;
    }

    /**
     * Gets the line on which the most recently returned token starts.
     * @return The 1-based line.
     */
    public int tokenLine() {
        return tokenLine;
    }

    /**
     * Gets the column at which the most recently returned token starts.
     * @return The 1-based column.
     */
    public int tokenColumn() {
        return tokenColumn;
    }

    /**
     * Gets the name of the source being lexed.
     * @return The source name.
     */
    public String sourceName() {
        return sourceName;
    }

    private Token literal(char c) throws LexException {
        if (c == '0') return Token.literal("0", false);
        if (c == '1') return Token.literal("1", true);
        throw error(SolverErrorCode.INVALID_LITERAL, "Invalid literal '" + c + "', only 0 and 1 are allowed");
    }

    private Token identifier() {
        if (options.multiCharacterIdentifiers()) {
            while (isAlpha(peek())) advance();
        }
        String text = source.substring(start, current);
        // 'v' is reserved for disjunction and never names a variable
        if (text.equals(Operator.OR.symbol())) {
            return Token.operator(Operator.OR);
        }
        return Token.variable(text);
    }

    private LexException error(SolverErrorCode code, String message) {
        return new LexException(code, message, sourceName, tokenLine, tokenColumn);
    }

    private boolean match(char expected) {
        if (peek() != expected) return false;
        advance();
        return true;
    }

    private char advance() {
        column++;
        return source.charAt(current++);
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') ||
                (c >= 'A' && c <= 'Z');
    }
}
