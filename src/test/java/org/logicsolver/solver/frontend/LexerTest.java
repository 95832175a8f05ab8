package org.logicsolver.solver.frontend;

import org.logicsolver.solver.SolverOptions;
import org.logicsolver.solver.api.SolverErrorCode;
import org.logicsolver.solver.diagnostics.DiagnosticsEngine;
import org.logicsolver.solver.frontend.lexer.LexException;
import org.logicsolver.solver.frontend.lexer.Lexer;
import org.logicsolver.solver.frontend.lexer.Operator;
import org.logicsolver.solver.frontend.lexer.Token;
import org.logicsolver.solver.frontend.lexer.TokenType;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

/**
 * Contains unit tests for the {@link Lexer}.
 * These tests verify that statements are split into literal, variable and operator tokens
 * and that malformed input is rejected with a positioned error.
 */
public class LexerTest {

    private static final SolverOptions SKIP_BARE_EQUALS =
            new SolverOptions(SolverOptions.BareEqualsPolicy.SKIP, false, false);
    private static final SolverOptions MULTI_CHARACTER =
            new SolverOptions(SolverOptions.BareEqualsPolicy.ERROR, true, false);

    /**
     * Verifies that a statement with literals, variables and operators is tokenized in order
     * and that the stream ends with an end-of-input token.
     */
    @Test
    @Tag("unit")
    void testLexerTokenization() throws Exception {
        // Arrange
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        Lexer lexer = new Lexer("p := 1 p ^ 0", diagnostics);

        // Act
        List<Token> tokens = lexer.scanTokens();

        // Assert
        assertThat(diagnostics.hasWarnings()).isFalse();
        assertThat(tokens).extracting(Token::type).containsExactly(
                TokenType.VARIABLE, TokenType.OPERATOR, TokenType.LITERAL,
                TokenType.VARIABLE, TokenType.OPERATOR, TokenType.LITERAL, TokenType.END_OF_INPUT);
        assertThat(tokens.get(0)).extracting(Token::text, Token::value).containsExactly("p", "p");
        assertThat(tokens.get(1).operator()).isEqualTo(Operator.ASSIGN);
        assertThat(tokens.get(2)).extracting(Token::text, Token::value).containsExactly("1", true);
        assertThat(tokens.get(4).operator()).isEqualTo(Operator.AND);
        assertThat(tokens.get(5).booleanValue()).isFalse();
    }

    /**
     * Verifies every operator symbol, including the multi-character ones.
     */
    @ParameterizedTest
    @Tag("unit")
    @CsvSource({
            "'<=>', EQUIVALENCE",
            "'=>',  IMPLICATION",
            "'v',   OR",
            "'^',   AND",
            "'~',   NOT",
            "'(',   PAREN_OPEN",
            "')',   PAREN_CLOSE",
            "':=',  ASSIGN"
    })
    void recognizesOperators(String source, Operator expected) throws Exception {
        Token token = new Lexer(source, new DiagnosticsEngine()).nextToken();

        assertThat(token.isOperator(expected)).isTrue();
        assertThat(token.text()).isEqualTo(expected.symbol());
    }

    /**
     * Verifies that letters are single-character variables by default, so {@code v} between two
     * letters is still a disjunction.
     */
    @Test
    @Tag("unit")
    void splitsLettersIntoSingleCharacterVariables() throws Exception {
        List<Token> tokens = new Lexer("pvq", new DiagnosticsEngine()).scanTokens();

        assertThat(tokens).extracting(Token::text).containsExactly("p", "v", "q", "");
        assertThat(tokens.get(1).isOperator(Operator.OR)).isTrue();
    }

    @Test
    @Tag("unit")
    void readsRunsOfLettersAsOneVariableWhenEnabled() throws Exception {
        List<Token> tokens = new Lexer("foo v bar vv", new DiagnosticsEngine(), MULTI_CHARACTER, "<memory>").scanTokens();

        assertThat(tokens).extracting(Token::type).containsExactly(
                TokenType.VARIABLE, TokenType.OPERATOR, TokenType.VARIABLE, TokenType.VARIABLE, TokenType.END_OF_INPUT);
        assertThat(tokens).extracting(Token::text).containsExactly("foo", "v", "bar", "vv", "");
    }

    /**
     * Verifies that the lexer keeps returning end-of-input once the statement is exhausted.
     */
    @Test
    @Tag("unit")
    void repeatsEndOfInput() throws Exception {
        Lexer lexer = new Lexer(" 1 ", new DiagnosticsEngine());

        assertThat(lexer.nextToken().type()).isEqualTo(TokenType.LITERAL);
        assertThat(lexer.nextToken().type()).isEqualTo(TokenType.END_OF_INPUT);
        assertThat(lexer.nextToken().type()).isEqualTo(TokenType.END_OF_INPUT);
    }

    @ParameterizedTest
    @Tag("unit")
    @CsvSource({
            "'<1',    INCOMPLETE_OPERATOR",
            "'1 <= 0', INCOMPLETE_OPERATOR",
            "'1 = 0', INCOMPLETE_OPERATOR",
            "'2',     INVALID_LITERAL",
            "'p # q', UNEXPECTED_CHARACTER",
            "'1 & 0', UNEXPECTED_CHARACTER"
    })
    void rejectsMalformedInput(String source, SolverErrorCode expected) {
        LexException e = catchThrowableOfType(
                () -> new Lexer(source, new DiagnosticsEngine()).scanTokens(), LexException.class);

        assertThat(e).isNotNull();
        assertThat(e.getErrorCode()).isEqualTo(expected);
    }

    /**
     * Verifies that errors carry the line and column of the offending character.
     */
    @Test
    @Tag("unit")
    void reportsPositionOfUnexpectedCharacter() {
        LexException e = catchThrowableOfType(
                () -> new Lexer("1 ^\n  #", new DiagnosticsEngine()).scanTokens(), LexException.class);

        assertThat(e.getMessage()).isEqualTo("Unexpected character: #");
        assertThat(e.getDiagnostic().line()).isEqualTo(2);
        assertThat(e.getDiagnostic().column()).isEqualTo(3);
    }

    @Test
    @Tag("unit")
    void reportsSupplementaryCharacterWhole() {
        LexException e = catchThrowableOfType(
                () -> new Lexer("1 ^ \uD83D\uDE00", new DiagnosticsEngine()).scanTokens(), LexException.class);

        assertThat(e.getErrorCode()).isEqualTo(SolverErrorCode.UNEXPECTED_CHARACTER);
        assertThat(e.getMessage()).isEqualTo("Unexpected character: \uD83D\uDE00");
        assertThat(e.getDiagnostic().column()).isEqualTo(5);
    }

    @Test
    @Tag("unit")
    void skipsBareEqualsWithWarningWhenConfigured() throws Exception {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        List<Token> tokens = new Lexer("1 = 0", diagnostics, SKIP_BARE_EQUALS, "<memory>").scanTokens();

        assertThat(tokens).extracting(Token::text).containsExactly("1", "0", "");
        assertThat(diagnostics.hasWarnings()).isTrue();
        assertThat(diagnostics.getDiagnostics().get(0).column()).isEqualTo(3);
    }

    @Test
    @Tag("unit")
    void skipsStrayColonWithWarning() throws Exception {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        List<Token> tokens = new Lexer("1 : 0", diagnostics).scanTokens();

        assertThat(tokens).extracting(Token::text).containsExactly("1", "0", "");
        assertThat(diagnostics.getDiagnostics()).singleElement()
                .satisfies(d -> assertThat(d.message()).contains("':'"));
    }
}
