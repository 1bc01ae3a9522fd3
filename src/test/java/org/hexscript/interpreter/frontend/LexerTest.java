package org.hexscript.interpreter.frontend;

import org.hexscript.interpreter.frontend.lexer.Lexer;
import org.hexscript.interpreter.frontend.lexer.Token;
import org.hexscript.interpreter.frontend.lexer.TokenType;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Contains unit tests for the {@link Lexer}.
 * These tests verify that the lexer converts statement text into typed tokens with
 * correct offsets, and that it never fails on unexpected input.
 */
public class LexerTest {

    /**
     * Verifies a complete assignment statement: identifier, assign marker, literals,
     * operators and parentheses, each with the offset it starts at.
     */
    @Test
    @Tag("unit")
    void testAssignmentTokenization() {
        // Act
        List<Token> tokens = Lexer.tokenize("_var := 0ff * (x - 1b)");

        // Assert
        assertThat(tokens)
                .extracting(Token::type, Token::text, Token::offset)
                .containsExactly(
                        tuple(TokenType.IDENTIFIER, "_var", 0),
                        tuple(TokenType.ASSIGN, ":=", 5),
                        tuple(TokenType.HEX_NUMBER, "0ff", 8),
                        tuple(TokenType.OPERATOR, "*", 12),
                        tuple(TokenType.LEFT_PAREN, "(", 14),
                        tuple(TokenType.IDENTIFIER, "x", 15),
                        tuple(TokenType.OPERATOR, "-", 17),
                        tuple(TokenType.HEX_NUMBER, "1b", 19),
                        tuple(TokenType.RIGHT_PAREN, ")", 21));
    }

    @Test
    @Tag("unit")
    void testWhitespaceProducesNoTokens() {
        assertThat(Lexer.tokenize(" \t\r\n ")).isEmpty();
        assertThat(Lexer.tokenize("")).isEmpty();
    }

    /**
     * A comment consumes the remainder of the text as one token and stops scanning.
     */
    @Test
    @Tag("unit")
    void testCommentConsumesRestOfText() {
        List<Token> tokens = Lexer.tokenize("1 + // rest := (");

        assertThat(tokens).extracting(Token::type)
                .containsExactly(TokenType.HEX_NUMBER, TokenType.OPERATOR, TokenType.COMMENT);
        assertThat(tokens.get(2).text()).isEqualTo("// rest := (");
        assertThat(tokens.get(2).offset()).isEqualTo(4);
    }

    @Test
    @Tag("unit")
    void testSingleSlashIsDivisionOperator() {
        assertThat(Lexer.tokenize("a/b"))
                .extracting(Token::type, Token::text)
                .containsExactly(
                        tuple(TokenType.IDENTIFIER, "a"),
                        tuple(TokenType.OPERATOR, "/"),
                        tuple(TokenType.IDENTIFIER, "b"));
    }

    @Test
    @Tag("unit")
    void testLoneColonIsUnknown() {
        assertThat(Lexer.tokenize("a : 1"))
                .extracting(Token::type, Token::text)
                .containsExactly(
                        tuple(TokenType.IDENTIFIER, "a"),
                        tuple(TokenType.UNKNOWN, ":"),
                        tuple(TokenType.HEX_NUMBER, "1"));
    }

    /**
     * Identifiers may continue with uppercase letters and digits, but an uppercase letter
     * cannot start one: it becomes an unknown character followed by whatever comes next.
     */
    @Test
    @Tag("unit")
    void testIdentifierCasing() {
        assertThat(Lexer.tokenize("myVar_2"))
                .extracting(Token::type, Token::text)
                .containsExactly(tuple(TokenType.IDENTIFIER, "myVar_2"));

        assertThat(Lexer.tokenize("Abc"))
                .extracting(Token::type, Token::text)
                .containsExactly(
                        tuple(TokenType.UNKNOWN, "A"),
                        tuple(TokenType.IDENTIFIER, "bc"));
    }

    /**
     * The literal scan is greedy over 0-9/a-f only, so letters beyond 'f' start a new token.
     */
    @Test
    @Tag("unit")
    void testHexLiteralStopsAtNonHexLetter() {
        assertThat(Lexer.tokenize("1fg"))
                .extracting(Token::type, Token::text, Token::offset)
                .containsExactly(
                        tuple(TokenType.HEX_NUMBER, "1f", 0),
                        tuple(TokenType.IDENTIFIER, "g", 2));

        assertThat(Lexer.tokenize("0xff"))
                .extracting(Token::type, Token::text)
                .containsExactly(
                        tuple(TokenType.HEX_NUMBER, "0"),
                        tuple(TokenType.IDENTIFIER, "xff"));
    }

    @Test
    @Tag("unit")
    void testUppercaseHexDigitsAreNotPartOfLiteral() {
        assertThat(Lexer.tokenize("1A"))
                .extracting(Token::type, Token::text)
                .containsExactly(
                        tuple(TokenType.HEX_NUMBER, "1"),
                        tuple(TokenType.UNKNOWN, "A"));
    }

    /**
     * Every unrecognized character becomes its own one-character token, so scanning always
     * makes progress.
     */
    @Test
    @Tag("unit")
    void testUnknownCharactersAreSingleTokens() {
        List<Token> tokens = Lexer.tokenize("$#@");

        assertThat(tokens).hasSize(3);
        assertThat(tokens).allSatisfy(t -> {
            assertThat(t.type()).isEqualTo(TokenType.UNKNOWN);
            assertThat(t.text()).hasSize(1);
        });
        assertThat(tokens).extracting(Token::offset).containsExactly(0, 1, 2);
    }

    @Test
    @Tag("unit")
    void testTokenizationIsDeterministic() {
        String source = "abc := 1a5 + 2f * (q / 3)";
        assertThat(Lexer.tokenize(source)).isEqualTo(Lexer.tokenize(source));
    }
}
