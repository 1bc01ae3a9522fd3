package org.hexscript.interpreter.frontend.lexer;

import java.util.ArrayList;
import java.util.List;

/**
 * The Lexer (also known as Tokenizer or Scanner) is responsible for converting
 * the text of one statement into a sequence of tokens.
 * <p>
 * Scanning never fails: any character that does not start a known token becomes a
 * one-character {@link TokenType#UNKNOWN} token, so every call makes progress and
 * terminates. A lexer instance is single-use; {@link #tokenize(String)} is the
 * convenient entry point.
 */
public class Lexer {

    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    private int start = 0;
    private int current = 0;

    /**
     * Creates a new Lexer.
     * @param source The statement text, without its terminator.
     */
    public Lexer(String source) {
        this.source = source;
    }

    /**
     * Tokenizes the given text.
     * @param source The statement text.
     * @return The recognized tokens, in source order.
     */
    public static List<Token> tokenize(String source) {
        return new Lexer(source).scanTokens();
    }

    /**
     * Performs the tokenization of the entire text.
     * @return An unmodifiable list of the recognized tokens.
     */
    public List<Token> scanTokens() {
        while (!isAtEnd()) {
            start = current;
            scanToken();
        }
        return List.copyOf(tokens);
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case ' ', '\r', '\t', '\n':
                break;
            case '(': addToken(TokenType.LEFT_PAREN); break;
            case ')': addToken(TokenType.RIGHT_PAREN); break;
            case ':':
                if (peek() == '=') {
                    advance();
                    addToken(TokenType.ASSIGN);
                } else {
                    addToken(TokenType.UNKNOWN);
                }
                break;
            case '/':
                if (peek() == '/') {
                    // A comment swallows everything that is left.
                    current = source.length();
                    addToken(TokenType.COMMENT);
                } else {
                    addToken(TokenType.OPERATOR);
                }
                break;
            case '+', '-', '*':
                addToken(TokenType.OPERATOR);
                break;
            default:
                if (LexicalRules.isIdentifierStart(c)) {
                    identifier();
                } else if (LexicalRules.isDigit(c)) {
                    hexNumber();
                } else {
                    addToken(TokenType.UNKNOWN);
                }
                break;
        }
    }

    private void identifier() {
        while (!isAtEnd() && LexicalRules.isIdentifierPart(peek())) advance();
        addToken(TokenType.IDENTIFIER);
    }

    private void hexNumber() {
        while (!isAtEnd() && LexicalRules.isHexDigit(peek())) advance();
        addToken(TokenType.HEX_NUMBER);
    }

    private char advance() {
        return source.charAt(current++);
    }

    private void addToken(TokenType type) {
        tokens.add(new Token(type, source.substring(start, current), start));
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }
}
