package org.hexscript.interpreter.frontend.lexer;

import java.util.regex.Pattern;

/**
 * Character classes and whole-lexeme patterns of the language.
 * <p>
 * The scanner uses the character predicates; the validator, the parser and the
 * statement processor re-check complete lexemes against the patterns.
 */
public final class LexicalRules {

    /** The statement terminator. */
    public static final char TERMINATOR = ';';
    /** The comment marker, running to the end of the enclosing statement. */
    public static final String COMMENT_MARKER = "//";
    /** The assignment marker. */
    public static final String ASSIGN_MARKER = ":=";
    /** The supported arithmetic operators. */
    public static final String OPERATORS = "+-*/";

    private static final Pattern HEX_LITERAL = Pattern.compile("[0-9][0-9a-f]*");
    private static final Pattern IDENTIFIER = Pattern.compile("[a-z_][A-Za-z0-9_]*");

    private LexicalRules() {}

    /**
     * @param c The character to test.
     * @return true if {@code c} may start an identifier.
     */
    public static boolean isIdentifierStart(char c) {
        return c == '_' || (c >= 'a' && c <= 'z');
    }

    /**
     * @param c The character to test.
     * @return true if {@code c} may continue an identifier.
     */
    public static boolean isIdentifierPart(char c) {
        return isAlpha(c) || isDigit(c) || c == '_';
    }

    /**
     * @param c The character to test.
     * @return true if {@code c} may continue a hex literal.
     */
    public static boolean isHexDigit(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'f');
    }

    public static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    public static boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    public static boolean isOperator(char c) {
        return OPERATORS.indexOf(c) >= 0;
    }

    /**
     * Checks a complete lexeme against the literal pattern: one leading digit, then 0-9/a-f.
     * @param text The literal text.
     * @return true if the literal is well-formed.
     */
    public static boolean isValidHexLiteral(String text) {
        return HEX_LITERAL.matcher(text).matches();
    }

    /**
     * Checks that a well-formed literal denotes a value of at most {@link Long#MAX_VALUE}.
     * @param text A literal that already matches {@link #isValidHexLiteral(String)}.
     * @return true if the literal fits into a signed 64-bit value.
     */
    public static boolean fitsInLong(String text) {
        int first = 0;
        while (first < text.length() - 1 && text.charAt(first) == '0') first++;
        int digits = text.length() - first;
        return digits < 16 || (digits == 16 && text.charAt(first) <= '7');
    }

    /**
     * Checks a complete lexeme against the identifier pattern.
     * @param text The identifier text.
     * @return true if the identifier is well-formed.
     */
    public static boolean isValidIdentifier(String text) {
        return IDENTIFIER.matcher(text).matches();
    }

    /**
     * @param text The text to test.
     * @return true if the text starts with an uppercase ASCII letter.
     */
    public static boolean startsWithUppercase(String text) {
        return !text.isEmpty() && text.charAt(0) >= 'A' && text.charAt(0) <= 'Z';
    }
}
