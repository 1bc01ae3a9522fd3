package org.hexscript.interpreter.frontend.lexer;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize.
 */
public enum TokenType {
    // Literals.
    /** An identifier, such as a variable name. Starts with '_' or a lowercase letter. */
    IDENTIFIER,
    /** A hexadecimal literal without prefix, such as 1a5. */
    HEX_NUMBER,

    // Operators and punctuation.
    /** One of the arithmetic operators '+', '-', '*' or '/'. */
    OPERATOR,
    /** The assignment marker ':='. */
    ASSIGN,
    /** The '(' character. */
    LEFT_PAREN,
    /** The ')' character. */
    RIGHT_PAREN,

    // Miscellaneous.
    /** A '//' comment running to the end of the scanned text. */
    COMMENT,
    /** A single character that does not start any known token. */
    UNKNOWN
}
