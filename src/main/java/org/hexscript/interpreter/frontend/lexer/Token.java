package org.hexscript.interpreter.frontend.lexer;

/**
 * Represents a single token extracted from a statement by the {@link Lexer}.
 *
 * @param type The type of the token (e.g., identifier, hex number, operator).
 * @param text The exact text of the token from the statement.
 * @param offset The 0-based index into the scanned text where the token begins.
 */
public record Token(
        TokenType type,
        String text,
        int offset
) {

    /**
     * Checks whether this token is of the given type.
     * @param expected The type to compare against.
     * @return true if the types match.
     */
    public boolean is(TokenType expected) {
        return type == expected;
    }

    @Override
    public String toString() {
        return String.format("%s '%s' @%d", type, text, offset);
    }
}
