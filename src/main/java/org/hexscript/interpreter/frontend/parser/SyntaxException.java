package org.hexscript.interpreter.frontend.parser;

/**
 * Thrown by the {@link Parser} to abandon a malformed expression.
 * Callers outside the frontend see it only as a syntax-tagged result.
 */
public class SyntaxException extends RuntimeException {

    /**
     * @param message The syntax error message.
     */
    public SyntaxException(String message) {
        super(message);
    }
}
