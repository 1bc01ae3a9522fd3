package org.hexscript.interpreter.diagnostics;

/**
 * Represents a single diagnostic message (error or warning) raised by one statement.
 *
 * @param type The type of the diagnostic (e.g., ERROR, WARNING).
 * @param message The diagnostic message.
 * @param statementNumber The 1-based number of the statement within the program.
 * @param offset The 0-based offset in the program text where the statement begins.
 */
public record Diagnostic(
        Type type,
        String message,
        int statementNumber,
        int offset
) {
    /**
     * The type of a diagnostic message.
     */
    public enum Type {
        /** A syntax error; the statement was rejected. */
        ERROR,
        /** A semantic problem; the statement was accepted but had no effect. */
        WARNING
    }

    @Override
    public String toString() {
        return String.format("[%s] statement %d (offset %d): %s", type, statementNumber, offset, message);
    }
}
