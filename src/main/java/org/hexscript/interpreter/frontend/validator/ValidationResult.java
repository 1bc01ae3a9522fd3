package org.hexscript.interpreter.frontend.validator;

/**
 * The outcome of a structural check by the {@link GrammarValidator}.
 *
 * @param valid Whether the token sequence forms a well-formed expression.
 * @param message The syntax error message, or {@code null} when valid.
 */
public record ValidationResult(boolean valid, String message) {

    private static final ValidationResult OK = new ValidationResult(true, null);

    /**
     * @return The shared successful result.
     */
    public static ValidationResult ok() {
        return OK;
    }

    /**
     * @param message The syntax error message.
     * @return A failed result carrying the message.
     */
    public static ValidationResult error(String message) {
        return new ValidationResult(false, message);
    }
}
