package org.hexscript.interpreter.frontend.evaluation;

/**
 * Either the value of an expression or a tagged error.
 *
 * @param value The computed value; only meaningful when {@link #isSuccess()}.
 * @param errorKind The error tag, or {@code null} on success.
 * @param message The error message, or {@code null} on success.
 */
public record EvaluationResult(long value, ErrorKind errorKind, String message) {

    /**
     * @param value The computed value.
     * @return A successful result.
     */
    public static EvaluationResult success(long value) {
        return new EvaluationResult(value, null, null);
    }

    /**
     * @param message The syntax error message.
     * @return A result tagged {@link ErrorKind#SYNTAX}.
     */
    public static EvaluationResult syntaxError(String message) {
        return new EvaluationResult(0L, ErrorKind.SYNTAX, message);
    }

    /**
     * @param message The semantic error message.
     * @return A result tagged {@link ErrorKind#SEMANTIC}.
     */
    public static EvaluationResult semanticError(String message) {
        return new EvaluationResult(0L, ErrorKind.SEMANTIC, message);
    }

    public boolean isSuccess() {
        return errorKind == null;
    }

    public boolean isSyntaxError() {
        return errorKind == ErrorKind.SYNTAX;
    }

    public boolean isSemanticError() {
        return errorKind == ErrorKind.SEMANTIC;
    }
}
