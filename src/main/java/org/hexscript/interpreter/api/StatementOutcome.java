package org.hexscript.interpreter.api;

import org.hexscript.interpreter.frontend.lexer.Token;

import java.util.List;

/**
 * The result of processing one statement.
 *
 * @param rawText The trimmed statement text, with the terminator restored by the interpreter.
 * @param status Whether the statement was accepted or rejected.
 * @param message The rejection reason, or the semantic warning of an accepted statement; otherwise {@code null}.
 * @param kind What the statement was recognized as.
 * @param target The assigned variable of an assignment, or {@code null}.
 * @param value The computed value, or {@code null} when nothing was evaluated successfully.
 * @param tokens The tokens of the analysed expression part.
 */
public record StatementOutcome(
        String rawText,
        OutcomeStatus status,
        String message,
        StatementKind kind,
        String target,
        Long value,
        List<Token> tokens
) {

    public StatementOutcome {
        tokens = tokens == null ? List.of() : List.copyOf(tokens);
    }

    public static StatementOutcome comment(String rawText) {
        return new StatementOutcome(rawText, OutcomeStatus.ACCEPTED, null, StatementKind.COMMENT, null, null, List.of());
    }

    public static StatementOutcome empty(String rawText) {
        return new StatementOutcome(rawText, OutcomeStatus.ACCEPTED, null, StatementKind.EMPTY, null, null, List.of());
    }

    public static StatementOutcome accepted(String rawText, StatementKind kind, String target, Long value, List<Token> tokens) {
        return new StatementOutcome(rawText, OutcomeStatus.ACCEPTED, null, kind, target, value, tokens);
    }

    public static StatementOutcome acceptedWithWarning(String rawText, StatementKind kind, String target, String warning, List<Token> tokens) {
        return new StatementOutcome(rawText, OutcomeStatus.ACCEPTED, warning, kind, target, null, tokens);
    }

    public static StatementOutcome rejected(String rawText, StatementKind kind, String target, String reason, List<Token> tokens) {
        return new StatementOutcome(rawText, OutcomeStatus.REJECTED, reason, kind, target, null, tokens);
    }

    public boolean isAccepted() {
        return status == OutcomeStatus.ACCEPTED;
    }

    /**
     * @return true for an accepted statement that carries a semantic warning.
     */
    public boolean hasWarning() {
        return isAccepted() && message != null;
    }

    /**
     * @param newRawText The replacement raw text.
     * @return A copy of this outcome with a different raw text.
     */
    public StatementOutcome withRawText(String newRawText) {
        return new StatementOutcome(newRawText, status, message, kind, target, value, tokens);
    }
}
