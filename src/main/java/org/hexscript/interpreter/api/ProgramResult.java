package org.hexscript.interpreter.api;

import org.hexscript.interpreter.diagnostics.Diagnostic;

import java.util.List;
import java.util.Map;

/**
 * Everything one interpreter run produces.
 *
 * @param mode The mode the run was performed in.
 * @param outcomes One outcome per non-empty statement, in source order.
 * @param variables The final variable table, in first-assignment order.
 * @param diagnostics One diagnostic per rejected or warned statement.
 */
public record ProgramResult(
        ExecutionMode mode,
        List<StatementOutcome> outcomes,
        Map<String, Long> variables,
        List<Diagnostic> diagnostics
) {

    public ProgramResult {
        outcomes = List.copyOf(outcomes);
        diagnostics = List.copyOf(diagnostics);
    }

    public long acceptedCount() {
        return outcomes.stream().filter(StatementOutcome::isAccepted).count();
    }

    public long rejectedCount() {
        return outcomes.size() - acceptedCount();
    }

    /**
     * @return true if at least one statement was rejected.
     */
    public boolean hasRejections() {
        return rejectedCount() > 0;
    }
}
