package org.hexscript.interpreter.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * An engine for collecting the diagnostic messages of one interpreter run.
 * <p>
 * This decouples reporting from the statement logic, which only produces outcomes.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports an error.
     *
     * @param message         The error message.
     * @param statementNumber The 1-based statement number.
     * @param offset          The offset of the statement in the program text.
     */
    public void reportError(String message, int statementNumber, int offset) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.ERROR, message, statementNumber, offset));
    }

    /**
     * Reports a warning.
     *
     * @param message         The warning message.
     * @param statementNumber The 1-based statement number.
     * @param offset          The offset of the statement in the program text.
     */
    public void reportWarning(String message, int statementNumber, int offset) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.WARNING, message, statementNumber, offset));
    }

    /**
     * Checks if errors have been reported.
     *
     * @return {@code true} if at least one error exists, otherwise {@code false}.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.ERROR);
    }

    /**
     * Returns an unmodifiable list of all collected diagnostics.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Returns all collected diagnostics as a single, formatted string.
     *
     * @return A formatted string summary of all diagnostics.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
