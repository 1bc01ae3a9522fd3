package org.hexscript.cli.rendering;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.hexscript.interpreter.api.ProgramResult;
import org.hexscript.interpreter.api.StatementOutcome;
import org.hexscript.interpreter.diagnostics.Diagnostic;

import java.io.PrintWriter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes a {@link ProgramResult} as pretty-printed JSON.
 */
public class JsonReportWriter {

    private final Gson gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();
    private final OutputOptions options;

    public JsonReportWriter(OutputOptions options) {
        this.options = options;
    }

    public void write(ProgramResult result, PrintWriter out) {
        out.println(gson.toJson(toReport(result)));
        out.flush();
    }

    Report toReport(ProgramResult result) {
        List<StatementOutcome> outcomes = options.showTokens()
                ? result.outcomes()
                : result.outcomes().stream().map(o -> new StatementOutcome(
                        o.rawText(), o.status(), o.message(), o.kind(), o.target(), o.value(), List.of())).toList();

        Map<String, VariableValue> variables = new LinkedHashMap<>();
        result.variables().forEach((name, value) ->
                variables.put(name, new VariableValue(value, OutcomeRenderer.toHex(value))));

        return new Report(result.mode().name(), result.acceptedCount(), result.rejectedCount(),
                outcomes, variables, result.diagnostics());
    }

    record Report(String mode, long accepted, long rejected, List<StatementOutcome> outcomes,
                  Map<String, VariableValue> variables, List<Diagnostic> diagnostics) {
    }

    record VariableValue(long decimal, String hex) {
    }
}
