package org.hexscript.cli.rendering;

import org.hexscript.interpreter.api.ProgramResult;
import org.hexscript.interpreter.api.StatementOutcome;
import org.hexscript.interpreter.frontend.lexer.Token;

import java.io.PrintWriter;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Renders a {@link ProgramResult} as human-readable text, one line per statement,
 * followed by the variable table in decimal and hex.
 */
public class OutcomeRenderer {

    private final OutputOptions options;

    public OutcomeRenderer(OutputOptions options) {
        this.options = options;
    }

    public void render(ProgramResult result, PrintWriter out) {
        for (StatementOutcome outcome : result.outcomes()) {
            StringBuilder line = new StringBuilder()
                    .append(outcome.rawText())
                    .append(" - ")
                    .append(outcome.status().name().toLowerCase(Locale.ROOT));
            if (outcome.message() != null) {
                line.append(": ").append(outcome.message());
            }
            out.println(line);
            if (options.showTokens() && !outcome.tokens().isEmpty()) {
                out.println("    " + formatTokens(outcome));
            }
        }

        if (options.showVariables()) {
            out.println();
            out.println("Variables:");
            if (result.variables().isEmpty()) {
                out.println("  (none)");
            }
            for (Map.Entry<String, Long> entry : result.variables().entrySet()) {
                out.printf("  %s = %d (hex %s)%n", entry.getKey(), entry.getValue(), toHex(entry.getValue()));
            }
        }
        out.printf("%n%d accepted, %d rejected%n", result.acceptedCount(), result.rejectedCount());
        out.flush();
    }

    private static String formatTokens(StatementOutcome outcome) {
        return outcome.tokens().stream()
                .map(OutcomeRenderer::formatToken)
                .collect(Collectors.joining(" "));
    }

    static String formatToken(Token token) {
        return "[" + token.text() + " : " + token.type().name().toLowerCase(Locale.ROOT) + "]";
    }

    /**
     * Formats a value the way literals are written in the language, with a leading '-' for
     * negative values.
     * @param value The value.
     * @return Lowercase hex digits without prefix.
     */
    public static String toHex(long value) {
        return value < 0 ? "-" + Long.toUnsignedString(-value, 16) : Long.toHexString(value);
    }
}
