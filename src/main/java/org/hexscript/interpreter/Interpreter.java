package org.hexscript.interpreter;

import org.hexscript.interpreter.api.ExecutionMode;
import org.hexscript.interpreter.api.IInterpreter;
import org.hexscript.interpreter.api.InterpreterOptions;
import org.hexscript.interpreter.api.ProgramResult;
import org.hexscript.interpreter.api.StatementOutcome;
import org.hexscript.interpreter.diagnostics.DiagnosticsEngine;
import org.hexscript.interpreter.frontend.evaluation.VariableTable;
import org.hexscript.interpreter.frontend.lexer.LexicalRules;
import org.hexscript.interpreter.statement.StatementProcessor;
import org.hexscript.interpreter.statement.StatementSegment;
import org.hexscript.interpreter.statement.StatementSplitter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * The main entry point of the interpreter. It orchestrates one run:
 * <ol>
 *     <li>Split the program text into statements on ';'.</li>
 *     <li>Hand each statement, in source order, to the {@link StatementProcessor}.</li>
 *     <li>Thread one {@link VariableTable} through all statements, so later statements
 *         see earlier assignments.</li>
 *     <li>Collect outcomes and diagnostics.</li>
 * </ol>
 * A run never fails as a whole; every statement is reported individually. Each run
 * starts with a fresh, empty variable table, so instances can be reused.
 */
public class Interpreter implements IInterpreter {

    private static final Logger LOG = LoggerFactory.getLogger(Interpreter.class);

    private final StatementSplitter splitter = new StatementSplitter();
    private final StatementProcessor processor;

    public Interpreter() {
        this(InterpreterOptions.defaults());
    }

    /**
     * @param options The options for statement processing.
     */
    public Interpreter(InterpreterOptions options) {
        this(new StatementProcessor(options));
    }

    /**
     * @param processor The processor to delegate single statements to.
     */
    public Interpreter(StatementProcessor processor) {
        this.processor = processor;
    }

    @Override
    public ProgramResult run(String source, ExecutionMode mode) {
        List<StatementSegment> segments = splitter.split(source);
        VariableTable variables = new VariableTable();
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        List<StatementOutcome> outcomes = new ArrayList<>(segments.size());

        LOG.debug("Running {} statement(s) in {} mode", segments.size(), mode);

        for (int i = 0; i < segments.size(); i++) {
            StatementSegment segment = segments.get(i);
            int statementNumber = i + 1;

            StatementOutcome outcome = mode == ExecutionMode.EVALUATE
                    ? processor.process(segment.text(), variables)
                    : processor.check(segment.text());
            outcome = outcome.withRawText(restoreTerminator(segment, outcome));

            if (!outcome.isAccepted()) {
                diagnostics.reportError(outcome.message(), statementNumber, segment.offset());
            } else if (outcome.hasWarning()) {
                diagnostics.reportWarning(outcome.message(), statementNumber, segment.offset());
            }
            LOG.debug("Statement {} [{}] {}{}", statementNumber, outcome.status(), outcome.rawText(),
                    outcome.message() == null ? "" : ": " + outcome.message());
            outcomes.add(outcome);
        }

        if (LOG.isDebugEnabled() && !diagnostics.getDiagnostics().isEmpty()) {
            LOG.debug("Diagnostics:\n{}", diagnostics.summary());
        }
        ProgramResult result = new ProgramResult(mode, outcomes, variables.snapshot(), diagnostics.getDiagnostics());
        LOG.info("Processed {} statement(s) {}: {} accepted, {} rejected, {} variable(s) defined",
                outcomes.size(), diagnostics.hasErrors() ? "with rejections" : "cleanly",
                result.acceptedCount(), result.rejectedCount(), variables.size());
        return result;
    }

    // An unterminated final statement only gets its terminator back when it was accepted.
    private static String restoreTerminator(StatementSegment segment, StatementOutcome outcome) {
        String trimmed = segment.text().trim();
        if (segment.terminated() || outcome.isAccepted()) {
            return trimmed + LexicalRules.TERMINATOR;
        }
        return trimmed;
    }
}
