package org.hexscript.interpreter.statement;

import org.hexscript.interpreter.api.ExecutionMode;
import org.hexscript.interpreter.api.InterpreterOptions;
import org.hexscript.interpreter.api.StatementKind;
import org.hexscript.interpreter.api.StatementOutcome;
import org.hexscript.interpreter.frontend.evaluation.EvaluationResult;
import org.hexscript.interpreter.frontend.evaluation.ExpressionEvaluator;
import org.hexscript.interpreter.frontend.evaluation.VariableTable;
import org.hexscript.interpreter.frontend.lexer.Lexer;
import org.hexscript.interpreter.frontend.lexer.LexicalRules;
import org.hexscript.interpreter.frontend.lexer.Token;
import org.hexscript.interpreter.frontend.lexer.TokenType;
import org.hexscript.interpreter.frontend.validator.GrammarValidator;
import org.hexscript.interpreter.frontend.validator.ValidationResult;
import org.hexscript.interpreter.internal.i18n.Messages;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Classifies a single statement as comment, assignment or bare expression and decides
 * whether it is accepted and whether the variable table changes.
 * <p>
 * Syntax errors reject the statement. Semantic errors (undefined variable, division by
 * zero, overflow) accept it with a warning, and an assignment carrying such a warning
 * does <em>not</em> take effect. Only a fully successful assignment writes the table.
 * <p>
 * Returned outcomes carry the trimmed statement text; restoring the terminator is up to
 * the caller.
 */
public class StatementProcessor {

    private static final Logger LOG = LoggerFactory.getLogger(StatementProcessor.class);

    private final InterpreterOptions options;
    private final GrammarValidator validator = new GrammarValidator();
    private final ExpressionEvaluator evaluator = new ExpressionEvaluator();

    public StatementProcessor() {
        this(InterpreterOptions.defaults());
    }

    /**
     * @param options The processing options.
     */
    public StatementProcessor(InterpreterOptions options) {
        this.options = options;
    }

    /**
     * Validates and evaluates one statement.
     * @param statementText The statement text without terminator.
     * @param variables The run's variable table; written only by a successful assignment.
     * @return The outcome.
     */
    public StatementOutcome process(String statementText, VariableTable variables) {
        return analyse(statementText, ExecutionMode.EVALUATE, variables);
    }

    /**
     * Validates the structure of one statement without evaluating it.
     * @param statementText The statement text without terminator.
     * @return The outcome; never carries a semantic warning or a value.
     */
    public StatementOutcome check(String statementText) {
        return analyse(statementText, ExecutionMode.VALIDATE, new VariableTable());
    }

    // In VALIDATE mode the table is never read or written.
    private StatementOutcome analyse(String statementText, ExecutionMode mode, VariableTable variables) {
        String trimmed = statementText.trim();
        if (trimmed.startsWith(LexicalRules.COMMENT_MARKER)) {
            return StatementOutcome.comment(trimmed);
        }

        int assignIndex = trimmed.indexOf(LexicalRules.ASSIGN_MARKER);
        if (assignIndex >= 0) {
            return assignment(trimmed, assignIndex, mode, variables);
        }
        return expression(trimmed, mode, variables);
    }

    private StatementOutcome assignment(String trimmed, int assignIndex, ExecutionMode mode, VariableTable variables) {
        String target = trimmed.substring(0, assignIndex).trim();
        String right = trimmed.substring(assignIndex + LexicalRules.ASSIGN_MARKER.length()).trim();

        if (!LexicalRules.isValidIdentifier(target)) {
            return StatementOutcome.rejected(trimmed, StatementKind.ASSIGNMENT, null,
                    Messages.get("syntax.assignmentTargetNotIdentifier", target), List.of());
        }
        if (LexicalRules.startsWithUppercase(target)) {
            return StatementOutcome.rejected(trimmed, StatementKind.ASSIGNMENT, null,
                    Messages.get("syntax.uppercaseIdentifier", target), List.of());
        }

        List<Token> tokens = Lexer.tokenize(right);
        ValidationResult validation = validator.validate(tokens);
        if (!validation.valid()) {
            return StatementOutcome.rejected(trimmed, StatementKind.ASSIGNMENT, target, validation.message(), tokens);
        }
        if (mode == ExecutionMode.VALIDATE) {
            return StatementOutcome.accepted(trimmed, StatementKind.ASSIGNMENT, target, null, tokens);
        }

        EvaluationResult result = evaluator.evaluate(tokens, variables);
        if (result.isSyntaxError()) {
            return StatementOutcome.rejected(trimmed, StatementKind.ASSIGNMENT, target, result.message(), tokens);
        }
        if (result.isSemanticError()) {
            LOG.debug("Assignment to '{}' skipped: {}", target, result.message());
            return StatementOutcome.acceptedWithWarning(trimmed, StatementKind.ASSIGNMENT, target, result.message(), tokens);
        }
        variables.assign(target, result.value());
        return StatementOutcome.accepted(trimmed, StatementKind.ASSIGNMENT, target, result.value(), tokens);
    }

    private StatementOutcome expression(String trimmed, ExecutionMode mode, VariableTable variables) {
        List<Token> tokens = Lexer.tokenize(trimmed);
        if (tokens.isEmpty()) {
            return StatementOutcome.empty(trimmed);
        }
        if (tokens.size() == 1 && isOperandToken(tokens.get(0))
                && (mode == ExecutionMode.VALIDATE || !options.resolveSingleTokenStatements())) {
            return singleToken(trimmed, tokens);
        }

        ValidationResult validation = validator.validate(tokens);
        if (!validation.valid()) {
            return StatementOutcome.rejected(trimmed, StatementKind.EXPRESSION, null, validation.message(), tokens);
        }
        if (mode == ExecutionMode.VALIDATE) {
            return StatementOutcome.accepted(trimmed, StatementKind.EXPRESSION, null, null, tokens);
        }

        EvaluationResult result = evaluator.evaluate(tokens, variables);
        if (result.isSyntaxError()) {
            return StatementOutcome.rejected(trimmed, StatementKind.EXPRESSION, null, result.message(), tokens);
        }
        if (result.isSemanticError()) {
            return StatementOutcome.acceptedWithWarning(trimmed, StatementKind.EXPRESSION, null, result.message(), tokens);
        }
        return StatementOutcome.accepted(trimmed, StatementKind.EXPRESSION, null, result.value(), tokens);
    }

    // Lexical check only; the variable table is not consulted.
    private StatementOutcome singleToken(String trimmed, List<Token> tokens) {
        Token token = tokens.get(0);
        if (token.is(TokenType.HEX_NUMBER) && !LexicalRules.isValidHexLiteral(token.text())) {
            return StatementOutcome.rejected(trimmed, StatementKind.EXPRESSION, null,
                    Messages.get("syntax.invalidHexLiteral", token.text()), tokens);
        }
        if (token.is(TokenType.HEX_NUMBER) && !LexicalRules.fitsInLong(token.text())) {
            return StatementOutcome.rejected(trimmed, StatementKind.EXPRESSION, null,
                    Messages.get("syntax.hexLiteralOutOfRange", token.text()), tokens);
        }
        if (token.is(TokenType.IDENTIFIER) && LexicalRules.startsWithUppercase(token.text())) {
            return StatementOutcome.rejected(trimmed, StatementKind.EXPRESSION, null,
                    Messages.get("syntax.uppercaseIdentifier", token.text()), tokens);
        }
        return StatementOutcome.accepted(trimmed, StatementKind.EXPRESSION, null, null, tokens);
    }

    private static boolean isOperandToken(Token token) {
        return token.is(TokenType.HEX_NUMBER) || token.is(TokenType.IDENTIFIER);
    }
}
