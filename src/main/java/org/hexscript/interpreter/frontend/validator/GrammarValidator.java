package org.hexscript.interpreter.frontend.validator;

import org.hexscript.interpreter.frontend.lexer.LexicalRules;
import org.hexscript.interpreter.frontend.lexer.Token;
import org.hexscript.interpreter.frontend.lexer.TokenType;
import org.hexscript.interpreter.internal.i18n.Messages;

import java.util.List;

/**
 * Confirms that a token sequence forms a syntactically well-formed expression
 * without computing its value.
 * <p>
 * A single left-to-right pass alternates between expecting an operand (literal,
 * identifier or '(') and expecting an operator or ')', while counting open
 * parentheses. The validator is stateless and never consults a variable table.
 */
public final class GrammarValidator {

    /**
     * Validates a token sequence.
     * @param tokens The tokens of one expression.
     * @return {@link ValidationResult#ok()} or the first syntax error found.
     */
    public ValidationResult validate(List<Token> tokens) {
        for (Token token : tokens) {
            if (token.is(TokenType.UNKNOWN)) {
                return ValidationResult.error(Messages.get("syntax.unknownToken", token.text()));
            }
            if (token.is(TokenType.COMMENT)) {
                return ValidationResult.error(Messages.get("syntax.commentInsideExpression"));
            }
        }
        if (tokens.isEmpty()) return ValidationResult.error(Messages.get("syntax.incomplete"));

        boolean expectOperand = true;
        int depth = 0;

        for (Token token : tokens) {
            if (expectOperand) {
                switch (token.type()) {
                    case HEX_NUMBER -> {
                        if (!LexicalRules.isValidHexLiteral(token.text())) {
                            return ValidationResult.error(Messages.get("syntax.invalidHexLiteral", token.text()));
                        }
                        if (!LexicalRules.fitsInLong(token.text())) {
                            return ValidationResult.error(Messages.get("syntax.hexLiteralOutOfRange", token.text()));
                        }
                        expectOperand = false;
                    }
                    case IDENTIFIER -> {
                        if (LexicalRules.startsWithUppercase(token.text())) {
                            return ValidationResult.error(Messages.get("syntax.uppercaseIdentifier", token.text()));
                        }
                        expectOperand = false;
                    }
                    case LEFT_PAREN -> depth++;
                    default -> {
                        return unexpected(token);
                    }
                }
            } else {
                switch (token.type()) {
                    case OPERATOR -> {
                        if (!isArithmeticOperator(token)) return unexpected(token);
                        expectOperand = true;
                    }
                    case RIGHT_PAREN -> {
                        if (depth == 0) return ValidationResult.error(Messages.get("syntax.missingOpeningParenthesis"));
                        depth--;
                    }
                    default -> {
                        return unexpected(token);
                    }
                }
            }
        }

        if (depth != 0) return ValidationResult.error(Messages.get("syntax.missingClosingParenthesis"));
        if (expectOperand) return ValidationResult.error(Messages.get("syntax.incomplete"));
        return ValidationResult.ok();
    }

    private static boolean isArithmeticOperator(Token token) {
        return token.text().length() == 1 && LexicalRules.isOperator(token.text().charAt(0));
    }

    private static ValidationResult unexpected(Token token) {
        return ValidationResult.error(Messages.get("syntax.unexpectedToken", token.text()));
    }
}
