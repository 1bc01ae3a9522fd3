package org.hexscript.interpreter.frontend.parser;

import org.hexscript.interpreter.frontend.lexer.LexicalRules;
import org.hexscript.interpreter.frontend.lexer.Token;
import org.hexscript.interpreter.frontend.lexer.TokenType;
import org.hexscript.interpreter.frontend.parser.ast.BinaryOperationNode;
import org.hexscript.interpreter.frontend.parser.ast.ExpressionNode;
import org.hexscript.interpreter.frontend.parser.ast.IdentifierNode;
import org.hexscript.interpreter.frontend.parser.ast.NumberLiteralNode;
import org.hexscript.interpreter.internal.i18n.Messages;

import java.util.List;

/**
 * A recursive-descent parser for arithmetic expressions. It consumes the tokens
 * produced by the {@link org.hexscript.interpreter.frontend.lexer.Lexer} and builds
 * an expression tree.
 * <p>
 * Grammar, lowest precedence first:
 * <pre>
 *   expression := addSub
 *   addSub     := mulDiv (("+" | "-") mulDiv)*
 *   mulDiv     := factor (("*" | "/") factor)*
 *   factor     := HEX_NUMBER | IDENTIFIER | "(" addSub ")"
 * </pre>
 * Both operator levels are left-associative.
 */
public class Parser {

    private final List<Token> tokens;
    private int current = 0;

    /**
     * Constructs a new Parser.
     * @param tokens The tokens of one expression.
     */
    public Parser(List<Token> tokens) {
        this.tokens = tokens;
    }

    /**
     * Parses the complete token list as one expression.
     * @return The root of the expression tree.
     * @throws SyntaxException if the tokens do not form exactly one expression.
     */
    public ExpressionNode parse() {
        ExpressionNode expression = addSub();
        if (!isAtEnd()) {
            Token trailing = peek();
            if (trailing.is(TokenType.RIGHT_PAREN)) {
                throw new SyntaxException(Messages.get("syntax.missingOpeningParenthesis"));
            }
            throw unexpected(trailing);
        }
        return expression;
    }

    private ExpressionNode addSub() {
        ExpressionNode expression = mulDiv();
        while (matchOperator('+', '-')) {
            Token operator = previous();
            ExpressionNode right = mulDiv();
            expression = new BinaryOperationNode(expression, operator, right);
        }
        return expression;
    }

    private ExpressionNode mulDiv() {
        ExpressionNode expression = factor();
        while (matchOperator('*', '/')) {
            Token operator = previous();
            ExpressionNode right = factor();
            expression = new BinaryOperationNode(expression, operator, right);
        }
        return expression;
    }

    private ExpressionNode factor() {
        if (isAtEnd()) {
            throw new SyntaxException(Messages.get("syntax.incomplete"));
        }
        Token token = advance();
        switch (token.type()) {
            case HEX_NUMBER:
                return numberLiteral(token);
            case IDENTIFIER:
                if (LexicalRules.startsWithUppercase(token.text())) {
                    throw new SyntaxException(Messages.get("syntax.uppercaseIdentifier", token.text()));
                }
                return new IdentifierNode(token);
            case LEFT_PAREN:
                ExpressionNode inner = addSub();
                if (isAtEnd()) {
                    throw new SyntaxException(Messages.get("syntax.missingClosingParenthesis"));
                }
                Token closing = advance();
                if (!closing.is(TokenType.RIGHT_PAREN)) {
                    throw unexpected(closing);
                }
                return inner;
            default:
                throw unexpected(token);
        }
    }

    private NumberLiteralNode numberLiteral(Token token) {
        if (!LexicalRules.isValidHexLiteral(token.text())) {
            throw new SyntaxException(Messages.get("syntax.invalidHexLiteral", token.text()));
        }
        try {
            return new NumberLiteralNode(token, Long.parseLong(token.text(), 16));
        } catch (NumberFormatException e) {
            throw new SyntaxException(Messages.get("syntax.hexLiteralOutOfRange", token.text()));
        }
    }

    private boolean matchOperator(char... operators) {
        if (isAtEnd() || !peek().is(TokenType.OPERATOR)) return false;
        char actual = peek().text().charAt(0);
        for (char operator : operators) {
            if (actual == operator) {
                advance();
                return true;
            }
        }
        return false;
    }

    private SyntaxException unexpected(Token token) {
        return switch (token.type()) {
            case UNKNOWN -> new SyntaxException(Messages.get("syntax.unknownToken", token.text()));
            case COMMENT -> new SyntaxException(Messages.get("syntax.commentInsideExpression"));
            default -> new SyntaxException(Messages.get("syntax.unexpectedToken", token.text()));
        };
    }

    private Token advance() {
        return tokens.get(current++);
    }

    private boolean isAtEnd() {
        return current >= tokens.size();
    }

    private Token peek() {
        return tokens.get(current);
    }

    private Token previous() {
        return tokens.get(current - 1);
    }
}
