package org.hexscript.interpreter.frontend.parser.ast;

import org.hexscript.interpreter.frontend.lexer.Token;

/**
 * An expression node for one of the four arithmetic operators.
 *
 * @param left The left operand, evaluated first.
 * @param operatorToken The operator token ('+', '-', '*' or '/').
 * @param right The right operand.
 */
public record BinaryOperationNode(
        ExpressionNode left,
        Token operatorToken,
        ExpressionNode right
) implements ExpressionNode {

    /**
     * @return The operator character.
     */
    public char operator() {
        return operatorToken.text().charAt(0);
    }
}
