package org.hexscript.interpreter.frontend.parser.ast;

import org.hexscript.interpreter.frontend.lexer.Token;

/**
 * An expression node that represents a hexadecimal literal.
 *
 * @param numberToken The token containing the literal.
 * @param value The literal's value, already converted from base 16.
 */
public record NumberLiteralNode(
        Token numberToken,
        long value
) implements ExpressionNode {
}
