package org.hexscript.interpreter.frontend.parser.ast;

import org.hexscript.interpreter.frontend.lexer.Token;

/**
 * An expression node that represents a variable reference.
 *
 * @param identifierToken The token of the identifier.
 */
public record IdentifierNode(
        Token identifierToken
) implements ExpressionNode {

    /**
     * @return The variable name.
     */
    public String name() {
        return identifierToken.text();
    }
}
