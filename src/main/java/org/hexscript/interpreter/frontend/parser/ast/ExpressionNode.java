package org.hexscript.interpreter.frontend.parser.ast;

/**
 * The base interface for all nodes of an expression tree.
 */
public interface ExpressionNode {
}
