package org.hexscript.interpreter.frontend.evaluation;

import org.hexscript.interpreter.frontend.lexer.Token;
import org.hexscript.interpreter.frontend.parser.Parser;
import org.hexscript.interpreter.frontend.parser.SyntaxException;
import org.hexscript.interpreter.frontend.parser.ast.ExpressionNode;

import java.util.List;

/**
 * Parses and evaluates a token sequence in one step.
 * <p>
 * This is the single place where malformed input ({@link ErrorKind#SYNTAX}) is told
 * apart from well-formed input without a value ({@link ErrorKind#SEMANTIC}): the whole
 * expression is parsed before anything is evaluated, so a syntax error anywhere always
 * wins over an undefined variable earlier in the text.
 */
public class ExpressionEvaluator {

    private final Evaluator evaluator = new Evaluator();

    /**
     * Evaluates the tokens of one expression.
     * @param tokens The tokens to parse.
     * @param variables The variables visible to the expression; only read.
     * @return The value or a tagged error.
     */
    public EvaluationResult evaluate(List<Token> tokens, VariableTable variables) {
        ExpressionNode tree;
        try {
            tree = new Parser(tokens).parse();
        } catch (SyntaxException e) {
            return EvaluationResult.syntaxError(e.getMessage());
        }
        return evaluator.evaluate(tree, variables);
    }
}
