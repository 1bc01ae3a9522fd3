package org.hexscript.interpreter.frontend.evaluation;

import org.hexscript.interpreter.frontend.parser.ast.BinaryOperationNode;
import org.hexscript.interpreter.frontend.parser.ast.ExpressionNode;
import org.hexscript.interpreter.frontend.parser.ast.IdentifierNode;
import org.hexscript.interpreter.frontend.parser.ast.NumberLiteralNode;
import org.hexscript.interpreter.internal.i18n.Messages;

/**
 * Computes the value of an expression tree against a variable table.
 * <p>
 * Operands are evaluated left before right, so the first failing operand in source
 * order determines the reported error. Division floors toward negative infinity.
 * All failures here are semantic; the tree itself is known to be well-formed.
 */
public class Evaluator {

    /**
     * Evaluates an expression tree. The variable table is only read.
     * @param node The root of the tree.
     * @param variables The variables visible to the expression.
     * @return The value, or a {@link ErrorKind#SEMANTIC} error.
     */
    public EvaluationResult evaluate(ExpressionNode node, VariableTable variables) {
        if (node instanceof NumberLiteralNode literal) {
            return EvaluationResult.success(literal.value());
        }
        if (node instanceof IdentifierNode identifier) {
            return variables.lookup(identifier.name())
                    .map(EvaluationResult::success)
                    .orElseGet(() -> EvaluationResult.semanticError(
                            Messages.get("semantic.undefinedVariable", identifier.name())));
        }
        if (node instanceof BinaryOperationNode binary) {
            EvaluationResult left = evaluate(binary.left(), variables);
            if (!left.isSuccess()) return left;
            EvaluationResult right = evaluate(binary.right(), variables);
            if (!right.isSuccess()) return right;
            return apply(binary.operator(), left.value(), right.value());
        }
        throw new IllegalArgumentException("Unsupported expression node: " + node.getClass().getSimpleName());
    }

    private EvaluationResult apply(char operator, long left, long right) {
        try {
            return switch (operator) {
                case '+' -> EvaluationResult.success(Math.addExact(left, right));
                case '-' -> EvaluationResult.success(Math.subtractExact(left, right));
                case '*' -> EvaluationResult.success(Math.multiplyExact(left, right));
                case '/' -> divide(left, right);
                default -> throw new IllegalArgumentException("Unsupported operator: " + operator);
            };
        } catch (ArithmeticException e) {
            return EvaluationResult.semanticError(Messages.get("semantic.arithmeticOverflow", String.valueOf(operator)));
        }
    }

    private EvaluationResult divide(long dividend, long divisor) {
        if (divisor == 0) {
            return EvaluationResult.semanticError(Messages.get("semantic.divisionByZero"));
        }
        if (dividend == Long.MIN_VALUE && divisor == -1) {
            throw new ArithmeticException("long overflow");
        }
        return EvaluationResult.success(Math.floorDiv(dividend, divisor));
    }
}
