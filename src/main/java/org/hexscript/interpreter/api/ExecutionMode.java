package org.hexscript.interpreter.api;

/**
 * How deeply the interpreter analyses each statement.
 */
public enum ExecutionMode {
    /** Tokenize, validate and evaluate; assignments update the variable table. */
    EVALUATE,
    /** Tokenize and validate the structure only; the variable table stays empty. */
    VALIDATE
}
