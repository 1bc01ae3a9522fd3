package org.hexscript.interpreter.frontend.evaluation;

/**
 * Distinguishes malformed input from well-formed input that has no value.
 */
public enum ErrorKind {
    /** The expression is malformed. The statement is rejected. */
    SYNTAX,
    /** The expression is well-formed but cannot be evaluated. The statement is accepted with a warning. */
    SEMANTIC
}
