package org.hexscript.interpreter.api;

/**
 * What a statement was recognized as, before any validation.
 */
public enum StatementKind {
    /** A statement starting with '//'. */
    COMMENT,
    /** A statement containing ':='. */
    ASSIGNMENT,
    /** A bare expression. */
    EXPRESSION,
    /** A statement without any tokens. */
    EMPTY
}
