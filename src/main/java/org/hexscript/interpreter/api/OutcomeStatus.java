package org.hexscript.interpreter.api;

/**
 * The classification of one statement.
 */
public enum OutcomeStatus {
    /** The statement is well-formed. It may still carry a semantic warning. */
    ACCEPTED,
    /** The statement is ill-formed. It never changes the variable table. */
    REJECTED
}
