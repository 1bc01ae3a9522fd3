package org.hexscript.interpreter.statement;

/**
 * The text of one statement as found between terminators.
 *
 * @param text The untrimmed text, without its terminator.
 * @param offset The 0-based offset of the first character of {@code text} in the program.
 * @param terminated Whether the statement was closed by a terminator.
 */
public record StatementSegment(String text, int offset, boolean terminated) {
}
