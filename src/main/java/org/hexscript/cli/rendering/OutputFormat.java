package org.hexscript.cli.rendering;

/**
 * How results are written to standard output.
 */
public enum OutputFormat {
    TEXT,
    JSON
}
