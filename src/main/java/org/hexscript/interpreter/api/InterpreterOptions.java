package org.hexscript.interpreter.api;

import com.typesafe.config.Config;

/**
 * Tunables of the statement processor.
 *
 * @param resolveSingleTokenStatements When true, a statement consisting of a single literal or
 *        identifier is evaluated like any other expression, so an undefined lone identifier yields
 *        an "undefined variable" warning. When false, such a statement is only checked lexically.
 */
public record InterpreterOptions(boolean resolveSingleTokenStatements) {

    static final String RESOLVE_SINGLE_TOKEN_KEY = "resolve-single-token-statements";

    /**
     * @return The options used when nothing is configured.
     */
    public static InterpreterOptions defaults() {
        return new InterpreterOptions(true);
    }

    /**
     * Reads the options from an interpreter configuration block, e.g. {@code hexscript.interpreter}.
     * Missing keys keep their defaults.
     * @param config The interpreter block.
     * @return The options.
     */
    public static InterpreterOptions fromConfig(Config config) {
        boolean resolve = config.hasPath(RESOLVE_SINGLE_TOKEN_KEY)
                ? config.getBoolean(RESOLVE_SINGLE_TOKEN_KEY)
                : defaults().resolveSingleTokenStatements();
        return new InterpreterOptions(resolve);
    }
}
