package org.hexscript.cli.rendering;

import com.typesafe.config.Config;

/**
 * Rendering switches, read from the {@code hexscript.output} configuration block.
 *
 * @param format The output format.
 * @param showTokens Whether to list the tokens under each statement.
 * @param showVariables Whether to print the final variable table.
 */
public record OutputOptions(OutputFormat format, boolean showTokens, boolean showVariables) {

    public static OutputOptions fromConfig(Config output) {
        return new OutputOptions(
                output.getEnum(OutputFormat.class, "format"),
                output.getBoolean("show-tokens"),
                output.getBoolean("show-variables"));
    }

    public OutputOptions withFormat(OutputFormat newFormat) {
        return new OutputOptions(newFormat, showTokens, showVariables);
    }

    public OutputOptions withShowTokens(boolean newShowTokens) {
        return new OutputOptions(format, newShowTokens, showVariables);
    }
}
