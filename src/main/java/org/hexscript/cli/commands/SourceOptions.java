package org.hexscript.cli.commands;

import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

/**
 * Where the program text comes from: a file or an inline string.
 */
public class SourceOptions {

    @Option(names = {"-f", "--file"}, description = "The path to the program file.")
    private File file;

    @Option(names = {"-e", "--source"}, description = "The program text itself.")
    private String source;

    /**
     * Reads the program text.
     * @param spec The spec of the command this mixin belongs to, for usage errors.
     * @return The program text.
     * @throws IOException if the file cannot be read.
     * @throws ParameterException unless exactly one of --file and --source is given.
     */
    public String read(CommandSpec spec) throws IOException {
        if ((file == null) == (source == null)) {
            throw new ParameterException(spec.commandLine(), "Exactly one of --file or --source is required.");
        }
        if (source != null) {
            return source;
        }
        return Files.readString(file.toPath(), StandardCharsets.UTF_8);
    }

    /**
     * @return A name for the program in log messages.
     */
    public String describe() {
        return file != null ? file.getPath() : "<inline>";
    }
}
