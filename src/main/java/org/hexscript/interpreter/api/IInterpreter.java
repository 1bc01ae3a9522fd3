package org.hexscript.interpreter.api;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Defines the public interface of the interpreter.
 * <p>
 * Every call starts from an empty variable table; nothing is carried over between runs.
 */
public interface IInterpreter {

    /**
     * Runs a program in the given mode.
     *
     * @param source The complete program text.
     * @param mode Whether to evaluate or only validate.
     * @return The per-statement outcomes and the final variable table.
     */
    ProgramResult run(String source, ExecutionMode mode);

    /**
     * Evaluates a program.
     * @param source The complete program text.
     * @return The per-statement outcomes and the final variable table.
     */
    default ProgramResult run(String source) {
        return run(source, ExecutionMode.EVALUATE);
    }

    /**
     * Runs a program read from a UTF-8 file.
     * @param programPath The path to the source file.
     * @param mode Whether to evaluate or only validate.
     * @return The per-statement outcomes and the final variable table.
     * @throws IOException if the file cannot be read.
     */
    default ProgramResult run(Path programPath, ExecutionMode mode) throws IOException {
        return run(Files.readString(programPath, StandardCharsets.UTF_8), mode);
    }
}
