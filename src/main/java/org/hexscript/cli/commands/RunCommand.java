package org.hexscript.cli.commands;

import org.hexscript.interpreter.api.ExecutionMode;
import picocli.CommandLine.Command;

@Command(name = "run", description = "Evaluates a program and prints the outcome of every statement and the final variables.")
public class RunCommand extends AbstractProgramCommand {

    @Override
    protected ExecutionMode mode() {
        return ExecutionMode.EVALUATE;
    }
}
