package org.hexscript.cli.commands;

import org.hexscript.interpreter.api.ExecutionMode;
import picocli.CommandLine.Command;

@Command(name = "check", description = "Validates the structure of every statement without evaluating anything.")
public class CheckCommand extends AbstractProgramCommand {

    @Override
    protected ExecutionMode mode() {
        return ExecutionMode.VALIDATE;
    }
}
