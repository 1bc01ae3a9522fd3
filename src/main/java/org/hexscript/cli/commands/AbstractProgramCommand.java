package org.hexscript.cli.commands;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.hexscript.cli.CommandLineInterface;
import org.hexscript.cli.rendering.JsonReportWriter;
import org.hexscript.cli.rendering.OutcomeRenderer;
import org.hexscript.cli.rendering.OutputFormat;
import org.hexscript.cli.rendering.OutputOptions;
import org.hexscript.interpreter.Interpreter;
import org.hexscript.interpreter.api.ExecutionMode;
import org.hexscript.interpreter.api.InterpreterOptions;
import org.hexscript.interpreter.api.ProgramResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.concurrent.Callable;

/**
 * Shared flow of the commands that run a program through the interpreter.
 */
abstract class AbstractProgramCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(AbstractProgramCommand.class);

    @ParentCommand
    private CommandLineInterface parent;

    @Mixin
    private SourceOptions sourceOptions;

    @Option(names = "--tokens", description = "List the tokens of every statement.")
    private boolean showTokens;

    @Option(names = "--json", description = "Write the result as JSON.")
    private boolean json;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    /**
     * @return The mode this command runs the interpreter in.
     */
    protected abstract ExecutionMode mode();

    @Override
    public Integer call() {
        final InterpreterOptions interpreterOptions;
        OutputOptions output;
        try {
            final Config config = parent.getConfig();
            interpreterOptions = InterpreterOptions.fromConfig(config.getConfig("hexscript.interpreter"));
            output = OutputOptions.fromConfig(config.getConfig("hexscript.output"));
        } catch (ConfigException e) {
            LOG.error("Failed to load or parse configuration: {}", e.getMessage());
            return CommandLineInterface.EXIT_FAILURE;
        }

        final String source;
        try {
            source = sourceOptions.read(spec);
        } catch (IOException e) {
            LOG.error("Failed to read program {}: {}", sourceOptions.describe(), e.getMessage());
            return CommandLineInterface.EXIT_FAILURE;
        }

        Interpreter interpreter = new Interpreter(interpreterOptions);
        ProgramResult result = interpreter.run(source, mode());

        if (showTokens) output = output.withShowTokens(true);
        if (json) output = output.withFormat(OutputFormat.JSON);

        PrintWriter out = spec.commandLine().getOut();
        if (output.format() == OutputFormat.JSON) {
            new JsonReportWriter(output).write(result, out);
        } else {
            new OutcomeRenderer(output).render(result, out);
        }
        return result.hasRejections() ? CommandLineInterface.EXIT_REJECTED : CommandLineInterface.EXIT_OK;
    }
}
