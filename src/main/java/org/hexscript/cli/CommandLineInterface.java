package org.hexscript.cli;

import com.typesafe.config.Config;
import org.hexscript.cli.commands.CheckCommand;
import org.hexscript.cli.commands.RunCommand;
import org.hexscript.cli.commands.TokensCommand;
import org.hexscript.config.ConfigLoader;
import org.hexscript.config.LoggingConfigurator;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "hexscript",
    mixinStandardHelpOptions = true,
    version = "HexScript 1.0",
    description = "HexScript - hexadecimal arithmetic and assignment statements",
    subcommands = {
        RunCommand.class,
        CheckCommand.class,
        TokensCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    /** Exit code when every statement was accepted. */
    public static final int EXIT_OK = 0;
    /** Exit code when at least one statement was rejected. */
    public static final int EXIT_REJECTED = 1;
    /** Exit code for unreadable input or broken configuration. */
    public static final int EXIT_FAILURE = 2;

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: " + ConfigLoader.CONFIG_FILE_NAME + ")"
    )
    private File configFile;

    private Config config;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        CommandLine.usage(this, System.out);
        return EXIT_OK;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("hexscript");
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    /**
     * Loads the configuration on first use and applies its logging block.
     * @return The resolved configuration.
     * @throws com.typesafe.config.ConfigException if the configuration cannot be loaded.
     */
    public Config getConfig() {
        if (config == null) {
            config = ConfigLoader.load(configFile);
            LoggingConfigurator.configure(config);
        }
        return config;
    }
}
