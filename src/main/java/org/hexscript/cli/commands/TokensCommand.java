package org.hexscript.cli.commands;

import org.hexscript.cli.CommandLineInterface;
import org.hexscript.interpreter.frontend.lexer.Lexer;
import org.hexscript.interpreter.frontend.lexer.Token;
import org.hexscript.interpreter.statement.StatementSegment;
import org.hexscript.interpreter.statement.StatementSplitter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;

@Command(name = "tokens", description = "Prints the tokens of every statement with their kind and offset.")
public class TokensCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(TokensCommand.class);

    @Mixin
    private SourceOptions sourceOptions;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        final String source;
        try {
            source = sourceOptions.read(spec);
        } catch (IOException e) {
            LOG.error("Failed to read program {}: {}", sourceOptions.describe(), e.getMessage());
            return CommandLineInterface.EXIT_FAILURE;
        }

        PrintWriter out = spec.commandLine().getOut();
        List<StatementSegment> segments = new StatementSplitter().split(source);
        for (int i = 0; i < segments.size(); i++) {
            StatementSegment segment = segments.get(i);
            out.printf("#%d %s%n", i + 1, segment.text().trim());
            for (Token token : Lexer.tokenize(segment.text())) {
                out.printf("  %-12s %-20s @%d%n",
                        token.type().name().toLowerCase(Locale.ROOT), token.text(), segment.offset() + token.offset());
            }
        }
        out.flush();
        return CommandLineInterface.EXIT_OK;
    }
}
