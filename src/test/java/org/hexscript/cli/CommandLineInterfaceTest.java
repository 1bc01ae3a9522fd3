package org.hexscript.cli;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.typesafe.config.ConfigFactory;
import org.hexscript.config.LoggingConfigurator;
import org.hexscript.junit.extensions.logging.ExpectLog;
import org.hexscript.junit.extensions.logging.LogLevel;
import org.hexscript.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Drives the command line through picocli and checks output and exit codes.
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
public class CommandLineInterfaceTest {

    private static final String PROGRAM = "a := 1; b := a + ff; c := x; 1 +";

    @TempDir
    Path tempDir;

    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() {
        ConfigFactory.invalidateCaches();
        LoggingConfigurator.reset();
        out = new StringWriter();
        err = new StringWriter();
    }

    @AfterEach
    void tearDown() {
        LoggingConfigurator.reset();
    }

    private int execute(String... args) {
        CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
        return commandLine.execute(args);
    }

    @Test
    void testCliInitialization() {
        CommandLine cmd = new CommandLine(new CommandLineInterface());

        assertThat(cmd.getCommandName()).isEqualTo("hexscript");
        assertThat(cmd.getSubcommands()).containsKeys("run", "check", "tokens", "help");
    }

    @Test
    void testRunPrintsOutcomesAndVariables() {
        int exitCode = execute("run", "-e", PROGRAM);

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_REJECTED);
        assertThat(out.toString()).containsSubsequence(
                "a := 1; - accepted",
                "b := a + ff; - accepted",
                "c := x; - accepted: Undefined variable 'x'",
                "1 + - rejected: Expression is incomplete",
                "Variables:",
                "  a = 1 (hex 1)",
                "  b = 256 (hex 100)",
                "3 accepted, 1 rejected");
    }

    @Test
    void testRunWithoutRejectionsExitsWithZero() {
        int exitCode = execute("run", "--source", "v := 0ff; v - 1");

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_OK);
        assertThat(out.toString()).contains("v - 1; - accepted").contains("  v = 255 (hex ff)");
    }

    @Test
    void testRunReadsProgramFile() throws IOException {
        Path program = tempDir.resolve("program.hex");
        Files.writeString(program, "abc := 1a5 + 2f;\n// done;\n");

        int exitCode = execute("run", "-f", program.toString());

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_OK);
        assertThat(out.toString()).contains("// done; - accepted").contains("  abc = 452 (hex 1c4)");
    }

    @Test
    void testRunWithTokens() {
        execute("run", "--tokens", "-e", "n := (1 + m)");

        assertThat(out.toString()).contains(
                "    [( : left_paren] [1 : hex_number] [+ : operator] [m : identifier] [) : right_paren]");
    }

    @Test
    void testRunAsJson() {
        int exitCode = execute("run", "--json", "-e", PROGRAM);

        JsonObject report = JsonParser.parseString(out.toString()).getAsJsonObject();
        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_REJECTED);
        assertThat(report.get("mode").getAsString()).isEqualTo("EVALUATE");
        assertThat(report.get("accepted").getAsInt()).isEqualTo(3);
        assertThat(report.get("rejected").getAsInt()).isEqualTo(1);

        JsonArray outcomes = report.getAsJsonArray("outcomes");
        assertThat(outcomes).hasSize(4);
        JsonObject second = outcomes.get(1).getAsJsonObject();
        assertThat(second.get("rawText").getAsString()).isEqualTo("b := a + ff;");
        assertThat(second.get("target").getAsString()).isEqualTo("b");
        assertThat(second.get("value").getAsLong()).isEqualTo(256L);
        assertThat(second.getAsJsonArray("tokens")).isEmpty();

        JsonObject b = report.getAsJsonObject("variables").getAsJsonObject("b");
        assertThat(b.get("decimal").getAsLong()).isEqualTo(256L);
        assertThat(b.get("hex").getAsString()).isEqualTo("100");
        assertThat(report.getAsJsonArray("diagnostics")).hasSize(2);
    }

    @Test
    void testCheckDoesNotEvaluate() {
        int exitCode = execute("check", "-e", "a := 1; b := q / 0; c := (");

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_REJECTED);
        assertThat(out.toString())
                .contains("b := q / 0; - accepted\n".replace("\n", System.lineSeparator()))
                .contains("c := ( - rejected: Missing closing parenthesis")
                .contains("  (none)");
    }

    @Test
    void testTokensCommand() {
        int exitCode = execute("tokens", "-e", "x := 1;\ny // c");

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_OK);
        String[] lines = out.toString().split("\\R");
        assertThat(lines[0]).isEqualTo("#1 x := 1");
        assertThat(lines[1]).startsWith("  identifier").endsWith("@0");
        assertThat(lines[2]).startsWith("  assign").contains(":=").endsWith("@2");
        assertThat(lines[3]).startsWith("  hex_number").endsWith("@5");
        assertThat(lines[4]).isEqualTo("#2 y // c");
        assertThat(lines[5]).startsWith("  identifier").endsWith("@8");
        assertThat(lines[6]).startsWith("  comment").contains("// c").endsWith("@10");
    }

    @Test
    @ExpectLog(level = LogLevel.ERROR, messagePattern = "(?s)Failed to read program .*missing\\.hex.*")
    void testMissingFileFails() {
        int exitCode = execute("run", "-f", tempDir.resolve("missing.hex").toString());

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_FAILURE);
        assertThat(out.toString()).isEmpty();
    }

    @Test
    @ExpectLog(level = LogLevel.ERROR, messagePattern = "(?s)Failed to load or parse configuration: .*")
    void testMissingConfigFileFails() {
        int exitCode = execute("-c", tempDir.resolve("nope.conf").toString(), "run", "-e", "1");

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_FAILURE);
    }

    @Test
    @ExpectLog(level = LogLevel.ERROR, messagePattern = "(?s)Failed to load or parse configuration: .*XML.*")
    void testInvalidConfigValueFails() throws IOException {
        Path conf = tempDir.resolve("bad.conf");
        Files.writeString(conf, "hexscript.output.format = XML\n");

        int exitCode = execute("-c", conf.toString(), "run", "-e", "1");

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_FAILURE);
        assertThat(out.toString()).isEmpty();
        assertThat(err.toString()).doesNotContain("Exception");
    }

    @Test
    @ExpectLog(level = LogLevel.ERROR, messagePattern = "(?s)Failed to load or parse configuration: .*")
    void testWrongTypedConfigValueFails() throws IOException {
        Path conf = tempDir.resolve("bad.conf");
        Files.writeString(conf, "hexscript.interpreter.resolve-single-token-statements = maybe\n");

        int exitCode = execute("-c", conf.toString(), "check", "-e", "1");

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_FAILURE);
    }

    @Test
    void testCheckRejectsOversizedLiteral() {
        int exitCode = execute("check", "-e", "n := 8000000000000000; m := 7fffffffffffffff");

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_REJECTED);
        assertThat(out.toString())
                .contains("n := 8000000000000000; - rejected: Hex literal '8000000000000000' is out of range")
                .contains("1 accepted, 1 rejected");
    }

    @Test
    void testConfigFileSelectsJson() throws IOException {
        Path conf = tempDir.resolve("hexscript.conf");
        Files.writeString(conf, "hexscript.output.format = JSON\n");

        int exitCode = execute("--config", conf.toString(), "run", "-e", "1 + 1");

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_OK);
        assertThat(JsonParser.parseString(out.toString()).getAsJsonObject().get("accepted").getAsInt()).isEqualTo(1);
    }

    @Test
    void testSourceOptionsAreMutuallyRequired() {
        int neither = execute("run");
        int both = execute("run", "-e", "1", "-f", "x.hex");

        assertThat(neither).isEqualTo(CommandLine.ExitCode.USAGE);
        assertThat(both).isEqualTo(CommandLine.ExitCode.USAGE);
        assertThat(err.toString()).contains("Exactly one of --file or --source is required.");
    }
}
