package org.logicsolver.cli;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.logicsolver.cli.config.LoggingConfigurator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs the command line through picocli with captured output streams.
 */
@Tag("unit")
public class CommandLineInterfaceTest {

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int execute(String... args) {
        CommandLine cmd = new CommandLine(new CommandLineInterface());
        cmd.setOut(new PrintWriter(out));
        cmd.setErr(new PrintWriter(err));
        return cmd.execute(args);
    }

    @AfterEach
    void tearDown() {
        LoggingConfigurator.reset();
    }

    @Test
    void testCliInitialization() {
        CommandLine cmd = new CommandLine(new CommandLineInterface());
        assertThat(cmd.getCommandName()).isEqualTo("logic-solver");
        assertThat(cmd.getSubcommands()).containsKeys("evaluate", "graph", "help");
    }

    @Test
    void printsUsageWithoutSubcommand() {
        assertThat(execute()).isEqualTo(CommandLineInterface.EXIT_OK);
        assertThat(out.toString()).contains("Usage: logic-solver");
    }

    @Test
    void evaluatesInlineExpression() {
        int exitCode = execute("evaluate", "-e", "p := 1 q := 0 p => q");

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_OK);
        assertThat(out.toString().trim()).isEqualTo("false");
    }

    @Test
    void evaluatesStatementFile(@TempDir Path tempDir) throws Exception {
        Path file = tempDir.resolve("statement.txt");
        Files.writeString(file, "~1 v ~0 <=> ~(1 ^ 0)\n");

        int exitCode = execute("evaluate", "--file", file.toString());

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_OK);
        assertThat(out.toString().trim()).isEqualTo("true");
    }

    @Test
    void printsResultAndBindingsAsJson() {
        int exitCode = execute("evaluate", "--json", "-e", "p := 1 q := 0 p v q");

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_OK);
        JsonObject json = JsonParser.parseString(out.toString()).getAsJsonObject();
        assertThat(json.get("result").getAsBoolean()).isTrue();
        assertThat(json.get("expression").getAsString()).isEqualTo("Or(p, q)");
        assertThat(json.getAsJsonObject("bindings").get("q").getAsBoolean()).isFalse();
    }

    @Test
    void reportsSolverErrorsOnStandardError() {
        int exitCode = execute("evaluate", "-e", "(1 ^ 0");

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_SOLVER_ERROR);
        assertThat(out.toString()).isEmpty();
        assertThat(err.toString()).contains("[ERROR] <expression>:1:1: Unmatched '('");
    }

    @Test
    void reportsUndefinedVariable() {
        assertThat(execute("evaluate", "-e", "p ^ 1")).isEqualTo(CommandLineInterface.EXIT_SOLVER_ERROR);
        assertThat(err.toString()).contains("Undefined variable p");
    }

    @Test
    void reportsUnreadableFile(@TempDir Path tempDir) {
        int exitCode = execute("evaluate", "-f", tempDir.resolve("missing.txt").toString());

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_IO_ERROR);
        assertThat(err.toString()).contains("I/O error");
    }

    @Test
    void rejectsFileAndExpressionTogether() {
        int exitCode = execute("evaluate", "-e", "1", "-f", "statement.txt");

        assertThat(exitCode).isEqualTo(CommandLine.ExitCode.USAGE);
    }

    @Test
    void writesGraphNextToEvaluation(@TempDir Path tempDir) throws Exception {
        Path dot = tempDir.resolve("tree.dot");

        int exitCode = execute("evaluate", "-e", "1 ^ 0", "--graph", dot.toString());

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_OK);
        assertThat(Files.readString(dot)).startsWith("digraph G {").contains("0 -> 2");
    }

    @Test
    void graphCommandWritesToStandardOutput() {
        int exitCode = execute("graph", "-e", "~1", "-o", "-");

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_OK);
        assertThat(out.toString()).isEqualTo("digraph G {\n    0 [label=\"Not\" shape=\"box\"]\n    1 [label=\"true\"]\n    0 -> 1\n}\n");
    }

    @Test
    void graphCommandWritesFile(@TempDir Path tempDir) throws Exception {
        Path dot = tempDir.resolve("out.dot");

        int exitCode = execute("graph", "-e", "p := 1 p v 0", "--output", dot.toString());

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_OK);
        assertThat(Files.readString(dot)).contains("[label=\"p\"]");
    }

    @Test
    void graphCommandReportsParseErrors() {
        assertThat(execute("graph", "-e", "1 1", "-o", "-")).isEqualTo(CommandLineInterface.EXIT_SOLVER_ERROR);
        assertThat(err.toString()).contains("Expected an operator before '1'");
    }

    @Test
    void appliesConfigurationFile(@TempDir Path tempDir) throws Exception {
        Path conf = tempDir.resolve("custom.conf");
        Files.writeString(conf, "logic-solver.lexer.bare-equals = skip\n");

        int exitCode = execute("--config", conf.toString(), "evaluate", "-e", "1 ^= 1");

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_OK);
        assertThat(out.toString().trim()).isEqualTo("true");
    }

    @Test
    void rejectsMissingConfigurationFile(@TempDir Path tempDir) {
        int exitCode = execute("--config", tempDir.resolve("absent.conf").toString(), "evaluate", "-e", "1");

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_IO_ERROR);
        assertThat(err.toString()).contains("Invalid configuration");
    }

    @Test
    void rejectsInvalidConfigurationValue(@TempDir Path tempDir) throws Exception {
        Path conf = tempDir.resolve("bad.conf");
        Files.writeString(conf, "logic-solver.lexer.bare-equals = ignore\n");

        assertThat(execute("-c", conf.toString(), "evaluate", "-e", "1")).isEqualTo(CommandLineInterface.EXIT_IO_ERROR);
    }
}
