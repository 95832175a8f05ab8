package org.logicsolver.cli.commands;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.logicsolver.cli.CommandLineInterface;
import org.logicsolver.solver.Solver;
import org.logicsolver.solver.SolverOptions;
import org.logicsolver.solver.api.SolverException;
import org.logicsolver.solver.frontend.parser.ParsedStatement;
import org.logicsolver.solver.util.GraphvizExporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(name = "graph", description = "Parses a statement and exports its expression tree as Graphviz DOT.")
public class GraphCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(GraphCommand.class);
    private static final String OUTPUT_PATH = SolverOptions.CONFIG_PATH + ".graph.output";
    private static final String STDOUT = "-";

    @ParentCommand
    private CommandLineInterface parent;

    @ArgGroup(exclusive = true, multiplicity = "1")
    StatementInput input;

    @Option(names = {"-o", "--output"},
            description = "The DOT file to write, '-' for standard output (default: logic-solver.graph.output).")
    private String output;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        Solver solver;
        String target;
        try {
            Config config = parent.getConfig();
            solver = new Solver(SolverOptions.fromConfig(config));
            target = output != null ? output : config.hasPath(OUTPUT_PATH) ? config.getString(OUTPUT_PATH) : STDOUT;
        } catch (ConfigException e) {
            spec.commandLine().getErr().println("Invalid configuration: " + e.getMessage());
            return CommandLineInterface.EXIT_IO_ERROR;
        }

        try {
            ParsedStatement parsed = solver.parse(input.read(), input.sourceName());
            EvaluateCommand.logWarnings(solver);
            if (STDOUT.equals(target)) {
                spec.commandLine().getOut().print(GraphvizExporter.render(parsed.expression()));
            } else {
                GraphvizExporter.write(parsed.expression(), Path.of(target));
                LOG.info("Wrote expression tree to {}", Path.of(target).toAbsolutePath());
            }
            return CommandLineInterface.EXIT_OK;
        } catch (SolverException e) {
            EvaluateCommand.logWarnings(solver);
            spec.commandLine().getErr().println(e.getDiagnostic());
            return CommandLineInterface.EXIT_SOLVER_ERROR;
        } catch (IOException e) {
            spec.commandLine().getErr().println("I/O error: " + e.getMessage());
            return CommandLineInterface.EXIT_IO_ERROR;
        }
    }
}
