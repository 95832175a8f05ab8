package org.logicsolver.cli.commands;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonObject;
import com.typesafe.config.ConfigException;
import org.logicsolver.cli.CommandLineInterface;
import org.logicsolver.solver.Solver;
import org.logicsolver.solver.SolverOptions;
import org.logicsolver.solver.api.SolverException;
import org.logicsolver.solver.diagnostics.Diagnostic;
import org.logicsolver.solver.frontend.parser.ParsedStatement;
import org.logicsolver.solver.util.GraphvizExporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(name = "evaluate", description = "Evaluates a statement and prints its truth value.")
public class EvaluateCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(EvaluateCommand.class);

    @ParentCommand
    private CommandLineInterface parent;

    @ArgGroup(exclusive = true, multiplicity = "1")
    StatementInput input;

    @Option(names = "--graph", description = "Also write the expression tree as a Graphviz DOT file.")
    private File graphFile;

    @Option(names = "--json", description = "Print the result and the bindings as JSON.")
    private boolean json;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        Solver solver;
        try {
            solver = new Solver(SolverOptions.fromConfig(parent.getConfig()));
        } catch (ConfigException e) {
            err.println("Invalid configuration: " + e.getMessage());
            return CommandLineInterface.EXIT_IO_ERROR;
        }

        try {
            String statement = input.read();
            String sourceName = input.sourceName();
            ParsedStatement parsed = solver.parse(statement, sourceName);
            if (graphFile != null) {
                GraphvizExporter.write(parsed.expression(), graphFile.toPath());
                LOG.info("Wrote expression tree to {}", graphFile.getAbsolutePath());
            }
            boolean result = solver.evaluate(parsed, sourceName);
            logWarnings(solver);

            if (json) {
                out.println(toJson(sourceName, parsed, result));
            } else {
                out.println(result);
            }
            return CommandLineInterface.EXIT_OK;
        } catch (SolverException e) {
            logWarnings(solver);
            err.println(e.getDiagnostic());
            return CommandLineInterface.EXIT_SOLVER_ERROR;
        } catch (IOException e) {
            err.println("I/O error: " + e.getMessage());
            return CommandLineInterface.EXIT_IO_ERROR;
        }
    }

    private static String toJson(String sourceName, ParsedStatement parsed, boolean result) {
        JsonObject bindings = new JsonObject();
        for (Map.Entry<String, Boolean> entry : parsed.bindings().asMap().entrySet()) {
            bindings.addProperty(entry.getKey(), entry.getValue());
        }
        JsonObject root = new JsonObject();
        root.addProperty("source", sourceName);
        root.addProperty("expression", parsed.expression().toString());
        root.add("bindings", bindings);
        root.addProperty("result", result);

        Gson gson = new GsonBuilder().setPrettyPrinting().create();
        return gson.toJson(root);
    }

    static void logWarnings(Solver solver) {
        for (Diagnostic diagnostic : solver.getDiagnostics().getDiagnostics()) {
            LOG.warn("{}", diagnostic);
        }
    }
}
