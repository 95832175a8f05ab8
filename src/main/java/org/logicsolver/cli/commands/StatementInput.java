package org.logicsolver.cli.commands;

import picocli.CommandLine.Option;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;

/**
 * The statement a command works on: either a file or an expression given inline.
 */
public class StatementInput {

    @Option(names = {"-f", "--file"}, required = true, description = "The path to a file containing the statement.")
    File file;

    @Option(names = {"-e", "--expression"}, required = true, description = "The statement itself, e.g. 'p := 1 p ^ ~0'.")
    String expression;

    /**
     * Reads the statement text.
     * @return The statement.
     * @throws IOException if the statement file cannot be read.
     */
    public String read() throws IOException {
        if (file != null) {
            return Files.readString(file.toPath());
        }
        return expression;
    }

    /**
     * Gets the name used for the statement in diagnostics.
     * @return The file name, or {@code <expression>} for inline statements.
     */
    public String sourceName() {
        return file != null ? file.getPath() : "<expression>";
    }
}
