package org.logicsolver.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigParseOptions;
import org.logicsolver.cli.commands.EvaluateCommand;
import org.logicsolver.cli.commands.GraphCommand;
import org.logicsolver.cli.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "logic-solver",
    mixinStandardHelpOptions = true,
    version = "Logic Solver 1.0",
    description = "Evaluates propositional-logic statements",
    subcommands = {
        EvaluateCommand.class,
        GraphCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    /** Exit code for a statement that was lexed, parsed and evaluated. */
    public static final int EXIT_OK = 0;
    /** Exit code for a lex, parse or evaluation error. */
    public static final int EXIT_SOLVER_ERROR = 1;
    /** Exit code for unreadable input, unwritable output or a broken configuration. */
    public static final int EXIT_IO_ERROR = 2;

    private static final String CONFIG_FILE_NAME = "logic-solver.conf";

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: " + CONFIG_FILE_NAME + ")"
    )
    private File configFile;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    private Config config;
    private boolean initialized = false;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        spec.commandLine().usage(spec.commandLine().getOut());
        return EXIT_OK;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("logic-solver");
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    /**
     * Loads the configuration and applies its logging block.
     * Order: system properties &gt; environment &gt; configuration file &gt; classpath defaults.
     *
     * @throws com.typesafe.config.ConfigException if the configuration file is missing or malformed.
     */
    private void initialize() {
        if (initialized) {
            return;
        }

        final Logger logger = LoggerFactory.getLogger(CommandLineInterface.class);

        final File file;
        if (this.configFile != null) {
            logger.debug("Using configuration file specified via --config: {}", this.configFile.getAbsolutePath());
            file = this.configFile;
        } else if (new File(CONFIG_FILE_NAME).exists()) {
            file = new File(CONFIG_FILE_NAME);
            logger.debug("Using configuration file found in current directory: {}", file.getAbsolutePath());
        } else {
            logger.debug("No '{}' found in current directory. Using default configuration from classpath.", CONFIG_FILE_NAME);
            file = null;
        }

        Config base = ConfigFactory.systemProperties().withFallback(ConfigFactory.systemEnvironment());
        if (file != null) {
            base = base.withFallback(ConfigFactory.parseFile(file, ConfigParseOptions.defaults().setAllowMissing(false)));
        }
        this.config = base.withFallback(ConfigFactory.load()).resolve();

        LoggingConfigurator.configure(config);
        initialized = true;
    }

    /**
     * Gets the loaded configuration, loading it on first use.
     * @return The resolved configuration.
     * @throws com.typesafe.config.ConfigException if the configuration cannot be loaded.
     */
    public Config getConfig() {
        if (!initialized) {
            initialize();
        }
        return config;
    }
}
