package com.regolith;

import ch.qos.logback.classic.Level;
import com.regolith.cli.FlavorsCommand;
import com.regolith.cli.RenderCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Main CLI entry point for Regolith.
 *
 * <p>Regolith draws regular expressions as railroad diagrams and writes them as SVG.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code render} - Render a pattern to an SVG file</li>
 *   <li>{@code flavors} - List available regex flavors</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 *   <li>{@code --help} - Show help information</li>
 *   <li>{@code --version} - Show version information</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Render a pattern to regex.svg
 * regolith render '(cat|dog)s?'
 *
 * # Custom output file and colors
 * regolith render -o words.svg --literal-fill '#ff0000' '[[:alpha:]]+'
 *
 * # Read the pattern from stdin
 * echo '^[0-9]{3}-[0-9]{4}$' | regolith render
 * }</pre>
 */
@Command(
    name = "regolith",
    mixinStandardHelpOptions = true,
    version = "Regolith 1.0.0-SNAPSHOT",
    description = "Visualize regular expressions as SVG railroad diagrams",
    subcommands = {
        RenderCommand.class,
        FlavorsCommand.class
    }
)
public class RegolithCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(RegolithCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }

        System.out.println("Regolith - Railroad diagrams for regular expressions");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'regolith --help' to see available commands");
        System.out.println("Use 'regolith <command> --help' for command-specific help");
    }

    /**
     * Configures logging level based on global options.
     */
    void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
        log.debug("Log level set to {}", root.getLevel());
    }

    /**
     * Returns whether verbose mode is enabled.
     *
     * @return true if verbose mode is enabled
     */
    public boolean isVerbose() {
        return verbose;
    }

    /**
     * Returns whether quiet mode is enabled.
     *
     * @return true if quiet mode is enabled
     */
    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Creates the command line with logging configured before any subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        RegolithCLI cli = new RegolithCLI();
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setExecutionStrategy(parseResult -> {
            cli.configureLogging();
            return new CommandLine.RunLast().execute(parseResult);
        });
        return commandLine;
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
