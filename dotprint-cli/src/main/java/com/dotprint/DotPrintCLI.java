package com.dotprint;

import ch.qos.logback.classic.Level;
import com.dotprint.cli.ListCommand;
import com.dotprint.cli.QuoteCommand;
import com.dotprint.cli.RenderCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Main CLI entry point for dotprint.
 *
 * <p>dotprint turns YAML graph definitions into Graphviz DOT documents, escaping and
 * quoting every identifier exactly where the DOT grammar requires it.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code render} - Render a graph definition to DOT</li>
 *   <li>{@code quote} - Print the DOT form of arbitrary strings</li>
 *   <li>{@code list} - List available output targets</li>
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
 * # Render to ./pipeline.dot
 * dotprint render pipeline.yaml
 *
 * # Render and pipe into Graphviz
 * dotprint -q render pipeline.yaml -t console | dot -Tsvg > pipeline.svg
 *
 * # Check how a string is written in DOT
 * dotprint quote 'he said "hi"' graph 42
 * }</pre>
 */
@Command(
    name = "dotprint",
    mixinStandardHelpOptions = true,
    version = "dotprint 1.0.0-SNAPSHOT",
    description = "Graphviz DOT document generator",
    subcommands = {
        RenderCommand.class,
        QuoteCommand.class,
        ListCommand.class
    }
)
public class DotPrintCLI implements Runnable {

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }

        System.out.println("dotprint - Graphviz DOT document generator");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'dotprint --help' to see available commands");
        System.out.println("Use 'dotprint <command> --help' for command-specific help");
    }

    /**
     * Configures the logback root level from the global options.
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
     * Builds the command line, applying the logging options before any subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        DotPrintCLI cli = new DotPrintCLI();
        CommandLine commandLine = new CommandLine(cli);
        CommandLine.IExecutionStrategy runLast = new CommandLine.RunLast();
        commandLine.setExecutionStrategy(parseResult -> {
            cli.configureLogging();
            return runLast.execute(parseResult);
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
