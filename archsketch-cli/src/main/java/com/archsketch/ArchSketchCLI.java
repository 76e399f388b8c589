package com.archsketch;

import ch.qos.logback.classic.Level;
import com.archsketch.cli.AnalyzeCommand;
import com.archsketch.cli.CgraCommand;
import com.archsketch.cli.RulesCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Main CLI entry point for ArchSketch.
 *
 * <p>ArchSketch reads pre-parsed syntax-tree bundles and produces an architecture sketch:
 * component containment, flow pattern inventories and metrics, or a CGRA hardware view.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code analyze} - Generic architecture analysis</li>
 *   <li>{@code cgra} - CGRA component and dataflow analysis</li>
 *   <li>{@code rules} - Print the effective rule tables</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * archsketch analyze ./arch_analysis/asts -o ./arch_analysis
 * archsketch -v cgra ./asts --format json --console
 * archsketch rules -c archsketch.yaml
 * }</pre>
 */
@Command(
    name = "archsketch",
    mixinStandardHelpOptions = true,
    version = "ArchSketch 1.0.0-SNAPSHOT",
    description = "Architecture sketches from syntax trees",
    subcommands = {
        AnalyzeCommand.class,
        CgraCommand.class,
        RulesCommand.class
    }
)
public class ArchSketchCLI implements Runnable {

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        configureLogging();

        if (quiet) {
            return;
        }

        System.out.println("ArchSketch - architecture sketches from syntax trees");
        System.out.println();
        System.out.println("Use 'archsketch --help' to see available commands");
    }

    /**
     * Applies {@code -v} / {@code -q} to the Logback root logger.
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

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Builds the command line with logging configured before any subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        ArchSketchCLI root = new ArchSketchCLI();
        CommandLine commandLine = new CommandLine(root);
        commandLine.setExecutionStrategy(parseResult -> {
            root.configureLogging();
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
