package com.bomanalyzer;

import ch.qos.logback.classic.Level;
import com.bomanalyzer.cli.AnalyzeCommand;
import com.bomanalyzer.cli.ListCommand;
import com.bomanalyzer.cli.ValidateCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

/**
 * Main CLI entry point for the BOM analyzer.
 *
 * <p>Reads a bill-of-materials export, reports data-quality warnings, the depth of every product
 * structure and the rolled-up cost of every product.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code analyze} - Run every analysis pass and print or write the reports</li>
 *   <li>{@code validate} - Check the source data for warnings only</li>
 *   <li>{@code list} - List available report generators or renderers</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all log output except errors</li>
 *   <li>{@code --help} - Show help information</li>
 *   <li>{@code --version} - Show version information</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Concise report on the console
 * bom-analyzer analyze bom.csv
 *
 * # Component breakdown written as Markdown files
 * bom-analyzer analyze bom.csv --detailed --format markdown -o ./bom-report
 *
 * # Data-quality check only
 * bom-analyzer validate bom.csv
 * }</pre>
 */
@Command(
    name = "bom-analyzer",
    mixinStandardHelpOptions = true,
    version = "BOM Analyzer 1.0.0-SNAPSHOT",
    description = "Product structure depth and rolled-up cost analysis for BOM exports",
    subcommands = {
        AnalyzeCommand.class,
        ValidateCommand.class,
        ListCommand.class
    }
)
public class BomAnalyzerCLI implements Runnable {

    @Spec
    private CommandSpec spec;

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all log output except errors")
    private boolean quiet;

    @Override
    public void run() {
        configureLogging();

        if (quiet) {
            return;
        }

        spec.commandLine().getOut().println("BOM Analyzer - product depth and rolled-up cost reports");
        spec.commandLine().getOut().println();
        spec.commandLine().getOut().println("Use 'bom-analyzer --help' to see available commands");
        spec.commandLine().getOut().println("Use 'bom-analyzer <command> --help' for command-specific help");
    }

    /**
     * Configures the Logback root level from the global options. Subcommands call this before
     * doing any work.
     */
    public void configureLogging() {
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
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = new CommandLine(new BomAnalyzerCLI()).execute(args);
        System.exit(exitCode);
    }
}
