package com.bomanalyzer.cli;

import com.bomanalyzer.BomAnalyzerCLI;
import com.bomanalyzer.core.analysis.CatalogueValidator;
import com.bomanalyzer.core.config.AnalyzerConfig;
import com.bomanalyzer.core.ingest.RejectedRow;
import com.bomanalyzer.core.model.AnalysisReport;
import com.bomanalyzer.core.model.Diagnostic;
import com.bomanalyzer.core.model.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to check a BOM export for data-quality problems without running the cost passes.
 *
 * <p>Prints rejected rows and source-data warnings. Exit codes:
 * <ul>
 *   <li>{@code 0} - no warnings</li>
 *   <li>{@code 1} - the file could not be read</li>
 *   <li>{@code 2} - warnings or rejected rows were found</li>
 * </ul>
 */
@Command(
    name = "validate",
    description = "Check a BOM export for data-quality warnings",
    mixinStandardHelpOptions = true
)
public class ValidateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    static final int EXIT_WARNINGS = 2;

    @ParentCommand
    private BomAnalyzerCLI parent;

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "BOM export (CSV) to validate")
    private Path csvFile;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: bom-analyzer.yaml, if present)"
    )
    private Path configPath;

    @Override
    public Integer call() {
        if (parent != null) {
            parent.configureLogging();
        }
        PrintWriter out = spec.commandLine().getOut();

        SourceData source;
        try {
            AnalyzerConfig config = SourceData.loadConfig(configPath);
            source = SourceData.load(csvFile, config);
        } catch (IOException e) {
            log.error("Validation failed", e);
            spec.commandLine().getErr().println("✗ Validation failed: " + e.getMessage());
            return 1;
        }

        ValidationResult validation = new CatalogueValidator().validate(source.catalogue());
        List<Diagnostic> warnings = AnalysisReport.sourceDataWarnings(source.catalogue(), validation);
        List<RejectedRow> rejected = source.readResult().rejectedRows();

        rejected.forEach(r -> out.println("⚠ " + r));
        warnings.forEach(w -> out.println("⚠ " + w.message()));

        if (warnings.isEmpty() && rejected.isEmpty()) {
            out.println("✓ " + csvFile + ": " + source.catalogue().size() + " products, no warnings");
            return 0;
        }
        out.println("✗ " + csvFile + ": " + warnings.size() + " warning(s), "
            + rejected.size() + " rejected row(s)");
        return EXIT_WARNINGS;
    }
}
