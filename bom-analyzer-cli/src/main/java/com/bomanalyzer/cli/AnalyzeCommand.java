package com.bomanalyzer.cli;

import com.bomanalyzer.BomAnalyzerCLI;
import com.bomanalyzer.core.analysis.BomAnalyzer;
import com.bomanalyzer.core.analysis.CycleDetectedException;
import com.bomanalyzer.core.config.AnalyzerConfig;
import com.bomanalyzer.core.ingest.RejectedRow;
import com.bomanalyzer.core.model.AnalysisReport;
import com.bomanalyzer.core.renderer.OutputRenderer;
import com.bomanalyzer.core.renderer.RenderContext;
import com.bomanalyzer.core.renderer.ReportBundle;
import com.bomanalyzer.core.report.GeneratedReport;
import com.bomanalyzer.core.report.ReportConfig;
import com.bomanalyzer.core.report.ReportGenerator;
import com.bomanalyzer.core.report.ReportType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.concurrent.Callable;

/**
 * Command to analyse a BOM export and produce the three reports.
 *
 * <p>Runs the full pipeline:
 * <ol>
 *   <li>Load configuration ({@code -c}, else {@code bom-analyzer.yaml} if present)</li>
 *   <li>Read the export and build the catalogue</li>
 *   <li>Run validation, depth and roll-up passes</li>
 *   <li>Generate warnings, depths and rolled-up cost reports with the selected generator</li>
 *   <li>Render them to the console, or to files when {@code -o} is given</li>
 * </ol>
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * bom-analyzer analyze bom.csv
 * bom-analyzer analyze bom.csv --detailed
 * bom-analyzer analyze bom.csv --format markdown -o ./bom-report
 * }</pre>
 */
@Command(
    name = "analyze",
    description = "Analyse product depths and rolled-up costs of a BOM export",
    mixinStandardHelpOptions = true
)
public class AnalyzeCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(AnalyzeCommand.class);

    @ParentCommand
    private BomAnalyzerCLI parent;

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "BOM export (CSV) to analyse")
    private Path csvFile;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: bom-analyzer.yaml, if present)"
    )
    private Path configPath;

    @Option(
        names = {"--format"},
        description = "Report format: text or markdown (overrides config)"
    )
    private String format;

    @ArgGroup(exclusive = true)
    private Detail detail;

    @Option(
        names = {"-o", "--output"},
        description = "Write one file per report to this directory (overrides config)"
    )
    private Path outputDir;

    @Option(
        names = {"--color"},
        description = "Use ANSI colours for console headers"
    )
    private boolean color;

    static class Detail {
        @Option(names = "--concise", required = true, description = "One line per product")
        boolean concise;

        @Option(names = "--detailed", required = true, description = "Full component breakdown per product")
        boolean detailed;
    }

    @Override
    public Integer call() {
        if (parent != null) {
            parent.configureLogging();
        }
        PrintWriter err = spec.commandLine().getErr();

        try {
            AnalyzerConfig config = SourceData.loadConfig(configPath);
            SourceData source = SourceData.load(csvFile, config);
            for (RejectedRow rejected : source.readResult().rejectedRows()) {
                err.println("⚠ " + rejected);
            }

            AnalysisReport report = new BomAnalyzer().analyze(source.catalogue());

            ReportGenerator generator = findGenerator(effectiveFormat(config));
            ReportConfig reportConfig = new ReportConfig(
                effectiveConcise(config), config.report().decimals(), ReportConfig.defaults().detailDecimals());
            ReportBundle bundle = generateReports(generator, report, reportConfig);

            OutputRenderer renderer = findRenderer(effectiveRenderer(config));
            renderer.render(bundle, renderContext(config));

            log.info("Analysis of {} complete: {} products, max depth {}",
                csvFile, report.catalogue().size(), report.depths().maxDepth());
            return 0;

        } catch (CycleDetectedException e) {
            log.error("Analysis aborted: {}", e.getMessage());
            err.println("✗ Analysis aborted: " + e.getMessage());
            return 1;
        } catch (IOException | IllegalArgumentException | IllegalStateException e) {
            log.error("Analysis failed", e);
            err.println("✗ Analysis failed: " + e.getMessage());
            return 1;
        }
    }

    private ReportBundle generateReports(ReportGenerator generator, AnalysisReport report, ReportConfig config) {
        List<GeneratedReport> reports = new ArrayList<>();
        for (ReportType type : ReportType.values()) {
            if (generator.getSupportedReportTypes().contains(type)) {
                reports.add(generator.generate(report, type, config));
            } else {
                log.debug("Generator {} does not support {}", generator.getId(), type);
            }
        }
        return new ReportBundle(reports);
    }

    private String effectiveFormat(AnalyzerConfig config) {
        return format != null ? format : config.report().format();
    }

    private boolean effectiveConcise(AnalyzerConfig config) {
        if (detail == null) {
            return config.report().concise();
        }
        return !detail.detailed;
    }

    private String effectiveRenderer(AnalyzerConfig config) {
        return outputDir != null ? "filesystem" : config.output().renderer();
    }

    private RenderContext renderContext(AnalyzerConfig config) {
        Path directory = outputDir != null ? outputDir : Paths.get(config.output().directory());
        return new RenderContext(
            directory,
            spec.commandLine().getOut(),
            Map.of("console.colors", String.valueOf(color)));
    }

    private ReportGenerator findGenerator(String id) {
        for (ReportGenerator generator : ServiceLoader.load(ReportGenerator.class)) {
            if (generator.getId().equalsIgnoreCase(id)) {
                return generator;
            }
        }
        throw new IllegalArgumentException("Unknown report format: " + id + ". Use 'bom-analyzer list generators'");
    }

    private OutputRenderer findRenderer(String id) {
        for (OutputRenderer renderer : ServiceLoader.load(OutputRenderer.class)) {
            if (renderer.getId().equalsIgnoreCase(id)) {
                return renderer;
            }
        }
        throw new IllegalArgumentException("Unknown renderer: " + id + ". Use 'bom-analyzer list renderers'");
    }
}
