package com.bomanalyzer.core.renderer.impl;

import com.bomanalyzer.core.renderer.OutputRenderer;
import com.bomanalyzer.core.renderer.RenderContext;
import com.bomanalyzer.core.renderer.ReportBundle;
import com.bomanalyzer.core.report.GeneratedReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Renderer that writes each report to its own file under the output directory.
 *
 * <p>The directory is created if missing and existing report files are overwritten. The
 * console receives one line per written file.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * new FileSystemRenderer().render(bundle, new RenderContext(Path.of("./bom-report"), console, Map.of()));
 * // Creates ./bom-report/warnings.txt, ./bom-report/depths.txt, ...
 * }</pre>
 */
public class FileSystemRenderer implements OutputRenderer {

    private static final Logger logger = LoggerFactory.getLogger(FileSystemRenderer.class);

    @Override
    public String getId() {
        return "filesystem";
    }

    @Override
    public String getDescription() {
        return "Writes one file per report to the output directory";
    }

    @Override
    public void render(ReportBundle bundle, RenderContext context) {
        Path outputDir = context.outputDirectory();
        logger.info("Writing {} reports to {}", bundle.reports().size(), outputDir);

        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create output directory: " + outputDir, e);
        }

        for (GeneratedReport report : bundle.reports()) {
            Path target = writeReport(outputDir, report);
            context.console().println("Wrote " + target);
        }
        context.console().flush();
    }

    private Path writeReport(Path outputDir, GeneratedReport report) {
        Path target = outputDir.resolve(report.fileName());
        try {
            Files.writeString(target, report.content(), StandardCharsets.UTF_8);
            logger.debug("Wrote {} ({} chars)", target, report.content().length());
            return target;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write report: " + target, e);
        }
    }
}
