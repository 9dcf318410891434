package com.bomanalyzer.core.report;

import com.bomanalyzer.core.model.AnalysisReport;

import java.util.Set;

/**
 * Interface for generators that turn analysis results into report text.
 *
 * <p>Generators only format. All numbers come from the {@link AnalysisReport}; rounding happens
 * here, on the way out, and never feeds back into computation.
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.bomanalyzer.core.report.ReportGenerator}
 *
 * @see ReportType
 * @see ReportConfig
 */
public interface ReportGenerator {

    /**
     * Returns unique identifier for this generator.
     *
     * <p>Used for selecting the generator in configuration and on the command line
     * (e.g., "text", "markdown").
     *
     * @return unique generator identifier
     */
    String getId();

    /**
     * Returns human-readable display name for this generator.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Returns file extension for generated reports.
     *
     * @return file extension without leading dot
     */
    String getFileExtension();

    /**
     * Returns set of report types this generator can produce.
     *
     * @return supported report types
     */
    Set<ReportType> getSupportedReportTypes();

    /**
     * Generates one report section.
     *
     * @param report analysis results
     * @param type section to generate
     * @param config formatting settings
     * @return generated section
     * @throws NullPointerException if any argument is null
     * @throws IllegalArgumentException if the type is not supported
     */
    GeneratedReport generate(AnalysisReport report, ReportType type, ReportConfig config);
}
