package com.bomanalyzer.core.renderer;

import com.bomanalyzer.core.report.GeneratedReport;

import java.util.List;
import java.util.Objects;

/**
 * Ordered set of generated reports handed to a renderer in one go.
 *
 * @param reports reports in output order
 */
public record ReportBundle(
    List<GeneratedReport> reports
) {
    /**
     * Compact constructor with validation.
     */
    public ReportBundle {
        Objects.requireNonNull(reports, "reports must not be null");
        reports = List.copyOf(reports);
    }
}
