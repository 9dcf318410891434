package com.bomanalyzer.core.report;

import java.util.Objects;

/**
 * Report section produced by a {@link ReportGenerator}.
 *
 * @param name section name, used as the file base name
 * @param content rendered text
 * @param fileExtension extension without leading dot
 */
public record GeneratedReport(
    String name,
    String content,
    String fileExtension
) {
    /**
     * Compact constructor with validation.
     */
    public GeneratedReport {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(content, "content must not be null");
        Objects.requireNonNull(fileExtension, "fileExtension must not be null");
    }

    /**
     * Returns the file name for this section.
     *
     * @return name plus extension
     */
    public String fileName() {
        return name + "." + fileExtension;
    }
}
