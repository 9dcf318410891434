package com.bomanalyzer.core.report;

/**
 * Sections a report generator can produce.
 */
public enum ReportType {
    /** Data-quality warnings about the source data */
    WARNINGS("warnings"),

    /** Component tree depth per product */
    DEPTHS("depths"),

    /** Rolled-up purchase cost per product */
    ROLLED_UP_COSTS("rolled-up-costs");

    private final String fileBaseName;

    ReportType(String fileBaseName) {
        this.fileBaseName = fileBaseName;
    }

    /**
     * Returns the file name, without extension, used when the section is written to disk.
     *
     * @return base file name
     */
    public String fileBaseName() {
        return fileBaseName;
    }
}
