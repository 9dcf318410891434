package com.bomanalyzer.core.report;

/**
 * Settings applied while generating a report.
 *
 * @param concise one line per product instead of the component breakdown
 * @param decimals decimal places for rolled-up totals
 * @param detailDecimals decimal places for quantities and costs on component lines
 */
public record ReportConfig(
    boolean concise,
    int decimals,
    int detailDecimals
) {
    /**
     * Compact constructor with validation.
     */
    public ReportConfig {
        if (decimals < 0) {
            throw new IllegalArgumentException("decimals must not be negative: " + decimals);
        }
        if (detailDecimals < 0) {
            throw new IllegalArgumentException("detailDecimals must not be negative: " + detailDecimals);
        }
    }

    /**
     * Creates the default configuration: concise, totals to 4 places, details to 2.
     *
     * @return default report config
     */
    public static ReportConfig defaults() {
        return new ReportConfig(true, 4, 2);
    }

    /**
     * Returns a copy with the given conciseness.
     *
     * @param concise whether to omit component lines
     * @return adjusted config
     */
    public ReportConfig withConcise(boolean concise) {
        return new ReportConfig(concise, decimals, detailDecimals);
    }
}
