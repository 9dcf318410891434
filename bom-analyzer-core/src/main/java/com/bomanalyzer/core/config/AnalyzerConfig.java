package com.bomanalyzer.core.config;

import com.bomanalyzer.core.ingest.BomColumns;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Root configuration for a BOM analysis run.
 *
 * <p>Loaded from {@code bom-analyzer.yaml}. Every section and field is optional; missing values
 * fall back to the defaults shown below.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * input:
 *   delimiter: ","
 *   columns:
 *     productId: "Item No."
 *     componentId: "No."
 *     quantityPer: "Quantity per"
 *     replenishmentSystem: "Item Replenishment System"
 *     unitCost: "Current Unit Cost (LCY)"
 *
 * report:
 *   format: text
 *   concise: true
 *   decimals: 4
 *
 * output:
 *   renderer: console
 *   directory: "./bom-report"
 * }</pre>
 *
 * @param input source file layout
 * @param report report settings
 * @param output output settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AnalyzerConfig(
    @JsonProperty("input") InputConfig input,
    @JsonProperty("report") ReportSettings report,
    @JsonProperty("output") OutputConfig output
) {
    /**
     * Compact constructor filling missing sections with defaults.
     */
    public AnalyzerConfig {
        if (input == null) {
            input = InputConfig.defaults();
        }
        if (report == null) {
            report = ReportSettings.defaults();
        }
        if (output == null) {
            output = OutputConfig.defaults();
        }
    }

    /**
     * Creates the default configuration: standard export columns, comma separated, concise text
     * report on the console.
     *
     * @return default configuration
     */
    public static AnalyzerConfig defaults() {
        return new AnalyzerConfig(InputConfig.defaults(), ReportSettings.defaults(), OutputConfig.defaults());
    }

    /**
     * Source file layout.
     *
     * @param delimiter column separator, a single character
     * @param columns header names
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record InputConfig(
        @JsonProperty("delimiter") String delimiter,
        @JsonProperty("columns") ColumnsConfig columns
    ) {
        public InputConfig {
            if (delimiter == null || delimiter.isEmpty()) {
                delimiter = ",";
            }
            if (delimiter.length() != 1) {
                throw new IllegalArgumentException("delimiter must be a single character: '" + delimiter + "'");
            }
            if (columns == null) {
                columns = new ColumnsConfig(null, null, null, null, null);
            }
        }

        public static InputConfig defaults() {
            return new InputConfig(",", null);
        }

        /**
         * Returns the column separator.
         *
         * @return separator character
         */
        public char separator() {
            return delimiter.charAt(0);
        }
    }

    /**
     * Header names; unset names use {@link BomColumns#defaults()}.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ColumnsConfig(
        @JsonProperty("productId") String productId,
        @JsonProperty("componentId") String componentId,
        @JsonProperty("quantityPer") String quantityPer,
        @JsonProperty("replenishmentSystem") String replenishmentSystem,
        @JsonProperty("unitCost") String unitCost
    ) {
        /**
         * Resolves the configured names against the defaults.
         *
         * @return effective column names
         */
        public BomColumns toBomColumns() {
            BomColumns defaults = BomColumns.defaults();
            return new BomColumns(
                productId != null ? productId : defaults.productId(),
                componentId != null ? componentId : defaults.componentId(),
                quantityPer != null ? quantityPer : defaults.quantityPer(),
                replenishmentSystem != null ? replenishmentSystem : defaults.replenishmentSystem(),
                unitCost != null ? unitCost : defaults.unitCost()
            );
        }
    }

    /**
     * Report settings.
     *
     * @param format report generator id ("text" or "markdown")
     * @param concise one line per product instead of the component breakdown
     * @param decimals decimal places for rolled-up totals
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ReportSettings(
        @JsonProperty("format") String format,
        @JsonProperty("concise") Boolean concise,
        @JsonProperty("decimals") Integer decimals
    ) {
        public ReportSettings {
            if (format == null || format.isBlank()) {
                format = "text";
            }
            if (concise == null) {
                concise = Boolean.TRUE;
            }
            if (decimals == null || decimals < 0) {
                decimals = 4;
            }
        }

        public static ReportSettings defaults() {
            return new ReportSettings("text", true, 4);
        }
    }

    /**
     * Output settings.
     *
     * @param renderer renderer id ("console" or "filesystem")
     * @param directory target directory for the filesystem renderer
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputConfig(
        @JsonProperty("renderer") String renderer,
        @JsonProperty("directory") String directory
    ) {
        public OutputConfig {
            if (renderer == null || renderer.isBlank()) {
                renderer = "console";
            }
            if (directory == null || directory.isBlank()) {
                directory = "./bom-report";
            }
        }

        public static OutputConfig defaults() {
            return new OutputConfig("console", "./bom-report");
        }
    }
}
