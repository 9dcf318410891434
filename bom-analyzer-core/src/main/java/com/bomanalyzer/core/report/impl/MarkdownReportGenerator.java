package com.bomanalyzer.core.report.impl;

import com.bomanalyzer.core.model.AnalysisReport;
import com.bomanalyzer.core.model.CostLine;
import com.bomanalyzer.core.model.Diagnostic;
import com.bomanalyzer.core.model.Product;
import com.bomanalyzer.core.model.RollUpResult;
import com.bomanalyzer.core.report.Amounts;
import com.bomanalyzer.core.report.GeneratedReport;
import com.bomanalyzer.core.report.ReportConfig;
import com.bomanalyzer.core.report.ReportGenerator;
import com.bomanalyzer.core.report.ReportType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Generates Markdown reports with one table per section.
 *
 * <h2>Generated Sections</h2>
 * <ul>
 *   <li><b>Warnings:</b> product, warning type and message</li>
 *   <li><b>Depths:</b> product, replenishment system, component count and depth</li>
 *   <li><b>Rolled-Up Costs:</b> one summary row per product; unless concise, a component table
 *       per product follows</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * MarkdownReportGenerator generator = new MarkdownReportGenerator();
 * GeneratedReport costs = generator.generate(report, ReportType.ROLLED_UP_COSTS, ReportConfig.defaults());
 * }</pre>
 */
public class MarkdownReportGenerator implements ReportGenerator {

    private static final Logger log = LoggerFactory.getLogger(MarkdownReportGenerator.class);

    private static final String H1 = "# ";
    private static final String H2 = "## ";
    private static final String PIPE = "|";
    private static final String NEWLINE = "\n";
    private static final String DOUBLE_NEWLINE = "\n\n";

    private static final String WARNINGS_TITLE = "Source Data Warnings";
    private static final String DEPTHS_TITLE = "Product Depths";
    private static final String COSTS_TITLE = "Rolled-Up Costs";
    private static final String NO_FOUND = "No %s found.";

    @Override
    public String getId() {
        return "markdown";
    }

    @Override
    public String getDisplayName() {
        return "Markdown Report Generator";
    }

    @Override
    public String getFileExtension() {
        return "md";
    }

    @Override
    public Set<ReportType> getSupportedReportTypes() {
        return EnumSet.allOf(ReportType.class);
    }

    @Override
    public GeneratedReport generate(AnalysisReport report, ReportType type, ReportConfig config) {
        Objects.requireNonNull(report, "report must not be null");
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(config, "config must not be null");

        log.debug("Generating {} markdown report for {} products", type, report.catalogue().size());
        String content = switch (type) {
            case WARNINGS -> generateWarnings(report);
            case DEPTHS -> generateDepths(report);
            case ROLLED_UP_COSTS -> generateCosts(report, config);
        };
        return new GeneratedReport(type.fileBaseName(), content, getFileExtension());
    }

    private String generateWarnings(AnalysisReport report) {
        StringBuilder sb = new StringBuilder();
        sb.append(H1).append(WARNINGS_TITLE).append(DOUBLE_NEWLINE);

        List<Diagnostic> warnings = report.sourceDataWarnings();
        if (warnings.isEmpty()) {
            sb.append(String.format(NO_FOUND, "warnings")).append(NEWLINE);
            return sb.toString();
        }

        appendRow(sb, "Product", "Type", "Warning");
        appendSeparator(sb, 3);
        for (Diagnostic warning : warnings) {
            appendRow(sb, warning.productId().toString(), warning.type().name(), warning.message());
        }
        return sb.toString();
    }

    private String generateDepths(AnalysisReport report) {
        StringBuilder sb = new StringBuilder();
        sb.append(H1).append(DEPTHS_TITLE).append(DOUBLE_NEWLINE);

        if (report.catalogue().size() == 0) {
            sb.append(String.format(NO_FOUND, "products")).append(NEWLINE);
            return sb.toString();
        }

        sb.append("**Products:** ").append(report.catalogue().size())
            .append(" | **Max depth:** ").append(report.depths().maxDepth())
            .append(DOUBLE_NEWLINE);

        appendRow(sb, "Product", "Replenishment", "Components", "Depth");
        appendSeparator(sb, 4);
        for (Product product : report.catalogue().all()) {
            appendRow(sb,
                product.id().toString(),
                product.replenishmentSystem().label(),
                String.valueOf(product.components().size()),
                String.valueOf(report.depths().depthOf(product.id())));
        }
        return sb.toString();
    }

    private String generateCosts(AnalysisReport report, ReportConfig config) {
        StringBuilder sb = new StringBuilder();
        sb.append(H1).append(COSTS_TITLE).append(DOUBLE_NEWLINE);

        if (report.rollUps().isEmpty()) {
            sb.append(String.format(NO_FOUND, "products")).append(NEWLINE);
            return sb.toString();
        }

        appendRow(sb, "Product", "Rolled-Up Cost", "Warnings");
        appendSeparator(sb, 3);
        for (RollUpResult rollUp : report.rollUps()) {
            appendRow(sb,
                rollUp.rootId().toString(),
                Amounts.format(rollUp.totalCost(), config.decimals()),
                String.valueOf(rollUp.diagnostics().size()));
        }

        if (!config.concise()) {
            for (RollUpResult rollUp : report.rollUps()) {
                appendBreakdown(sb, rollUp, config);
            }
        }
        return sb.toString();
    }

    private void appendBreakdown(StringBuilder sb, RollUpResult rollUp, ReportConfig config) {
        sb.append(NEWLINE).append(H2).append("Product ").append(rollUp.rootId()).append(DOUBLE_NEWLINE);

        if (rollUp.lines().isEmpty()) {
            sb.append(String.format(NO_FOUND, "components")).append(NEWLINE);
        } else {
            appendRow(sb, "Level", "Parent", "Component", "Qty Per", "Qty Per Top",
                "Replenishment", "Unit Cost", "Component Cost");
            appendSeparator(sb, 8);
            int decimals = config.detailDecimals();
            for (CostLine line : rollUp.lines()) {
                appendRow(sb,
                    String.valueOf(line.level()),
                    line.parentId().toString(),
                    line.componentId().toString(),
                    Amounts.format(line.quantityPer(), decimals),
                    Amounts.format(line.quantityPerTop(), decimals),
                    line.replenishmentSystem().label(),
                    line.unitCost().toPlainString(),
                    Amounts.format(line.componentCost(), decimals));
            }
        }

        for (Diagnostic warning : rollUp.diagnostics()) {
            sb.append(NEWLINE).append("> ").append(escape(warning.message()));
        }
        if (rollUp.hasDiagnostics()) {
            sb.append(NEWLINE);
        }

        sb.append(NEWLINE).append("**Total component cost:** ")
            .append(Amounts.format(rollUp.totalCost(), config.decimals()))
            .append(NEWLINE);
    }

    private void appendRow(StringBuilder sb, String... cells) {
        sb.append(PIPE);
        for (String cell : cells) {
            sb.append(' ').append(escape(cell)).append(' ').append(PIPE);
        }
        sb.append(NEWLINE);
    }

    private void appendSeparator(StringBuilder sb, int columns) {
        sb.append(PIPE);
        for (int i = 0; i < columns; i++) {
            sb.append("---").append(PIPE);
        }
        sb.append(NEWLINE);
    }

    /**
     * Escapes characters that would break a table cell.
     */
    private static String escape(String text) {
        return text.replace(PIPE, "\\|").replace(NEWLINE, " ");
    }
}
