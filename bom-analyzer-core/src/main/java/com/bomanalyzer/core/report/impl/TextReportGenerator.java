package com.bomanalyzer.core.report.impl;

import com.bomanalyzer.core.model.AnalysisReport;
import com.bomanalyzer.core.model.CostLine;
import com.bomanalyzer.core.model.Diagnostic;
import com.bomanalyzer.core.model.ProductId;
import com.bomanalyzer.core.model.RollUpResult;
import com.bomanalyzer.core.report.Amounts;
import com.bomanalyzer.core.report.GeneratedReport;
import com.bomanalyzer.core.report.ReportConfig;
import com.bomanalyzer.core.report.ReportGenerator;
import com.bomanalyzer.core.report.ReportType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Generates the plain-text console report.
 *
 * <p>Each section opens with a banner. Rolled-up costs come in two layouts:
 * <ul>
 *   <li><b>Concise:</b> {@code Product 1001 Rolled Up Cost: 24.0} followed by the warnings raised
 *       while crawling that product</li>
 *   <li><b>Detailed:</b> {@code Product: 1001}, one tab-indented pair of lines per component
 *       visit (indent = nesting level), the warnings, then {@code TOTAL COMPONENT COST}</li>
 * </ul>
 */
public class TextReportGenerator implements ReportGenerator {

    private static final Logger log = LoggerFactory.getLogger(TextReportGenerator.class);

    private static final String NEWLINE = "\n";
    private static final String WARNING_INDENT = "      ";
    private static final String TAB = "\t";

    private static final String WARNINGS_TITLE = "=== Warnings About Source Data ===";
    private static final String DEPTHS_TITLE = "=== Product Levels per Product ===";
    private static final String COSTS_TITLE = "=== Product Rolled Up Costs   Concise Report? %s ===";

    @Override
    public String getId() {
        return "text";
    }

    @Override
    public String getDisplayName() {
        return "Plain Text Report Generator";
    }

    @Override
    public String getFileExtension() {
        return "txt";
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

        log.debug("Generating {} text report for {} products", type, report.catalogue().size());
        String content = switch (type) {
            case WARNINGS -> generateWarnings(report);
            case DEPTHS -> generateDepths(report);
            case ROLLED_UP_COSTS -> generateCosts(report, config);
        };
        return new GeneratedReport(type.fileBaseName(), content, getFileExtension());
    }

    private String generateWarnings(AnalysisReport report) {
        StringBuilder sb = new StringBuilder();
        appendBanner(sb, WARNINGS_TITLE);
        for (Diagnostic warning : report.sourceDataWarnings()) {
            appendWarning(sb, warning);
        }
        return sb.toString();
    }

    private String generateDepths(AnalysisReport report) {
        StringBuilder sb = new StringBuilder();
        appendBanner(sb, DEPTHS_TITLE);
        for (Map.Entry<ProductId, Integer> entry : report.depths().depths().entrySet()) {
            sb.append("Item ").append(entry.getKey()).append(" Level - ").append(entry.getValue()).append(NEWLINE);
        }
        return sb.toString();
    }

    private String generateCosts(AnalysisReport report, ReportConfig config) {
        StringBuilder sb = new StringBuilder();
        appendBanner(sb, String.format(COSTS_TITLE, config.concise()));

        for (RollUpResult rollUp : report.rollUps()) {
            String total = Amounts.format(rollUp.totalCost(), config.decimals());
            if (config.concise()) {
                sb.append("Product ").append(rollUp.rootId()).append(" Rolled Up Cost: ").append(total).append(NEWLINE);
                rollUp.diagnostics().forEach(d -> appendWarning(sb, d));
            } else {
                sb.append("Product: ").append(rollUp.rootId()).append(NEWLINE);
                for (CostLine line : rollUp.lines()) {
                    appendCostLine(sb, line, config.detailDecimals());
                }
                rollUp.diagnostics().forEach(d -> appendWarning(sb, d));
                sb.append("   TOTAL COMPONENT COST: ").append(total).append(NEWLINE);
                sb.append(NEWLINE);
            }
        }
        return sb.toString();
    }

    private void appendCostLine(StringBuilder sb, CostLine line, int decimals) {
        String indent = TAB.repeat(line.level());
        sb.append(indent)
            .append(line.componentId())
            .append(TAB).append("QtyPer:").append(Amounts.format(line.quantityPer(), decimals))
            .append(TAB).append("CompCost:").append(Amounts.format(line.componentCost(), decimals))
            .append(TAB).append("QtyPerTop:").append(Amounts.format(line.quantityPerTop(), decimals))
            .append(NEWLINE);
        sb.append(indent)
            .append("Replen:").append(line.replenishmentSystem().label())
            .append(TAB).append("UnitCost:").append(line.unitCost().toPlainString())
            .append(NEWLINE);
    }

    private void appendBanner(StringBuilder sb, String title) {
        String rule = "=".repeat(title.length());
        sb.append(rule).append(NEWLINE)
            .append(title).append(NEWLINE)
            .append(rule).append(NEWLINE);
    }

    private void appendWarning(StringBuilder sb, Diagnostic warning) {
        sb.append(WARNING_INDENT).append(warning.message()).append(NEWLINE);
    }
}
