package com.bomanalyzer.core.report.impl;

import com.bomanalyzer.core.BomFixtures;
import com.bomanalyzer.core.analysis.BomAnalyzer;
import com.bomanalyzer.core.model.AnalysisReport;
import com.bomanalyzer.core.model.Catalogue;
import com.bomanalyzer.core.report.GeneratedReport;
import com.bomanalyzer.core.report.ReportConfig;
import com.bomanalyzer.core.report.ReportType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.bomanalyzer.core.BomFixtures.bom;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link TextReportGenerator}.
 */
class TextReportGeneratorTest {

    private TextReportGenerator generator;
    private AnalysisReport multiLevel;

    @BeforeEach
    void setUp() {
        generator = new TextReportGenerator();
        multiLevel = new BomAnalyzer().analyze(BomFixtures.multiLevel());
    }

    @Test
    void metadata() {
        assertThat(generator.getId()).isEqualTo("text");
        assertThat(generator.getFileExtension()).isEqualTo("txt");
        assertThat(generator.getSupportedReportTypes()).containsExactlyInAnyOrder(ReportType.values());
    }

    @Test
    void generate_depths_listsEveryProductInCatalogueOrder() {
        GeneratedReport report = generator.generate(multiLevel, ReportType.DEPTHS, ReportConfig.defaults());

        assertThat(report.fileName()).isEqualTo("depths.txt");
        assertThat(report.content()).isEqualTo("""
            ==================================
            === Product Levels per Product ===
            ==================================
            Item 1 Level - 2
            Item 11 Level - 1
            Item 12 Level - 0
            """);
    }

    @Test
    void generate_conciseCosts_printsOneLinePerProduct() {
        GeneratedReport report = generator.generate(multiLevel, ReportType.ROLLED_UP_COSTS, ReportConfig.defaults());

        assertThat(report.content())
            .contains("=== Product Rolled Up Costs   Concise Report? true ===")
            .contains("Product 1 Rolled Up Cost: 24.0\n")
            .contains("Product 11 Rolled Up Cost: 12.0\n")
            .contains("Product 12 Rolled Up Cost: 0.0\n")
            .doesNotContain("TOTAL COMPONENT COST");
    }

    @Test
    void generate_detailedCosts_nestsComponentLinesByLevel() {
        ReportConfig detailed = ReportConfig.defaults().withConcise(false);

        GeneratedReport report = generator.generate(multiLevel, ReportType.ROLLED_UP_COSTS, detailed);

        assertThat(report.content())
            .contains("Concise Report? false")
            .contains("Product: 1\n"
                + "\t11\tQtyPer:2.0\tCompCost:0.0\tQtyPerTop:2.0\n"
                + "\tReplen:Prod. Order\tUnitCost:99.0\n"
                + "\t\t12\tQtyPer:3.0\tCompCost:24.0\tQtyPerTop:6.0\n"
                + "\t\tReplen:Purchase\tUnitCost:4.0\n"
                + "   TOTAL COMPONENT COST: 24.0\n"
                + "\n");
    }

    @Test
    void generate_warnings_indentsEachWarning() {
        Catalogue catalogue = bom()
            .assembly("1", "2", "1")
            .assembly("1", "2", "1")
            .build();
        AnalysisReport report = new BomAnalyzer().analyze(catalogue);

        String content = generator.generate(report, ReportType.WARNINGS, ReportConfig.defaults()).content();

        assertThat(content).startsWith("""
            ==================================
            === Warnings About Source Data ===
            ==================================
            """);
        assertThat(content).contains(
            "      Product 1 refers to component product 2 more than once.\n",
            "      Product 1 refers to product 2 for which there is no definition in the source data.\n");
    }

    @Test
    void generate_conciseCosts_listsWarningsRaisedDuringCrawl() {
        Catalogue catalogue = bom()
            .assembly("1", "2", "1")
            .assembly("2", "404", "1")
            .build();
        AnalysisReport report = new BomAnalyzer().analyze(catalogue);

        String content = generator.generate(report, ReportType.ROLLED_UP_COSTS, ReportConfig.defaults()).content();

        assertThat(content).contains("Product 1 Rolled Up Cost: 0.0\n"
            + "      Product 2 refers to product 404 for which there is no definition in the source data.\n");
    }

    @Test
    void generate_roundsTotalsOnlyOnOutput() {
        Catalogue catalogue = bom()
            .assembly("1", "2", "3")
            .purchased("2", "0.123456")
            .build();
        AnalysisReport report = new BomAnalyzer().analyze(catalogue);

        String content = generator.generate(report, ReportType.ROLLED_UP_COSTS, ReportConfig.defaults()).content();

        assertThat(content).contains("Product 1 Rolled Up Cost: 0.3704\n");
        assertThat(report.rollUpFor(BomFixtures.id(1)).orElseThrow().totalCost())
            .isEqualByComparingTo("0.370368");
    }

    @Test
    void generate_nullArguments_throwsException() {
        assertThatThrownBy(() -> generator.generate(null, ReportType.DEPTHS, ReportConfig.defaults()))
            .isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> generator.generate(multiLevel, null, ReportConfig.defaults()))
            .isInstanceOf(NullPointerException.class);
    }
}
