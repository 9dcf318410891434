package com.bomanalyzer.core;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.classes;
import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

/**
 * ArchUnit tests to validate architectural rules and design patterns.
 *
 * <p>These tests ensure:
 * <ul>
 *   <li>Domain models are implemented as immutable records</li>
 *   <li>Analysis passes know nothing about report formatting or output</li>
 *   <li>The model depends on no other package</li>
 * </ul>
 */
class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("com.bomanalyzer.core");
    }

    /**
     * Verifies all domain models in the model package are implemented as Java records.
     */
    @Test
    void models_shouldBeRecords() {
        ArchRule rule = classes()
            .that().resideInAPackage("..model..")
            .and().areTopLevelClasses()
            .and().areNotEnums()
            .and().areNotInterfaces()
            .should().beRecords();

        rule.check(classes);
    }

    @Test
    void models_shouldNotDependOnOtherPackages() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..model..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..catalogue..", "..ingest..", "..analysis..", "..report..", "..renderer..", "..config..");

        rule.check(classes);
    }

    /**
     * Verifies computation stays separate from formatting: analysis produces records, reports
     * format them.
     */
    @Test
    void analysis_shouldNotDependOnReportingOrRendering() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..analysis..")
            .should().dependOnClassesThat().resideInAnyPackage("..report..", "..renderer..", "..ingest..");

        rule.check(classes);
    }

    @Test
    void traversalContexts_shouldNotBePublic() {
        ArchRule rule = classes()
            .that().haveSimpleNameEndingWith("Traversal")
            .should().notBePublic();

        rule.check(classes);
    }
}
