package com.bomanalyzer.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Everything one analysis run produced, ready for report generation.
 *
 * @param catalogue analysed catalogue, with its ingestion diagnostics
 * @param validation validation pass result
 * @param depths depth pass result
 * @param rollUps one roll-up result per catalogue product, in catalogue order
 */
public record AnalysisReport(
    Catalogue catalogue,
    ValidationResult validation,
    DepthResult depths,
    List<RollUpResult> rollUps
) {
    /**
     * Compact constructor with validation.
     */
    public AnalysisReport {
        Objects.requireNonNull(catalogue, "catalogue must not be null");
        Objects.requireNonNull(validation, "validation must not be null");
        Objects.requireNonNull(depths, "depths must not be null");
        rollUps = rollUps == null ? List.of() : List.copyOf(rollUps);
    }

    /**
     * Finds the roll-up result for a product.
     *
     * @param productId root product
     * @return result, or empty if the product was not rolled up
     */
    public Optional<RollUpResult> rollUpFor(ProductId productId) {
        return rollUps.stream()
            .filter(r -> r.rootId().equals(productId))
            .findFirst();
    }

    /**
     * Returns the source-data warnings grouped by product in catalogue order: each product's
     * ingestion diagnostics, then its validation diagnostics.
     *
     * @return warnings in report order
     */
    public List<Diagnostic> sourceDataWarnings() {
        return sourceDataWarnings(catalogue, validation);
    }

    /**
     * Orders ingestion and validation diagnostics the way reports list them, for callers that
     * ran the validator alone.
     *
     * @param catalogue catalogue with its ingestion diagnostics
     * @param validation validation pass result
     * @return warnings in report order
     */
    public static List<Diagnostic> sourceDataWarnings(Catalogue catalogue, ValidationResult validation) {
        List<Diagnostic> warnings = new ArrayList<>();
        for (ProductId id : catalogue.products().keySet()) {
            warnings.addAll(catalogue.diagnosticsFor(id));
            warnings.addAll(validation.diagnosticsFor(id));
        }
        return List.copyOf(warnings);
    }
}
