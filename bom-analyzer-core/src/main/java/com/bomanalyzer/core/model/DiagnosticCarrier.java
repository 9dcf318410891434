package com.bomanalyzer.core.model;

import java.util.List;

/**
 * Anything that carries data-quality diagnostics: the catalogue and each analysis pass result.
 */
public interface DiagnosticCarrier {

    /**
     * Returns all diagnostics in the order they were produced.
     *
     * @return diagnostics
     */
    List<Diagnostic> diagnostics();

    /**
     * Returns the diagnostics attached to one product, in production order.
     *
     * @param productId owning product
     * @return matching diagnostics, possibly empty
     */
    default List<Diagnostic> diagnosticsFor(ProductId productId) {
        return diagnostics().stream()
            .filter(d -> d.productId().equals(productId))
            .toList();
    }

    /**
     * Returns whether any diagnostics were produced.
     *
     * @return true if at least one diagnostic exists
     */
    default boolean hasDiagnostics() {
        return !diagnostics().isEmpty();
    }
}
