package com.bomanalyzer.core.analysis;

import com.bomanalyzer.core.model.Catalogue;
import com.bomanalyzer.core.model.ComponentRef;
import com.bomanalyzer.core.model.Diagnostic;
import com.bomanalyzer.core.model.Product;
import com.bomanalyzer.core.model.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Flags component references that have no product definition.
 *
 * <p>One warning per unresolved reference, attached to the referencing product. A component
 * listed twice and missing produces two warnings. Products are checked in catalogue order.
 */
public class CatalogueValidator {

    private static final Logger log = LoggerFactory.getLogger(CatalogueValidator.class);

    /**
     * Checks every component reference in the catalogue.
     *
     * @param catalogue catalogue to check
     * @return unresolved-reference diagnostics
     */
    public ValidationResult validate(Catalogue catalogue) {
        Objects.requireNonNull(catalogue, "catalogue must not be null");

        DiagnosticLog diagnostics = new DiagnosticLog("validate");
        for (Product product : catalogue.all()) {
            for (ComponentRef ref : product.components()) {
                if (!catalogue.contains(ref.componentId())) {
                    diagnostics.append(Diagnostic.unresolvedReference(product.id(), ref.componentId()));
                }
            }
        }

        log.info("Validated {} products: {} unresolved references", catalogue.size(), diagnostics.size());
        return new ValidationResult(diagnostics.snapshot());
    }
}
