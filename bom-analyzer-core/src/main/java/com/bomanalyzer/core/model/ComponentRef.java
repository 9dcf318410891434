package com.bomanalyzer.core.model;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Reference from a product to one of its components.
 *
 * @param componentId referenced product, which may be missing from the catalogue
 * @param quantityPer units of the component consumed per unit of the owning product
 */
public record ComponentRef(
    ProductId componentId,
    BigDecimal quantityPer
) {
    /**
     * Compact constructor with validation.
     */
    public ComponentRef {
        Objects.requireNonNull(componentId, "componentId must not be null");
        Objects.requireNonNull(quantityPer, "quantityPer must not be null");
        if (quantityPer.signum() <= 0) {
            throw new IllegalArgumentException("quantityPer must be positive: " + quantityPer);
        }
    }
}
