package com.bomanalyzer.core.ingest;

import java.util.List;
import java.util.Objects;

/**
 * Header names of the five columns read from a BOM export.
 *
 * @param productId product identifier column
 * @param componentId component identifier column
 * @param quantityPer quantity-per column
 * @param replenishmentSystem replenishment system column
 * @param unitCost unit cost column
 */
public record BomColumns(
    String productId,
    String componentId,
    String quantityPer,
    String replenishmentSystem,
    String unitCost
) {
    /**
     * Compact constructor with validation.
     */
    public BomColumns {
        Objects.requireNonNull(productId, "productId must not be null");
        Objects.requireNonNull(componentId, "componentId must not be null");
        Objects.requireNonNull(quantityPer, "quantityPer must not be null");
        Objects.requireNonNull(replenishmentSystem, "replenishmentSystem must not be null");
        Objects.requireNonNull(unitCost, "unitCost must not be null");
    }

    /**
     * Column names of the standard item BOM export.
     *
     * @return default columns
     */
    public static BomColumns defaults() {
        return new BomColumns(
            "Item No.",
            "No.",
            "Quantity per",
            "Item Replenishment System",
            "Current Unit Cost (LCY)"
        );
    }

    /**
     * Returns all column names.
     *
     * @return column names in declaration order
     */
    public List<String> all() {
        return List.of(productId, componentId, quantityPer, replenishmentSystem, unitCost);
    }
}
