package com.bomanalyzer.core.model;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * One decoded row of BOM source data: a product-component edge, or a bare product when
 * {@code componentId} is absent.
 *
 * <p>Numeric fields are already cleaned by the ingestion adapter. Identifiers stay raw; the
 * catalogue builder normalizes them into {@link ProductId}s.
 *
 * @param rowNumber zero-based data row, used in diagnostics
 * @param productId raw "Item No." text, may be blank
 * @param componentId raw component "No." text, null when the row has no component
 * @param quantityPer units of component per product unit, null when the row has no component
 * @param replenishmentSystem raw replenishment label
 * @param unitCost product unit cost
 */
public record BomRow(
    long rowNumber,
    String productId,
    String componentId,
    BigDecimal quantityPer,
    String replenishmentSystem,
    BigDecimal unitCost
) {
    /**
     * Compact constructor with validation.
     */
    public BomRow {
        if (componentId != null && componentId.isBlank()) {
            componentId = null;
        }
        if (unitCost == null) {
            unitCost = BigDecimal.ZERO;
        }
        if (componentId != null) {
            Objects.requireNonNull(quantityPer, "quantityPer must not be null when a component is present");
        }
    }

    /**
     * Returns whether this row names a component.
     *
     * @return true if a component id is present
     */
    public boolean hasComponent() {
        return componentId != null;
    }
}
