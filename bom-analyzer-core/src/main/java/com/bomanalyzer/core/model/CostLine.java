package com.bomanalyzer.core.model;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * One resolved component visited while rolling up a product's cost.
 *
 * @param level nesting level below the root, starting at 1
 * @param parentId product whose component list holds this reference
 * @param componentId component reached
 * @param quantityPer units per parent unit
 * @param componentCost cost contributed by this visit, zero unless purchased
 * @param quantityPerTop units per root unit at this visit
 * @param replenishmentSystem how the component is obtained
 * @param unitCost component unit cost
 */
public record CostLine(
    int level,
    ProductId parentId,
    ProductId componentId,
    BigDecimal quantityPer,
    BigDecimal componentCost,
    BigDecimal quantityPerTop,
    ReplenishmentSystem replenishmentSystem,
    BigDecimal unitCost
) {
    /**
     * Compact constructor with validation.
     */
    public CostLine {
        Objects.requireNonNull(parentId, "parentId must not be null");
        Objects.requireNonNull(componentId, "componentId must not be null");
        Objects.requireNonNull(quantityPer, "quantityPer must not be null");
        Objects.requireNonNull(componentCost, "componentCost must not be null");
        Objects.requireNonNull(quantityPerTop, "quantityPerTop must not be null");
        Objects.requireNonNull(replenishmentSystem, "replenishmentSystem must not be null");
        Objects.requireNonNull(unitCost, "unitCost must not be null");
        if (level < 1) {
            throw new IllegalArgumentException("level must be at least 1: " + level);
        }
    }
}
