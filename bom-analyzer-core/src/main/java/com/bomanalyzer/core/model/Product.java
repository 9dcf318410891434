package com.bomanalyzer.core.model;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;

/**
 * A catalogue entry: one product and its direct components.
 *
 * <p>Components keep source row order. The same component may appear more than once; each
 * occurrence is a separate edge.
 *
 * @param id product identifier
 * @param replenishmentSystem how the product is obtained
 * @param unitCost cost per unit when purchased, ignored otherwise
 * @param components direct components in row order
 */
public record Product(
    ProductId id,
    ReplenishmentSystem replenishmentSystem,
    BigDecimal unitCost,
    List<ComponentRef> components
) {
    /**
     * Compact constructor with validation.
     */
    public Product {
        Objects.requireNonNull(id, "id must not be null");
        if (replenishmentSystem == null) {
            replenishmentSystem = ReplenishmentSystem.UNKNOWN;
        }
        if (unitCost == null) {
            unitCost = BigDecimal.ZERO;
        }
        if (unitCost.signum() < 0) {
            throw new IllegalArgumentException("unitCost must not be negative: " + unitCost);
        }
        components = components == null ? List.of() : List.copyOf(components);
    }

    /**
     * Returns whether this product is bought rather than built.
     *
     * @return true for {@link ReplenishmentSystem#PURCHASE}
     */
    public boolean isPurchased() {
        return replenishmentSystem == ReplenishmentSystem.PURCHASE;
    }

    /**
     * Returns whether this product has no recorded components.
     *
     * @return true if the component list is empty
     */
    public boolean isLeaf() {
        return components.isEmpty();
    }
}
