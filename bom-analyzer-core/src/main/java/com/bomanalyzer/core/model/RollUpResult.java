package com.bomanalyzer.core.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of rolling up the purchase cost of one root product.
 *
 * <p>{@code quantityPerTop} is relative to this root only. When a product is reached along
 * several paths, the value from the last visit is kept.
 *
 * @param rootId product whose cost was rolled up
 * @param totalCost unrounded sum of purchased component costs
 * @param quantityPerTop units of each reached product per root unit, in first-visit order
 * @param lines resolved component visits in crawl order
 * @param diagnostics warnings raised while crawling
 */
public record RollUpResult(
    ProductId rootId,
    BigDecimal totalCost,
    Map<ProductId, BigDecimal> quantityPerTop,
    List<CostLine> lines,
    List<Diagnostic> diagnostics
) implements DiagnosticCarrier {

    /**
     * Compact constructor with validation.
     */
    public RollUpResult {
        Objects.requireNonNull(rootId, "rootId must not be null");
        Objects.requireNonNull(totalCost, "totalCost must not be null");
        Objects.requireNonNull(quantityPerTop, "quantityPerTop must not be null");
        quantityPerTop = Collections.unmodifiableMap(new LinkedHashMap<>(quantityPerTop));
        lines = lines == null ? List.of() : List.copyOf(lines);
        diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
    }

    /**
     * Returns the quantity-per-top recorded for a product during this crawl.
     *
     * @param productId product id
     * @return quantity per root unit, or empty if the crawl never reached the product
     */
    public Optional<BigDecimal> quantityPerTopOf(ProductId productId) {
        return Optional.ofNullable(quantityPerTop.get(productId));
    }

    /**
     * Returns the total rounded for display. The stored total is left untouched.
     *
     * @param scale decimal places
     * @return rounded total, half-up
     */
    public BigDecimal roundedTotal(int scale) {
        return totalCost.setScale(scale, RoundingMode.HALF_UP);
    }
}
