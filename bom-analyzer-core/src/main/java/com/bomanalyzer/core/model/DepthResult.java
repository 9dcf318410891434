package com.bomanalyzer.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of the depth pass: the depth of every product's component tree.
 *
 * @param depths depth per product, in catalogue order
 * @param diagnostics warnings raised while crawling, in crawl order
 */
public record DepthResult(
    Map<ProductId, Integer> depths,
    List<Diagnostic> diagnostics
) implements DiagnosticCarrier {

    /**
     * Compact constructor with validation.
     */
    public DepthResult {
        Objects.requireNonNull(depths, "depths must not be null");
        depths = Collections.unmodifiableMap(new LinkedHashMap<>(depths));
        diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
    }

    /**
     * Returns the depth computed for a product.
     *
     * @param productId product id
     * @return longest chain of component edges below the product
     * @throws IllegalArgumentException if the product was not part of this pass
     */
    public int depthOf(ProductId productId) {
        Integer depth = depths.get(productId);
        if (depth == null) {
            throw new IllegalArgumentException("No depth computed for product " + productId);
        }
        return depth;
    }

    /**
     * Returns the deepest tree in this result.
     *
     * @return maximum depth, 0 when empty
     */
    public int maxDepth() {
        return depths.values().stream().mapToInt(Integer::intValue).max().orElse(0);
    }
}
