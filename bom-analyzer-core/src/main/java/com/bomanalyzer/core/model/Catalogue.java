package com.bomanalyzer.core.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * The product catalogue: every product defined by the source data, keyed by id in the order
 * products first appeared.
 *
 * <p>Immutable once built. Analysis passes read it and return their own results; nothing is
 * written back. Diagnostics raised while the catalogue was built (duplicate references,
 * unreadable identifiers) travel with it.
 *
 * @param products products keyed by id, in first-appearance order
 * @param diagnostics ingestion diagnostics in row order
 */
public record Catalogue(
    Map<ProductId, Product> products,
    List<Diagnostic> diagnostics
) implements DiagnosticCarrier {

    /**
     * Compact constructor with validation.
     */
    public Catalogue {
        Objects.requireNonNull(products, "products must not be null");
        products.forEach((id, product) -> {
            if (!id.equals(product.id())) {
                throw new IllegalArgumentException("catalogue key " + id + " does not match product " + product.id());
            }
        });
        products = Collections.unmodifiableMap(new LinkedHashMap<>(products));
        diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
    }

    /**
     * Creates an empty catalogue.
     *
     * @return catalogue with no products
     */
    public static Catalogue empty() {
        return new Catalogue(Map.of(), List.of());
    }

    /**
     * Looks up a product.
     *
     * @param id product id
     * @return product, or empty for an unresolved id
     */
    public Optional<Product> find(ProductId id) {
        return Optional.ofNullable(products.get(id));
    }

    /**
     * Returns whether the id has a product definition.
     *
     * @param id product id
     * @return true if defined
     */
    public boolean contains(ProductId id) {
        return products.containsKey(id);
    }

    /**
     * Returns all products in first-appearance order.
     *
     * @return products
     */
    public Collection<Product> all() {
        return products.values();
    }

    /**
     * Returns the number of products.
     *
     * @return product count
     */
    public int size() {
        return products.size();
    }
}
