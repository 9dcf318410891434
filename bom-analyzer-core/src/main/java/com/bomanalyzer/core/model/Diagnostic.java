package com.bomanalyzer.core.model;

import java.util.Objects;

/**
 * A data-quality warning attached to the product it concerns.
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * Diagnostic warning = Diagnostic.unresolvedReference(ProductId.of(1001), ProductId.of(2002));
 * // "Product 1001 refers to product 2002 for which there is no definition in the source data."
 * }</pre>
 *
 * @param productId owning product
 * @param type kind of finding
 * @param message human-readable text
 */
public record Diagnostic(
    ProductId productId,
    DiagnosticType type,
    String message
) {
    /**
     * Compact constructor with validation.
     */
    public Diagnostic {
        Objects.requireNonNull(productId, "productId must not be null");
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }

    /**
     * Component referenced by a product but never defined.
     *
     * @param productId referencing product
     * @param componentId missing component
     * @return diagnostic
     */
    public static Diagnostic unresolvedReference(ProductId productId, ProductId componentId) {
        return new Diagnostic(productId, DiagnosticType.UNRESOLVED_REFERENCE,
            "Product " + productId + " refers to product " + componentId
                + " for which there is no definition in the source data.");
    }

    /**
     * Component listed more than once by the same product.
     *
     * @param productId referencing product
     * @param componentId repeated component
     * @return diagnostic
     */
    public static Diagnostic duplicateReference(ProductId productId, ProductId componentId) {
        return new Diagnostic(productId, DiagnosticType.DUPLICATE_REFERENCE,
            "Product " + productId + " refers to component product " + componentId + " more than once.");
    }

    /**
     * Unreadable "Item No." on a source row. Always attached to {@link ProductId#INVALID}.
     *
     * @param rawValue text read from the row
     * @param rowNumber zero-based data row
     * @return diagnostic
     */
    public static Diagnostic invalidProductId(String rawValue, long rowNumber) {
        return new Diagnostic(ProductId.INVALID, DiagnosticType.INVALID_IDENTIFIER,
            "Non-numeric Item No. detected in raw data, value read was: " + rawValue + " on row " + rowNumber);
    }

    /**
     * Unreadable component id on a source row.
     *
     * @param productId owning product
     * @param rawValue text read from the row
     * @param rowNumber zero-based data row
     * @return diagnostic
     */
    public static Diagnostic invalidComponentId(ProductId productId, String rawValue, long rowNumber) {
        return new Diagnostic(productId, DiagnosticType.INVALID_IDENTIFIER,
            "Product " + productId + " refers to non-numeric component product " + rawValue
                + " on row " + rowNumber + "; the reference was skipped.");
    }
}
