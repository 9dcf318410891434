package com.bomanalyzer.core.model;

/**
 * Kinds of data-quality findings. None of them stop processing.
 *
 * @since 1.0.0
 */
public enum DiagnosticType {
    /**
     * A component id that has no product definition in the source data.
     */
    UNRESOLVED_REFERENCE,

    /**
     * A product lists the same component more than once.
     */
    DUPLICATE_REFERENCE,

    /**
     * A blank or non-numeric identifier in the source data.
     */
    INVALID_IDENTIFIER
}
