package com.bomanalyzer.core.model;

import java.util.List;

/**
 * Outcome of the catalogue validation pass.
 *
 * @param diagnostics unresolved-reference warnings in catalogue order
 */
public record ValidationResult(
    List<Diagnostic> diagnostics
) implements DiagnosticCarrier {

    /**
     * Compact constructor with validation.
     */
    public ValidationResult {
        diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
    }
}
