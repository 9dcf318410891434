package com.bomanalyzer.core.ingest;

import com.bomanalyzer.core.model.BomRow;

import java.util.List;

/**
 * Rows decoded from a BOM export.
 *
 * @param rows accepted rows in source order
 * @param rejectedRows rows dropped because a numeric field was malformed
 */
public record BomReadResult(
    List<BomRow> rows,
    List<RejectedRow> rejectedRows
) {
    /**
     * Compact constructor with validation.
     */
    public BomReadResult {
        rows = rows == null ? List.of() : List.copyOf(rows);
        rejectedRows = rejectedRows == null ? List.of() : List.copyOf(rejectedRows);
    }

    /**
     * Returns whether any row was dropped.
     *
     * @return true if at least one row was rejected
     */
    public boolean hasRejections() {
        return !rejectedRows.isEmpty();
    }
}
