package com.bomanalyzer.core.ingest;

import java.util.Objects;

/**
 * A source row dropped during ingestion.
 *
 * @param rowNumber zero-based data row
 * @param reason why the row was dropped
 */
public record RejectedRow(
    long rowNumber,
    String reason
) {
    /**
     * Compact constructor with validation.
     */
    public RejectedRow {
        Objects.requireNonNull(reason, "reason must not be null");
    }

    @Override
    public String toString() {
        return "Row " + rowNumber + " rejected: " + reason;
    }
}
