package com.bomanalyzer.core.ingest;

import java.io.IOException;

/**
 * Thrown when a BOM export cannot be read as a table: missing header columns or broken rows.
 */
public class BomFormatException extends IOException {

    public BomFormatException(String message) {
        super(message);
    }

    public BomFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
