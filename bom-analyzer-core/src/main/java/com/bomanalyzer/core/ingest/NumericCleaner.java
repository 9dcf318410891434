package com.bomanalyzer.core.ingest;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Cleans numeric text exported from the ERP system before parsing.
 *
 * <p>Exports write quantities such as {@code "1,250."}: a comma thousands separator and a
 * dangling decimal point. Both are removed; everything else must be a plain decimal.
 */
public final class NumericCleaner {

    private NumericCleaner() {
        // Utility class
    }

    /**
     * Parses an exported decimal.
     *
     * @param text raw text, may be null
     * @return parsed value, or empty for null or blank text
     * @throws NumberFormatException if the cleaned text is not a decimal
     */
    public static Optional<BigDecimal> clean(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String cleaned = stripTrailingDecimalPoint(text.trim().replace(",", ""));
        if (cleaned.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(new BigDecimal(cleaned));
        } catch (NumberFormatException e) {
            throw new NumberFormatException("Invalid decimal: " + text);
        }
    }

    /**
     * Removes a single trailing {@code '.'}.
     *
     * @param text text to strip
     * @return text without a trailing decimal point
     */
    static String stripTrailingDecimalPoint(String text) {
        if (text.endsWith(".")) {
            return text.substring(0, text.length() - 1);
        }
        return text;
    }
}
