package com.bomanalyzer.core.model;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Canonical product identifier.
 *
 * <p>Either a validated numeric id or the {@link #INVALID} sentinel that collects rows whose
 * "Item No." could not be read as a number. Normalization happens once, when source rows enter
 * the catalogue, through {@link #parse(String)}.
 *
 * <p><b>Accepted forms:</b>
 * <ul>
 *   <li>{@code "1001"}, {@code " 1001 "} - plain digits, surrounding whitespace ignored</li>
 *   <li>{@code "1001.0"}, {@code "1001."} - integral decimals produced by spreadsheet exports</li>
 *   <li>{@code "1,001"} - thousands separators</li>
 * </ul>
 *
 * @param number numeric value, always 0 for the sentinel
 * @param valid whether this is a real identifier
 */
public record ProductId(long number, boolean valid) {

    /**
     * Sentinel for blank or non-numeric identifiers.
     */
    public static final ProductId INVALID = new ProductId(0L, false);

    private static final String INVALID_LABEL = "NAN";

    /** Digits with an optional all-zero fraction. Signs and exponents are not identifiers. */
    private static final Pattern INTEGRAL = Pattern.compile("\\d+(\\.0*)?");

    /**
     * Compact constructor with validation.
     */
    public ProductId {
        if (!valid && number != 0L) {
            throw new IllegalArgumentException("invalid ProductId must not carry a number");
        }
        if (valid && number < 0L) {
            throw new IllegalArgumentException("product number must not be negative: " + number);
        }
    }

    /**
     * Creates a numeric identifier.
     *
     * @param number non-negative product number
     * @return product id
     */
    public static ProductId of(long number) {
        return new ProductId(number, true);
    }

    /**
     * Normalizes a raw identifier read from source data.
     *
     * @param raw raw text, may be null
     * @return the numeric id, or empty when the text is blank, non-numeric or fractional
     */
    public static Optional<ProductId> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String cleaned = raw.trim().replace(",", "");
        if (cleaned.endsWith(".")) {
            cleaned = cleaned.substring(0, cleaned.length() - 1);
        }
        if (!INTEGRAL.matcher(cleaned).matches()) {
            return Optional.empty();
        }
        try {
            BigDecimal value = new BigDecimal(cleaned);
            return Optional.of(of(value.stripTrailingZeros().longValueExact()));
        } catch (NumberFormatException | ArithmeticException e) {
            return Optional.empty();
        }
    }

    /**
     * Normalizes a raw identifier, mapping anything unreadable to {@link #INVALID}.
     *
     * @param raw raw text, may be null
     * @return canonical id or the sentinel
     */
    public static ProductId parseOrInvalid(String raw) {
        return parse(raw).orElse(INVALID);
    }

    @Override
    public String toString() {
        return valid ? Long.toString(number) : INVALID_LABEL;
    }
}
