package com.bomanalyzer.core.report;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Number formatting shared by report generators.
 */
public final class Amounts {

    private Amounts() {
        // Utility class
    }

    /**
     * Rounds half-up to at most {@code scale} places and drops trailing zeros, keeping one
     * decimal place for whole numbers: {@code 24 -> "24.0"}, {@code 10.12345 -> "10.1235"}.
     *
     * @param value value to format
     * @param scale maximum decimal places
     * @return formatted value
     */
    public static String format(BigDecimal value, int scale) {
        BigDecimal rounded = value.setScale(scale, RoundingMode.HALF_UP).stripTrailingZeros();
        if (rounded.scale() < 1) {
            rounded = rounded.setScale(1, RoundingMode.UNNECESSARY);
        }
        return rounded.toPlainString();
    }
}
