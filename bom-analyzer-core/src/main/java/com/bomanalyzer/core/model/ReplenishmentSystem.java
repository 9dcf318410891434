package com.bomanalyzer.core.model;

/**
 * How a product is obtained.
 *
 * @since 1.0.0
 */
public enum ReplenishmentSystem {
    /** Bought from a supplier; its unit cost counts towards rolled-up costs. */
    PURCHASE("Purchase"),

    /** Manufactured internally from its own components. */
    PROD_ORDER("Prod. Order"),

    /** Anything the source data did not label as one of the above. */
    UNKNOWN("Unknown");

    private final String label;

    ReplenishmentSystem(String label) {
        this.label = label;
    }

    /**
     * Returns the label used in source data and reports.
     *
     * @return label text
     */
    public String label() {
        return label;
    }

    /**
     * Maps a source label to a replenishment system. Labels match after trimming; anything
     * else, including null, is {@link #UNKNOWN}.
     *
     * @param text label from source data
     * @return matching replenishment system
     */
    public static ReplenishmentSystem fromLabel(String text) {
        if (text == null) {
            return UNKNOWN;
        }
        String trimmed = text.trim();
        for (ReplenishmentSystem system : values()) {
            if (system != UNKNOWN && system.label.equals(trimmed)) {
                return system;
            }
        }
        return UNKNOWN;
    }
}
