package com.eainde.verity.model;

/**
 * Closed set of discrepancy categories a finding can carry.
 */
public enum FindingCategory {
    DATE_ANOMALY,
    SOURCE_MISMATCH,
    QUANTITY_DRIFT,
    DUPLICATE_REFERENCE,
    CERTIFICATE_EXPIRED,
    EMISSIONS_EXCESS,
    ENTITY_VALIDATION;

    /**
     * Lenient parse used for reasoning output ("quantity drift", "Quantity-Drift", ...).
     *
     * @return the category, or {@code null} when the text names none
     */
    public static FindingCategory parse(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        String normalized = text.trim().toUpperCase().replace('-', '_').replace(' ', '_');
        for (FindingCategory category : values()) {
            if (category.name().equals(normalized)) {
                return category;
            }
        }
        return null;
    }
}
