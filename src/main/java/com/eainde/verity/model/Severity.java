package com.eainde.verity.model;

public enum Severity {
    CRITICAL(1.0),
    HIGH(0.8),
    MEDIUM(0.5),
    LOW(0.2);

    private final double riskWeight;

    Severity(double riskWeight) {
        this.riskWeight = riskWeight;
    }

    /** Weight applied to a finding's confidence when scoring overall risk. */
    public double riskWeight() {
        return riskWeight;
    }

    public ViolationClass toViolationClass() {
        return switch (this) {
            case CRITICAL -> ViolationClass.CRITICAL;
            case HIGH -> ViolationClass.MAJOR;
            case MEDIUM -> ViolationClass.MINOR;
            case LOW -> ViolationClass.OBSERVATION;
        };
    }

    public static Severity parseOrDefault(String text, Severity fallback) {
        if (text == null || text.isBlank()) {
            return fallback;
        }
        try {
            return valueOf(text.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return fallback;
        }
    }
}
