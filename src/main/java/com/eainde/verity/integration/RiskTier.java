package com.eainde.verity.integration;

/**
 * Live-intelligence risk tier. {@link #UNKNOWN} is only produced when the search itself failed.
 */
public enum RiskTier {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL,
    UNKNOWN;

    static RiskTier fromKeywordCount(int distinctKeywords) {
        if (distinctKeywords >= 5) {
            return CRITICAL;
        }
        if (distinctKeywords >= 3) {
            return HIGH;
        }
        return distinctKeywords >= 1 ? MEDIUM : LOW;
    }
}
