package com.eainde.verity.regulatory;

import com.eainde.verity.integration.ReasoningResponse;

/**
 * Refined penalty percentage and narrative for one finding.
 */
public record LegalAssessment(double penaltyPercentage, String legalReasoning, ReasoningResponse response) {
}
