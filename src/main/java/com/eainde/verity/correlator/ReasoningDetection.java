package com.eainde.verity.correlator;

import com.eainde.verity.integration.ReasoningResponse;
import com.eainde.verity.model.Finding;

import java.util.List;

/**
 * @param findings findings accepted from the reasoning answer
 * @param skipped  items dropped because they named no known category
 * @param response the raw answer, for token accounting
 */
public record ReasoningDetection(List<Finding> findings, int skipped, ReasoningResponse response) {
}
