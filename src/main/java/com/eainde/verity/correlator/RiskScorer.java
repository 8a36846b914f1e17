package com.eainde.verity.correlator;

import com.eainde.verity.model.Finding;

import java.util.List;

public final class RiskScorer {

    private RiskScorer() {
    }

    /** Mean of severity weight times confidence, capped at 1; 0 for no findings. */
    public static double score(List<Finding> findings) {
        if (findings.isEmpty()) {
            return 0.0;
        }
        double mean = findings.stream().mapToDouble(Finding::weightedRisk).average().orElse(0.0);
        return Math.min(1.0, mean);
    }
}
