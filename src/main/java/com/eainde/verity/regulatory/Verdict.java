package com.eainde.verity.regulatory;

import com.eainde.verity.model.ComplianceStatus;

/**
 * @param rule which verdict rule matched, for the audit log
 */
public record Verdict(ComplianceStatus status, double riskScore, double exposure, String rule) {
}
